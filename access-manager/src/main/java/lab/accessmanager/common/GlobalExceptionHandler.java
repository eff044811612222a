package lab.accessmanager.common;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.regex.Pattern;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Pattern SENSITIVE_HEX_PATTERN = Pattern.compile("0x[a-fA-F0-9]{64,}");

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        String message = ex.getMessage();

        if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            message = "Invalid value '%s' for parameter '%s'".formatted(mismatch.getValue(), mismatch.getName());
        }

        return ResponseEntity.badRequest().body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body.";
        if (detail != null && !detail.isBlank()) {
            message += " Detail: " + detail;
        }

        return ResponseEntity.badRequest()
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), message));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), "Missing required header: " + ex.getHeaderName()));
    }

    @ExceptionHandler({IllegalStateException.class, RuntimeException.class})
    public ResponseEntity<RuntimeErrorResponse> handleRuntimeException(Exception ex, HttpServletRequest request) {
        RuntimeErrorResponse body = new RuntimeErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                sanitizeMessage(ex.getMessage()),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Unexpected server error";
        }
        return SENSITIVE_HEX_PATTERN.matcher(message).replaceAll("0x[REDACTED]");
    }

    public record ErrorResponse(
            int status,
            String message
    ) {}

    public record RuntimeErrorResponse(
            int status,
            String message,
            String path
    ) {
    }
}
