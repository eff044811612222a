package lab.accessmanager.authorization;

import lab.accessmanager.authorization.error.AccessManagerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidRequestException e) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("message", e.getMessage()));
    }

    @ExceptionHandler(AccessManagerException.class)
    public ResponseEntity<AccessErrorResponse> handleAccessManager(AccessManagerException e) {
        HttpStatus status = statusOf(e);
        log.info(
                "event=access.request.rejected error={} category={} status={} parameters={}",
                e.getErrorName(),
                e.getCategory(),
                status.value(),
                e.getParameters()
        );
        return ResponseEntity
                .status(status)
                .body(new AccessErrorResponse(e.getErrorName(), e.getMessage(), e.getParameters()));
    }

    private HttpStatus statusOf(AccessManagerException e) {
        return switch (e.getCategory()) {
            case CONFIGURATION -> HttpStatus.CONFLICT;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case TEMPORAL -> HttpStatus.LOCKED;
        };
    }

    public record AccessErrorResponse(
            String error,
            String message,
            Map<String, Object> parameters
    ) {}
}
