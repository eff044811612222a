package lab.accessmanager.authorization.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every rejection raised by the access manager. Aborts the enclosing call; the
 * error name and parameters are what callers see so they can decide whether and when to retry.
 */
public abstract class AccessManagerException extends RuntimeException {

    private final String errorName;
    private final ErrorCategory category;
    private final Map<String, Object> parameters;

    protected AccessManagerException(String errorName, ErrorCategory category, Map<String, Object> parameters) {
        super(errorName + parameters);
        this.errorName = errorName;
        this.category = category;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getErrorName() {
        return errorName;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    protected static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
