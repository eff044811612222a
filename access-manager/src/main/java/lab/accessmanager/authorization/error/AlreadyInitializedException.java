package lab.accessmanager.authorization.error;

import java.util.Map;

public class AlreadyInitializedException extends AccessManagerException {

    public AlreadyInitializedException() {
        super("AlreadyInitialized", ErrorCategory.CONFIGURATION, Map.of());
    }
}
