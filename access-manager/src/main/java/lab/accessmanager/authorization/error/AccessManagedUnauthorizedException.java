package lab.accessmanager.authorization.error;

public class AccessManagedUnauthorizedException extends AccessManagerException {

    private final String caller;

    public AccessManagedUnauthorizedException(String caller) {
        super("AccessManagedUnauthorized", ErrorCategory.AUTHORIZATION, params("caller", caller));
        this.caller = caller;
    }

    public String getCaller() {
        return caller;
    }
}
