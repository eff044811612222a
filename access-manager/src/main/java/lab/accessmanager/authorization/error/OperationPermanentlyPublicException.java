package lab.accessmanager.authorization.error;

public class OperationPermanentlyPublicException extends AccessManagerException {

    public OperationPermanentlyPublicException(String target, String selector) {
        super("OperationPermanentlyPublic", ErrorCategory.CONFIGURATION,
                params("target", target, "selector", selector));
    }
}
