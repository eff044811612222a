package lab.accessmanager.authorization.error;

public class TooLongRedemptionDelayException extends AccessManagerException {

    public TooLongRedemptionDelayException(long redemptionDelay, long maxRedemptionDelay) {
        super("TooLongRedemptionDelay", ErrorCategory.CONFIGURATION,
                params("redemptionDelay", redemptionDelay, "maxRedemptionDelay", maxRedemptionDelay));
    }
}
