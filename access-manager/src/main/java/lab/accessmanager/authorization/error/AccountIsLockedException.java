package lab.accessmanager.authorization.error;

public class AccountIsLockedException extends AccessManagerException {

    private final long unlockTime;

    public AccountIsLockedException(long unlockTime) {
        super("AccountIsLocked", ErrorCategory.TEMPORAL, params("unlockTime", unlockTime));
        this.unlockTime = unlockTime;
    }

    public long getUnlockTime() {
        return unlockTime;
    }
}
