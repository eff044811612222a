package lab.accessmanager.managed;

public record GuardedCallReceipt(
        String target,
        String caller,
        String operation,
        AuthorizationPath authorizationPath,
        long accountLockTime
) {}
