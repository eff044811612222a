package lab.accessmanager.authorization.init;

import lab.accessmanager.authorization.error.AlreadyInitializedException;
import lab.accessmanager.store.PersistentStateStore;
import lab.accessmanager.store.StateValue;
import lab.accessmanager.store.StorageNamespaces;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class InitializationGuard {

    private final StateValue initialization;

    public InitializationGuard(PersistentStateStore store) {
        this.initialization = store.value(StorageNamespaces.INITIALIZATION);
    }

    public InitializationState state() {
        return InitializationState.values()[(int) initialization.get()];
    }

    public void ensureNotInitialized() {
        if (state() == InitializationState.INITIALIZED) {
            log.warn("event=access.initialize.rejected reason=already_initialized");
            throw new AlreadyInitializedException();
        }
    }

    // UNINITIALIZED -> INITIALIZED is the only transition.
    public void markInitialized() {
        ensureNotInitialized();
        initialization.put(InitializationState.INITIALIZED.ordinal());
    }
}
