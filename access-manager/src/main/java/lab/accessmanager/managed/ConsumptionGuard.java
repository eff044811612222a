package lab.accessmanager.managed;

import lab.accessmanager.authorization.OperationId;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks which guarded targets are consuming a scheduled operation on the current thread.
 *
 * <p>The marker is only ever set through {@link #enter(String)} and cleared when the returned scope closes, so a
 * failed consumption cannot leave it set for a later call.
 */
@Component
public class ConsumptionGuard {

    public static final String CONSUMING_MARKER = OperationId.ofSignature("isConsumingScheduledOp()").selector();
    public static final String IDLE_MARKER = "0x00000000";

    private final ThreadLocal<Deque<String>> consumingTargets = ThreadLocal.withInitial(ArrayDeque::new);

    public Scope enter(String target) {
        consumingTargets.get().addLast(target);
        return new Scope(target);
    }

    public boolean isConsuming(String target) {
        return consumingTargets.get().contains(target);
    }

    public String marker() {
        return consumingTargets.get().isEmpty() ? IDLE_MARKER : CONSUMING_MARKER;
    }

    public String marker(String target) {
        return isConsuming(target) ? CONSUMING_MARKER : IDLE_MARKER;
    }

    public final class Scope implements AutoCloseable {

        private final String target;
        private boolean closed;

        private Scope(String target) {
            this.target = target;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            Deque<String> targets = consumingTargets.get();
            targets.removeLastOccurrence(target);
            if (targets.isEmpty()) {
                consumingTargets.remove();
            }
        }
    }
}
