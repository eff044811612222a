package lab.accessmanager.authorization.lock;

import lab.accessmanager.authorization.OperationId;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Lookup table from operation selector to the redemption-lock class of the operation.
 * Anything not listed is {@link OperationKind#OTHER}.
 */
public class OperationClassifier {

    private final Map<OperationId, OperationKind> kinds;

    public OperationClassifier(Map<OperationId, OperationKind> kinds) {
        this.kinds = Map.copyOf(kinds);
    }

    public static OperationClassifier of(Collection<OperationId> depositLike, Collection<OperationId> withdrawLike) {
        Map<OperationId, OperationKind> table = new HashMap<>();
        depositLike.forEach(op -> table.put(op, OperationKind.DEPOSIT));
        for (OperationId op : withdrawLike) {
            if (table.putIfAbsent(op, OperationKind.WITHDRAW) != null) {
                throw new IllegalStateException("operation classified as both deposit-like and withdraw-like: " + op);
            }
        }
        return new OperationClassifier(table);
    }

    public OperationKind classify(OperationId operation) {
        return kinds.getOrDefault(operation, OperationKind.OTHER);
    }

    public Map<OperationId, OperationKind> table() {
        return kinds;
    }
}
