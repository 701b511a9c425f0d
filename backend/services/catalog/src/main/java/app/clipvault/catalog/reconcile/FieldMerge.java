package app.clipvault.catalog.reconcile;

import java.util.function.BinaryOperator;
import java.util.function.Predicate;

/**
 * Pure per-field reducers. None of them look at which event produced which side, which is
 * what makes registration and finalization merges commute.
 */
public final class FieldMerge {

    private FieldMerge() {
    }

    public static <T> T merge(T existing, T incoming, FieldPolicy policy, Predicate<? super T> isEmpty) {
        return switch (policy) {
            case FILL_IF_EMPTY -> isEmpty.test(existing) && !isEmpty.test(incoming) ? incoming : existing;
            case AUTHORITATIVE -> isEmpty.test(incoming) ? existing : incoming;
            case ESCALATE_ONLY -> throw new IllegalArgumentException(
                    "Escalate-only merge applies to boolean fields, use FieldMerge.escalateOnly()");
        };
    }

    public static <T> BinaryOperator<T> reducer(FieldPolicy policy, Predicate<? super T> isEmpty) {
        if (policy == FieldPolicy.ESCALATE_ONLY) {
            throw new IllegalArgumentException(
                    "Escalate-only merge applies to boolean fields, use FieldMerge.escalateOnly()");
        }
        return (existing, incoming) -> merge(existing, incoming, policy, isEmpty);
    }

    public static BinaryOperator<Boolean> escalateOnly() {
        return FieldMerge::escalate;
    }

    /**
     * A flag that is set stays set; an unset stored flag reads as {@code false}.
     */
    public static Boolean escalate(Boolean existing, Boolean incoming) {
        if (Boolean.TRUE.equals(existing) || Boolean.TRUE.equals(incoming)) {
            return Boolean.TRUE;
        }
        return Boolean.FALSE;
    }
}
