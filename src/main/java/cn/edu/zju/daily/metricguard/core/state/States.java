package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import java.util.Collection;
import java.util.Iterator;

/** Helpers for combining states whose concrete type is only known at runtime. */
public final class States {

    private States() {}

    /**
     * Merges two type-erased states. Both must be of exactly the same class.
     *
     * @throws StateIncompatibilityException if the shapes differ
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static AnalyzerState<?> mergeErased(AnalyzerState<?> left, AnalyzerState<?> right) {
        checkSameShape(left, right);
        return (AnalyzerState<?>) ((AnalyzerState) left).merge(right);
    }

    public static <S extends AnalyzerState<S>> S mergeAll(Collection<S> states, S empty) {
        S result = empty;
        Iterator<S> it = states.iterator();
        while (it.hasNext()) {
            result = result.merge(it.next());
        }
        return result;
    }

    public static void checkSameShape(Object left, Object right) {
        if (left == null || right == null || left.getClass() != right.getClass()) {
            throw StateIncompatibilityException.of(left, right);
        }
    }
}
