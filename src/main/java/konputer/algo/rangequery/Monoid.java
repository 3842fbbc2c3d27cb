package konputer.algo.rangequery;

import org.jspecify.annotations.NonNull;

import java.util.function.BinaryOperator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An associative merge operation paired with its identity element.
 * <p>
 * {@code merge(identity, x)} and {@code merge(x, identity)} must both equal {@code x}.
 * The operation does not have to be commutative.
 */
public record Monoid<T>(
        T identity,
        @NonNull BinaryOperator<T> merge
) {

    public Monoid {
        checkNotNull(merge, "merge operation cannot be null");
    }

    public static <T> Monoid<T> of(T identity, @NonNull BinaryOperator<T> merge) {
        return new Monoid<>(identity, merge);
    }

    public T combine(T left, T right) {
        return merge.apply(left, right);
    }
}
