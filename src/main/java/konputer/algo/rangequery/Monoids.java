package konputer.algo.rangequery;

import com.google.common.math.LongMath;

/**
 * Stock monoids for the common range queries.
 */
public final class Monoids {

    private static final Monoid<Long> LONG_SUM = Monoid.of(0L, Long::sum);
    private static final Monoid<Long> LONG_MIN = Monoid.of(Long.MAX_VALUE, Math::min);
    private static final Monoid<Long> LONG_MAX = Monoid.of(Long.MIN_VALUE, Math::max);
    // gcd(0, x) == x, so 0 is the identity
    private static final Monoid<Long> LONG_GCD = Monoid.of(0L, Monoids::gcd);
    private static final Monoid<Long> LONG_XOR = Monoid.of(0L, (a, b) -> a ^ b);
    private static final Monoid<Integer> INT_SUM = Monoid.of(0, Integer::sum);
    private static final Monoid<Integer> INT_MIN = Monoid.of(Integer.MAX_VALUE, Math::min);
    private static final Monoid<Integer> INT_MAX = Monoid.of(Integer.MIN_VALUE, Math::max);
    private static final Monoid<String> STRING_CONCAT = Monoid.of("", String::concat);

    private Monoids() {
    }

    public static Monoid<Long> longSum() {
        return LONG_SUM;
    }

    public static Monoid<Long> longMin() {
        return LONG_MIN;
    }

    public static Monoid<Long> longMax() {
        return LONG_MAX;
    }

    /** Greatest common divisor of absolute values. */
    public static Monoid<Long> longGcd() {
        return LONG_GCD;
    }

    public static Monoid<Long> longXor() {
        return LONG_XOR;
    }

    public static Monoid<Integer> intSum() {
        return INT_SUM;
    }

    public static Monoid<Integer> intMin() {
        return INT_MIN;
    }

    public static Monoid<Integer> intMax() {
        return INT_MAX;
    }

    /** Left-to-right concatenation, not commutative. */
    public static Monoid<String> stringConcat() {
        return STRING_CONCAT;
    }

    private static long gcd(long a, long b) {
        return LongMath.gcd(Math.abs(a), Math.abs(b));
    }
}
