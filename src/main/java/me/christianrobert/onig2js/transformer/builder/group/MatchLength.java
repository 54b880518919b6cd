package me.christianrobert.onig2js.transformer.builder.group;

/**
 * Length range, in target code units, of the strings a subpattern can match.
 *
 * <p>A length is <em>variable</em> when it cannot be described by a single
 * bounded range: unbounded repetition, alternations of differing lengths,
 * backreferences and similar.</p>
 */
public final class MatchLength {

    private static final long LIMIT = Integer.MAX_VALUE;

    public static final MatchLength ZERO = new MatchLength(0, 0, false);
    public static final MatchLength ONE = new MatchLength(1, 1, false);
    public static final MatchLength VARIABLE = new MatchLength(0, 0, true);

    private final int min;
    private final int max;
    private final boolean variable;

    private MatchLength(int min, int max, boolean variable) {
        this.min = min;
        this.max = max;
        this.variable = variable;
    }

    public static MatchLength of(int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid match length [" + min + "," + max + "]");
        }
        return new MatchLength(min, max, false);
    }

    public static MatchLength fixed(int length) {
        return of(length, length);
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean isVariable() {
        return variable;
    }

    public boolean isFixed() {
        return !variable && min == max;
    }

    /**
     * Length of this followed by {@code next}.
     */
    public MatchLength then(MatchLength next) {
        if (variable || next.variable) {
            return VARIABLE;
        }
        return bounded((long) min + next.min, (long) max + next.max);
    }

    /**
     * Length of this repeated between {@code minTimes} and {@code maxTimes} times.
     */
    public MatchLength repeat(int minTimes, int maxTimes) {
        if (variable) {
            return VARIABLE;
        }
        return bounded((long) min * minTimes, (long) max * maxTimes);
    }

    private static MatchLength bounded(long min, long max) {
        if (max > LIMIT) {
            return VARIABLE;
        }
        return of((int) min, (int) max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchLength)) {
            return false;
        }
        MatchLength that = (MatchLength) o;
        return min == that.min && max == that.max && variable == that.variable;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * min + max) + (variable ? 1 : 0);
    }

    @Override
    public String toString() {
        return variable ? "MatchLength{variable}" : "MatchLength{" + min + ".." + max + "}";
    }
}
