package com.clientspaces.quota;

/**
 * A numeric ceiling that may be "unlimited".
 *
 * @param max the maximum count, or {@code -1} for unlimited
 */
public record Limit(long max) {

    private static final long UNLIMITED_VALUE = -1;

    /** No ceiling. */
    public static final Limit UNLIMITED = new Limit(UNLIMITED_VALUE);

    public Limit {
        if (max < 0 && max != UNLIMITED_VALUE) {
            throw new IllegalArgumentException("max must be >= 0 or unlimited");
        }
    }

    public static Limit of(long max) {
        if (max < 0) {
            throw new IllegalArgumentException("max must be >= 0, got " + max);
        }
        return new Limit(max);
    }

    /** Null means unlimited, which is how plan configuration expresses it. */
    public static Limit ofNullable(Long max) {
        return max == null ? UNLIMITED : of(max);
    }

    public boolean isUnlimited() {
        return max == UNLIMITED_VALUE;
    }

    /** Whether one more unit may be taken when {@code current} are already used. */
    public boolean allows(long current) {
        return isUnlimited() || current < max;
    }

    /** Remaining headroom, or {@link Long#MAX_VALUE} when unlimited. */
    public long remaining(long current) {
        return isUnlimited() ? Long.MAX_VALUE : Math.max(0, max - current);
    }

    @Override
    public String toString() {
        return isUnlimited() ? "unlimited" : Long.toString(max);
    }
}
