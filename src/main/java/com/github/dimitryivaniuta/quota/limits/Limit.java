package com.github.dimitryivaniuta.quota.limits;

/**
 * A per-period cap: either a finite non-negative count or explicitly unbounded.
 * Also used for "remaining" values, which share the same shape.
 */
public sealed interface Limit permits Limit.Finite, Limit.Unbounded {

    static Limit of(int value) {
        return new Finite(value);
    }

    static Limit unbounded() {
        return Unbounded.INSTANCE;
    }

    /** Null maps to unbounded (absent cap in configuration). */
    static Limit ofNullable(Integer value) {
        return value == null ? unbounded() : of(value);
    }

    boolean isUnbounded();

    /** Most-permissive-wins: unbounded beats any finite value, otherwise the larger value. */
    Limit mostPermissive(Limit other);

    /** {@code true} if another request fits given {@code used} requests so far. */
    boolean admits(int used);

    /** Remaining count after {@code used} requests, floored at zero. */
    Limit remainingAfter(int used);

    /** Finite value or null when unbounded (for reporting). */
    Integer valueOrNull();

    record Finite(int value) implements Limit {

        public Finite {
            if (value < 0) {
                throw new IllegalArgumentException("limit must be >= 0, got " + value);
            }
        }

        @Override
        public boolean isUnbounded() {
            return false;
        }

        @Override
        public Limit mostPermissive(Limit other) {
            if (other instanceof Finite f) {
                return f.value > value ? f : this;
            }
            return other;
        }

        @Override
        public boolean admits(int used) {
            return used < value;
        }

        @Override
        public Limit remainingAfter(int used) {
            return new Finite(Math.max(0, value - used));
        }

        @Override
        public Integer valueOrNull() {
            return value;
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    final class Unbounded implements Limit {

        static final Unbounded INSTANCE = new Unbounded();

        private Unbounded() {}

        @Override
        public boolean isUnbounded() {
            return true;
        }

        @Override
        public Limit mostPermissive(Limit other) {
            return this;
        }

        @Override
        public boolean admits(int used) {
            return true;
        }

        @Override
        public Limit remainingAfter(int used) {
            return this;
        }

        @Override
        public Integer valueOrNull() {
            return null;
        }

        @Override
        public String toString() {
            return "unbounded";
        }
    }
}
