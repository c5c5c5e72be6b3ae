package com.pdm.engine.history;

/**
 * Deterministic pseudo-random sequence keyed by a string, so that demo
 * history for the same asset and equipment is identical on every call.
 */
final class SeededRandom {

    private static final long MODULUS_MASK = 0x7fffffffL;

    private long state;

    SeededRandom(String key) {
        this.state = seedOf(key);
    }

    static long seedOf(String key) {
        return Math.abs((long) key.hashCode());
    }

    /**
     * Next value in [0, 1].
     */
    double nextDouble() {
        state = (state * 1103515245L + 12345L) & MODULUS_MASK;
        return (double) state / MODULUS_MASK;
    }

    /**
     * Next integer in [0, bound).
     */
    int nextInt(int bound) {
        return Math.min(bound - 1, (int) Math.floor(nextDouble() * bound));
    }

    boolean chance(double threshold) {
        return nextDouble() > threshold;
    }
}
