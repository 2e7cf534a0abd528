package com.sky.association.lock;

/**
 * Waiting and expiry limits for tile locks.
 *
 * @param timeoutMs      how long {@link LocalDistributedLock} waits for a busy tile
 * @param maxRetries     extra attempts {@link GraphDistributedLock} makes after the first
 * @param retryDelayMs   pause between graph attempts
 * @param lockTtlSeconds lifetime of a graph tile lock; association and matching of the
 *                       largest image must finish inside it
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs, int lockTtlSeconds) {

    public LockConfig {
        requirePositive(timeoutMs, "timeoutMs");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        requirePositive(retryDelayMs, "retryDelayMs");
        requirePositive(lockTtlSeconds, "lockTtlSeconds");
    }

    /**
     * One minute of waiting locally; 21 graph attempts half a second apart; ten minute expiry.
     */
    public static LockConfig defaults() {
        return new LockConfig(60_000, 20, 500, 600);
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
