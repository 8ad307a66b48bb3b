package dev.epwbatch.api;

/**
 * Point-in-time view of a cache store.
 *
 * @param entryCount   indexed entries, valid or not
 * @param validCount   entries that are unexpired
 * @param expiredCount entries past their TTL that the next sweep will remove
 * @param totalBytes   sum of recorded payload sizes
 * @param maxBytes     configured byte budget
 * @param usagePercent {@code totalBytes / maxBytes * 100}
 */
public record CacheStats(int entryCount, int validCount, int expiredCount, long totalBytes, long maxBytes,
                         double usagePercent) {

    public static CacheStats empty(long maxBytes) {
        return new CacheStats(0, 0, 0, 0L, maxBytes, 0.0);
    }

    public double totalMb() {
        return totalBytes / (1024.0 * 1024.0);
    }

    public double maxMb() {
        return maxBytes / (1024.0 * 1024.0);
    }
}
