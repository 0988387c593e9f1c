package com.williamcallahan.publist.web;

import com.williamcallahan.publist.service.PublicationImportService;
import java.util.Locale;

/**
 * Parse cache statistics.
 *
 * @param hitCount cache hits
 * @param missCount cache misses
 * @param evictionCount evicted entries
 * @param size approximate entry count
 * @param hitRate formatted hit rate percentage
 */
public record PublicationCacheStatsResponse(long hitCount, long missCount, long evictionCount, long size, String hitRate) {

    static PublicationCacheStatsResponse from(PublicationImportService.CacheStats stats) {
        return new PublicationCacheStatsResponse(
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                stats.size(),
                String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100));
    }
}
