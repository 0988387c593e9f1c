package com.williamcallahan.publist.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.publist.config.AppProperties;
import com.williamcallahan.publist.config.PublicationParsingConfig;
import com.williamcallahan.publist.domain.publication.PublicationOutcome;
import com.williamcallahan.publist.domain.publication.PublicationParseResult;
import com.williamcallahan.publist.service.publication.PublicationListParser;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Parses pasted publication lists for the HTTP API and the command-line import.
 *
 * <p>Parsing is a pure function of the text, so results are memoized by the raw text.</p>
 */
@Service
public class PublicationImportService {

    private static final Logger logger = LoggerFactory.getLogger(PublicationImportService.class);
    private static final int CACHE_SIZE = 200;
    private static final Duration CACHE_DURATION = Duration.ofMinutes(30);

    private final PublicationListParser parser;
    private final int maxInputLength;
    private final Cache<String, PublicationParseResult> parseCache;

    public PublicationImportService(AppProperties appProperties) {
        PublicationParsingConfig parsingConfig = appProperties.getParser();
        this.parser = PublicationListParser.from(parsingConfig);
        this.maxInputLength = parsingConfig.getMaxInputLength();
        this.parseCache = Caffeine.newBuilder()
            .maximumSize(CACHE_SIZE)
            .expireAfterWrite(CACHE_DURATION)
            .recordStats()
            .build();

        logger.info("PublicationImportService initialized: years {}-{}, min content length {}, prefixes {}",
            parsingConfig.getMinYear(), parsingConfig.getMaxYear(),
            parsingConfig.getMinContentLength(), parsingConfig.getMetadataPrefixes());
    }

    /**
     * Parses a pasted publication list.
     *
     * @param rawText pasted text; null and blank input yield an empty result
     * @return outcomes in anchor order with their summary
     * @throws PublicationListTooLargeException when the text exceeds the configured input limit
     */
    public PublicationParseResult parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return PublicationParseResult.empty();
        }
        if (rawText.length() > maxInputLength) {
            throw new PublicationListTooLargeException(rawText.length(), maxInputLength);
        }

        PublicationParseResult cached = parseCache.getIfPresent(rawText);
        if (cached != null) {
            logger.debug("Cache hit for publication list of length {}", rawText.length());
            return cached;
        }

        long startTime = System.currentTimeMillis();
        List<PublicationOutcome> outcomes = parser.parse(rawText);
        PublicationParseResult result = PublicationParseResult.of(outcomes);
        parseCache.put(rawText, result);

        var summary = result.summary();
        logger.debug("Parsed publication list of length {} in {}ms", rawText.length(),
            System.currentTimeMillis() - startTime);
        logger.info("Publication list parsed: {} anchors, {} extracted, {} skipped "
                + "({} missing title, {} missing quartile)",
            summary.anchors(), summary.extracted(), summary.skipped(),
            summary.missingTitle(), summary.missingQuartile());
        return result;
    }

    /**
     * Gets cache statistics for monitoring.
     * @return cache statistics
     */
    public CacheStats getCacheStats() {
        var stats = parseCache.stats();
        return new CacheStats(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            parseCache.estimatedSize()
        );
    }

    /**
     * Clears the parse cache.
     */
    public void clearCache() {
        parseCache.invalidateAll();
        logger.info("Publication parse cache cleared");
    }

    /**
     * Cache statistics record.
     */
    public record CacheStats(
        long hitCount,
        long missCount,
        long evictionCount,
        long size
    ) {
        public double hitRate() {
            long total = hitCount + missCount;
            return total == 0 ? 0.0 : (double) hitCount / total;
        }
    }
}
