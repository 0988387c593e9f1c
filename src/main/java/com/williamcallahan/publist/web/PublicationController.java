package com.williamcallahan.publist.web;

import com.williamcallahan.publist.service.PublicationImportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for extracting ranked publications from pasted publication lists.
 */
@RestController
@RequestMapping("/api/publications")
public class PublicationController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(PublicationController.class);

    private final PublicationImportService publicationImportService;

    public PublicationController(PublicationImportService publicationImportService,
                                 ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.publicationImportService = publicationImportService;
    }

    /**
     * Parses a pasted publication list sent as JSON.
     *
     * @param request A JSON object containing the pasted list. Expected format:
     *                <pre>{@code
     *                  {
     *                    "content": "Title...\nQ1\n48\t2023"
     *                  }
     *                }</pre>
     * @return outcomes, summary and storable drafts
     */
    @PostMapping(value = "/parse",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PublicationParseResponse> parseJson(@RequestBody(required = false) PublicationParseRequest request) {
        String content = request == null ? null : request.content();
        return ResponseEntity.ok(parse(content));
    }

    /**
     * Parses a pasted publication list sent as the raw request body.
     *
     * @param content pasted text
     * @return outcomes, summary and storable drafts
     */
    @PostMapping(value = "/parse",
                 consumes = MediaType.TEXT_PLAIN_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PublicationParseResponse> parseText(@RequestBody(required = false) String content) {
        return ResponseEntity.ok(parse(content));
    }

    /**
     * Retrieves statistics about the parse cache.
     */
    @GetMapping("/cache/stats")
    public ResponseEntity<PublicationCacheStatsResponse> getCacheStats() {
        return ResponseEntity.ok(PublicationCacheStatsResponse.from(publicationImportService.getCacheStats()));
    }

    /**
     * Clears the parse cache.
     *
     * @return statistics after clearing, or an error payload when clearing fails
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<?> clearCache() {
        try {
            publicationImportService.clearCache();
            logger.info("Publication parse cache cleared via API");
            return ResponseEntity.ok(PublicationCacheStatsResponse.from(publicationImportService.getCacheStats()));
        } catch (RuntimeException e) {
            logger.error("Error clearing publication parse cache", e);
            return handleServiceException(e, "clear cache");
        }
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<PublicationErrorResponse> handleValidationException(IllegalArgumentException e) {
        logger.warn("Rejected publication list: {}", e.getMessage());
        return super.handleValidationException(e);
    }

    private PublicationParseResponse parse(String content) {
        if (content != null) {
            logger.debug("Parsing publication list of length: {}", content.length());
        }
        return PublicationParseResponse.from(publicationImportService.parse(content));
    }
}
