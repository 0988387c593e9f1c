package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.domain.publication.PublicationOutcome;
import com.williamcallahan.publist.domain.publication.Quartile;
import com.williamcallahan.publist.domain.publication.SkipReason;
import com.williamcallahan.publist.domain.publication.YearAnchor;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns one anchor's scan results into an outcome. A missing title outranks a missing quartile.
 */
final class PublicationRecordAssembler {

    private PublicationRecordAssembler() {}

    static PublicationOutcome assemble(YearAnchor anchor, Optional<Quartile> quartile, Optional<String> title) {
        Objects.requireNonNull(anchor, "anchor");
        if (title.isEmpty()) {
            return PublicationOutcome.skipped(anchor.year(), SkipReason.MISSING_TITLE);
        }
        if (quartile.isEmpty()) {
            return PublicationOutcome.skipped(anchor.year(), SkipReason.MISSING_QUARTILE);
        }
        return PublicationOutcome.extracted(title.get(), anchor.year(), quartile.get());
    }
}
