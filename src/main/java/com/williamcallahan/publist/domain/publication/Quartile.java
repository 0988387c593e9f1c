package com.williamcallahan.publist.domain.publication;

import java.util.Optional;

/**
 * Journal quality tiers, Q1 being the highest.
 */
public enum Quartile {
    Q1,
    Q2,
    Q3,
    Q4;

    /**
     * Resolves a standalone quartile token such as {@code "Q2"}.
     *
     * <p>Matching is exact and case-sensitive; surrounding text disqualifies the token.</p>
     *
     * @param token trimmed line text (may be null)
     * @return the quartile, or empty when the token is not exactly one of Q1..Q4
     */
    public static Optional<Quartile> fromToken(String token) {
        if (token == null || token.length() != 2 || token.charAt(0) != 'Q') {
            return Optional.empty();
        }
        return switch (token.charAt(1)) {
            case '1' -> Optional.of(Q1);
            case '2' -> Optional.of(Q2);
            case '3' -> Optional.of(Q3);
            case '4' -> Optional.of(Q4);
            default -> Optional.empty();
        };
    }

    /**
     * Returns the lower-case ranking key used by stored publication records.
     *
     * @return ranking key, e.g. {@code "q1"}
     */
    public String rankingKey() {
        return "q" + (ordinal() + 1);
    }
}
