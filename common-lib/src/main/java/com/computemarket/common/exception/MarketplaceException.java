package com.computemarket.common.exception;

import java.util.Locale;

/**
 * Unchecked failure of the marketplace, tagged with what it concerns: a market strategy
 * (unknown, unregistered or duplicated) or a configuration key holding an unusable value.
 *
 * <p>Invalid offers and unknown tasks are not failures and never raise this exception.
 */
public class MarketplaceException extends RuntimeException {

    public enum Kind {
        STRATEGY,
        CONFIGURATION
    }

    private final Kind kind;
    private final String subject;

    public MarketplaceException(Kind kind, String subject, String message) {
        super(kind.name().toLowerCase(Locale.ROOT) + " [" + subject + "] " + message);
        this.kind = kind;
        this.subject = subject;
    }

    public static MarketplaceException strategy(String strategyId, String message) {
        return new MarketplaceException(Kind.STRATEGY, strategyId, message);
    }

    public static MarketplaceException configuration(String key, String message) {
        return new MarketplaceException(Kind.CONFIGURATION, key, message);
    }

    public Kind getKind() {
        return kind;
    }

    /** Strategy id or configuration key. */
    public String getSubject() {
        return subject;
    }
}
