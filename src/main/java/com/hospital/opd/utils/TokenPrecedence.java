package com.hospital.opd.utils;

import com.hospital.opd.entity.Token;

import java.time.Instant;
import java.util.Comparator;

/**
 * Orders tokens by who is served first: higher priority, then earlier
 * creation, then smaller token id.
 */
public final class TokenPrecedence {

    public static final Comparator<Token> SERVE_ORDER = Comparator
            .comparingInt(Token::getPriority).reversed()
            .thenComparing(Token::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(Token::getTokenId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    /** Lowest precedence first; the order in which preemption victims are considered. */
    public static final Comparator<Token> VICTIM_ORDER = SERVE_ORDER.reversed();

    private TokenPrecedence() {
    }

    /** Negative when {@code a} is served before {@code b}. */
    public static int compare(Token a, Token b) {
        return SERVE_ORDER.compare(a, b);
    }
}
