package com.hospital.opd.entity;

import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Allowed moves of the token state machine. Terminal states accept none.
 */
public enum TokenTransition {
    CONFIRM(EnumSet.of(TokenStatus.ALLOCATED), TokenStatus.CONFIRMED),
    START(EnumSet.of(TokenStatus.CONFIRMED), TokenStatus.IN_CONSULTATION),
    COMPLETE(EnumSet.of(TokenStatus.CONFIRMED, TokenStatus.IN_CONSULTATION), TokenStatus.COMPLETED),
    CANCEL(EnumSet.of(TokenStatus.ALLOCATED, TokenStatus.CONFIRMED), TokenStatus.CANCELLED),
    PREEMPT(EnumSet.of(TokenStatus.ALLOCATED, TokenStatus.CONFIRMED), TokenStatus.CANCELLED),
    NOSHOW(EnumSet.of(TokenStatus.ALLOCATED, TokenStatus.CONFIRMED), TokenStatus.NOSHOW);

    private final Set<TokenStatus> from;
    private final TokenStatus target;

    TokenTransition(Set<TokenStatus> from, TokenStatus target) {
        this.from = from;
        this.target = target;
    }

    public boolean allowedFrom(TokenStatus status) {
        return from.contains(status);
    }

    public TokenStatus target() {
        return target;
    }

    /** True when applying this move takes the token out of its slot's allocation. */
    public boolean releasesCapacity() {
        return !target.isActive();
    }

    public void requireAllowed(Token token) {
        TokenStatus current = token.getStatus();
        if (allowedFrom(current)) {
            return;
        }
        String action = name().toLowerCase(Locale.ROOT);
        Map<String, Object> details = Map.of(
                "tokenId", token.getTokenId(),
                "currentStatus", current.name(),
                "action", action);
        if (current.isTerminal()) {
            throw new AllocationException(ErrorCode.TOKEN_ALREADY_PROCESSED,
                    "Token " + token.getTokenId() + " is already " + current.name().toLowerCase(Locale.ROOT),
                    details, List.of("Book a new token instead"));
        }
        throw new AllocationException(ErrorCode.INVALID_TOKEN_STATUS,
                "Cannot " + action + " token " + token.getTokenId() + " in status " + current.name(),
                details);
    }
}
