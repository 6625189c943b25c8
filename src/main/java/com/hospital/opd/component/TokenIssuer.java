package com.hospital.opd.component;

import com.hospital.opd.entity.Slot;
import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenMetadata;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.entity.TokenStatus;
import com.hospital.opd.repository.TokenRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Inserts a new token under a number already issued by the capacity manager.
 */
@Component
public class TokenIssuer {

    private final TokenRepository tokenRepository;
    private final Clock clock;

    public TokenIssuer(TokenRepository tokenRepository, Clock clock) {
        this.tokenRepository = tokenRepository;
        this.clock = clock;
    }

    public Token issue(Slot slot, int tokenNumber, String patientId, TokenSource source, int priority,
                       TokenStatus status, TokenMetadata metadata) {
        Instant now = clock.instant();
        Token token = Token.builder()
                .tokenId(newTokenId())
                .patientId(patientId)
                .doctorId(slot.getDoctorId())
                .slotId(slot.getSlotId())
                .tokenNumber(tokenNumber)
                .source(source)
                .priority(priority)
                .status(status)
                .metadata(metadata != null ? metadata : new TokenMetadata())
                .createdAt(now)
                .updatedAt(now)
                .build();
        return tokenRepository.save(token);
    }

    public static String newTokenId() {
        return "TKN-" + UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
    }
}
