package com.hospital.opd.dto;

import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenMetadata;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.entity.TokenStatus;

import java.time.Instant;

public record TokenView(
        String tokenId,
        String patientId,
        String doctorId,
        String slotId,
        int tokenNumber,
        TokenSource source,
        int priority,
        TokenStatus status,
        TokenMetadata metadata,
        Instant createdAt,
        Instant updatedAt,
        long version
) {

    public static TokenView from(Token token) {
        return new TokenView(
                token.getTokenId(),
                token.getPatientId(),
                token.getDoctorId(),
                token.getSlotId(),
                token.getTokenNumber(),
                token.getSource(),
                token.getPriority(),
                token.getStatus(),
                token.getMetadata(),
                token.getCreatedAt(),
                token.getUpdatedAt(),
                token.getVersion() != null ? token.getVersion() : 0L
        );
    }
}
