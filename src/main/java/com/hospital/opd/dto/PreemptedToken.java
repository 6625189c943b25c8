package com.hospital.opd.dto;

import com.hospital.opd.entity.ReallocationStatus;

/**
 * What happened to a token displaced by preemption. {@code reallocatedTo*}
 * are null while the token is pending reallocation.
 */
public record PreemptedToken(
        String tokenId,
        String patientId,
        int priority,
        ReallocationStatus reallocationStatus,
        String reallocatedToTokenId,
        String reallocatedToSlotId
) {

    public static PreemptedToken pending(String tokenId, String patientId, int priority) {
        return new PreemptedToken(tokenId, patientId, priority, ReallocationStatus.PENDING_REALLOCATION, null, null);
    }
}
