package com.hospital.opd.dto;

import com.hospital.opd.entity.TokenStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.List;

/**
 * Selects tokens to move out of their slots. {@code slotId} wins over
 * {@code doctorId}; dates default to today. Statuses default to the active
 * preemptable ones.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchReallocationRequest {
    private String doctorId;
    private String slotId;
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private List<TokenStatus> statuses;
    private String reason;
}
