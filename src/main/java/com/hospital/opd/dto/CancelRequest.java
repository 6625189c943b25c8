package com.hospital.opd.dto;

import com.hospital.opd.entity.CancellationReason;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CancelRequest {
    private CancellationReason reason;
    private String cancelledBy;
    private String notes;
}
