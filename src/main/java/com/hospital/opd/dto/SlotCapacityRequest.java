package com.hospital.opd.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SlotCapacityRequest {
    private Integer maxCapacity;
    private Integer emergencyReserved;
}
