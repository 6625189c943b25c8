package com.hospital.opd.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Body of confirm / start / complete / no-show calls. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ActionRequest {
    private String actorId;
    private String notes;
}
