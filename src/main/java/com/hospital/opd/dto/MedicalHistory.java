package com.hospital.opd.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MedicalHistory {

    private boolean critical;

    private boolean chronic;

    @Builder.Default
    private List<String> conditions = new ArrayList<>();
}
