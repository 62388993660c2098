package com.meisai.mapping.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CandidateRequest {
    private String entityId;
    private String entityType;
    private LocalDate date;
    private LocalTime time;
    private String entryPoint;
    private String exitPoint;
    private Integer amount;
    private String vehicleNumber;
}
