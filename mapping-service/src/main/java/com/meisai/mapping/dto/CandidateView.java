package com.meisai.mapping.dto;

import com.meisai.mapping.entity.ExternalCandidate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CandidateView {
    private Long id;
    private String entityId;
    private String entityType;
    private LocalDate date;
    private LocalTime time;
    private String entryPoint;
    private String exitPoint;
    private Integer amount;
    private String vehicleNumber;
    private Instant registeredAt;

    public static CandidateView of(ExternalCandidate c) {
        return CandidateView.builder()
                .id(c.getId())
                .entityId(c.getEntityId())
                .entityType(c.getEntityType().wireName())
                .date(c.getDate())
                .time(c.getTime())
                .entryPoint(c.getEntryPoint())
                .exitPoint(c.getExitPoint())
                .amount(c.getAmount())
                .vehicleNumber(c.getVehicleNumber())
                .registeredAt(c.getRegisteredAt())
                .build();
    }
}
