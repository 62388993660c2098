package com.meisai.mapping.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/** The part of an ingest-service statement record the mapping side reads. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatementRecordView {
    private Long id;
    private LocalDate date;
    private LocalTime time;
    private String entryPoint;
    private String exitPoint;
    private Integer tollAmount;
    private String vehicleNumber;
    private String contentHash;
    private String externalReferenceNumber;
}
