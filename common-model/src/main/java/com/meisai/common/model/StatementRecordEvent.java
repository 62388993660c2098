package com.meisai.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Published by ingest-service after a new statement record has been committed.
 * Carries the fields the match engine compares so consumers need no lookup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatementRecordEvent implements Serializable {
    private Long recordId;
    private String contentHash;
    private LocalDate date;
    private LocalTime time;
    private String entryPoint;
    private String exitPoint;
    private Integer tollAmount;
    private String vehicleNumber;
    private String cardNumber;
    private String accountType;
    private String accountId;
    private String importSessionId;
}
