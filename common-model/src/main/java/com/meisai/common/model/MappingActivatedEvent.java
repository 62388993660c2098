package com.meisai.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/** Published by mapping-service when a mapping becomes active. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MappingActivatedEvent implements Serializable {
    private Long mappingId;
    private Long statementRecordId;
    private String externalEntityId;
    private String externalEntityType;
    private Instant timestamp;
}
