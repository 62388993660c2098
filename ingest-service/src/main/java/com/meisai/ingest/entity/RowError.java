package com.meisai.ingest.entity;

import com.meisai.common.error.ErrorKind;
import jakarta.persistence.*;
import lombok.*;

@Embeddable
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class RowError {

    private long rowNumber;

    @Enumerated(EnumType.STRING)
    private ErrorKind errorKind;

    @Column(length = 1000)
    private String message;
}
