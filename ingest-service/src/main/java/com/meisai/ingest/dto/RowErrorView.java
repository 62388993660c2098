package com.meisai.ingest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RowErrorView {
    private long rowNumber;
    private String errorKind;
    private String message;
}
