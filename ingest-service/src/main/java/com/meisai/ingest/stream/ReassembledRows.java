package com.meisai.ingest.stream;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/** Complete rows recovered from one chunk. */
@Getter
@AllArgsConstructor
public class ReassembledRows {

    private final List<String> rows;
    private final long bytesConsumed;
    private final boolean last;
    private final boolean ignored;

    static ReassembledRows ignoredChunk() {
        return new ReassembledRows(List.of(), 0, false, true);
    }
}
