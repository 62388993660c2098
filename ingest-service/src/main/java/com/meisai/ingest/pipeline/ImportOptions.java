package com.meisai.ingest.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * skipDuplicates=false turns an exact duplicate into a row error.
 * updateExisting only matters when change detection is enabled.
 * validateOnly classifies without writing anything.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportOptions {

    @Builder.Default
    private boolean skipDuplicates = true;

    @Builder.Default
    private boolean updateExisting = false;

    @Builder.Default
    private boolean validateOnly = false;

    public static ImportOptions defaults() {
        return ImportOptions.builder().build();
    }
}
