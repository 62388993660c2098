package com.meisai.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ImportProgress Unit Tests")
class ImportProgressTest {

    @ParameterizedTest(name = "{0} terminal={1}")
    @CsvSource({"pending,false", "processing,false", "completed,true", "failed,true"})
    @DisplayName("Completed and failed snapshots are terminal")
    void terminal(String status, boolean terminal) {
        assertThat(ImportProgress.builder().status(status).build().isTerminal()).isEqualTo(terminal);
    }
}
