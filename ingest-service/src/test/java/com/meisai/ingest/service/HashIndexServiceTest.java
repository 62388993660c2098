package com.meisai.ingest.service;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.ingest.dto.HashImportRequest;
import com.meisai.ingest.dto.HashImportResult;
import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.pipeline.ImportOptions;
import com.meisai.ingest.support.IngestFixture;
import com.meisai.ingest.support.StatementCsv;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HashIndexService Unit Tests")
class HashIndexServiceTest {

    @TempDir
    Path dir;

    private Path write(String name, String csv) throws IOException {
        return Files.write(dir.resolve(name), StatementCsv.bytes(csv));
    }

    private static HashImportRequest request(Path path, ImportOptions options) {
        return HashImportRequest.builder().csvPath(path.toString()).options(options).build();
    }

    @Test
    @DisplayName("Importing the same file twice adds nothing the second time")
    void idempotentReimport() throws IOException {
        // Given
        IngestFixture fixture = new IngestFixture();
        Path file = write("statement.csv", StatementCsv.withHeader(25));

        // When
        HashImportResult first = fixture.hashIndexService.importFile(request(file, null));
        HashImportResult second = fixture.hashIndexService.importFile(request(file, null));

        // Then
        assertThat(first.getAddedCount()).isEqualTo(25);
        assertThat(first.getStatus()).isEqualTo("completed");
        assertThat(second.getAddedCount()).isZero();
        assertThat(second.getDuplicateCount()).isEqualTo(25);
        assertThat(second.getProcessedCount()).isEqualTo(25);
        assertThat(fixture.store.count()).isEqualTo(25);
        assertThat(fixture.hashIndexService.stats().getTotalRecords()).isEqualTo(25);
    }

    @Test
    @DisplayName("The import is tracked as a session of its own")
    void trackedAsSession() throws IOException {
        IngestFixture fixture = new IngestFixture();
        Path file = write("statement.csv", StatementCsv.withHeader(2));

        HashImportResult result = fixture.hashIndexService.importFile(request(file, null));

        ImportSession session = fixture.savedSessions.get(result.getSessionId());
        assertThat(session.getCreatedBy()).isEqualTo("hash-import");
        assertThat(session.getFileName()).isEqualTo("statement.csv");
        assertThat(session.getAccountType()).isNull();
    }

    @Test
    @DisplayName("validateOnly reports what would be added without storing it")
    void validateOnly() throws IOException {
        IngestFixture fixture = new IngestFixture();
        Path file = write("statement.csv", StatementCsv.withHeader(5));

        HashImportResult result = fixture.hashIndexService.importFile(
                request(file, ImportOptions.builder().validateOnly(true).build()));

        assertThat(result.isValidateOnly()).isTrue();
        assertThat(result.getAddedCount()).isEqualTo(5);
        assertThat(fixture.store.count()).isZero();
        assertThat(fixture.hashIndex.size()).isZero();
    }

    @Test
    @DisplayName("With change detection and updateExisting a corrected row updates the stored record")
    void correctedRowsUpdateInPlace() throws IOException {
        // Given
        IngestFixture fixture = new IngestFixture(true);
        String original = StatementCsv.withHeader(3);
        fixture.hashIndexService.importFile(request(write("v1.csv", original), null));
        String corrected = original.replace("\"1,001\"", "\"1,101\"");

        // When
        HashImportResult result = fixture.hashIndexService.importFile(request(write("v2.csv", corrected),
                ImportOptions.builder().updateExisting(true).build()));

        // Then
        assertThat(result.getUpdatedCount()).isEqualTo(1);
        assertThat(result.getAddedCount()).isZero();
        assertThat(result.getDuplicateCount()).isEqualTo(2);
        assertThat(fixture.store.count()).isEqualTo(3);
        assertThat(fixture.store.all()).extracting(r -> r.getTollAmount()).contains(1101).doesNotContain(1001);
        assertThat(fixture.hashIndex.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Without updateExisting a corrected row is stored next to the original")
    void correctedRowsStoredSeparately() throws IOException {
        IngestFixture fixture = new IngestFixture(true);
        String original = StatementCsv.withHeader(3);
        fixture.hashIndexService.importFile(request(write("v1.csv", original), null));

        HashImportResult result = fixture.hashIndexService.importFile(
                request(write("v2.csv", original.replace("\"1,001\"", "\"1,101\"")), null));

        assertThat(result.getAddedCount()).isEqualTo(1);
        assertThat(result.getUpdatedCount()).isZero();
        assertThat(fixture.store.count()).isEqualTo(4);
    }

    @Test
    @DisplayName("Missing or non-CSV paths are validation errors")
    void badPaths() throws IOException {
        IngestFixture fixture = new IngestFixture();
        Path text = write("statement.txt", StatementCsv.withHeader(1));

        assertThatThrownBy(() -> fixture.hashIndexService.importFile(request(dir.resolve("missing.csv"), null)))
                .isInstanceOfSatisfying(MeisaiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR));
        assertThatThrownBy(() -> fixture.hashIndexService.importFile(request(text, null)))
                .isInstanceOfSatisfying(MeisaiException.class,
                        e -> assertThat(e.getContext()).containsEntry("field", "fileName"));
        assertThatThrownBy(() -> fixture.hashIndexService.importFile(new HashImportRequest()))
                .isInstanceOfSatisfying(MeisaiException.class,
                        e -> assertThat(e.getContext()).containsEntry("field", "csvPath"));
    }

    @Test
    @DisplayName("clear empties the index and a re-import still finds the stored rows")
    void clear() throws IOException {
        // Given
        IngestFixture fixture = new IngestFixture();
        Path file = write("a.csv", StatementCsv.withHeader(4));
        fixture.hashIndexService.importFile(request(file, null));

        // When
        assertThat(fixture.hashIndexService.clear().getTotalRecords()).isZero();
        HashImportResult again = fixture.hashIndexService.importFile(request(file, null));

        // Then
        assertThat(again.getDuplicateCount()).isEqualTo(4);
        assertThat(again.getAddedCount()).isZero();
        assertThat(again.getErrorCount()).isZero();
        assertThat(fixture.store.count()).isEqualTo(4);
        assertThat(fixture.hashIndexService.stats().getTotalRecords()).isEqualTo(4);
    }
}
