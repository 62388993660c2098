package com.meisai.ingest.controller;

import com.meisai.common.model.ImportChunk;
import com.meisai.common.model.ImportProgress;
import com.meisai.ingest.dto.ChunkRequest;
import com.meisai.ingest.dto.ImportRequest;
import com.meisai.ingest.dto.ImportSessionSummary;
import com.meisai.ingest.dto.OpenStreamRequest;
import com.meisai.ingest.dto.PageResponse;
import com.meisai.ingest.service.CsvImportService;
import com.meisai.ingest.service.ImportSessionService;
import com.meisai.ingest.service.StreamingImportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/imports")
@RequiredArgsConstructor
public class ImportController {

    private final CsvImportService csvImportService;
    private final StreamingImportService streamingImportService;
    private final ImportSessionService sessionService;

    @PostMapping
    public ResponseEntity<ImportSessionSummary> importFile(@RequestBody ImportRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(csvImportService.importFile(request));
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportSessionSummary> upload(@RequestParam("file") MultipartFile file,
                                                       @RequestParam String accountType,
                                                       @RequestParam String accountId,
                                                       @RequestParam(required = false) String createdBy) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(csvImportService.importUpload(file, accountType, accountId, createdBy));
    }

    @PostMapping("/streams")
    public ResponseEntity<ImportSessionSummary> openStream(@RequestBody OpenStreamRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(streamingImportService.open(request));
    }

    @PostMapping("/streams/{sessionId}/chunks")
    public List<ImportProgress> sendChunk(@PathVariable String sessionId, @RequestBody ChunkRequest request) {
        ImportChunk chunk = ImportChunk.builder()
                .sessionId(request.getSessionId() != null ? request.getSessionId() : sessionId)
                .chunkNumber(request.getChunkNumber())
                .data(request.getData())
                .last(request.isLast())
                .build();
        return streamingImportService.acceptChunk(sessionId, chunk);
    }

    @PostMapping("/{sessionId}/cancel")
    public ImportSessionSummary cancel(@PathVariable String sessionId) {
        return sessionService.cancel(sessionId);
    }

    @GetMapping("/{sessionId}")
    public ImportSessionSummary get(@PathVariable String sessionId) {
        return sessionService.get(sessionId);
    }

    @GetMapping
    public PageResponse<ImportSessionSummary> list(@RequestParam(required = false) String accountType,
                                                   @RequestParam(required = false) String accountId,
                                                   @RequestParam(required = false) String status,
                                                   @RequestParam(required = false) String createdBy,
                                                   @RequestParam(required = false) Integer page,
                                                   @RequestParam(required = false) Integer pageSize) {
        return sessionService.list(accountType, accountId, status, createdBy, page, pageSize);
    }
}
