package com.meisai.ingest.controller;

import com.meisai.ingest.dto.HashImportRequest;
import com.meisai.ingest.dto.HashImportResult;
import com.meisai.ingest.hash.HashIndexStats;
import com.meisai.ingest.service.HashIndexService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/hash-index")
@RequiredArgsConstructor
public class HashIndexController {

    private final HashIndexService hashIndexService;

    @PostMapping("/import")
    public HashImportResult importFile(@RequestBody HashImportRequest request) {
        return hashIndexService.importFile(request);
    }

    @GetMapping("/stats")
    public HashIndexStats stats() {
        return hashIndexService.stats();
    }

    @DeleteMapping
    public HashIndexStats clear() {
        return hashIndexService.clear();
    }
}
