package com.meisai.ingest.controller;

import com.meisai.common.error.MeisaiException;
import com.meisai.ingest.entity.StatementRecord;
import com.meisai.ingest.storage.StatementStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/** Read access to stored records; mapping-service uses it to check a record exists. */
@RestController
@RequestMapping("/statements")
@RequiredArgsConstructor
public class StatementController {

    private final StatementStore statementStore;

    @GetMapping("/{id}")
    public StatementRecord get(@PathVariable Long id) {
        return statementStore.get(id).orElseThrow(() -> MeisaiException.statementNotFound("id", id));
    }

    @GetMapping("/by-hash/{hash}")
    public StatementRecord getByHash(@PathVariable String hash) {
        return statementStore.getByHash(hash).orElseThrow(() -> MeisaiException.statementNotFound("contentHash", hash));
    }
}
