package com.meisai.mapping.controller;

import com.meisai.mapping.dto.CandidateRequest;
import com.meisai.mapping.dto.CandidateView;
import com.meisai.mapping.dto.PageResponse;
import com.meisai.mapping.service.CandidateService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/candidates")
@RequiredArgsConstructor
public class CandidateController {

    private final CandidateService candidateService;

    @PostMapping
    public ResponseEntity<CandidateView> register(@RequestBody CandidateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(candidateService.register(request));
    }

    @GetMapping
    public PageResponse<CandidateView> list(@RequestParam(required = false) String entityType,
                                            @RequestParam(required = false) Integer page,
                                            @RequestParam(required = false) Integer pageSize) {
        return candidateService.list(entityType, page, pageSize);
    }
}
