package com.meisai.mapping.controller;

import com.meisai.mapping.dto.CreateMappingRequest;
import com.meisai.mapping.dto.MappingView;
import com.meisai.mapping.dto.PageResponse;
import com.meisai.mapping.dto.ProposeRequest;
import com.meisai.mapping.dto.ProposeResponse;
import com.meisai.mapping.dto.RejectMappingRequest;
import com.meisai.mapping.dto.UpdateMappingRequest;
import com.meisai.mapping.service.MappingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/mappings")
@RequiredArgsConstructor
public class MappingController {

    private final MappingService mappingService;

    @PostMapping
    public ResponseEntity<MappingView> create(@RequestBody CreateMappingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mappingService.create(request));
    }

    @GetMapping("/{id}")
    public MappingView get(@PathVariable Long id) {
        return mappingService.get(id);
    }

    @GetMapping
    public PageResponse<MappingView> list(@RequestParam(required = false) Long statementRecordId,
                                          @RequestParam(required = false) String matchType,
                                          @RequestParam(required = false) String status,
                                          @RequestParam(required = false) String entityType,
                                          @RequestParam(required = false) Integer page,
                                          @RequestParam(required = false) Integer pageSize) {
        return mappingService.list(statementRecordId, matchType, status, entityType, page, pageSize);
    }

    @PatchMapping("/{id}")
    public MappingView update(@PathVariable Long id, @RequestBody UpdateMappingRequest request) {
        return mappingService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        mappingService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/confirm")
    public MappingView confirm(@PathVariable Long id) {
        return mappingService.confirm(id);
    }

    @PostMapping("/{id}/deactivate")
    public MappingView deactivate(@PathVariable Long id) {
        return mappingService.deactivate(id);
    }

    @PostMapping("/{id}/reject")
    public MappingView reject(@PathVariable Long id, @RequestBody RejectMappingRequest request) {
        return mappingService.reject(id, request.getReason());
    }

    @PostMapping("/propose")
    public ProposeResponse propose(@RequestBody ProposeRequest request) {
        return mappingService.propose(request);
    }
}
