package com.hospital.opd.controller;

import com.hospital.opd.dto.ActionRequest;
import com.hospital.opd.dto.AllocationOutcome;
import com.hospital.opd.dto.AllocationRequest;
import com.hospital.opd.dto.BatchReallocationRequest;
import com.hospital.opd.dto.BatchReallocationResult;
import com.hospital.opd.dto.CancelRequest;
import com.hospital.opd.dto.EmergencyRequest;
import com.hospital.opd.dto.MoveRequest;
import com.hospital.opd.dto.TokenView;
import com.hospital.opd.service.ReallocationService;
import com.hospital.opd.service.TokenAllocationService;
import com.hospital.opd.service.TokenLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tokens")
public class TokenController {

    private final TokenAllocationService allocationService;
    private final TokenLifecycleService lifecycleService;
    private final ReallocationService reallocationService;

    public TokenController(TokenAllocationService allocationService,
                           TokenLifecycleService lifecycleService,
                           ReallocationService reallocationService) {
        this.allocationService = allocationService;
        this.lifecycleService = lifecycleService;
        this.reallocationService = reallocationService;
    }

    @PostMapping
    public ResponseEntity<AllocationOutcome> allocate(@RequestBody AllocationRequest request) {
        return respond(allocationService.allocateToken(request));
    }

    @PostMapping("/emergency")
    public ResponseEntity<AllocationOutcome> emergency(@RequestBody EmergencyRequest request) {
        return respond(allocationService.emergencyInsertion(request));
    }

    @GetMapping("/{tokenId}")
    public TokenView get(@PathVariable String tokenId) {
        return lifecycleService.getToken(tokenId);
    }

    @GetMapping
    public List<TokenView> forPatient(@RequestParam String patientId) {
        return lifecycleService.tokensForPatient(patientId);
    }

    @PostMapping("/{tokenId}/cancel")
    public TokenView cancel(@PathVariable String tokenId, @RequestBody CancelRequest request) {
        return lifecycleService.cancel(tokenId, request);
    }

    @PostMapping("/{tokenId}/move")
    public TokenView move(@PathVariable String tokenId, @RequestBody MoveRequest request) {
        return lifecycleService.move(tokenId, request);
    }

    @PostMapping("/{tokenId}/confirm")
    public TokenView confirm(@PathVariable String tokenId, @RequestBody(required = false) ActionRequest request) {
        return lifecycleService.confirm(tokenId, request);
    }

    @PostMapping("/{tokenId}/start")
    public TokenView start(@PathVariable String tokenId, @RequestBody(required = false) ActionRequest request) {
        return lifecycleService.start(tokenId, request);
    }

    @PostMapping("/{tokenId}/complete")
    public TokenView complete(@PathVariable String tokenId, @RequestBody(required = false) ActionRequest request) {
        return lifecycleService.complete(tokenId, request);
    }

    @PostMapping("/{tokenId}/no-show")
    public TokenView noShow(@PathVariable String tokenId, @RequestBody(required = false) ActionRequest request) {
        return lifecycleService.markNoShow(tokenId, request);
    }

    @PostMapping("/reallocate")
    public BatchReallocationResult reallocate(@RequestBody BatchReallocationRequest request) {
        return reallocationService.reallocateBatch(request);
    }

    /** Rejections carry the status of their error code; the others are 201 / 200. */
    private static ResponseEntity<AllocationOutcome> respond(AllocationOutcome outcome) {
        if (outcome instanceof AllocationOutcome.Allocated) {
            return ResponseEntity.status(HttpStatus.CREATED).body(outcome);
        }
        if (outcome instanceof AllocationOutcome.Rejected rejected) {
            return ResponseEntity.status(rejected.errorCode().getHttpStatus()).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }
}
