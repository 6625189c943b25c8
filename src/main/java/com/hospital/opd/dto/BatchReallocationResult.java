package com.hospital.opd.dto;

import com.hospital.opd.exception.ErrorCode;

import java.util.List;

public record BatchReallocationResult(List<Relocated> relocated, List<Failed> failed) {

    public BatchReallocationResult {
        relocated = List.copyOf(relocated);
        failed = List.copyOf(failed);
    }

    public record Relocated(String originalTokenId, String newTokenId, String fromSlotId, String toSlotId,
                            int priority) {
    }

    public record Failed(String tokenId, ErrorCode errorCode, String reason) {
    }
}
