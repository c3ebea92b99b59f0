package com.kmg.grading.dto;

public record EventMessage(
        String type,
        String batchId,
        String message,
        String timestamp,
        Object payload
) {
}
