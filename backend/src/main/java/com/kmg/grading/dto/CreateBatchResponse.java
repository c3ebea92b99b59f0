package com.kmg.grading.dto;

public record CreateBatchResponse(String batchId) {
}
