package com.kmg.grading.dto;

public record ApiError(int status, String error, String message) {
}
