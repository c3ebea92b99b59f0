package com.kmg.grading.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record AddStudentsRequest(@NotEmpty List<String> documents) {
}
