package com.kmg.grading.dto;

import java.util.List;

public record AddStudentsResponse(int accepted, List<String> pendingSubmissions) {
}
