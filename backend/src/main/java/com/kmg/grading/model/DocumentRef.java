package com.kmg.grading.model;

import java.nio.file.Path;
import java.util.Objects;

public record DocumentRef(String name, Path path) {
    public DocumentRef {
        Objects.requireNonNull(path, "path");
        if (name == null || name.isBlank()) {
            name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        }
    }

    public static DocumentRef of(String path) {
        Path normalized = Path.of(path).toAbsolutePath().normalize();
        return new DocumentRef(null, normalized);
    }
}
