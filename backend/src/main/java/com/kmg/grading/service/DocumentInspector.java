package com.kmg.grading.service;

import com.kmg.grading.model.DocumentRef;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks that a document can be sent to the grading service: an existing, readable, unprotected PDF
 * with at least one page.
 */
@Service
public class DocumentInspector {

    public DocumentInfo inspect(DocumentRef document) {
        Path path = document.path();
        if (!Files.isRegularFile(path)) {
            throw new DocumentRejectedException("Document not found: " + path);
        }

        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            throw new DocumentRejectedException("Cannot read " + document.name() + ": " + e.getMessage(), e);
        }
        if (size == 0) {
            throw new DocumentRejectedException("Document is empty: " + document.name());
        }

        try (PDDocument pdf = Loader.loadPDF(path.toFile())) {
            int pages = pdf.getNumberOfPages();
            if (pages == 0) {
                throw new DocumentRejectedException("Document has no pages: " + document.name());
            }
            return new DocumentInfo(document.name(), pages, size);
        } catch (InvalidPasswordException e) {
            throw new DocumentRejectedException("Document is password protected: " + document.name(), e);
        } catch (IOException e) {
            throw new DocumentRejectedException("Not a readable PDF: " + document.name() + " (" + e.getMessage() + ")", e);
        }
    }

    public record DocumentInfo(String name, int pages, long sizeBytes) {
    }

    public static class DocumentRejectedException extends RuntimeException {
        public DocumentRejectedException(String message) {
            super(message);
        }

        public DocumentRejectedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
