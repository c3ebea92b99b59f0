package com.kmg.grading.api;

import com.kmg.grading.repo.ArchivedResult;
import com.kmg.grading.repo.ResultArchiveRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Archived results across batches, looked up by student document name.
 */
@RestController
@RequestMapping("/api/results")
public class ResultController {
    private final ResultArchiveRepository archiveRepository;

    public ResultController(ResultArchiveRepository archiveRepository) {
        this.archiveRepository = archiveRepository;
    }

    @GetMapping
    public List<ArchivedResult> findByDocument(@RequestParam String document) {
        return archiveRepository.findBySourceDocument(document);
    }
}
