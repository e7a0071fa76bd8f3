package com.ella.analyzer.controllers;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ella.analyzer.classification.CategorizationService;
import com.ella.analyzer.classification.TagService;
import com.ella.analyzer.classification.dto.RecategorizationResponseDTO;
import com.ella.analyzer.classification.dto.TagRequestDTO;
import com.ella.analyzer.classification.dto.TagStatistics;
import com.ella.analyzer.dto.ApiResponse;
import com.ella.analyzer.entities.Tag;
import com.ella.analyzer.repositories.TransactionStore;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/tags")
@RequiredArgsConstructor
@Slf4j
public class TagController {

    private final TagService tagService;
    private final CategorizationService categorizationService;
    private final TransactionStore transactionStore;

    @GetMapping
    public ResponseEntity<ApiResponse<List<Tag>>> list() {
        return ResponseEntity.ok(ApiResponse.success(tagService.listTags()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Tag>> create(@Valid @RequestBody TagRequestDTO request) {
        Tag created = tagService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(created, "Tag created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Tag>> update(@PathVariable String id, @Valid @RequestBody TagRequestDTO request) {
        return ResponseEntity.ok(ApiResponse.success(tagService.update(id, request), "Tag updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        tagService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/defaults/restore")
    public ResponseEntity<ApiResponse<List<Tag>>> restoreDefaults() {
        return ResponseEntity.ok(ApiResponse.success(tagService.restoreDefaults(), "Default tags restored"));
    }

    @PostMapping("/recategorize")
    public ResponseEntity<ApiResponse<RecategorizationResponseDTO>> recategorize() {
        RecategorizationResponseDTO response = categorizationService.recategorizeStoredTransactions();
        return ResponseEntity.ok(ApiResponse.success(response, "Transactions recategorized"));
    }

    @GetMapping("/statistics")
    public ResponseEntity<ApiResponse<List<TagStatistics>>> statistics() {
        List<TagStatistics> stats = List.copyOf(
                categorizationService.tagStatistics(transactionStore.findAll(), tagService.listTags()).values());
        return ResponseEntity.ok(ApiResponse.success(stats));
    }

    @GetMapping("/{id}/suggestions")
    public ResponseEntity<ApiResponse<List<String>>> suggestions(@PathVariable String id) {
        Tag tag = tagService.getTag(id);
        List<String> suggestions = categorizationService.suggestKeywords(transactionStore.findAll(), tag);
        log.debug("[TagController] {} keyword suggestions for tag {}", suggestions.size(), id);
        return ResponseEntity.ok(ApiResponse.success(suggestions));
    }
}
