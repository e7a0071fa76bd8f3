package com.ella.analyzer.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.ella.analyzer.dto.ApiResponse;
import com.ella.analyzer.dto.statements.MergeResult;
import com.ella.analyzer.dto.statements.ParseDiagnostic;
import com.ella.analyzer.dto.statements.StatementImportResult;
import com.ella.analyzer.dto.statements.StatementParseResult;
import com.ella.analyzer.dto.statements.StatementUploadResponseDTO;
import com.ella.analyzer.services.bankstatements.StatementImportService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/statements")
@RequiredArgsConstructor
@Slf4j
public class StatementController {

    private final StatementImportService statementImportService;

    @PostMapping("/upload")
    public ResponseEntity<ApiResponse<StatementUploadResponseDTO>> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "password", required = false) String password
    ) {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("File is missing or empty"));
        }

        try {
            String effectivePassword = (password == null || password.isBlank()) ? null : password;
            StatementImportResult result = statementImportService.importStatement(file, effectivePassword);

            if (!result.imported()) {
                List<String> errors = result.parse().diagnostics().stream().map(StatementController::describe).toList();
                String message = errors.isEmpty() ? "Statement could not be parsed" : result.parse().diagnostics().get(0).message();
                return ResponseEntity.badRequest().body(ApiResponse.error(message, errors));
            }

            return ResponseEntity.status(201).body(ApiResponse.success(toResponse(result), "Statement imported successfully"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("[StatementController] Error while importing statement", e);
            return ResponseEntity.status(500).body(ApiResponse.error("Internal server error: " + e.getMessage()));
        }
    }

    private static StatementUploadResponseDTO toResponse(StatementImportResult result) {
        StatementParseResult parse = result.parse();
        MergeResult merge = result.merge();
        return StatementUploadResponseDTO.builder()
                .fileName(parse.metadata() == null ? null : parse.metadata().fileName())
                .bankName(parse.metadata() == null ? null : parse.metadata().bankName())
                .statementPeriod(parse.dateRange())
                .parsedTransactions(parse.transactions().size())
                .newTransactions(merge.newTransactions())
                .duplicatesRemoved(merge.duplicatesRemoved())
                .overlappingPeriod(merge.overlappingPeriod())
                .totalTransactions(merge.transactions().size())
                .warnings(parse.warnings())
                .build();
    }

    private static String describe(ParseDiagnostic d) {
        return d.row() > 0 ? "Row " + d.row() + ": " + d.message() : d.message();
    }
}
