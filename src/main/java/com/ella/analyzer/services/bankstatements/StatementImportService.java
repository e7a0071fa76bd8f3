package com.ella.analyzer.services.bankstatements;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import com.ella.analyzer.classification.CategorizationService;
import com.ella.analyzer.dto.statements.MergeResult;
import com.ella.analyzer.dto.statements.StatementImportResult;
import com.ella.analyzer.dto.statements.StatementParseResult;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.repositories.TagStore;
import com.ella.analyzer.repositories.TransactionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Importa um extrato para o store: parse, merge com o que já existe, recategorização e gravação em bloco.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementImportService {

    private final StatementIngestionService ingestionService;
    private final TransactionDeduplicator deduplicator;
    private final CategorizationService categorizationService;
    private final TransactionStore transactionStore;
    private final TagStore tagStore;

    public StatementImportResult importStatement(MultipartFile file, String password) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is missing or empty");
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not read uploaded file", e);
        }
        return importStatement(bytes, file.getOriginalFilename(), password);
    }

    public StatementImportResult importStatement(byte[] data, String fileName, String password) {
        StatementParseResult parsed = ingestionService.parse(data, fileName, password);
        if (!parsed.success()) {
            log.warn("[StatementImport] file={} not imported: {}", fileName,
                    parsed.diagnostics().isEmpty() ? "unknown" : parsed.diagnostics().get(0).message());
            return new StatementImportResult(parsed, null);
        }

        // merge e recategorização sobre o conjunto lido dentro do lock; uploads concorrentes não se perdem
        AtomicReference<MergeResult> merge = new AtomicReference<>();
        List<Transaction> stored = transactionStore.update(existing -> {
            MergeResult merged = deduplicator.merge(existing, parsed.transactions());
            merge.set(merged);
            return categorizationService.recategorize(merged.transactions(), tagStore.findAll());
        });

        log.info("[StatementImport] file={} parsed={} new={} duplicates={} total={}",
                fileName, parsed.transactions().size(), merge.get().newTransactions(), merge.get().duplicatesRemoved(),
                stored.size());
        return new StatementImportResult(parsed, merge.get());
    }
}
