package com.ella.analyzer.services.bankstatements;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import org.springframework.stereotype.Service;

import com.ella.analyzer.config.IngestionProperties;
import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.dto.statements.ParseDiagnostic;
import com.ella.analyzer.dto.statements.StatementMetadata;
import com.ella.analyzer.dto.statements.StatementParseResult;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.services.bankstatements.SpreadsheetDecoder.SheetGrid;
import com.ella.analyzer.services.bankstatements.StatementFileValidator.FileValidation;
import com.ella.analyzer.services.bankstatements.parsers.ColumnMapper;
import com.ella.analyzer.services.bankstatements.parsers.ColumnMapping;
import com.ella.analyzer.services.bankstatements.parsers.ColumnMappingException;
import com.ella.analyzer.services.bankstatements.parsers.HeaderRowLocator;
import com.ella.analyzer.services.bankstatements.parsers.StatementRowNormalizer;
import com.ella.analyzer.services.bankstatements.parsers.StatementRowNormalizer.RowOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pipeline de importação: validação do arquivo, decodificação, cabeçalho, colunas, linhas e deduplicação.
 * <p>
 * Nunca lança exceção para o chamador: falhas fatais viram um único diagnóstico de erro e zero transações.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementIngestionService {

    private final StatementFileValidator fileValidator;
    private final SpreadsheetDecoder spreadsheetDecoder;
    private final HeaderRowLocator headerRowLocator;
    private final ColumnMapper columnMapper;
    private final StatementRowNormalizer rowNormalizer;
    private final TransactionDeduplicator deduplicator;
    private final IngestionProperties properties;
    private final Clock clock;

    public StatementParseResult parse(byte[] data, String fileName, String password) {
        LocalDateTime parsedAt = LocalDateTime.now(clock);

        FileValidation validation = fileValidator.validate(data);
        if (!validation.valid()) {
            log.warn("[StatementIngestion] rejected file={} reason={}", fileName, validation.error());
            return failed(fileName, parsedAt, ParseDiagnostic.error(0, validation.error()));
        }

        Optional<SheetGrid> grid;
        try {
            grid = spreadsheetDecoder.readFirstSheet(data, password);
        } catch (SpreadsheetDecodingException e) {
            log.warn("[StatementIngestion] decode failed file={} reason={}", fileName, e.getReason());
            return failed(fileName, parsedAt, ParseDiagnostic.error(0, e.getMessage()));
        }

        if (grid.isEmpty()) {
            return failed(fileName, parsedAt, ParseDiagnostic.error(0, "No sheets found in the workbook"));
        }

        List<List<Object>> rows = grid.get().rows();
        if (rows.isEmpty()) {
            return failed(fileName, parsedAt, ParseDiagnostic.error(0, "No data found in the sheet"));
        }

        OptionalInt headerIndex = headerRowLocator.locate(rows);
        if (headerIndex.isEmpty()) {
            return failed(fileName, parsedAt, ParseDiagnostic.error(0,
                    "Could not find transaction header row. Expected columns: Date, Details, Debit, Credit, Balance"));
        }
        int headerRow = headerIndex.getAsInt();

        if (rows.size() <= headerRow + 1) {
            return failed(fileName, parsedAt, ParseDiagnostic.error(0, "No transaction data found after header row"));
        }

        ColumnMapping mapping;
        try {
            mapping = columnMapper.map(rows.get(headerRow));
        } catch (ColumnMappingException e) {
            log.warn("[StatementIngestion] column mapping failed file={} missing={}", fileName, e.getMissingFields());
            return failed(fileName, parsedAt, ParseDiagnostic.error(headerRow + 1, e.getMessage()));
        }

        List<Transaction> parsed = new ArrayList<>();
        List<ParseDiagnostic> diagnostics = new ArrayList<>();

        for (int i = headerRow + 1; i < rows.size(); i++) {
            int rowNumber = i + 1;
            RowOutcome outcome = rowNormalizer.normalize(rows.get(i), mapping, rowNumber, fileName, parsedAt);
            if (outcome.isAccepted()) {
                parsed.add(outcome.transaction());
            } else if (outcome.diagnostic() != null) {
                diagnostics.add(outcome.diagnostic());
            }
        }

        List<Transaction> transactions = deduplicator.deduplicate(parsed);
        DateRange range = deduplicator.dateRange(transactions);

        diagnostics.forEach(d -> log.warn("[StatementIngestion] file={} row={} {}", fileName, d.row(), d.message()));
        log.info("[StatementIngestion] parsed file={} headerRow={} rows={} transactions={} duplicates={} warnings={}",
                fileName, headerRow, rows.size() - headerRow - 1, transactions.size(),
                parsed.size() - transactions.size(), diagnostics.size());

        boolean success = diagnostics.stream().noneMatch(ParseDiagnostic::isError);
        StatementMetadata metadata = new StatementMetadata(fileName, properties.bankLabel(), range,
                transactions.size(), parsedAt);
        return new StatementParseResult(success, transactions, range, diagnostics, metadata);
    }

    private StatementParseResult failed(String fileName, LocalDateTime parsedAt, ParseDiagnostic diagnostic) {
        StatementMetadata metadata = new StatementMetadata(fileName, properties.bankLabel(), null, 0, parsedAt);
        return new StatementParseResult(false, List.of(), null, List.of(diagnostic), metadata);
    }
}
