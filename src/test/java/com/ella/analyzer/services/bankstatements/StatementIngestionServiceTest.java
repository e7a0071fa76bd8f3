package com.ella.analyzer.services.bankstatements;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.ella.analyzer.classification.rules.MerchantExtractor;
import com.ella.analyzer.config.IngestionProperties;
import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.dto.statements.ParseDiagnostic;
import com.ella.analyzer.dto.statements.StatementParseResult;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.DiagnosticSeverity;
import com.ella.analyzer.enums.PaymentChannel;
import com.ella.analyzer.services.bankstatements.SpreadsheetDecodingException.Reason;
import com.ella.analyzer.services.bankstatements.parsers.ColumnMapper;
import com.ella.analyzer.services.bankstatements.parsers.HeaderRowLocator;
import com.ella.analyzer.services.bankstatements.parsers.StatementRowNormalizer;

@DisplayName("StatementIngestionService - pipeline de importação")
class StatementIngestionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SpreadsheetDecoder mockedDecoder;

    private StatementIngestionService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = build(new PoiSpreadsheetDecoder());
    }

    private static StatementIngestionService build(SpreadsheetDecoder decoder) {
        IngestionProperties properties = IngestionProperties.defaults();
        return new StatementIngestionService(
                new StatementFileValidator(),
                decoder,
                new HeaderRowLocator(properties),
                new ColumnMapper(),
                new StatementRowNormalizer(),
                new TransactionDeduplicator(),
                properties,
                CLOCK);
    }

    private static List<List<Object>> sampleRows() {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(List.of("Account Name", "JOHN DOE"));
        rows.add(List.of());
        rows.add(StatementWorkbooks.HEADER);
        rows.add(List.of("01 Jan 2024", "UPI/DR/123/Acme/x", "REF1", "", "500.00", "1500.00"));
        rows.add(List.of("02 Jan 2024", "UPI/DR/124/Acme/x", "REF2", "200.00", "", "1300.00"));
        return rows;
    }

    @Test
    void parsesSampleStatementEndToEnd() {
        StatementParseResult result = service.parse(StatementWorkbooks.xlsx(sampleRows()), "jan.xlsx", null);

        assertTrue(result.success());
        assertTrue(result.diagnostics().isEmpty());
        assertEquals(2, result.transactions().size());

        Transaction credit = result.transactions().get(0);
        assertEquals(LocalDate.of(2024, 1, 1), credit.getDate());
        assertEquals(new BigDecimal("500.00"), credit.getCredit());
        assertNull(credit.getDebit());
        assertEquals(new BigDecimal("1500.00"), credit.getBalance());

        Transaction debit = result.transactions().get(1);
        assertEquals(new BigDecimal("200.00"), debit.getDebit());
        assertEquals(new BigDecimal("1300.00"), debit.getBalance());

        for (Transaction t : result.transactions()) {
            assertEquals(PaymentChannel.INSTANT_TRANSFER, t.getPaymentChannel());
            assertEquals("Acme", MerchantExtractor.extractMerchantName(t.getDetails()).orElseThrow());
        }

        assertEquals(new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)), result.dateRange());
        assertEquals("jan.xlsx", result.metadata().fileName());
        assertEquals("State Bank of India", result.metadata().bankName());
        assertEquals(2, result.metadata().transactionCount());
    }

    @Test
    void reparsingSameFile_isDeterministic() {
        byte[] data = StatementWorkbooks.xlsx(sampleRows());

        StatementParseResult first = service.parse(data, "jan.xlsx", null);
        StatementParseResult second = service.parse(data, "jan.xlsx", null);

        assertEquals(first.transactions(), second.transactions());
        assertEquals(first.metadata(), second.metadata());
    }

    @Test
    void duplicateRowsInFile_areCollapsed() {
        List<List<Object>> rows = sampleRows();
        rows.add(List.of("01 Jan 2024", "UPI/DR/123/Acme/x", "REF1", "", "500.00", "1500.00"));

        StatementParseResult result = service.parse(StatementWorkbooks.xlsx(rows), "jan.xlsx", null);

        assertEquals(2, result.transactions().size());
    }

    @Test
    void badRows_becomeWarningsWithSpreadsheetRowNumbers() {
        List<List<Object>> rows = sampleRows();
        rows.add(List.of("99/99/2024", "POS SHOP", "REF3", "10.00", "", "1290.00"));

        StatementParseResult result = service.parse(StatementWorkbooks.xlsx(rows), "jan.xlsx", null);

        assertTrue(result.success());
        assertEquals(2, result.transactions().size());
        assertEquals(1, result.warnings().size());
        ParseDiagnostic warning = result.warnings().get(0);
        assertEquals(6, warning.row());
        assertEquals("Date", warning.column());
        assertEquals(DiagnosticSeverity.WARNING, warning.severity());
    }

    @Test
    void wrongPassword_yieldsSingleErrorDiagnostic() {
        byte[] ole2 = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, 0x01, 0x02};
        when(mockedDecoder.readFirstSheet(any(), eq("bad")))
                .thenThrow(new SpreadsheetDecodingException(Reason.INVALID_PASSWORD, "Incorrect password. Please try again."));

        StatementParseResult result = build(mockedDecoder).parse(ole2, "locked.xlsx", "bad");

        assertFalse(result.success());
        assertTrue(result.transactions().isEmpty());
        assertEquals(1, result.diagnostics().size());
        assertEquals("Incorrect password. Please try again.", result.diagnostics().get(0).message());
        assertEquals(DiagnosticSeverity.ERROR, result.diagnostics().get(0).severity());
    }

    @Test
    void invalidFormat_isRejectedBeforeDecoding() {
        StatementParseResult result = service.parse("not a spreadsheet".getBytes(), "x.csv", null);

        assertFalse(result.success());
        assertEquals("Invalid file format. Please upload a valid Excel file (.xlsx)",
                result.diagnostics().get(0).message());
    }

    @Test
    void missingHeaderRow_isFatal() {
        byte[] data = StatementWorkbooks.xlsx(List.of(
                List.of("Something", "Else", "Entirely", "Here"),
                List.of("1", "2", "3", "4")));

        StatementParseResult result = service.parse(data, "odd.xlsx", null);

        assertFalse(result.success());
        assertEquals(1, result.diagnostics().size());
        assertTrue(result.diagnostics().get(0).message().startsWith("Could not find transaction header row"));
    }

    @Test
    void headerWithoutReferenceColumn_reportsMissingColumn() {
        byte[] data = StatementWorkbooks.xlsx(List.of(
                List.of("Date", "Details", "Debit", "Credit", "Balance"),
                List.of("01 Jan 2024", "x", "1", "", "2")));

        StatementParseResult result = service.parse(data, "noref.xlsx", null);

        assertFalse(result.success());
        ParseDiagnostic error = result.diagnostics().get(0);
        assertEquals(1, error.row());
        assertTrue(error.message().contains("Missing: Ref No"));
    }

    @Test
    void headerAsLastRow_hasNoData() {
        byte[] data = StatementWorkbooks.xlsx(List.of(StatementWorkbooks.HEADER));

        StatementParseResult result = service.parse(data, "empty.xlsx", null);

        assertFalse(result.success());
        assertEquals("No transaction data found after header row", result.diagnostics().get(0).message());
    }
}
