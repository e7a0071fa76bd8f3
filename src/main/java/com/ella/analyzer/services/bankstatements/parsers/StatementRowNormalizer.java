package com.ella.analyzer.services.bankstatements.parsers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.ella.analyzer.dto.statements.ParseDiagnostic;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.PaymentChannel;
import com.ella.analyzer.enums.TransactionType;

import lombok.extern.slf4j.Slf4j;

/**
 * Converte uma linha de dados da planilha em {@link Transaction}.
 * <p>
 * Ordem das regras: linha vazia e rodapé são ignorados em silêncio; linha sem débito e sem crédito também;
 * data ou saldo ilegíveis geram aviso e descartam só aquela linha.
 */
@Component
@Slf4j
public class StatementRowNormalizer {

    private static final List<String> FOOTER_MARKERS = List.of(
            "statement summary",
            "brought forward",
            "please do not share"
    );

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public record RowOutcome(Transaction transaction, ParseDiagnostic diagnostic) {

        static RowOutcome skipped() {
            return new RowOutcome(null, null);
        }

        static RowOutcome rejected(ParseDiagnostic diagnostic) {
            return new RowOutcome(null, diagnostic);
        }

        static RowOutcome accepted(Transaction transaction) {
            return new RowOutcome(transaction, null);
        }

        public boolean isAccepted() {
            return transaction != null;
        }
    }

    public RowOutcome normalize(List<Object> row,
                                ColumnMapping mapping,
                                int rowNumber,
                                String sourceFile,
                                LocalDateTime importedAt) {
        if (CellValues.isBlankRow(row)) {
            return RowOutcome.skipped();
        }
        if (isFooterRow(row)) {
            log.debug("[RowNormalizer] row {} is a footer/summary row, skipping", rowNumber);
            return RowOutcome.skipped();
        }

        Object dateValue = CellValues.cell(row, mapping.index(StatementField.DATE));
        Object balanceValue = CellValues.cell(row, mapping.index(StatementField.BALANCE));
        BigDecimal debit = AmountParser.parse(CellValues.cell(row, mapping.index(StatementField.DEBIT)));
        BigDecimal credit = AmountParser.parse(CellValues.cell(row, mapping.index(StatementField.CREDIT)));

        // alguns bancos preenchem o lado sem movimento com 0.00
        if (debit != null && credit != null) {
            if (debit.signum() == 0) {
                debit = null;
            } else if (credit.signum() == 0) {
                credit = null;
            }
        }

        if (debit == null && credit == null) {
            return RowOutcome.skipped();
        }

        LocalDate date = StatementDateParser.parse(dateValue);
        if (date == null) {
            return RowOutcome.rejected(ParseDiagnostic.warning(rowNumber, mapping.header(StatementField.DATE),
                    "Invalid date: " + CellValues.text(dateValue)));
        }

        BigDecimal balance = AmountParser.parse(balanceValue);
        if (balance == null) {
            return RowOutcome.rejected(ParseDiagnostic.warning(rowNumber, mapping.header(StatementField.BALANCE),
                    "Invalid balance: " + CellValues.text(balanceValue)));
        }

        if (debit != null && credit != null) {
            return RowOutcome.rejected(ParseDiagnostic.warning(rowNumber, null,
                    "Row has both debit and credit: " + debit.toPlainString() + " / " + credit.toPlainString()));
        }

        String details = CellValues.text(CellValues.cell(row, mapping.index(StatementField.DETAILS)));
        String refNo = CellValues.text(CellValues.cell(row, mapping.index(StatementField.REF_NO)));
        TransactionType type = debit != null ? TransactionType.DEBIT : TransactionType.CREDIT;
        BigDecimal amount = (debit != null ? debit : credit).abs();

        return RowOutcome.accepted(Transaction.builder()
                .id(transactionId(date, refNo, amount))
                .date(date)
                .details(details)
                .refNo(refNo)
                .debit(debit)
                .credit(credit)
                .balance(balance)
                .amount(amount)
                .type(type)
                .paymentChannel(PaymentChannel.classify(details))
                .sourceFile(sourceFile)
                .importedAt(importedAt)
                .build());
    }

    /**
     * Id estável: yyyyMMdd-referência-valor. Reimportar o mesmo arquivo reproduz os mesmos ids.
     */
    public static String transactionId(LocalDate date, String refNo, BigDecimal amount) {
        return date.format(ID_DATE)
                + "-" + (refNo == null ? "" : refNo)
                + "-" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    static boolean isFooterRow(List<Object> row) {
        String first = CellValues.text(CellValues.cell(row, 0)).toLowerCase(Locale.ROOT);
        if (first.isEmpty()) {
            return false;
        }
        for (String marker : FOOTER_MARKERS) {
            if (first.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
