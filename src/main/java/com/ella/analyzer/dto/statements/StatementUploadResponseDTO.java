package com.ella.analyzer.dto.statements;

import java.util.List;

import com.ella.analyzer.dto.DateRange;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementUploadResponseDTO {

    private String fileName;
    private String bankName;
    private DateRange statementPeriod;
    private int parsedTransactions;
    private int newTransactions;
    private int duplicatesRemoved;
    private DateRange overlappingPeriod;
    private int totalTransactions;
    private List<ParseDiagnostic> warnings;
}
