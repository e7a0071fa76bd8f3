package com.ella.analyzer.services.bankstatements;

import java.util.List;
import java.util.Optional;

/**
 * Transforma os bytes de uma planilha (mais a senha, se houver) em uma grade de células.
 * <p>
 * Cada célula é {@code String}, {@code Double} (números e datas seriais) ou {@code null}.
 */
public interface SpreadsheetDecoder {

    record SheetGrid(String sheetName, List<List<Object>> rows) {
        public SheetGrid {
            rows = rows == null ? List.of() : rows;
        }
    }

    /**
     * @return a primeira aba, ou vazio quando o workbook não tem abas
     * @throws SpreadsheetDecodingException senha ausente/errada, arquivo corrompido ou ilegível
     */
    Optional<SheetGrid> readFirstSheet(byte[] data, String password);
}
