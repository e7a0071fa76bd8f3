package com.ella.analyzer.services.bankstatements;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import com.ella.analyzer.services.bankstatements.SpreadsheetDecodingException.Reason;

import lombok.extern.slf4j.Slf4j;

@Component
@Slf4j
public class PoiSpreadsheetDecoder implements SpreadsheetDecoder {

    @Override
    public Optional<SheetGrid> readFirstSheet(byte[] data, String password) {
        if (data == null || data.length == 0) {
            throw new SpreadsheetDecodingException(Reason.EMPTY_FILE, "File is empty");
        }

        String effectivePassword = (password == null || password.isEmpty()) ? null : password;
        if (StatementFileValidator.isEncrypted(data) && effectivePassword == null) {
            throw new SpreadsheetDecodingException(Reason.NO_PASSWORD,
                    "This file is password protected. Please provide the password.");
        }

        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(data), effectivePassword)) {
            if (workbook.getNumberOfSheets() == 0) {
                return Optional.empty();
            }
            Sheet sheet = workbook.getSheetAt(0);
            List<List<Object>> rows = readRows(sheet);
            log.debug("[SpreadsheetDecoder] sheet='{}' rows={}", sheet.getSheetName(), rows.size());
            return Optional.of(new SheetGrid(sheet.getSheetName(), rows));
        } catch (EncryptedDocumentException e) {
            throw new SpreadsheetDecodingException(Reason.INVALID_PASSWORD,
                    "Incorrect password. Please try again.", e);
        } catch (UnsupportedFileFormatException e) {
            throw new SpreadsheetDecodingException(Reason.CORRUPTED_FILE,
                    "The file appears to be corrupted or is not a valid Excel file.", e);
        } catch (IOException e) {
            throw new SpreadsheetDecodingException(Reason.READ_ERROR,
                    "Failed to read the Excel file: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SpreadsheetDecodingException(Reason.UNKNOWN_ERROR,
                    "Unexpected error while reading the Excel file: " + e.getMessage(), e);
        }
    }

    private List<List<Object>> readRows(Sheet sheet) {
        int lastRow = sheet.getLastRowNum();
        if (lastRow < 0 || sheet.getPhysicalNumberOfRows() == 0) {
            return List.of();
        }

        List<List<Object>> rows = new ArrayList<>(lastRow + 1);
        for (int r = 0; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            if (row == null || row.getLastCellNum() <= 0) {
                rows.add(Collections.emptyList());
                continue;
            }
            List<Object> cells = new ArrayList<>(row.getLastCellNum());
            for (int c = 0; c < row.getLastCellNum(); c++) {
                cells.add(cellValue(row.getCell(c)));
            }
            rows.add(cells);
        }
        return rows;
    }

    // datas formatadas continuam como serial numérico; quem interpreta é o parser de datas
    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        return switch (type) {
            case NUMERIC -> cell.getNumericCellValue();
            case STRING -> {
                String s = cell.getStringCellValue();
                yield (s == null || s.isEmpty()) ? null : s;
            }
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> null;
        };
    }
}
