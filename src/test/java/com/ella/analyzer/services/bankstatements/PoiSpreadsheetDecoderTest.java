package com.ella.analyzer.services.bankstatements;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.List;

import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.poifs.crypt.EncryptionInfo;
import org.apache.poi.poifs.crypt.EncryptionMode;
import org.apache.poi.poifs.crypt.Encryptor;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.analyzer.services.bankstatements.SpreadsheetDecoder.SheetGrid;
import com.ella.analyzer.services.bankstatements.SpreadsheetDecodingException.Reason;

@DisplayName("PoiSpreadsheetDecoder - leitura e decriptação")
class PoiSpreadsheetDecoderTest {

    private final PoiSpreadsheetDecoder decoder = new PoiSpreadsheetDecoder();

    private static byte[] encrypt(byte[] plainXlsx, String password) throws Exception {
        try (POIFSFileSystem fs = new POIFSFileSystem()) {
            EncryptionInfo info = new EncryptionInfo(EncryptionMode.agile);
            Encryptor encryptor = info.getEncryptor();
            encryptor.confirmPassword(password);
            try (OPCPackage opc = OPCPackage.open(new ByteArrayInputStream(plainXlsx));
                 OutputStream os = encryptor.getDataStream(fs)) {
                opc.save(os);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            fs.writeFilesystem(out);
            return out.toByteArray();
        }
    }

    @Test
    void readsFirstSheetAsGrid() {
        byte[] data = StatementWorkbooks.xlsx(List.of(
                List.of("Date", "Details"),
                List.of(),
                Arrays.asList("01 Jan 2024", null, 42.0)));

        SheetGrid grid = decoder.readFirstSheet(data, null).orElseThrow();

        assertEquals("Statement", grid.sheetName());
        assertEquals(3, grid.rows().size());
        assertEquals(List.of("Date", "Details"), grid.rows().get(0));
        assertTrue(grid.rows().get(1).isEmpty());
        assertEquals(Arrays.asList("01 Jan 2024", null, 42.0), grid.rows().get(2));
    }

    @Test
    void emptyBuffer_isEmptyFile() {
        SpreadsheetDecodingException ex = assertThrows(SpreadsheetDecodingException.class,
                () -> decoder.readFirstSheet(new byte[0], null));

        assertEquals(Reason.EMPTY_FILE, ex.getReason());
    }

    @Test
    void encryptedWorkbook_opensWithCorrectPassword() throws Exception {
        byte[] encrypted = encrypt(StatementWorkbooks.xlsx(List.of(StatementWorkbooks.HEADER)), "s3cret");

        SheetGrid grid = decoder.readFirstSheet(encrypted, "s3cret").orElseThrow();

        assertEquals(StatementWorkbooks.HEADER, grid.rows().get(0));
    }

    @Test
    void encryptedWorkbook_withoutPassword_asksForIt() throws Exception {
        byte[] encrypted = encrypt(StatementWorkbooks.xlsx(List.of(StatementWorkbooks.HEADER)), "s3cret");

        SpreadsheetDecodingException ex = assertThrows(SpreadsheetDecodingException.class,
                () -> decoder.readFirstSheet(encrypted, ""));

        assertEquals(Reason.NO_PASSWORD, ex.getReason());
        assertEquals("This file is password protected. Please provide the password.", ex.getMessage());
    }

    @Test
    void encryptedWorkbook_withWrongPassword_isRejected() throws Exception {
        byte[] encrypted = encrypt(StatementWorkbooks.xlsx(List.of(StatementWorkbooks.HEADER)), "s3cret");

        SpreadsheetDecodingException ex = assertThrows(SpreadsheetDecodingException.class,
                () -> decoder.readFirstSheet(encrypted, "wrong"));

        assertEquals(Reason.INVALID_PASSWORD, ex.getReason());
        assertEquals("Incorrect password. Please try again.", ex.getMessage());
    }
}
