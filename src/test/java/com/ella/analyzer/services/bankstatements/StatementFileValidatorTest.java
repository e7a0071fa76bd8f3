package com.ella.analyzer.services.bankstatements;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.analyzer.enums.FileFormat;
import com.ella.analyzer.services.bankstatements.StatementFileValidator.FileValidation;

@DisplayName("StatementFileValidator - magic bytes")
class StatementFileValidatorTest {

    private final StatementFileValidator validator = new StatementFileValidator();

    @Test
    void emptyBuffer_isRejected() {
        FileValidation v = validator.validate(new byte[0]);

        assertFalse(v.valid());
        assertEquals("File is empty", v.error());
    }

    @Test
    void tinyBuffer_isTooSmall() {
        FileValidation v = validator.validate(new byte[] {0x50, 0x4B});

        assertFalse(v.valid());
        assertEquals("File is too small to be a valid spreadsheet", v.error());
    }

    @Test
    void ole2Signature_isEncryptedAndNeedsPassword() {
        byte[] data = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, 0x00, 0x00};

        FileValidation v = validator.validate(data);

        assertTrue(v.valid());
        assertTrue(v.encrypted());
        assertTrue(v.requiresPassword());
        assertEquals(FileFormat.OLE2, v.fileFormat());
        assertTrue(StatementFileValidator.isEncrypted(data));
    }

    @Test
    void realXlsx_isPlainZip() {
        byte[] data = StatementWorkbooks.xlsx(List.of(StatementWorkbooks.HEADER));

        FileValidation v = validator.validate(data);

        assertTrue(v.valid());
        assertFalse(v.encrypted());
        assertEquals(FileFormat.ZIP, v.fileFormat());
        assertNull(v.error());
    }

    @Test
    void unknownSignature_isInvalidFormat() {
        byte[] data = "Date,Details,Debit".getBytes();

        FileValidation v = validator.validate(data);

        assertFalse(v.valid());
        assertFalse(StatementFileValidator.isValidFormat(data));
        assertEquals("Invalid file format. Please upload a valid Excel file (.xlsx)", v.error());
    }
}
