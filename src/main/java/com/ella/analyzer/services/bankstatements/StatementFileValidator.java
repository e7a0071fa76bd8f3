package com.ella.analyzer.services.bankstatements;

import org.springframework.stereotype.Component;

import com.ella.analyzer.enums.FileFormat;

/**
 * Triagem por magic bytes antes de entregar o arquivo ao decoder.
 * <p>
 * Planilhas protegidas por senha chegam como compound document (OLE2, D0 CF 11 E0);
 * planilhas OOXML comuns são ZIP (50 4B 03 04). Não faz nenhuma decriptação.
 */
@Component
public class StatementFileValidator {

    private static final byte[] OLE2_SIGNATURE = {(byte) 0xD0, (byte) 0xCF, (byte) 0x11, (byte) 0xE0};
    private static final byte[] ZIP_SIGNATURE = {(byte) 0x50, (byte) 0x4B, (byte) 0x03, (byte) 0x04};

    public record FileValidation(
            boolean valid,
            boolean encrypted,
            boolean requiresPassword,
            FileFormat fileFormat,
            String error
    ) {
    }

    public static FileFormat detectFormat(byte[] data) {
        if (data == null || data.length < 4) {
            return FileFormat.UNKNOWN;
        }
        if (startsWith(data, OLE2_SIGNATURE)) {
            return FileFormat.OLE2;
        }
        if (startsWith(data, ZIP_SIGNATURE)) {
            return FileFormat.ZIP;
        }
        return FileFormat.UNKNOWN;
    }

    public static boolean isEncrypted(byte[] data) {
        return detectFormat(data) == FileFormat.OLE2;
    }

    public static boolean isValidFormat(byte[] data) {
        return detectFormat(data) != FileFormat.UNKNOWN;
    }

    public FileValidation validate(byte[] data) {
        if (data == null || data.length == 0) {
            return new FileValidation(false, false, false, FileFormat.UNKNOWN, "File is empty");
        }
        if (data.length < 4) {
            return new FileValidation(false, false, false, FileFormat.UNKNOWN,
                    "File is too small to be a valid spreadsheet");
        }

        FileFormat format = detectFormat(data);
        return switch (format) {
            case OLE2 -> new FileValidation(true, true, true, format, null);
            case ZIP -> new FileValidation(true, false, false, format, null);
            case UNKNOWN -> new FileValidation(false, false, false, format,
                    "Invalid file format. Please upload a valid Excel file (.xlsx)");
        };
    }

    private static boolean startsWith(byte[] data, byte[] signature) {
        for (int i = 0; i < signature.length; i++) {
            if (data[i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
