package com.ella.analyzer.enums;

/**
 * Container detectado pelos magic bytes iniciais.
 * OLE2 = compound document (planilha criptografada), ZIP = OOXML sem senha.
 */
public enum FileFormat {
    OLE2,
    ZIP,
    UNKNOWN
}
