package io.github.yok.certdump.core;

/**
 * Raised when a table cannot be read from the relational store.
 *
 * @author Yasuharu.Okawauchi
 */
public class ExtractionException extends CertDumpException {

    private static final long serialVersionUID = 1L;

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_FAILURE, message, cause);
    }
}
