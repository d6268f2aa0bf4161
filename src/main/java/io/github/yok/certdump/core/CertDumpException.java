package io.github.yok.certdump.core;

/**
 * Base class of the checked exceptions raised by the extraction contracts.
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class CertDumpException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected CertDumpException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
