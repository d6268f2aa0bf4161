package io.github.yok.certdump.core;

/**
 * Raised when a snapshot or report file cannot be written.
 *
 * @author Yasuharu.Okawauchi
 */
public class SnapshotWriteException extends CertDumpException {

    private static final long serialVersionUID = 1L;

    public SnapshotWriteException(String message, Throwable cause) {
        super(ErrorKind.WRITE_FAILURE, message, cause);
    }
}
