package io.github.yok.certdump.core;

/**
 * Category of a per-table or run-level failure.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ErrorKind {
    // Reading the table failed
    EXTRACTION_FAILURE,
    // Writing the snapshot failed
    WRITE_FAILURE,
    // Anything else
    SYSTEM_FAILURE
}
