package io.github.yok.certdump.model;

/**
 * Action recorded by an audit log entry.
 *
 * @author Yasuharu.Okawauchi
 */
public enum AuditAction {
    VALIDATION, EXTRACTION, ERROR, START, END
}
