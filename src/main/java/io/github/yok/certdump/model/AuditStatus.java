package io.github.yok.certdump.model;

/**
 * Outcome recorded by an audit log entry.
 *
 * @author Yasuharu.Okawauchi
 */
public enum AuditStatus {
    SUCCESS, ERROR, WARNING;

    /**
     * Returns {@link #WARNING} when something was found, {@link #SUCCESS} otherwise.
     *
     * @param found number of problems found by a stage
     * @return status for the stage's audit entry
     */
    public static AuditStatus warningIf(long found) {
        return found > 0 ? WARNING : SUCCESS;
    }
}
