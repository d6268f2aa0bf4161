package io.github.yok.certdump.core;

import lombok.NonNull;
import lombok.Value;

/**
 * Failure of one catalog table, as carried by {@link TableOutcome}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ExtractionError {

    @NonNull
    String tableName;

    @NonNull
    ErrorKind kind;

    // Exception text recorded in the audit entry
    @NonNull
    String message;
}
