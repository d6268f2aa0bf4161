package io.github.yok.certdump.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Name and declared kind of one dataset column.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnSpec {

    // Column label as reported by the driver
    @NonNull
    String name;

    // Declared kind; fixed for the lifetime of the dataset
    @NonNull
    ColumnKind kind;
}
