package io.github.yok.certdump.core;

import io.github.yok.certdump.model.Dataset;
import java.util.List;
import lombok.Value;

/**
 * Result of {@link ReferentialIntegrityChecker#check(Dataset)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ReferentialCheckResult {

    Dataset dataset;

    // Rows removed because a foreign key was missing
    int rowsDropped;

    // Foreign-key columns that were actually checked
    List<String> checkedColumns;
}
