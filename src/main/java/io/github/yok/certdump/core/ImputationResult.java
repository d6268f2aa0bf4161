package io.github.yok.certdump.core;

import io.github.yok.certdump.model.Dataset;
import lombok.Value;

/**
 * Result of {@link NullImputationPolicy#impute(Dataset, java.util.Set)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ImputationResult {

    Dataset dataset;

    // Missing cells in eligible columns before treatment
    int nullsFound;

    // Missing cells replaced
    int nullsTreated;
}
