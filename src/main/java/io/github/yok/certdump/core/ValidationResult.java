package io.github.yok.certdump.core;

import io.github.yok.certdump.model.CleaningStatistics;
import io.github.yok.certdump.model.Dataset;
import lombok.Value;

/**
 * Cleaned dataset and the statistics of the pass that produced it.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ValidationResult {

    Dataset dataset;

    CleaningStatistics statistics;
}
