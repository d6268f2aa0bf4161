package io.github.yok.certdump.model;

import lombok.Builder;
import lombok.Value;

/**
 * Before/after counters of one validation pass over one dataset.
 *
 * <p>
 * Produced once per dataset by {@code ValidationOrchestrator} and immutable once returned.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class CleaningStatistics {

    // Rows as extracted
    int rowsInitial;

    // Rows after every cleaning stage
    int rowsFinal;

    // Rows that repeat an earlier row
    int duplicatesFound;

    // Rows deleted by the duplicate resolver
    int duplicatesRemoved;

    // Missing cells in imputable columns after deduplication
    int nullsFound;

    // Missing cells replaced by a default
    int nullsTreated;

    // Fact rows dropped for missing foreign keys
    int referentialRowsDropped;

    /**
     * Returns the share of extracted rows that survived cleaning.
     *
     * @return percentage in {@code [0, 100]}; {@code 100} for an empty extraction
     */
    public double retainedPercentage() {
        if (rowsInitial == 0) {
            return 100.0;
        }
        return rowsFinal * 100.0 / rowsInitial;
    }

    /**
     * Adds duplicate rows removed after the validation pass to these counters.
     *
     * @param count rows removed by the final check
     * @return updated statistics
     */
    public CleaningStatistics withResidualDuplicatesRemoved(int count) {
        return toBuilder().duplicatesFound(duplicatesFound + count)
                .duplicatesRemoved(duplicatesRemoved + count).rowsFinal(rowsFinal - count)
                .build();
    }
}
