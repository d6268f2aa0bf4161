package io.github.yok.certdump.core;

import com.google.common.base.Preconditions;
import io.github.yok.certdump.model.CleaningStatistics;
import java.util.Optional;

/**
 * Result of processing one catalog table: either the written snapshot with its statistics, or the
 * error that stopped the table.
 *
 * @author Yasuharu.Okawauchi
 */
public final class TableOutcome {

    private final String tableName;
    private final CleaningStatistics statistics;
    private final String outputFile;
    private final double sizeMb;
    private final ExtractionError error;

    private TableOutcome(String tableName, CleaningStatistics statistics, String outputFile,
            double sizeMb, ExtractionError error) {
        this.tableName = tableName;
        this.statistics = statistics;
        this.outputFile = outputFile;
        this.sizeMb = sizeMb;
        this.error = error;
    }

    /**
     * Creates a successful outcome.
     *
     * @param tableName table name
     * @param statistics cleaning statistics
     * @param outputFile snapshot file name
     * @param sizeMb snapshot size in MB
     * @return outcome
     */
    public static TableOutcome success(String tableName, CleaningStatistics statistics,
            String outputFile, double sizeMb) {
        Preconditions.checkNotNull(statistics, "statistics must not be null");
        return new TableOutcome(tableName, statistics, outputFile, sizeMb, null);
    }

    /**
     * Creates a failed outcome.
     *
     * @param error failure description
     * @return outcome
     */
    public static TableOutcome failure(ExtractionError error) {
        Preconditions.checkNotNull(error, "error must not be null");
        return new TableOutcome(error.getTableName(), null, null, 0, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getTableName() {
        return tableName;
    }

    public Optional<CleaningStatistics> getStatistics() {
        return Optional.ofNullable(statistics);
    }

    public Optional<String> getOutputFile() {
        return Optional.ofNullable(outputFile);
    }

    public double getSizeMb() {
        return sizeMb;
    }

    public Optional<ExtractionError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "TableOutcome[" + tableName + " → " + outputFile + "]"
                : "TableOutcome[" + tableName + " failed: " + error.getMessage() + "]";
    }
}
