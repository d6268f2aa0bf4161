package io.github.yok.certdump.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.certdump.model.CleaningStatistics;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToIntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Aggregated result of one extraction run.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class RunSummary {

    private final List<TableOutcome> outcomes;
    private final Map<String, Long> databaseRowCounts;

    /**
     * Creates a summary.
     *
     * @param outcomes per-table outcomes in processing order
     * @param databaseRowCounts rows currently stored per table, as counted after extraction
     */
    public RunSummary(List<TableOutcome> outcomes, Map<String, Long> databaseRowCounts) {
        this.outcomes = ImmutableList.copyOf(outcomes);
        this.databaseRowCounts = ImmutableMap.copyOf(databaseRowCounts);
    }

    public List<TableOutcome> getOutcomes() {
        return outcomes;
    }

    public Map<String, Long> getDatabaseRowCounts() {
        return databaseRowCounts;
    }

    public int getTableCount() {
        return outcomes.size();
    }

    public int getSuccessCount() {
        return (int) outcomes.stream().filter(TableOutcome::isSuccess).count();
    }

    public boolean isAllSucceeded() {
        return getSuccessCount() == getTableCount();
    }

    /**
     * Returns the share of tables that were written, in percent.
     *
     * @return success rate, {@code 0} when no table was processed
     */
    public double successRate() {
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        return getSuccessCount() * 100.0 / getTableCount();
    }

    public int totalRowsInitial() {
        return sum(CleaningStatistics::getRowsInitial);
    }

    public int totalRowsFinal() {
        return sum(CleaningStatistics::getRowsFinal);
    }

    public int totalDuplicatesRemoved() {
        return sum(CleaningStatistics::getDuplicatesRemoved);
    }

    public int totalNullsTreated() {
        return sum(CleaningStatistics::getNullsTreated);
    }

    private int sum(ToIntFunction<CleaningStatistics> field) {
        return outcomes.stream().filter(TableOutcome::isSuccess)
                .map(o -> o.getStatistics().get()).mapToInt(field).sum();
    }

    /**
     * Logs the database row counts, the cleaning totals and the generated files.
     */
    public void logSummary() {
        log.info("===== Summary =====");
        if (!databaseRowCounts.isEmpty()) {
            log.info("Rows in database:");
            int maxNameLen =
                    databaseRowCounts.keySet().stream().mapToInt(String::length).max().orElse(0);
            String fmt = "  Table[%-" + maxNameLen + "s] Total=%,d";
            databaseRowCounts
                    .forEach((table, count) -> log.info(String.format(Locale.ROOT, fmt, table,
                            count)));
        }

        log.info("Validation results:");
        log.info("  Tables processed     : {}/{}", getSuccessCount(), getTableCount());
        log.info("  Rows before cleaning : {}", totalRowsInitial());
        log.info("  Rows after cleaning  : {}", totalRowsFinal());
        log.info("  Duplicates removed   : {}", totalDuplicatesRemoved());
        log.info("  Null values treated  : {}", totalNullsTreated());

        log.info("Generated files:");
        for (TableOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                log.info(String.format(Locale.ROOT, "  %s: %,d rows (%.2f MB)",
                        outcome.getOutputFile().get(),
                        outcome.getStatistics().get().getRowsFinal(), outcome.getSizeMb()));
            } else {
                log.info("  Table[{}] failed: {}", outcome.getTableName(),
                        outcome.getError().get().getMessage());
            }
        }
    }
}
