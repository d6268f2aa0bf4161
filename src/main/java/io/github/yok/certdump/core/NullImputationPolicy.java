package io.github.yok.certdump.core;

import com.google.common.base.Preconditions;
import io.github.yok.certdump.config.ImputationConfig;
import io.github.yok.certdump.model.Cell;
import io.github.yok.certdump.model.ColumnKind;
import io.github.yok.certdump.model.ColumnSpec;
import io.github.yok.certdump.model.Dataset;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Replaces missing cells with deterministic defaults chosen from the column kind and name.
 *
 * <p>
 * <strong>Rules:</strong>
 * </p>
 * <ul>
 * <li>{@code INTEGER} → {@code 0L}; {@code REAL} → {@code 0.0} (also for {@code valor} columns);
 * {@code BOOLEAN} → {@code false}; {@code TEMPORAL} → sentinel date at midnight.</li>
 * <li>{@code TEXT} → the first matching {@link TextImputationRule}.</li>
 * </ul>
 *
 * <p>
 * The identifier column and the exempt columns passed by the caller (foreign keys of fact tables)
 * are neither counted nor filled.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class NullImputationPolicy {

    private final String identifierColumn;
    private final LocalDateTime sentinelDate;
    private final Clock clock;

    /**
     * Creates the policy and validates the text rule table.
     *
     * @param config imputation settings
     * @param clock clock supplying the run date for synthesized process numbers
     * @throws IllegalStateException if the text rule table is inconsistent
     */
    public NullImputationPolicy(ImputationConfig config, Clock clock) {
        Preconditions.checkNotNull(config, "config must not be null");
        TextImputationRule.validateRuleTable();
        this.identifierColumn = config.getIdentifierColumn();
        this.sentinelDate = LocalDate.parse(config.getSentinelDate()).atStartOfDay();
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
    }

    /**
     * Returns whether a column takes part in imputation.
     *
     * @param columnName column name
     * @param exemptColumns columns excluded by the caller
     * @return {@code false} for the identifier column and exempt columns, ignoring case
     */
    public boolean isEligible(String columnName, Set<String> exemptColumns) {
        return !columnName.equalsIgnoreCase(identifierColumn)
                && exemptColumns.stream().noneMatch(columnName::equalsIgnoreCase);
    }

    /**
     * Resolves which text rule applies to each eligible text column of the dataset.
     *
     * @param dataset dataset to plan for
     * @param exemptColumns columns excluded from imputation
     * @return column name to rule, in column order
     */
    public Map<String, TextImputationRule> planTextRules(Dataset dataset,
            Set<String> exemptColumns) {
        Map<String, TextImputationRule> plan = new LinkedHashMap<>();
        for (ColumnSpec col : dataset.getColumns()) {
            if (col.getKind() == ColumnKind.TEXT
                    && isEligible(col.getName(), exemptColumns)) {
                plan.put(col.getName(), TextImputationRule.forColumn(col.getName()));
            }
        }
        return plan;
    }

    /**
     * Fills every missing cell of the eligible columns.
     *
     * @param dataset deduplicated dataset
     * @param exemptColumns columns excluded from imputation (e.g. foreign keys)
     * @return treated dataset and counts
     */
    public ImputationResult impute(Dataset dataset, Set<String> exemptColumns) {
        Map<String, TextImputationRule> plan = planTextRules(dataset, exemptColumns);
        if (!plan.isEmpty()) {
            log.debug("Table[{}] Text imputation plan: {}", dataset.getName(),
                    plan.entrySet().stream().map(e -> e.getKey() + "→" + e.getValue())
                            .collect(Collectors.joining(", ")));
            List<String> unmatched = plan.entrySet().stream()
                    .filter(e -> e.getValue() == TextImputationRule.FALLBACK)
                    .map(Map.Entry::getKey).collect(Collectors.toList());
            if (!unmatched.isEmpty()) {
                log.debug("Table[{}] Columns using the generic default: {}", dataset.getName(),
                        unmatched);
            }
        }

        List<List<Cell>> rows = new ArrayList<>(dataset.getRowCount());
        for (List<Cell> row : dataset.getRows()) {
            rows.add(new ArrayList<>(row));
        }

        LocalDate today = LocalDate.now(clock);
        int found = 0;
        int treated = 0;
        for (int c = 0; c < dataset.getColumnCount(); c++) {
            ColumnSpec col = dataset.getColumns().get(c);
            if (!isEligible(col.getName(), exemptColumns)) {
                continue;
            }
            int missing = dataset.countMissing(c);
            if (missing == 0) {
                continue;
            }
            found += missing;
            for (int r = 0; r < rows.size(); r++) {
                if (rows.get(r).get(c).isMissing()) {
                    rows.get(r).set(c, Cell.of(col.getKind(),
                            defaultFor(col, plan.get(col.getName()), r, today)));
                    treated++;
                }
            }
            log.info("Table[{}] Column[{}] {} nulls → {}", dataset.getName(), col.getName(),
                    missing, describe(col, plan.get(col.getName())));
        }

        if (found == 0) {
            return new ImputationResult(dataset, 0, 0);
        }
        log.info("Table[{}] {} null values treated", dataset.getName(), treated);
        return new ImputationResult(dataset.withRows(rows), found, treated);
    }

    private Object defaultFor(ColumnSpec col, TextImputationRule rule, int rowIndex,
            LocalDate today) {
        switch (col.getKind()) {
            case INTEGER:
                return 0L;
            case REAL:
                return 0.0d;
            case BOOLEAN:
                return Boolean.FALSE;
            case TEMPORAL:
                return sentinelDate;
            case TEXT:
            default:
                return rule.valueFor(rowIndex, today);
        }
    }

    private String describe(ColumnSpec col, TextImputationRule rule) {
        switch (col.getKind()) {
            case INTEGER:
                return "filled with 0";
            case REAL:
                return isMonetary(col.getName()) ? "filled with 0.0 (monetary value)"
                        : "filled with 0.0";
            case BOOLEAN:
                return "filled with false";
            case TEMPORAL:
                return "filled with sentinel date " + sentinelDate.toLocalDate();
            case TEXT:
            default:
                return "filled with default value (" + rule + ")";
        }
    }

    private static boolean isMonetary(String columnName) {
        return columnName.toLowerCase(Locale.ROOT).contains("valor");
    }
}
