package io.github.yok.certdump.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.github.yok.certdump.model.Cell;
import io.github.yok.certdump.model.Dataset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Drops fact rows whose foreign-key columns are unset.
 *
 * <p>
 * Foreign keys of fact tables are exempt from imputation, since a synthetic key would silently
 * corrupt joins with the dimension tables. Rows still missing a key after imputation are dropped
 * and cannot be recovered.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ReferentialIntegrityChecker {

    private final Map<String, List<String>> foreignKeysByTable;

    /**
     * Creates a checker.
     *
     * @param foreignKeysByTable fact table name to its foreign-key columns
     */
    public ReferentialIntegrityChecker(Map<String, List<String>> foreignKeysByTable) {
        ImmutableMap.Builder<String, List<String>> copy = ImmutableMap.builder();
        foreignKeysByTable.forEach((table, keys) -> copy.put(table, ImmutableList.copyOf(keys)));
        this.foreignKeysByTable = copy.build();
    }

    /**
     * Returns whether the table is a fact table subject to this check.
     *
     * @param tableName table name
     * @return {@code true} for configured fact tables
     */
    public boolean appliesTo(String tableName) {
        return foreignKeysByTable.containsKey(tableName);
    }

    /**
     * Returns the foreign-key columns of a table, which must not be imputed.
     *
     * @param tableName table name
     * @return foreign-key columns, empty for dimension tables
     */
    public Set<String> foreignKeysOf(String tableName) {
        return ImmutableSet.copyOf(foreignKeysByTable.getOrDefault(tableName, List.of()));
    }

    /**
     * Removes every row in which any foreign-key column is missing.
     *
     * @param dataset imputed fact dataset
     * @return filtered dataset and drop count
     */
    public ReferentialCheckResult check(Dataset dataset) {
        List<String> keys = foreignKeysByTable.getOrDefault(dataset.getName(), List.of());
        List<Integer> keyIndexes = new ArrayList<>();
        List<String> checked = new ArrayList<>();
        for (String key : keys) {
            Optional<Integer> idx = dataset.indexOf(key);
            if (idx.isPresent()) {
                keyIndexes.add(idx.get());
                checked.add(key);
            } else {
                log.warn("Table[{}] Foreign key column [{}] not found; skipping", dataset.getName(),
                        key);
            }
        }
        if (keyIndexes.isEmpty()) {
            return new ReferentialCheckResult(dataset, 0, List.copyOf(checked));
        }

        List<List<Cell>> kept = new ArrayList<>(dataset.getRowCount());
        for (List<Cell> row : dataset.getRows()) {
            boolean complete = keyIndexes.stream().noneMatch(i -> row.get(i).isMissing());
            if (complete) {
                kept.add(row);
            }
        }
        int dropped = dataset.getRowCount() - kept.size();
        if (dropped == 0) {
            return new ReferentialCheckResult(dataset, 0, List.copyOf(checked));
        }
        log.warn("Table[{}] {} rows removed for missing foreign keys {}", dataset.getName(),
                dropped, checked);
        return new ReferentialCheckResult(dataset.withRows(kept), dropped, List.copyOf(checked));
    }
}
