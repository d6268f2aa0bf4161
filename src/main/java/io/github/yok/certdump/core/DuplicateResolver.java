package io.github.yok.certdump.core;

import io.github.yok.certdump.model.Cell;
import io.github.yok.certdump.model.Dataset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects and removes rows that are identical, across all columns, to an earlier row.
 *
 * <p>
 * Rows are scanned in their original order and the first occurrence always wins. Two rows are equal
 * when every pair of cells is equal; missing cells of the same kind compare equal to each other.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DuplicateResolver {

    /**
     * Removes every row that repeats an earlier row.
     *
     * @param dataset dataset to deduplicate
     * @return deduplicated dataset and counts
     */
    public DuplicateResolution resolve(Dataset dataset) {
        Set<List<Cell>> seen = new HashSet<>();
        List<List<Cell>> kept = new ArrayList<>(dataset.getRowCount());
        int found = 0;
        for (int r = 0; r < dataset.getRowCount(); r++) {
            List<Cell> row = dataset.getRows().get(r);
            if (seen.add(row)) {
                kept.add(row);
            } else {
                found++;
                log.debug("Table[{}] Duplicate detected: row={}", dataset.getName(), r);
            }
        }
        if (found == 0) {
            return new DuplicateResolution(dataset, 0, 0);
        }
        Dataset deduplicated = dataset.withRows(kept);
        int removed = dataset.getRowCount() - deduplicated.getRowCount();
        log.info("Table[{}] {} duplicate rows removed", dataset.getName(), removed);
        return new DuplicateResolution(deduplicated, found, removed);
    }

    /**
     * Counts rows that repeat an earlier row without removing them.
     *
     * @param dataset dataset to inspect
     * @return number of duplicate rows
     */
    public int countDuplicates(Dataset dataset) {
        Set<List<Cell>> seen = new HashSet<>();
        int found = 0;
        for (List<Cell> row : dataset.getRows()) {
            if (!seen.add(row)) {
                found++;
            }
        }
        return found;
    }
}
