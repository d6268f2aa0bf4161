package io.github.yok.certdump.core;

import io.github.yok.certdump.model.Cell;
import io.github.yok.certdump.model.Dataset;
import io.github.yok.certdump.util.CsvUtils;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a dataset to a UTF-8 CSV file whose header row is the column names.
 *
 * <p>
 * Missing cells are written as empty fields; other cells are rendered by
 * {@link CsvUtils#toCsvValue(Cell)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvSnapshotWriter implements SnapshotWriter {

    @Override
    public void write(Dataset dataset, File file) throws SnapshotWriteException {
        String[] headers = dataset.getColumnNames().toArray(new String[0]);
        List<List<String>> rows = new ArrayList<>(dataset.getRowCount());
        for (List<Cell> row : dataset.getRows()) {
            List<String> out = new ArrayList<>(row.size());
            for (Cell cell : row) {
                out.add(CsvUtils.toCsvValue(cell));
            }
            rows.add(out);
        }
        try {
            CsvUtils.writeCsvUtf8(file, headers, rows);
        } catch (IOException e) {
            throw new SnapshotWriteException("Failed to write snapshot: " + file.getPath(), e);
        }
        log.debug("Table[{}] {} rows written to {}", dataset.getName(), rows.size(), file);
    }
}
