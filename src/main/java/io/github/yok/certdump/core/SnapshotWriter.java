package io.github.yok.certdump.core;

import io.github.yok.certdump.model.Dataset;
import java.io.File;

/**
 * Write contract for cleaned datasets.
 *
 * @author Yasuharu.Okawauchi
 */
public interface SnapshotWriter {

    /**
     * Writes the whole dataset, overwriting any existing file.
     *
     * @param dataset cleaned dataset
     * @param file destination file
     * @throws SnapshotWriteException if the file cannot be written
     */
    void write(Dataset dataset, File file) throws SnapshotWriteException;
}
