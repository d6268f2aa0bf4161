package io.github.yok.certdump.db;

import io.github.yok.certdump.core.ExtractionException;
import io.github.yok.certdump.model.Dataset;

/**
 * Read contract of the relational store.
 *
 * @author Yasuharu.Okawauchi
 */
public interface TableReader {

    /**
     * Reads every row of the named table, without filtering or pagination.
     *
     * @param tableName table name
     * @return dataset holding the raw driver values
     * @throws ExtractionException if the table cannot be read
     */
    Dataset fetchTable(String tableName) throws ExtractionException;

    /**
     * Counts the rows currently stored in the named table.
     *
     * @param tableName table name
     * @return row count
     * @throws ExtractionException if the count query fails
     */
    long countRows(String tableName) throws ExtractionException;
}
