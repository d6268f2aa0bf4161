package io.github.yok.certdump.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory table produced by extraction: ordered, named columns with row-aligned cells.
 *
 * <p>
 * Instances are immutable. Cleaning stages never modify a dataset; they derive a new one through
 * {@link #withRows(List)}. The constructor enforces that every row has one cell per column and that
 * each cell carries the kind of its column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Dataset {

    private final String name;
    private final List<ColumnSpec> columns;
    private final List<List<Cell>> rows;

    /**
     * Creates a dataset.
     *
     * @param name table name
     * @param columns column definitions, in order
     * @param rows row-major cells
     * @throws IllegalArgumentException if a row is misaligned with the columns
     */
    public Dataset(String name, List<ColumnSpec> columns, List<List<Cell>> rows) {
        this.name = Preconditions.checkNotNull(name, "name must not be null");
        this.columns = ImmutableList.copyOf(columns);
        ImmutableList.Builder<List<Cell>> copy = ImmutableList.builder();
        for (int r = 0; r < rows.size(); r++) {
            List<Cell> row = rows.get(r);
            Preconditions.checkArgument(row.size() == this.columns.size(),
                    "Table[%s] row %s has %s cells but %s columns are declared", name, r,
                    row.size(), this.columns.size());
            for (int c = 0; c < row.size(); c++) {
                ColumnKind expected = this.columns.get(c).getKind();
                Preconditions.checkArgument(row.get(c).getKind() == expected,
                        "Table[%s] row %s column [%s] holds %s but is declared %s", name, r,
                        this.columns.get(c).getName(), row.get(c).getKind(), expected);
            }
            copy.add(ImmutableList.copyOf(row));
        }
        this.rows = copy.build();
    }

    /**
     * Starts a builder for hand-assembled datasets.
     *
     * @param name table name
     * @return builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<ColumnSpec> getColumns() {
        return columns;
    }

    public List<List<Cell>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Returns column names in declaration order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnSpec::getName).collect(Collectors.toList());
    }

    /**
     * Finds the position of a column by name, ignoring case as drivers may report names in a
     * different case than configured.
     *
     * @param columnName column name
     * @return zero-based index, or empty if the column does not exist
     */
    public Optional<Integer> indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equalsIgnoreCase(columnName)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns one cell.
     *
     * @param row zero-based row index
     * @param column zero-based column index
     * @return cell
     */
    public Cell getCell(int row, int column) {
        return rows.get(row).get(column);
    }

    /**
     * Returns one column as a list of cells aligned by row index.
     *
     * @param column zero-based column index
     * @return cells of the column
     */
    public List<Cell> getColumn(int column) {
        return rows.stream().map(r -> r.get(column)).collect(ImmutableList.toImmutableList());
    }

    /**
     * Counts missing cells of one column.
     *
     * @param column zero-based column index
     * @return number of missing cells
     */
    public int countMissing(int column) {
        int count = 0;
        for (List<Cell> row : rows) {
            if (row.get(column).isMissing()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Derives a dataset with the same name and columns and the given rows.
     *
     * @param newRows replacement rows
     * @return new dataset
     */
    public Dataset withRows(List<List<Cell>> newRows) {
        return new Dataset(name, columns, newRows);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset)) {
            return false;
        }
        Dataset other = (Dataset) o;
        return name.equals(other.name) && columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset[" + name + ", columns=" + getColumnNames() + ", rows=" + rows.size() + "]";
    }

    /**
     * Row-by-row builder; values are wrapped into cells of the declared column kind.
     */
    public static final class Builder {

        private final String name;
        private final List<ColumnSpec> columns = new ArrayList<>();
        private final List<List<Cell>> rows = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Declares the next column.
         *
         * @param columnName column name
         * @param kind column kind
         * @return this builder
         */
        public Builder column(String columnName, ColumnKind kind) {
            Preconditions.checkState(rows.isEmpty(), "columns must be declared before rows");
            columns.add(new ColumnSpec(columnName, kind));
            return this;
        }

        /**
         * Appends a row of raw payloads.
         *
         * @param values one payload per declared column ({@code null} for missing)
         * @return this builder
         */
        public Builder row(Object... values) {
            Preconditions.checkArgument(values.length == columns.size(),
                    "expected %s values but got %s", columns.size(), values.length);
            List<Cell> row = new ArrayList<>(values.length);
            for (int i = 0; i < values.length; i++) {
                row.add(Cell.of(columns.get(i).getKind(), values[i]));
            }
            rows.add(row);
            return this;
        }

        /**
         * Builds the dataset.
         *
         * @return dataset
         */
        public Dataset build() {
            return new Dataset(name, columns, rows);
        }
    }
}
