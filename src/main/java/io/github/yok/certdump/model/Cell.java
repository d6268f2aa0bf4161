package io.github.yok.certdump.model;

import com.google.common.base.Preconditions;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A single dataset value tagged with the kind of the column it belongs to.
 *
 * <p>
 * The payload is whatever the extraction layer produced (for example {@link java.math.BigDecimal}
 * or {@link java.sql.Timestamp}) until the type normalizer replaces it with the canonical type of
 * the kind. A {@code null} payload, or a floating-point {@code NaN}, marks a missing value.
 * </p>
 *
 * <p>
 * Equality compares payload content: binary payloads by their bytes and decimals regardless of
 * scale, so {@code 10.5} equals {@code 10.50}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Cell {

    private final ColumnKind kind;
    private final Object value;

    private Cell(ColumnKind kind, Object value) {
        this.kind = Preconditions.checkNotNull(kind, "kind must not be null");
        this.value = value;
    }

    /**
     * Creates a cell holding the given payload.
     *
     * @param kind column kind
     * @param value payload, {@code null} for a missing value
     * @return new cell
     */
    public static Cell of(ColumnKind kind, Object value) {
        return new Cell(kind, value);
    }

    /**
     * Creates the explicit absent marker for the given kind.
     *
     * @param kind column kind
     * @return cell without payload
     */
    public static Cell absent(ColumnKind kind) {
        return new Cell(kind, null);
    }

    public ColumnKind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Returns whether this cell is missing ({@code null} payload or {@code NaN}).
     *
     * @return {@code true} if the cell needs imputation
     */
    public boolean isMissing() {
        if (value == null) {
            return true;
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if (value instanceof Float) {
            return ((Float) value).isNaN();
        }
        return false;
    }

    /**
     * Returns whether the payload is in the canonical domain of the kind. Absent cells count as
     * canonical.
     *
     * @return {@code true} if no normalization is required
     */
    public boolean isCanonical() {
        return isMissing() ? value == null : kind.isCanonical(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) o;
        if (kind != other.kind) {
            return false;
        }
        // every missing marker of a kind is the same value
        if (isMissing() && other.isMissing()) {
            return true;
        }
        return Objects.equals(comparisonKey(), other.comparisonKey());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, isMissing() ? null : comparisonKey());
    }

    private Object comparisonKey() {
        if (value instanceof byte[]) {
            return ByteBuffer.wrap((byte[]) value);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros();
        }
        return value;
    }

    @Override
    public String toString() {
        return kind + ":" + (isMissing() ? "<absent>" : value);
    }
}
