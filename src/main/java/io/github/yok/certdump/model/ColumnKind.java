package io.github.yok.certdump.model;

import java.sql.Types;
import java.time.LocalDateTime;

/**
 * Declared kind of a dataset column.
 *
 * <p>
 * The kind is inferred from the JDBC SQL type at extraction time and never changes while the
 * dataset is cleaned; only cell values are filled or normalized. Each kind names the canonical Java
 * type its cells hold once {@code TypeNormalizer} has run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ColumnKind {

    TEXT(String.class),
    INTEGER(Long.class),
    REAL(Double.class),
    BOOLEAN(Boolean.class),
    TEMPORAL(LocalDateTime.class);

    private final Class<?> canonicalType;

    ColumnKind(Class<?> canonicalType) {
        this.canonicalType = canonicalType;
    }

    /**
     * Returns the canonical Java type of cells of this kind.
     *
     * @return canonical type
     */
    public Class<?> getCanonicalType() {
        return canonicalType;
    }

    /**
     * Returns whether the given payload is already in the canonical domain of this kind.
     *
     * @param value cell payload (may be {@code null})
     * @return {@code true} if {@code value} is {@code null} or an instance of the canonical type
     */
    public boolean isCanonical(Object value) {
        return value == null || canonicalType.isInstance(value);
    }

    /**
     * Maps a JDBC SQL type ({@link Types}) to a column kind.
     *
     * <p>
     * Fixed-point types ({@code NUMERIC}/{@code DECIMAL}) map to {@link #REAL}. Anything that is
     * not numeric, boolean or temporal is treated as {@link #TEXT}.
     * </p>
     *
     * @param sqlType JDBC SQL type code
     * @return column kind
     */
    public static ColumnKind fromSqlType(int sqlType) {
        switch (sqlType) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return INTEGER;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
            case Types.NUMERIC:
            case Types.DECIMAL:
                return REAL;
            case Types.BIT:
            case Types.BOOLEAN:
                return BOOLEAN;
            case Types.DATE:
            case Types.TIME:
            case Types.TIMESTAMP:
            case Types.TIME_WITH_TIMEZONE:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return TEMPORAL;
            default:
                return TEXT;
        }
    }
}
