package io.github.yok.certdump.core;

import io.github.yok.certdump.model.Cell;
import io.github.yok.certdump.model.ColumnKind;
import io.github.yok.certdump.model.Dataset;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts driver-specific cell payloads into the canonical type of each cell's kind.
 *
 * <p>
 * <strong>Conversions:</strong>
 * </p>
 * <ul>
 * <li>{@code INTEGER}: any integral {@link Number}, or numeric text → {@link Long}</li>
 * <li>{@code REAL}: any {@link Number}, or numeric text → {@link Double}</li>
 * <li>{@code BOOLEAN}: {@link Boolean}, numbers (non-zero is true), {@code t/f/y/n/yes/no/on/off}
 * text → {@link Boolean}</li>
 * <li>{@code TEMPORAL}: {@link Timestamp}, {@link java.sql.Date}, {@link Time},
 * {@link LocalDate}, {@link OffsetDateTime}, {@link ZonedDateTime}, {@link Instant},
 * {@link Date} → {@link LocalDateTime} (offsets and instants in UTC)</li>
 * <li>{@code TEXT}: numbers, booleans, characters, {@link UUID} → {@link String}; {@code byte[]}
 * → upper-case hexadecimal</li>
 * </ul>
 *
 * <p>
 * Missing cells become {@link Cell#absent(ColumnKind)}. Payloads that have no known conversion
 * are kept as they are: this step never fails.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TypeNormalizer {

    /**
     * Normalizes every cell of the dataset.
     *
     * @param dataset cleaned dataset
     * @return dataset whose cells hold canonical payloads or explicit absent markers
     */
    public Dataset normalize(Dataset dataset) {
        List<List<Cell>> rows = new ArrayList<>(dataset.getRowCount());
        int converted = 0;
        int unrecognized = 0;
        for (List<Cell> row : dataset.getRows()) {
            List<Cell> out = new ArrayList<>(row.size());
            for (Cell cell : row) {
                Cell normalized = normalize(cell);
                if (normalized != cell) {
                    converted++;
                }
                if (!normalized.isCanonical()) {
                    unrecognized++;
                }
                out.add(normalized);
            }
            rows.add(out);
        }
        if (unrecognized > 0) {
            log.warn("Table[{}] {} cells kept with an unrecognized value type", dataset.getName(),
                    unrecognized);
        }
        log.debug("Table[{}] Type normalization converted {} cells", dataset.getName(), converted);
        return converted == 0 ? dataset : dataset.withRows(rows);
    }

    /**
     * Normalizes a single cell.
     *
     * @param cell cell to normalize
     * @return the same instance when already canonical, otherwise a converted cell
     */
    public Cell normalize(Cell cell) {
        if (cell.isMissing()) {
            return cell.getValue() == null ? cell : Cell.absent(cell.getKind());
        }
        if (cell.isCanonical()) {
            return cell;
        }
        Object value = cell.getValue();
        Object canonical;
        switch (cell.getKind()) {
            case INTEGER:
                canonical = toLong(value);
                break;
            case REAL:
                canonical = toDouble(value);
                break;
            case BOOLEAN:
                canonical = toBoolean(value);
                break;
            case TEMPORAL:
                canonical = toLocalDateTime(value);
                break;
            case TEXT:
            default:
                canonical = toText(value);
                break;
        }
        if (canonical == null) {
            log.debug("Unrecognized {} value type {}; kept as is", cell.getKind(),
                    value.getClass().getName());
            return cell;
        }
        return Cell.of(cell.getKind(), canonical);
    }

    private static Long toLong(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).longValue();
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).longValue();
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            String trimmed = StringUtils.trim((String) value);
            try {
                return new BigDecimal(trimmed).longValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.valueOf(StringUtils.trim((String) value));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        if (value instanceof String) {
            String trimmed = StringUtils.trim((String) value);
            if ("1".equals(trimmed)) {
                return Boolean.TRUE;
            }
            if ("0".equals(trimmed)) {
                return Boolean.FALSE;
            }
            return BooleanUtils.toBooleanObject(trimmed);
        }
        return null;
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay();
        }
        if (value instanceof Time) {
            return LocalDateTime.of(LocalDate.EPOCH, ((Time) value).toLocalTime());
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof LocalTime) {
            return LocalDateTime.of(LocalDate.EPOCH, (LocalTime) value);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC);
        }
        return null;
    }

    private static String toText(Object value) {
        if (value instanceof byte[]) {
            return Hex.encodeHexString((byte[]) value).toUpperCase();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character
                || value instanceof UUID || value instanceof CharSequence) {
            return value.toString();
        }
        return null;
    }
}
