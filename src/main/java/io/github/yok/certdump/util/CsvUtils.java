package io.github.yok.certdump.util;

import io.github.yok.certdump.model.Cell;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

/**
 * Utility class for writing snapshot and report CSV files.
 *
 * <p>
 * Files are written in UTF-8 using Apache Commons CSV with minimal quoting. Records are separated
 * using the platform's default line separator, and the backslash character ({@code \}) is used as
 * the escape character.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    // Timestamp format without milliseconds
    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    // Timestamp format with milliseconds
    private static final DateTimeFormatter DATE_TIME_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Renders a cell as CSV text.
     *
     * <ul>
     * <li>Missing cells → empty string</li>
     * <li>{@link LocalDateTime} → {@code yyyy-MM-dd HH:mm:ss}, with {@code .SSS} when the value has
     * a fraction of a second</li>
     * <li>{@link Double} → plain decimal notation (no exponent)</li>
     * <li>Anything else → {@code toString()}</li>
     * </ul>
     *
     * @param cell cell to render
     * @return CSV text, never {@code null}
     */
    public static String toCsvValue(Cell cell) {
        if (cell.isMissing()) {
            return "";
        }
        return formatValue(cell.getValue());
    }

    /**
     * Renders a canonical value as CSV text. {@code null} becomes an empty string.
     *
     * @param value value to render
     * @return CSV text, never {@code null}
     */
    public static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            LocalDateTime ts = (LocalDateTime) value;
            return ts.format(ts.getNano() == 0 ? DATE_TIME : DATE_TIME_MILLIS);
        }
        if (value instanceof Double) {
            return BigDecimal.valueOf((Double) value).toPlainString();
        }
        return value.toString();
    }

    /**
     * Returns the size of a file in megabytes.
     *
     * @param file file to measure
     * @return size in MB, {@code 0} if the file does not exist
     */
    public static double sizeInMegabytes(File file) {
        return file.length() / BYTES_PER_MEGABYTE;
    }

    /**
     * Writes the given header and row data to a CSV file encoded in UTF-8.
     *
     * <p>
     * The CSV is written with:
     * </p>
     * <ul>
     * <li>Header row provided by {@code headers}</li>
     * <li>Quote mode: {@link QuoteMode#MINIMAL}</li>
     * <li>Escape character: backslash ({@code \})</li>
     * <li>Record separator: {@link System#lineSeparator()}</li>
     * </ul>
     *
     * @param csvFile the destination CSV file (will be created or overwritten)
     * @param headers the header columns to write as the first record
     * @param rows the data rows; each inner list represents one CSV record
     * @throws IOException if an I/O error occurs while writing the file
     */
    public static void writeCsvUtf8(File csvFile, String[] headers, List<List<String>> rows)
            throws IOException {
        CSVFormat fmt =
                CSVFormat.DEFAULT.builder().setHeader(headers).setQuoteMode(QuoteMode.MINIMAL)
                        .setEscape('\\').setRecordSeparator(System.lineSeparator()).get();
        try (Writer w =
                new OutputStreamWriter(new FileOutputStream(csvFile), StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }
}
