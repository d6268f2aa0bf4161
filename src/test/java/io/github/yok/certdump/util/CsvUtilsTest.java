package io.github.yok.certdump.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import io.github.yok.certdump.model.Cell;
import io.github.yok.certdump.model.ColumnKind;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvUtilsTest {

    @TempDir
    Path tempDir;

    // -------------------------------------------------------------------------
    // toCsvValue / formatValue
    // -------------------------------------------------------------------------

    @Test
    void toCsvValue_正常ケース_欠損セルは空文字になること() {
        assertEquals("", CsvUtils.toCsvValue(Cell.absent(ColumnKind.TEXT)));
        assertEquals("", CsvUtils.toCsvValue(Cell.of(ColumnKind.REAL, Double.NaN)));
        assertEquals("abc", CsvUtils.toCsvValue(Cell.of(ColumnKind.TEXT, "abc")));
    }

    @Test
    void formatValue_正常ケース_日時はミリ秒の有無で書式が変わること() {
        assertEquals("2024-01-02 03:04:05",
                CsvUtils.formatValue(LocalDateTime.of(2024, 1, 2, 3, 4, 5)));
        assertEquals("2024-01-02 03:04:05.120",
                CsvUtils.formatValue(LocalDateTime.of(2024, 1, 2, 3, 4, 5, 120_000_000)));
    }

    @Test
    void formatValue_正常ケース_実数は指数表記にならないこと() {
        assertEquals("12345678901", CsvUtils.formatValue(1.2345678901E10));
        assertEquals("0.0", CsvUtils.formatValue(0.0d));
        assertEquals("", CsvUtils.formatValue(null));
        assertEquals("true", CsvUtils.formatValue(Boolean.TRUE));
    }

    // -------------------------------------------------------------------------
    // writeCsvUtf8 / sizeInMegabytes
    // -------------------------------------------------------------------------

    @Test
    void writeCsvUtf8_正常ケース_ヘッダと行が書き出されること() throws Exception {
        File csv = tempDir.resolve("out.csv").toFile();

        CsvUtils.writeCsvUtf8(csv, new String[] {"id", "cidade"},
                List.of(List.of("1", "São Paulo"), List.of("2", "Rio, RJ")));

        List<String> lines = Files.readAllLines(csv.toPath(), StandardCharsets.UTF_8);
        assertEquals(List.of("id,cidade", "1,São Paulo", "2,\"Rio, RJ\""), lines);
    }

    @Test
    void sizeInMegabytes_正常ケース_ファイルサイズがMB単位で返ること() throws Exception {
        File file = tempDir.resolve("one-mb.bin").toFile();
        Files.write(file.toPath(), new byte[1024 * 1024]);
        assertEquals(1.0, CsvUtils.sizeInMegabytes(file), 1e-9);
        assertEquals(0.0, CsvUtils.sizeInMegabytes(tempDir.resolve("none").toFile()), 1e-9);
    }
}
