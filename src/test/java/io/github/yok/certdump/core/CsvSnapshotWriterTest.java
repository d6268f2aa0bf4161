package io.github.yok.certdump.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.certdump.model.ColumnKind;
import io.github.yok.certdump.model.Dataset;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvSnapshotWriterTest {

    @TempDir
    Path tempDir;

    private final CsvSnapshotWriter writer = new CsvSnapshotWriter();

    @Test
    void write_正常ケース_ヘッダと行がUTF8で書き出されること() throws Exception {
        Dataset ds = Dataset.builder("dim_pessoa").column("id", ColumnKind.INTEGER)
                .column("nome", ColumnKind.TEXT).column("nascimento", ColumnKind.TEMPORAL)
                .column("renda", ColumnKind.REAL)
                .row(1L, "João, Filho", LocalDateTime.of(1990, 1, 2, 0, 0), 1500.5d)
                .row(2L, null, null, null).build();
        File csv = tempDir.resolve("dim_pessoa.csv").toFile();

        writer.write(ds, csv);

        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).get();
        try (CSVParser parser = CSVParser.parse(csv, StandardCharsets.UTF_8, fmt)) {
            assertEquals(List.of("id", "nome", "nascimento", "renda"), parser.getHeaderNames());
            List<CSVRecord> records = parser.getRecords();
            assertEquals(2, records.size());
            assertEquals("1", records.get(0).get("id"));
            assertEquals("João, Filho", records.get(0).get("nome"));
            assertEquals("1990-01-02 00:00:00", records.get(0).get("nascimento"));
            assertEquals("1500.5", records.get(0).get("renda"));
            assertEquals("", records.get(1).get("nome"));
            assertEquals("", records.get(1).get("renda"));
        }
    }

    @Test
    void write_正常ケース_既存ファイルが上書きされること() throws Exception {
        File csv = tempDir.resolve("t.csv").toFile();
        Files.writeString(csv.toPath(), "old content\nold\nold\n");
        Dataset ds = Dataset.builder("t").column("id", ColumnKind.INTEGER).row(9L).build();

        writer.write(ds, csv);

        List<String> lines = Files.readAllLines(csv.toPath(), StandardCharsets.UTF_8);
        assertEquals(List.of("id", "9"), lines);
    }

    @Test
    void write_正常ケース_空のデータセット_ヘッダのみ書き出されること() throws Exception {
        File csv = tempDir.resolve("empty.csv").toFile();
        Dataset ds = Dataset.builder("empty").column("id", ColumnKind.INTEGER)
                .column("nome", ColumnKind.TEXT).build();

        writer.write(ds, csv);

        assertEquals(List.of("id,nome"), Files.readAllLines(csv.toPath()));
    }

    @Test
    void write_異常ケース_出力先ディレクトリが存在しない_SnapshotWriteExceptionが送出されること() {
        File csv = tempDir.resolve("missing").resolve("t.csv").toFile();
        Dataset ds = Dataset.builder("t").column("id", ColumnKind.INTEGER).row(1L).build();

        SnapshotWriteException ex =
                assertThrows(SnapshotWriteException.class, () -> writer.write(ds, csv));
        assertEquals(ErrorKind.WRITE_FAILURE, ex.getKind());
        assertTrue(ex.getMessage().contains("t.csv"));
    }
}
