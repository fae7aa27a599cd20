package udem.fieldauthors.utils;

import udem.fieldauthors.dto.AuthorRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Appends author rows to a CSV file. The header is written only when the file is new or empty.
 */
public class CsvAuthorSink implements AuthorSink {
    private final BufferedWriter w;

    private CsvAuthorSink(BufferedWriter w) {
        this.w = w;
    }

    public static CsvAuthorSink open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        boolean writeHeader = !Files.exists(path) || Files.size(path) == 0;
        var w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        var sink = new CsvAuthorSink(w);
        if (writeHeader) sink.row(AuthorRecord.COLUMNS);
        return sink;
    }

    @Override
    public void write(AuthorRecord record) throws IOException {
        row(record.values());
    }

    @Override
    public void flush() throws IOException {
        w.flush();
    }

    @Override
    public void close() throws IOException {
        w.close();
    }

    private void row(List<String> values) throws IOException {
        w.write(values.stream().map(CsvAuthorSink::q).collect(Collectors.joining(",")));
        w.write("\r\n");
    }

    static String q(String s) {
        if (s == null) return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
