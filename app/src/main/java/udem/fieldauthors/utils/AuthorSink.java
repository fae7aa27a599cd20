package udem.fieldauthors.utils;

import udem.fieldauthors.dto.AuthorRecord;

import java.io.Closeable;
import java.io.IOException;

public interface AuthorSink extends Closeable {
    void write(AuthorRecord record) throws IOException;

    void flush() throws IOException;
}
