package udem.fieldauthors.collection;

import udem.fieldauthors.utils.AuthorSink;

import java.io.IOException;

@FunctionalInterface
public interface SinkOpener {
    AuthorSink open() throws IOException;
}
