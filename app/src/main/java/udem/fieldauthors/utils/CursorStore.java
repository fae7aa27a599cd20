package udem.fieldauthors.utils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Single-slot checkpoint of the next page cursor.
 * <p>
 * The checkpoint is cleared once the sequence is exhausted, so a run after natural
 * completion starts over from {@link #START}. A stopped run keeps its cursor.
 */
public class CursorStore {
    public static final String START = "*";

    private final Path file;

    public CursorStore(Path file) {
        this.file = file;
    }

    public String load() {
        if (!Files.exists(file)) return START;
        try {
            String s = Files.readString(file, StandardCharsets.UTF_8).trim();
            return s.isEmpty() ? START : s;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cursor file " + file, e);
        }
    }

    public void save(String cursor) {
        if (cursor == null || cursor.isBlank()) return;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, cursor, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cursor file " + file, e);
        }
    }

    public void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete cursor file " + file, e);
        }
    }
}
