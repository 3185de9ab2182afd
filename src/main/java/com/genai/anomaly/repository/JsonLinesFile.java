package com.genai.anomaly.repository;

import com.genai.anomaly.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * An append-only JSON-Lines file shared by the file-backed store and ledger.
 *
 * Each append is written and fsynced before it returns; a failed write is
 * truncated back to the previous length. Loading drops an incomplete final
 * line left by a crash.
 */
final class JsonLinesFile implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesFile.class);

    @FunctionalInterface
    interface LineHandler {
        void accept(int lineNumber, String line);
    }

    private final Path path;
    private final String description;
    private final FileChannel channel;

    JsonLinesFile(Path path, String description) {
        this.path = path.toAbsolutePath();
        this.description = description;
        try {
            Path parent = this.path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.channel = FileChannel.open(this.path,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StoreException("Cannot open " + description + " " + this.path, e);
        }
    }

    /**
     * Feed every complete, non-blank line to the handler in file order.
     */
    void load(LineHandler handler) {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new StoreException("Cannot read " + description + " " + path, e);
        }

        int lineStart = 0;
        int lineNumber = 0;
        for (int i = 0; i < content.length; i++) {
            if (content[i] != '\n') continue;
            lineNumber++;
            String line = new String(content, lineStart, i - lineStart, StandardCharsets.UTF_8).trim();
            lineStart = i + 1;
            if (line.isEmpty()) continue;
            handler.accept(lineNumber, line);
        }

        if (lineStart < content.length) {
            // Unterminated tail: an append that crashed before its fsync was acknowledged
            log.warn("Dropping incomplete trailing line in {} ({} bytes at offset {})",
                    path, content.length - lineStart, lineStart);
            try {
                channel.truncate(lineStart);
                channel.force(true);
            } catch (IOException e) {
                throw new StoreException("Cannot truncate incomplete tail of " + path, e);
            }
        }
    }

    /**
     * Append one line and fsync it. Callers serialize appends.
     *
     * @throws IOException if the write fails; the file is rolled back first
     */
    void append(String json) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap((json + "\n").getBytes(StandardCharsets.UTF_8));
        long previousSize = -1;
        try {
            previousSize = channel.size();
            long position = previousSize;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            channel.force(true);
        } catch (IOException e) {
            rollback(previousSize, e);
            throw e;
        }
    }

    private void rollback(long previousSize, IOException cause) {
        if (previousSize < 0) return;
        try {
            channel.truncate(previousSize);
            channel.force(true);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.error("Failed to roll back partial append in {} to {} bytes", path, previousSize, e);
        }
    }

    Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.close();
        }
    }

    void closeQuietly() {
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close {} after a failed open: {}", path, e.getMessage());
        }
    }
}
