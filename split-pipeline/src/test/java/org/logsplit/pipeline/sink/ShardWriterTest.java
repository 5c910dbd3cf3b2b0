package org.logsplit.pipeline.sink;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;

import org.logsplit.pipeline.ir.LineTerminator;
import org.logsplit.pipeline.ir.RawRecord;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class ShardWriterTest {

    @TempDir
    Path tempDir;

    private static RawRecord record(String text, LineTerminator terminator) {
        return new RawRecord(1, text.getBytes(StandardCharsets.UTF_8), terminator);
    }

    @Test
    void writesRecordsWithTheirTerminators() throws IOException {
        Path path = tempDir.resolve("out-2020-01-01");

        try (ShardWriter writer = ShardWriter.open(path, false)) {
            writer.write(record("a", LineTerminator.LF));
            writer.write(record("b", LineTerminator.CRLF));
            writer.write(record("c", LineTerminator.NONE));
            assertEquals(3, writer.getRecordsWritten());
        }

        assertEquals("a\nb\r\nc\n", Files.readString(path));
    }

    @Test
    void bufferedRecordsOnlyReachTheFileOnClose() throws IOException {
        Path path = tempDir.resolve("buffered");
        ShardWriter writer = ShardWriter.open(path, false);
        writer.write(record("pending", LineTerminator.LF));

        assertEquals(0, Files.size(path));
        writer.close();
        assertEquals("pending\n", Files.readString(path));
    }

    @Test
    void reopeningAppendsInsteadOfTruncating() throws IOException {
        Path path = tempDir.resolve("append");
        try (ShardWriter writer = ShardWriter.open(path, false)) {
            writer.write(record("first", LineTerminator.LF));
        }
        try (ShardWriter writer = ShardWriter.open(path, false)) {
            writer.write(record("second", LineTerminator.LF));
        }

        assertEquals(List.of("first", "second"), Files.readAllLines(path));
    }

    @Test
    void gzipSessionsConcatenateIntoOneReadableStream() throws IOException {
        Path path = tempDir.resolve("out-2020-01-01.gz");
        try (ShardWriter writer = ShardWriter.open(path, true)) {
            writer.write(record("first", LineTerminator.LF));
        }
        try (ShardWriter writer = ShardWriter.open(path, true)) {
            writer.write(record("second", LineTerminator.LF));
        }

        try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
            assertEquals("first\nsecond\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void createsMissingParentDirectories() throws IOException {
        Path path = tempDir.resolve("nested/deeper/out-2020-01-01");

        try (ShardWriter writer = ShardWriter.open(path, false)) {
            writer.write(record("x", LineTerminator.LF));
        }

        assertTrue(Files.isRegularFile(path));
    }

    @Test
    void closeIsIdempotentAndWritesAfterCloseFail() throws IOException {
        ShardWriter writer = ShardWriter.open(tempDir.resolve("closed"), false);

        writer.close();
        writer.close();

        assertTrue(writer.isClosed());
        assertThrows(IOException.class, () -> writer.write(record("late", LineTerminator.LF)));
    }

    @Test
    void openFailsWhenParentIsAFile() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.createFile(blocker);

        assertThrows(IOException.class, () -> ShardWriter.open(blocker.resolve("out-2020-01-01"), false));
    }
}
