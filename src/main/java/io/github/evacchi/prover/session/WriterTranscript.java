package io.github.evacchi.prover.session;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

import io.github.evacchi.prover.tactic.Transcript;

/**
 * Writes a transcript line by line, flushing each one, so an interrupted proof
 * still leaves every command typed so far on disk.
 */
public class WriterTranscript implements Transcript, Closeable {
    private final Writer writer;

    public WriterTranscript(Writer writer) {
        this.writer = writer;
    }

    @Override
    public void record(String line) {
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
