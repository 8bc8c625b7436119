package net.docfmt.api;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * The files of one input of the command line.
 */
public interface FileSource extends AutoCloseable {
    Stream<FileEntry> streamEntries() throws IOException;

    @Override
    default void close() throws IOException {
    }
}
