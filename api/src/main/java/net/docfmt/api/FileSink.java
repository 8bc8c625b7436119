package net.docfmt.api;

import java.io.IOException;
import java.nio.file.attribute.FileTime;

/**
 * Receives the formatted files of one input.
 */
public interface FileSink extends AutoCloseable {
    /**
     * @param relativePath the {@link FileEntry#relativePath() relative path} of the entry that was read
     * @param lastModified the time of the last change, which is the time of formatting if the text changed
     */
    void putFile(String relativePath, FileTime lastModified, byte[] content) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
