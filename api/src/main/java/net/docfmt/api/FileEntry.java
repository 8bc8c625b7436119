package net.docfmt.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

public interface FileEntry {
    /**
     * Path to the file. Uses forward slashes as path-separators, and does not have a leading slash.
     */
    String relativePath();

    /**
     * The location of the file on disk, used when reporting problems.
     */
    Path path();

    FileTime lastModified();

    /**
     * @return An input stream to read this content.
     */
    InputStream openInputStream() throws IOException;

    /**
     * @return the extension of the file name without the dot, or an empty string if it has none
     */
    default String extension() {
        var path = relativePath();
        var fileName = path.substring(path.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? "" : fileName.substring(dot + 1);
    }
}
