package net.docfmt.api;

import java.nio.file.Path;

public final class FileEntries {
    private FileEntries() {
    }

    /**
     * Creates an entry for a file given on its own, whose relative path is its file name.
     */
    public static FileEntry ofFile(Path file) {
        var absoluteFile = file.toAbsolutePath();
        var directory = absoluteFile.getParent();
        if (directory == null) {
            throw new IllegalArgumentException("Not a file: " + file);
        }
        return new PathFileEntry(directory, absoluteFile);
    }
}
