package net.docfmt.cli.io;

import net.docfmt.api.FileSource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class FileSources {
    private FileSources() {
    }

    public static FileSource create(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("File does not exist: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Expected " + path + " to be a file.");
        }
        return new SingleFileSource(path);
    }
}
