package net.docfmt.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

final class PathFileEntry implements FileEntry {
    private final Path path;
    private final String relativePath;
    private final FileTime lastModified;

    PathFileEntry(Path relativeTo, Path path) {
        this.path = path;
        this.relativePath = relativeTo.relativize(path).toString().replace('\\', '/');
        try {
            this.lastModified = Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String relativePath() {
        return relativePath;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public FileTime lastModified() {
        return lastModified;
    }

    @Override
    public InputStream openInputStream() throws IOException {
        return Files.newInputStream(path);
    }
}
