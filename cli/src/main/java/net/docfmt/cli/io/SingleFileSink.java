package net.docfmt.cli.io;

import net.docfmt.api.FileSink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * Writes to a single file, or into a directory if {@code path} is one.
 */
public record SingleFileSink(Path path) implements FileSink {

    @Override
    public void putFile(String relativePath, FileTime lastModified, byte[] content) throws IOException {
        Path targetPath;
        if (Files.isDirectory(path)) {
            targetPath = path.resolve(relativePath);
        } else {
            targetPath = path;
            var parent = targetPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        }
        Files.write(targetPath, content);
        Files.setLastModifiedTime(targetPath, lastModified);
    }
}
