package net.docfmt.cli.io;

import net.docfmt.api.FileEntries;
import net.docfmt.api.FileEntry;
import net.docfmt.api.FileSource;

import java.nio.file.Path;
import java.util.stream.Stream;

record SingleFileSource(Path path) implements FileSource {
    SingleFileSource(Path path) {
        this.path = path.toAbsolutePath();
    }

    @Override
    public Stream<FileEntry> streamEntries() {
        return Stream.of(FileEntries.ofFile(path));
    }
}
