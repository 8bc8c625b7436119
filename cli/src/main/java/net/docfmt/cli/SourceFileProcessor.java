package net.docfmt.cli;

import net.docfmt.api.FileEntry;
import net.docfmt.api.FileSink;
import net.docfmt.api.FileSource;
import net.docfmt.api.Logger;
import net.docfmt.api.ProblemReporter;
import net.docfmt.api.SourceTransformer;
import net.docfmt.api.TransformContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

/**
 * Runs the enabled transformers over every file of a source, one after the other, and writes the result to a sink.
 */
class SourceFileProcessor {
    private final Logger logger;
    private final ProblemReporter problemReporter;

    public SourceFileProcessor(Logger logger, ProblemReporter problemReporter) {
        this.logger = logger;
        this.problemReporter = problemReporter;
    }

    public boolean process(FileSource source, FileSink sink, List<SourceTransformer> transformers) throws IOException {
        var context = new TransformContext(logger, problemReporter);

        for (var transformer : transformers) {
            transformer.beforeRun(context);
        }

        try (var stream = source.streamEntries()) {
            stream.forEach(entry -> {
                try {
                    processEntry(entry, transformers, sink);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        boolean isOk = true;
        for (var transformer : transformers) {
            isOk = transformer.afterRun(context) && isOk;
        }

        return isOk;
    }

    private void processEntry(FileEntry entry, List<SourceTransformer> transformers, FileSink sink) throws IOException {
        byte[] content;
        try (var in = entry.openInputStream()) {
            content = in.readAllBytes();
        }
        var lastModified = entry.lastModified();

        if (!transformers.isEmpty()) {
            var originalText = new String(content, StandardCharsets.UTF_8);
            var text = originalText;
            for (var transformer : transformers) {
                text = transformer.transformFile(entry, text);
            }
            if (!text.equals(originalText)) {
                logger.debug("Formatted %s", entry.relativePath());
                content = text.getBytes(StandardCharsets.UTF_8);
                lastModified = FileTime.from(Instant.now());
            }
        }
        sink.putFile(entry.relativePath(), lastModified, content);
    }
}
