package net.docfmt.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import net.docfmt.api.Logger;
import net.docfmt.api.ProblemId;
import net.docfmt.api.ProblemLocation;
import net.docfmt.api.ProblemReporter;
import net.docfmt.api.ProblemSeverity;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.VisibleForTesting;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the problems of a whole invocation and writes them to the {@code --problems-report} file when closed.
 * Files are written with absolute paths.
 */
@ApiStatus.Internal
public class FileProblemReporter implements ProblemReporter, AutoCloseable {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .registerTypeHierarchyAdapter(Path.class, new TypeAdapter<Path>() {
                @Override
                public void write(JsonWriter out, Path value) throws IOException {
                    out.value(value.toAbsolutePath().toString());
                }

                @Override
                public Path read(JsonReader in) throws IOException {
                    return Paths.get(in.nextString());
                }
            })
            .create();

    private final Logger logger;
    private final Path reportFile;
    private final List<ProblemRecord> records = new ArrayList<>();

    public FileProblemReporter(Logger logger, Path reportFile) {
        this.logger = logger;
        this.reportFile = reportFile;
    }

    @Override
    public synchronized void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message) {
        records.add(new ProblemRecord(problemId, severity, location, message));
    }

    @Override
    public synchronized void close() throws IOException {
        logger.debug("Writing %d problems to %s", records.size(), reportFile);
        var parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(reportFile, GSON.toJson(records), StandardCharsets.UTF_8);
    }

    @VisibleForTesting
    public static List<ProblemRecord> loadRecords(Path reportFile) throws IOException {
        return List.of(GSON.fromJson(Files.readString(reportFile, StandardCharsets.UTF_8), ProblemRecord[].class));
    }

    public record ProblemRecord(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message) {
    }
}
