package net.docfmt.cli;

import net.docfmt.api.Logger;
import net.docfmt.api.ProblemReporter;
import net.docfmt.api.SourceTransformer;
import net.docfmt.api.SourceTransformerPlugin;
import net.docfmt.cli.io.FileSources;
import net.docfmt.cli.io.SingleFileSink;
import org.jetbrains.annotations.VisibleForTesting;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "docfmt", mixinStandardHelpOptions = true, usageHelpWidth = 100)
public class Main implements Callable<Integer> {
    @CommandLine.ArgGroup(exclusive = false, multiplicity = "1..*")
    List<Task> tasks;

    static class Task {
        @CommandLine.Parameters(index = "0", paramLabel = "INPUT", description = "Path to a single Elixir or markdown file to format.")
        Path inputPath;

        @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT", description = "Path to where the result should be written. If it is a directory, the input file name is used.")
        Path outputPath;
    }

    @CommandLine.Option(names = "--problems-report", description = "Write problems found while formatting to this JSON file")
    Path problemsReport;

    @CommandLine.Option(names = "--debug", description = "Print additional debugging information")
    boolean debug = false;

    // Insertion order is the order transformers were enabled in
    private final LinkedHashSet<SourceTransformer> enabledTransformers = new LinkedHashSet<>();

    public static void main(String[] args) {
        System.exit(innerMain(args));
    }

    @VisibleForTesting
    public static int innerMain(String... args) {
        // Load these up front so that they can add CommandLine Options
        var plugins = ServiceLoader.load(SourceTransformerPlugin.class).stream().map(ServiceLoader.Provider::get).toList();

        var main = new Main();
        var commandLine = new CommandLine(main);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        var spec = commandLine.getCommandSpec();

        main.setupPluginCliOptions(plugins, spec);
        return commandLine.execute(args);
    }

    @Override
    public Integer call() throws Exception {
        var logger = debug ? new Logger(System.out, System.err) : new Logger(null, System.err);
        if (enabledTransformers.isEmpty()) {
            logger.warn("No transformer is enabled, files are copied unchanged");
        }

        var problemReporter = problemsReport != null ? new FileProblemReporter(logger, problemsReport) : null;
        var processor = new SourceFileProcessor(logger, problemReporter != null ? problemReporter : ProblemReporter.NOOP);
        try {
            for (var task : tasks) {
                try (var source = FileSources.create(task.inputPath);
                     var sink = new SingleFileSink(task.outputPath)) {
                    if (!processor.process(source, sink, new ArrayList<>(enabledTransformers))) {
                        logger.error("Transformation failed");
                        return 1;
                    }
                }
            }
        } finally {
            if (problemReporter != null) {
                problemReporter.close();
            }
        }

        return 0;
    }

    private void setupPluginCliOptions(List<SourceTransformerPlugin> plugins, CommandLine.Model.CommandSpec spec) {
        for (var plugin : plugins) {
            var transformer = plugin.createTransformer();

            var builder = CommandLine.Model.ArgGroupSpec.builder();
            builder
                    .exclusive(false)
                    .heading("Plugin - " + plugin.getName() + "%n");

            builder.addArg(CommandLine.Model.OptionSpec.builder("--enable-" + plugin.getName())
                    .type(boolean.class)
                    .required(true)
                    .setter(new CommandLine.Model.ISetter() {
                        @SuppressWarnings("unchecked")
                        @Override
                        public <T> T set(T value) {
                            var previous = enabledTransformers.contains(transformer);
                            if ((boolean) value) {
                                enabledTransformers.add(transformer);
                            } else {
                                enabledTransformers.remove(transformer);
                            }
                            return (T) (Object) previous;
                        }
                    })
                    .description("Enable " + plugin.getName())
                    .build());

            var transformerSpec = CommandLine.Model.CommandSpec.forAnnotatedObject(transformer);
            for (var option : transformerSpec.options()) {
                builder.addArg(option);
            }
            spec.addArgGroup(builder.build());
        }
    }
}
