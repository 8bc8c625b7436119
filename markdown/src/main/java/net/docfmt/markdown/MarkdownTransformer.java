package net.docfmt.markdown;

import net.docfmt.api.FileEntry;
import net.docfmt.api.Logger;
import net.docfmt.api.ProblemGroup;
import net.docfmt.api.ProblemId;
import net.docfmt.api.ProblemLocation;
import net.docfmt.api.ProblemReporter;
import net.docfmt.api.ProblemSeverity;
import net.docfmt.api.SourceTransformer;
import net.docfmt.api.TransformContext;
import net.docfmt.markdown.config.ConfigurationResolver;
import net.docfmt.markdown.config.FormatterOption;
import net.docfmt.markdown.formatter.MarkdownFormatters;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MarkdownTransformer implements SourceTransformer {

    private static final ProblemGroup PROBLEM_GROUP = ProblemGroup.create("markdown", "Markdown");
    private static final Map<FormatDiagnostic.Kind, ProblemId> PROBLEM_IDS = new EnumMap<>(FormatDiagnostic.Kind.class);

    static {
        for (var kind : FormatDiagnostic.Kind.values()) {
            PROBLEM_IDS.put(kind, ProblemId.create(kind.id(), kind.displayName(), PROBLEM_GROUP));
        }
    }

    @CommandLine.Option(names = "--markdown-config", description = "JSON file with the formatter options and the attributes to format")
    public Path configFile;

    @CommandLine.Option(names = "--markdown-attributes", split = ",", description = "The documentation attributes to format, overriding the configuration file")
    public List<String> attributes;

    @CommandLine.Option(names = "--markdown-all-doc-attributes", description = "Format all default documentation attributes (moduledoc, doc, typedoc, shortdoc, deprecated)")
    public boolean allDocAttributes;

    @CommandLine.Option(names = "--markdown-line-width", description = "Maximum line width")
    public Integer lineWidth;

    @CommandLine.Option(names = "--markdown-text-wrap", description = "always, never or maintain")
    public String textWrap;

    @CommandLine.Option(names = "--markdown-emphasis-kind", description = "asterisks or underscores")
    public String emphasisKind;

    @CommandLine.Option(names = "--markdown-strong-kind", description = "asterisks or underscores")
    public String strongKind;

    @CommandLine.Option(names = "--markdown-new-line-kind", description = "auto, lf or crlf")
    public String newLineKind;

    @CommandLine.Option(names = "--markdown-unordered-list-kind", description = "dashes or asterisks")
    public String unorderedListKind;

    @CommandLine.Option(names = "--markdown-formatter", description = "The markdown formatter to use")
    public String formatterName = MarkdownFormatters.DEFAULT_NAME;

    @CommandLine.Option(names = "--markdown-strict", description = "Fail the run if any file could not be formatted")
    public boolean strict;

    private DocFormatter docFormatter;
    private Map<String, Object> configuration;
    private Map<String, Object> runtimeOptions;
    private Logger logger;
    private ProblemReporter problemReporter;
    private volatile boolean errored;

    @Override
    public void beforeRun(TransformContext context) {
        logger = context.logger();
        problemReporter = context.problemReporter();

        configuration = new LinkedHashMap<>();
        if (configFile != null) {
            logger.debug("Loading markdown configuration %s", configFile);
            try {
                configuration.putAll(ConfigurationFile.loadJson(configFile));
            } catch (IOException e) {
                logger.error("Failed to load markdown configuration %s: %s", configFile, e.getMessage());
                problemReporter.report(PROBLEM_IDS.get(FormatDiagnostic.Kind.INVALID_OPTION), ProblemSeverity.ERROR, ProblemLocation.ofFile(configFile), e.getMessage());
                throw new UncheckedIOException(e);
            }
        }
        if (attributes != null) {
            configuration.put(ConfigurationResolver.ATTRIBUTES_KEY, attributes);
        } else if (allDocAttributes) {
            configuration.put(ConfigurationResolver.ATTRIBUTES_KEY, true);
        }

        runtimeOptions = new LinkedHashMap<>();
        putIfSet(FormatterOption.LINE_WIDTH, lineWidth);
        putIfSet(FormatterOption.TEXT_WRAP, textWrap);
        putIfSet(FormatterOption.EMPHASIS_KIND, emphasisKind);
        putIfSet(FormatterOption.STRONG_KIND, strongKind);
        putIfSet(FormatterOption.NEW_LINE_KIND, newLineKind);
        putIfSet(FormatterOption.UNORDERED_LIST_KIND, unorderedListKind);

        docFormatter = new DocFormatter(MarkdownFormatters.create(formatterName));
    }

    private void putIfSet(FormatterOption option, Object value) {
        if (value != null) {
            runtimeOptions.put(option.key(), value);
        }
    }

    @Override
    public String transformFile(FileEntry fileEntry, String content) {
        var extension = fileEntry.extension();
        var context = FormatContext.forExtension(configuration, extension.isEmpty() ? null : extension)
                .withRuntimeOptions(runtimeOptions);

        var result = docFormatter.formatWithDiagnostics(content, context);
        for (var diagnostic : result.diagnostics()) {
            report(fileEntry, content, diagnostic);
        }
        if (result.hasErrors()) {
            errored = true;
        }
        return result.text();
    }

    private void report(FileEntry fileEntry, String content, FormatDiagnostic diagnostic) {
        if (diagnostic.severity() == ProblemSeverity.ERROR) {
            logger.error("%s: %s", fileEntry.relativePath(), diagnostic.message());
        } else {
            logger.warn("%s: %s", fileEntry.relativePath(), diagnostic.message());
        }

        var problemId = PROBLEM_IDS.get(diagnostic.kind());
        ProblemLocation location;
        if (diagnostic.hasOffset()) {
            int line = 1;
            int lineStart = 0;
            for (int i = 0; i < diagnostic.offset() && i < content.length(); i++) {
                if (content.charAt(i) == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            location = ProblemLocation.ofLocationInFile(fileEntry.path(), line, diagnostic.offset() - lineStart + 1);
        } else {
            location = ProblemLocation.ofFile(fileEntry.path());
        }
        problemReporter.report(problemId, diagnostic.severity(), location, diagnostic.message());
    }

    @Override
    public boolean afterRun(TransformContext context) {
        return !(errored && strict);
    }
}
