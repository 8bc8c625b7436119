package net.docfmt.api;

/**
 * Registered in {@code META-INF/services} and loaded with {@link java.util.ServiceLoader} by the command line.
 */
public interface SourceTransformerPlugin {
    /**
     * The plugin is enabled with {@code --enable-<name>}, and its options should start with {@code --<name>-}.
     */
    String getName();

    /**
     * Called once per command line invocation; the transformer's picocli options are bound before any run.
     */
    SourceTransformer createTransformer();
}
