package net.docfmt.api;

/**
 * Transformers are created through {@link SourceTransformerPlugin plugins}, and rewrite the text of source files.
 * <p>
 * Transformers will be given to picocli for option collection, so they can accept CLI parameters.
 * It is <b>strongly recommended</b> that transformers prefix their options with the transformer name.
 */
public interface SourceTransformer {
    /**
     * Invoked before source files are transformed.
     * <p>
     * Can be used for loading data from CLI parameters.
     *
     * @param context the transform context
     */
    default void beforeRun(TransformContext context) {
    }

    /**
     * Transform the text of a single file.
     * <p>
     * Implementations must not throw for malformed input; they report the problem through the
     * {@link TransformContext#problemReporter() context} and return {@code content} unchanged instead.
     *
     * @param fileEntry the file being transformed
     * @param content   the current text of the file
     * @return the new text of the file, or {@code content} if nothing changed
     */
    String transformFile(FileEntry fileEntry, String content);

    /**
     * Invoked after all source transformations are finished.
     * <p>
     * Can be used for post-transformation validation.
     *
     * @param context the transform context
     * @return {@code true} if the transformation was successful, {@code false} otherwise
     */
    default boolean afterRun(TransformContext context) {
        return true;
    }
}
