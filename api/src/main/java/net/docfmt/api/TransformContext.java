package net.docfmt.api;

/**
 * What a transformer gets to work with for one run over a source.
 */
public record TransformContext(Logger logger, ProblemReporter problemReporter) {
}
