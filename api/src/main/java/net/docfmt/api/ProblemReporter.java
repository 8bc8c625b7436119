package net.docfmt.api;

/**
 * Receives the problems a transformer finds in a file or in its own configuration.
 */
@FunctionalInterface
public interface ProblemReporter {
    ProblemReporter NOOP = (problemId, severity, location, message) -> {
    };

    void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message);
}
