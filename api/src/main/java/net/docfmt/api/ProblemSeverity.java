package net.docfmt.api;

public enum ProblemSeverity {
    WARNING,
    ERROR
}
