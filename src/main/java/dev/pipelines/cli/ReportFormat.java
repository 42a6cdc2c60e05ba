package dev.pipelines.cli;

/** Output format of validation reports. */
public enum ReportFormat {
    TEXT,
    JSON
}
