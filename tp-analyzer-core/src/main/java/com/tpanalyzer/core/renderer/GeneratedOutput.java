package com.tpanalyzer.core.renderer;

import com.tpanalyzer.core.generator.GeneratedReport;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Set of files produced by one analysis run.
 *
 * @param files files in the order they should be written
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(Collection<GeneratedReport> reports) {
        return new GeneratedOutput(reports.stream().map(GeneratedFile::of).toList());
    }

    public int totalCharacters() {
        return files.stream().mapToInt(file -> file.content().length()).sum();
    }
}
