package com.tpanalyzer.core.parser;

/**
 * Thrown when a program file has no content at all.
 *
 * <p>This is the only parse failure that removes a file from the corpus. Every other
 * problem is recorded as a warning on the program.
 */
public class EmptyFileException extends RuntimeException {

    private final String fileName;

    public EmptyFileException(String fileName) {
        super("Program file is empty: " + fileName);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
