package com.debstats.statistics.parser;

/**
 * Thrown when a Contents index line has no whitespace separating the file
 * name from the package list.
 */
public class MalformedLineException extends RuntimeException {

    private final String line;
    private int lineNumber;

    public MalformedLineException(String line) {
        super("Malformed line: '" + line + "'");
        this.line = line;
        this.lineNumber = -1;
    }

    public String getLine() {
        return line;
    }

    /**
     * 1-based line number within the index, or -1 when unknown.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Records where in the index the line was found and returns this exception.
     */
    public MalformedLineException atLine(int number) {
        this.lineNumber = number;
        return this;
    }

    @Override
    public String getMessage() {
        return lineNumber > 0
                ? "Malformed line " + lineNumber + ": '" + line + "'"
                : super.getMessage();
    }
}
