package com.stackdoc.core.loader;

/**
 * Thrown when a document is not syntactically valid YAML.
 *
 * <p>This is the only load failure that aborts documentation of an element. The
 * pipeline records it against the element and carries on with the others.
 */
public class StructuralParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String sourceName;
    private final int lineNumber;
    private final String problem;

    public StructuralParseException(String sourceName, int lineNumber, String problem, Throwable cause) {
        super(sourceName + ": line " + lineNumber + ": " + problem, cause);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
        this.problem = problem;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Returns the 1-based line at which the decoder gave up.
     *
     * @return line number, or 0 when the decoder reported no position
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getProblem() {
        return problem;
    }
}
