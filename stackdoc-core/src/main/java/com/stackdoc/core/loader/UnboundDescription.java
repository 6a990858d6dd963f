package com.stackdoc.core.loader;

import java.util.Objects;

/**
 * A description comment that could not be attached to any node.
 *
 * <p>Never fatal: the loader reports these as warnings and generation continues.
 *
 * @param text description text
 * @param lineNumber 1-based line of the first comment line of the run
 * @param reason why the description was dropped
 */
public record UnboundDescription(
    String text,
    int lineNumber,
    Reason reason
) {
    /**
     * Compact constructor with validation.
     */
    public UnboundDescription {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * Reasons a description is left unattached.
     */
    public enum Reason {
        /** The next content line was less indented than the comment. */
        INDENTATION("no node follows at the comment's indentation"),
        /** The comment was the last content in the document. */
        END_OF_DOCUMENT("comment is the last content in the document"),
        /** A later description run replaced this one before any node followed. */
        SUPERSEDED("replaced by a later description before any node"),
        /** The bound path does not exist in the decoded tree. */
        UNREACHABLE("bound path is not present in the decoded document");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }
}
