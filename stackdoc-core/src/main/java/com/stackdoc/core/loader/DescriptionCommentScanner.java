package com.stackdoc.core.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line scanner that binds {@code @description:} / {@code @desc:} comments to the
 * structural path of the node that follows them.
 *
 * <p>The YAML decoder drops comments, so this scanner re-reads the raw text one
 * physical line at a time. It keeps a stack of open mapping and sequence frames
 * keyed by indentation, mirroring the nesting the decoder builds. Every sequence
 * frame counts the index of the item about to be read, so a comment written
 * right above a dash binds to that item rather than to the key on the same line.
 *
 * <p><b>Binding rules:</b>
 * <ul>
 *   <li>Contiguous description comment lines form one run, joined by a space.</li>
 *   <li>A blank line closes the run. A closed run still binds to the next node,
 *       but a later description comment replaces it.</li>
 *   <li>The run binds to the next content line indented at least as far as the
 *       run's first line. A less indented line discards it.</li>
 *   <li>Block scalars and multi-line flow collections are skipped, so {@code #}
 *       lines inside them are never read as comments.</li>
 * </ul>
 *
 * <p>The scanner assumes the text has already been decoded successfully. Lines
 * it cannot place (continuations of multi-line scalars, complex keys) are
 * passed over.
 */
public class DescriptionCommentScanner {

    private static final Logger log = LoggerFactory.getLogger(DescriptionCommentScanner.class);

    private static final Pattern DESCRIPTION_MARKER = Pattern.compile("^#\\s*@(?:description|desc):(.*)$");
    private static final Pattern BLOCK_SCALAR_HEADER = Pattern.compile("^[|>][0-9+-]*$");
    private static final Pattern NODE_PROPERTY_ONLY = Pattern.compile("^[&!]\\S*$");

    /**
     * Scans raw document text for description comments.
     *
     * @param rawText YAML document text
     * @return bound and unbound descriptions in document order
     */
    public CommentScan scan(String rawText) {
        Objects.requireNonNull(rawText, "rawText must not be null");
        ScanState state = new ScanState();
        String[] lines = rawText.split("\\r?\\n", -1);
        for (int i = 0; i < lines.length; i++) {
            state.accept(lines[i], i + 1);
        }
        state.finish();
        log.debug("Scanned {} lines: {} descriptions bound, {} unbound",
            lines.length, state.bound.size(), state.unbound.size());
        return new CommentScan(state.bound, state.unbound);
    }

    /**
     * A description attached to a path.
     *
     * @param path structural path of the described node
     * @param text description text
     * @param lineNumber 1-based line of the first comment line
     */
    public record BoundDescription(StructuralPath path, String text, int lineNumber) {
    }

    /**
     * Result of scanning one document.
     *
     * @param bound descriptions attached to a path, in document order
     * @param unbound descriptions that could not be attached
     */
    public record CommentScan(List<BoundDescription> bound, List<UnboundDescription> unbound) {
        /**
         * Compact constructor with validation.
         */
        public CommentScan {
            bound = List.copyOf(bound);
            unbound = List.copyOf(unbound);
        }
    }

    /**
     * Open mapping or sequence at one indentation.
     */
    private static final class Frame {
        final int indent;
        final StructuralPath path;
        final boolean sequence;
        final boolean compact;
        int nextIndex;

        Frame(int indent, StructuralPath path, boolean sequence, boolean compact) {
            this.indent = indent;
            this.path = path;
            this.sequence = sequence;
            this.compact = compact;
        }
    }

    /**
     * A key or item whose value continues on the following lines.
     */
    private record OpenContainer(StructuralPath path, int indent, boolean allowsCompactSequence) {
    }

    /**
     * Description comment lines waiting for the node they describe.
     */
    private static final class PendingRun {
        final int indent;
        final int lineNumber;
        final List<String> parts = new ArrayList<>();
        boolean open = true;

        PendingRun(int indent, int lineNumber) {
            this.indent = indent;
            this.lineNumber = lineNumber;
        }

        String text() {
            return String.join(" ", parts.stream().filter(p -> !p.isEmpty()).toList());
        }
    }

    private static final class ScanState {
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final List<BoundDescription> bound = new ArrayList<>();
        private final List<UnboundDescription> unbound = new ArrayList<>();

        private OpenContainer openContainer;
        private PendingRun pending;
        private boolean rootSeen;
        private int blockScalarIndent = -1;
        private int flowDepth;

        void accept(String line, int lineNumber) {
            if (blockScalarIndent >= 0) {
                if (line.isBlank() || indentOf(line) > blockScalarIndent) {
                    return;
                }
                blockScalarIndent = -1;
            }
            if (flowDepth > 0) {
                flowDepth = Math.max(0, flowDepth + bracketBalance(stripComment(line)));
                return;
            }

            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                if (pending != null) {
                    pending.open = false;
                }
                return;
            }
            if (trimmed.startsWith("#")) {
                Matcher matcher = DESCRIPTION_MARKER.matcher(trimmed);
                if (matcher.matches()) {
                    acceptDescription(matcher.group(1).strip(), indentOf(line), lineNumber);
                }
                return;
            }
            if (indentOf(line) == 0 && (trimmed.equals("---") || trimmed.equals("..."))) {
                return;
            }
            acceptContent(line);
        }

        void finish() {
            if (pending != null) {
                discard(pending, UnboundDescription.Reason.END_OF_DOCUMENT);
                pending = null;
            }
        }

        private void acceptDescription(String text, int indent, int lineNumber) {
            if (pending != null && pending.open) {
                pending.parts.add(text);
                return;
            }
            if (pending != null) {
                discard(pending, UnboundDescription.Reason.SUPERSEDED);
            }
            pending = new PendingRun(indent, lineNumber);
            pending.parts.add(text);
        }

        private void acceptContent(String line) {
            int indent = indentOf(line);
            String content = line.substring(indent);
            boolean dash = isSequenceEntry(content);

            if (openContainer != null) {
                OpenContainer container = openContainer;
                openContainer = null;
                if (indent > container.indent()) {
                    frames.push(new Frame(indent, container.path(), dash, false));
                } else if (indent == container.indent() && dash && container.allowsCompactSequence()) {
                    frames.push(new Frame(indent, container.path(), true, true));
                }
            }

            while (!frames.isEmpty()) {
                Frame top = frames.peek();
                if (top.indent > indent || (top.indent == indent && top.sequence && top.compact && !dash)) {
                    frames.pop();
                } else {
                    break;
                }
            }

            if (frames.isEmpty()) {
                if (rootSeen) {
                    dropPendingBelow(indent);
                    return;
                }
                rootSeen = true;
                frames.push(new Frame(indent, StructuralPath.root(), dash, false));
            }

            Frame top = frames.peek();
            if (top.indent != indent) {
                // continuation of a multi-line scalar
                return;
            }
            if (top.sequence) {
                if (dash) {
                    consumeSequenceEntry(top, indent, content);
                }
            } else if (!dash) {
                consumeMappingEntry(top, indent, content);
            }
        }

        private void consumeSequenceEntry(Frame frame, int column, String content) {
            StructuralPath itemPath = frame.path.index(frame.nextIndex++);
            bindPending(itemPath, column);

            String rest = content.substring(1);
            int offset = leadingSpaces(rest);
            String value = stripComment(rest.substring(offset)).strip();
            int valueColumn = column + 1 + offset;

            if (value.isEmpty() || NODE_PROPERTY_ONLY.matcher(value).matches()) {
                openContainer = new OpenContainer(itemPath, column, false);
            } else if (isSequenceEntry(value)) {
                Frame nested = new Frame(valueColumn, itemPath, true, false);
                frames.push(nested);
                consumeSequenceEntry(nested, valueColumn, rest.substring(offset));
            } else if (findMappingColon(value) >= 0) {
                Frame mapping = new Frame(valueColumn, itemPath, false, false);
                frames.push(mapping);
                consumeMappingEntry(mapping, valueColumn, rest.substring(offset));
            } else {
                consumeScalar(value, column);
            }
        }

        private void consumeMappingEntry(Frame frame, int column, String content) {
            int colon = findMappingColon(content);
            if (colon < 0) {
                return;
            }
            StructuralPath keyPath = frame.path.key(unquote(content.substring(0, colon).strip()));
            bindPending(keyPath, column);

            String value = stripComment(content.substring(colon + 1)).strip();
            if (value.isEmpty() || NODE_PROPERTY_ONLY.matcher(value).matches()) {
                openContainer = new OpenContainer(keyPath, column, true);
            } else {
                consumeScalar(value, column);
            }
        }

        private void consumeScalar(String value, int ownerColumn) {
            if (BLOCK_SCALAR_HEADER.matcher(value).matches()) {
                blockScalarIndent = ownerColumn;
            } else if (value.startsWith("[") || value.startsWith("{")) {
                flowDepth = Math.max(0, bracketBalance(value));
            }
        }

        private void bindPending(StructuralPath path, int column) {
            if (pending == null) {
                return;
            }
            PendingRun run = pending;
            pending = null;
            if (column < run.indent) {
                discard(run, UnboundDescription.Reason.INDENTATION);
                return;
            }
            String text = run.text();
            if (!text.isEmpty()) {
                bound.add(new BoundDescription(path, text, run.lineNumber));
            }
        }

        private void dropPendingBelow(int column) {
            if (pending != null && column < pending.indent) {
                discard(pending, UnboundDescription.Reason.INDENTATION);
                pending = null;
            }
        }

        private void discard(PendingRun run, UnboundDescription.Reason reason) {
            String text = run.text();
            if (!text.isEmpty()) {
                unbound.add(new UnboundDescription(text, run.lineNumber, reason));
            }
        }
    }

    // ==================== Line helpers ====================

    static int indentOf(String line) {
        return leadingSpaces(line);
    }

    private static int leadingSpaces(String text) {
        int count = 0;
        while (count < text.length() && text.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    static boolean isSequenceEntry(String content) {
        return content.equals("-") || content.startsWith("- ") || content.startsWith("-\t");
    }

    /**
     * Finds the colon separating a mapping key from its value.
     *
     * @param content line content without indentation
     * @return index of the colon, or -1 if the line is not a mapping entry
     */
    static int findMappingColon(String content) {
        if (content.isEmpty() || content.charAt(0) == '[' || content.charAt(0) == '{') {
            return -1;
        }
        int start = 0;
        char first = content.charAt(0);
        if (first == '"' || first == '\'') {
            int close = findClosingQuote(content, 0);
            if (close < 0) {
                return -1;
            }
            start = close + 1;
        }
        for (int i = start; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '#' && i > 0 && Character.isWhitespace(content.charAt(i - 1))) {
                return -1;
            }
            if (c == ':' && (i + 1 == content.length() || content.charAt(i + 1) == ' ' || content.charAt(i + 1) == '\t')) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Removes a trailing {@code # comment} from a value.
     */
    static String stripComment(String value) {
        int start = leadingSpaces(value);
        int from = start;
        if (start < value.length() && (value.charAt(start) == '"' || value.charAt(start) == '\'')) {
            int close = findClosingQuote(value, start);
            if (close < 0) {
                return value;
            }
            from = close + 1;
        }
        for (int i = from; i < value.length(); i++) {
            if (value.charAt(i) == '#' && (i == start || Character.isWhitespace(value.charAt(i - 1)))) {
                return value.substring(0, i);
            }
        }
        return value;
    }

    private static int findClosingQuote(String text, int openIndex) {
        char quote = text.charAt(openIndex);
        for (int i = openIndex + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote == '"' && c == '\\') {
                i++;
            } else if (c == quote) {
                if (quote == '\'' && i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    i++;
                } else {
                    return i;
                }
            }
        }
        return -1;
    }

    static String unquote(String key) {
        if (key.length() >= 2 && key.startsWith("\"") && key.endsWith("\"")) {
            return key.substring(1, key.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
        }
        if (key.length() >= 2 && key.startsWith("'") && key.endsWith("'")) {
            return key.substring(1, key.length() - 1).replace("''", "'");
        }
        return key;
    }

    private static int bracketBalance(String text) {
        int depth = 0;
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inDouble) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inDouble = false;
                }
            } else if (inSingle) {
                if (c == '\'') {
                    inSingle = false;
                }
            } else if (c == '"') {
                inDouble = true;
            } else if (c == '\'') {
                inSingle = true;
            } else if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
            }
        }
        return depth;
    }
}
