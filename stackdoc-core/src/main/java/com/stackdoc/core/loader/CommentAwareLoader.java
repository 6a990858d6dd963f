package com.stackdoc.core.loader;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads a YAML document into a decoded tree and a {@link DescriptionIndex}.
 *
 * <p>The tree comes from Jackson's YAML data format, so mappings decode into
 * insertion-ordered {@link LinkedHashMap}s and rendering stays deterministic. The
 * description index comes from {@link DescriptionCommentScanner}, which only runs
 * once the document decoded cleanly. Extraction is a pure side channel: the
 * tree is returned exactly as decoded.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CommentAwareLoader loader = new CommentAwareLoader();
 * LoadedDocument document = loader.load("values.yaml", Files.readString(valuesFile));
 *
 * document.descriptions()
 *     .find(StructuralPath.of("stack", "baseline", "policies", 0))
 *     .ifPresent(System.out::println);
 * }</pre>
 */
public class CommentAwareLoader {

    private static final Logger log = LoggerFactory.getLogger(CommentAwareLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern MARK_LINE = Pattern.compile("line (\\d+), column \\d+");
    private static final String DEFAULT_SOURCE = "<document>";

    private final DescriptionCommentScanner scanner;

    public CommentAwareLoader() {
        this(new DescriptionCommentScanner());
    }

    public CommentAwareLoader(DescriptionCommentScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
    }

    /**
     * Loads a document without a source name.
     *
     * @param rawText YAML text
     * @return decoded tree and description index
     * @throws StructuralParseException if the text is not valid YAML
     */
    public LoadedDocument load(String rawText) throws StructuralParseException {
        return load(DEFAULT_SOURCE, rawText);
    }

    /**
     * Loads a document.
     *
     * <p>Never fails because of comments: descriptions that cannot be attached are
     * returned as {@link UnboundDescription}s and logged as warnings.
     *
     * @param sourceName name used in diagnostics
     * @param rawText YAML text
     * @return decoded tree and description index
     * @throws StructuralParseException if the text is not valid YAML
     */
    public LoadedDocument load(String sourceName, String rawText) throws StructuralParseException {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");

        Object root = decode(sourceName, rawText);
        DescriptionCommentScanner.CommentScan scan = scanner.scan(rawText);

        Map<StructuralPath, String> reachable = new LinkedHashMap<>();
        List<UnboundDescription> unbound = new ArrayList<>(scan.unbound());
        for (DescriptionCommentScanner.BoundDescription description : scan.bound()) {
            if (TreeNavigator.exists(root, description.path())) {
                reachable.put(description.path(), description.text());
            } else {
                unbound.add(new UnboundDescription(description.text(), description.lineNumber(),
                    UnboundDescription.Reason.UNREACHABLE));
            }
        }
        unbound.sort(Comparator.comparingInt(UnboundDescription::lineNumber));

        for (UnboundDescription description : unbound) {
            log.warn("{}: unbound description at line {} ({}): {}",
                sourceName, description.lineNumber(), description.reason().message(), description.text());
        }
        log.debug("Loaded {} with {} descriptions", sourceName, reachable.size());

        return new LoadedDocument(sourceName, root, DescriptionIndex.of(reachable), unbound);
    }

    private Object decode(String sourceName, String rawText) throws StructuralParseException {
        try {
            JsonNode node = YAML_MAPPER.readTree(rawText);
            if (node == null || node.isMissingNode() || node.isNull()) {
                return new LinkedHashMap<String, Object>();
            }
            return YAML_MAPPER.convertValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new StructuralParseException(sourceName, lineOf(e), problemOf(e), e);
        }
    }

    /**
     * Extracts the 1-based line of a decoder failure. SnakeYAML marks are listed
     * context first, problem last, so the last mark wins.
     */
    static int lineOf(JsonProcessingException e) {
        int line = 0;
        Matcher matcher = MARK_LINE.matcher(String.valueOf(e.getOriginalMessage()));
        while (matcher.find()) {
            line = Integer.parseInt(matcher.group(1));
        }
        if (line > 0) {
            return line;
        }
        JsonLocation location = e.getLocation();
        return location != null && location.getLineNr() > 0 ? location.getLineNr() : 0;
    }

    private static String problemOf(JsonProcessingException e) {
        String message = String.valueOf(e.getOriginalMessage());
        String problem = message.lines()
            .filter(l -> !l.isBlank() && !Character.isWhitespace(l.charAt(0)))
            .map(String::strip)
            .collect(Collectors.joining("; "));
        return problem.isEmpty() ? message.strip() : problem;
    }
}
