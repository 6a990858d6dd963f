package com.stackdoc.core.generator;

import com.stackdoc.core.generator.section.ReportSections;
import com.stackdoc.core.loader.LoadedDocument;
import com.stackdoc.core.model.ElementMetadata;
import com.stackdoc.core.model.ElementSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Renders the Markdown report of one element.
 *
 * <p>Each call locates the component, resolves its policy graph, then walks the
 * ordered section list. The engine holds no per-element state, so one instance can
 * serve a whole run.
 */
public class DocumentationEngine {

    private static final Logger log = LoggerFactory.getLogger(DocumentationEngine.class);
    private static final String REPORT_EXTENSION = ".md";

    private final Clock clock;
    private final List<ReportSection> sections;

    public DocumentationEngine() {
        this(Clock.systemDefaultZone());
    }

    public DocumentationEngine(Clock clock) {
        this(clock, ReportSections.defaults());
    }

    public DocumentationEngine(Clock clock, List<ReportSection> sections) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sections = List.copyOf(Objects.requireNonNull(sections, "sections must not be null"));
    }

    /**
     * Generates the report of one element.
     *
     * @param metadata element metadata
     * @param document loaded values document
     * @return the report with its summary
     */
    public ElementReport generate(ElementMetadata metadata, LoadedDocument document) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(document, "document must not be null");

        ComponentLocator.ComponentRoot root = ComponentLocator.locate(metadata.identifier(), document);
        PolicyGraph graph = PolicyGraph.build(root.component(), root.path());
        ReportContext context = new ReportContext(metadata, document, root, graph, GenerationTimestamp.line(clock));

        MarkdownWriter out = new MarkdownWriter();
        for (ReportSection section : sections) {
            if (section.appliesTo(context)) {
                log.debug("Rendering section '{}' for {}", section.key(), metadata.identifier());
                section.render(context, out);
            } else {
                log.debug("Skipping section '{}' for {}", section.key(), metadata.identifier());
            }
        }

        String relativePath = metadata.identifier() + REPORT_EXTENSION;
        ElementSummary summary = new ElementSummary(
            metadata, relativePath, graph.statistics(), graph.danglingReferences(), graph.orphans());
        log.info("Generated {} ({} resources, {} dangling references, {} orphans)",
            relativePath, summary.statistics().total(),
            summary.danglingReferences().size(), summary.orphans().size());
        return new ElementReport(metadata.identifier(), relativePath, out.toString(), summary);
    }
}
