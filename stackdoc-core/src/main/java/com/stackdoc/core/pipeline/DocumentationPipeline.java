package com.stackdoc.core.pipeline;

import com.stackdoc.core.generator.DocumentationEngine;
import com.stackdoc.core.generator.ElementReport;
import com.stackdoc.core.generator.IndexGenerator;
import com.stackdoc.core.loader.CommentAwareLoader;
import com.stackdoc.core.loader.LoadedDocument;
import com.stackdoc.core.loader.StructuralParseException;
import com.stackdoc.core.model.ElementMetadata;
import com.stackdoc.core.model.ElementSummary;
import com.stackdoc.core.renderer.GeneratedFile;
import com.stackdoc.core.renderer.GeneratedOutput;
import com.stackdoc.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Discovers elements, loads each values document once, and generates the reports
 * and the index.
 *
 * <p>A values document that fails to parse is recorded as an {@link ElementFailure}
 * and the run continues with the next element. Nothing is written here; the caller
 * hands {@link PipelineResult#output()} to a renderer or a checker.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DocumentationPipeline pipeline = new DocumentationPipeline();
 * PipelineResult result = pipeline.run(PipelineRequest.from(config, null));
 * new FileSystemRenderer().render(result.output(), new RenderContext("docs", Map.of()));
 * }</pre>
 */
public class DocumentationPipeline {

    private static final Logger log = LoggerFactory.getLogger(DocumentationPipeline.class);

    private final CommentAwareLoader loader;
    private final DocumentationEngine engine;
    private final IndexGenerator indexGenerator;

    public DocumentationPipeline() {
        this(Clock.systemDefaultZone());
    }

    public DocumentationPipeline(Clock clock) {
        this(new CommentAwareLoader(), new DocumentationEngine(clock), new IndexGenerator(clock));
    }

    public DocumentationPipeline(CommentAwareLoader loader, DocumentationEngine engine, IndexGenerator indexGenerator) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.indexGenerator = Objects.requireNonNull(indexGenerator, "indexGenerator must not be null");
    }

    /**
     * Runs discovery and generation.
     *
     * @param request run inputs
     * @return reports, failures, skipped elements and the files to write
     * @throws IllegalArgumentException if the stack root or the filtered element does not exist
     */
    public PipelineResult run(PipelineRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<Path> elements = ElementDiscovery.discover(request.stackRoot(), request.elementFilter());
        log.info("Processing {} elements from {}", elements.size(), request.stackRoot());

        List<ElementReport> reports = new ArrayList<>();
        List<ElementFailure> failures = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Path elementDir : elements) {
            String identifier = elementDir.getFileName().toString();
            Path valuesPath = elementDir.resolve(request.valuesFile());
            try {
                Optional<String> values = FileUtils.readIfPresent(valuesPath);
                if (values.isEmpty()) {
                    log.warn("Skipping {}: no {} found", identifier, request.valuesFile());
                    skipped.add(identifier);
                    continue;
                }
                ElementMetadata metadata = ManifestLoader.load(elementDir, request.manifestFile());
                LoadedDocument document = loader.load(valuesPath.toString(), values.get());
                reports.add(engine.generate(metadata, document));
            } catch (StructuralParseException e) {
                log.error("Failed to load {}: {}", identifier, e.getMessage());
                failures.add(failureOf(identifier, e));
            } catch (IOException e) {
                log.error("Failed to read {}: {}", valuesPath, e.getMessage());
                failures.add(new ElementFailure(identifier, valuesPath.toString(), 0, "cannot read file: " + e.getMessage()));
            }
        }

        List<GeneratedFile> files = new ArrayList<>();
        for (ElementReport report : reports) {
            files.add(new GeneratedFile(report.relativePath(), report.content(), GeneratedFile.Kind.ELEMENT_REPORT));
        }
        if (request.includesIndex()) {
            List<ElementSummary> summaries = reports.stream().map(ElementReport::summary).toList();
            files.add(new GeneratedFile(request.indexFile(), indexGenerator.generate(summaries), GeneratedFile.Kind.INDEX));
        }

        log.info("Generated {} reports ({} failed, {} skipped)", reports.size(), failures.size(), skipped.size());
        return new PipelineResult(elements.size(), reports, failures, skipped, new GeneratedOutput(files));
    }

    /**
     * Loads every values document without generating, collecting parse errors and
     * unbound descriptions.
     *
     * @param request run inputs
     * @return one validation per element that has a values document
     */
    public List<ElementValidation> validate(PipelineRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<ElementValidation> validations = new ArrayList<>();
        for (Path elementDir : ElementDiscovery.discover(request.stackRoot(), request.elementFilter())) {
            String identifier = elementDir.getFileName().toString();
            Path valuesPath = elementDir.resolve(request.valuesFile());
            try {
                Optional<String> values = FileUtils.readIfPresent(valuesPath);
                if (values.isEmpty()) {
                    log.warn("Skipping {}: no {} found", identifier, request.valuesFile());
                    continue;
                }
                LoadedDocument document = loader.load(valuesPath.toString(), values.get());
                validations.add(new ElementValidation(identifier, null,
                    document.descriptions().size(), document.unboundDescriptions()));
            } catch (StructuralParseException e) {
                validations.add(new ElementValidation(identifier, failureOf(identifier, e), 0, List.of()));
            } catch (IOException e) {
                validations.add(new ElementValidation(identifier,
                    new ElementFailure(identifier, valuesPath.toString(), 0, "cannot read file: " + e.getMessage()),
                    0, List.of()));
            }
        }
        return validations;
    }

    private static ElementFailure failureOf(String identifier, StructuralParseException e) {
        return new ElementFailure(identifier, e.getSourceName(), e.getLineNumber(), e.getProblem());
    }
}
