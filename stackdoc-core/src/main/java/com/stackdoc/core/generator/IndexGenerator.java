package com.stackdoc.core.generator;

import com.stackdoc.core.model.ElementSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Renders the index file that links every element report.
 */
public class IndexGenerator {

    private static final Logger log = LoggerFactory.getLogger(IndexGenerator.class);

    static final String NOTATION_GUIDE = """
        ## Comment Notation Guide

        Use special comment notation in values.yaml files to add descriptions at any level:

        ### Basic Usage

        ```yaml
        # @description: This policy enforces security standards
        security-policy:
          enabled: true
        ```

        ### Nested Field Descriptions

        ```yaml
        configPolicies:
          - name: example-config
            # @desc: Whether to actually apply this configuration
            enabled: true

            # @description: Individual template configurations
            templateNames:
              # @desc: Network policy template for namespace isolation
              - name: network-policy
                complianceType: musthave

              # @desc: RBAC template for role bindings
              - name: rbac-config
                complianceType: musthave

            # @description: Template parameters with specific values
            templateParameters:
              # @desc: The namespace to apply policies to
              targetNamespace: production

              # @desc: Severity level for alerts (low/medium/high/critical)
              alertLevel: high
        ```

        ### Array Item Descriptions

        ```yaml
        operatorPolicies:
          # @description: GitOps operator for continuous deployment
          - name: openshift-gitops
            enabled: true

            # @desc: Which approved versions can be installed
            versions:
              # @desc: Initial stable release
              - gitops-operator.v1.5.0
              # @desc: Security patch release
              - gitops-operator.v1.5.1
              # @desc: Feature update with performance improvements
              - gitops-operator.v1.6.0
        ```

        ## Notes

        - Place `@description:` or `@desc:` comments on the lines immediately before the field
        - Consecutive comment lines are joined; a blank line ends the comment
        - Descriptions work at any nesting level
        - Array items can be documented by placing the comment before the item
        - Both `@description:` and `@desc:` are supported (they're equivalent)
        - Comments that bind to nothing are reported by `stackdoc validate`
        """;

    private final Clock clock;

    public IndexGenerator() {
        this(Clock.systemDefaultZone());
    }

    public IndexGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Generates the index content.
     *
     * @param summaries summaries of the documented elements, in any order
     * @return Markdown content
     */
    public String generate(List<ElementSummary> summaries) {
        Objects.requireNonNull(summaries, "summaries must not be null");

        MarkdownWriter out = new MarkdownWriter();
        out.heading(1, "PolicyStack Documentation Index");
        out.paragraph(GenerationTimestamp.line(clock));
        out.heading(2, "Available Elements");

        if (summaries.isEmpty()) {
            out.paragraph("No elements documented yet.");
        } else {
            summaries.stream()
                .sorted(Comparator.comparing(ElementSummary::identifier))
                .forEach(summary -> out.bullet(entry(summary)));
            out.blankLine();
        }

        out.line(NOTATION_GUIDE);
        log.debug("Generated index with {} elements", summaries.size());
        return out.toString();
    }

    private static String entry(ElementSummary summary) {
        StringBuilder sb = new StringBuilder()
            .append('[').append(summary.metadata().displayName()).append("](./")
            .append(summary.relativePath()).append(')');
        if (!summary.metadata().description().isBlank()) {
            sb.append(" - ").append(ValueFormatter.escapeCell(summary.metadata().description()));
        }
        int issues = summary.danglingReferences().size() + summary.orphans().size();
        if (issues > 0) {
            sb.append(" (⚠️ ").append(issues).append(issues == 1 ? " warning)" : " warnings)");
        }
        return sb.toString();
    }
}
