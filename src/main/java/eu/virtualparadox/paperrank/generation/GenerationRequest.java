package eu.virtualparadox.paperrank.generation;

import java.util.Objects;

/**
 * One call to the text-generation capability.
 *
 * @param instructions       task description (system role)
 * @param context            material the task operates on (user role)
 * @param responseSchemaHint shape the answer must have, see the {@code SCHEMA_*} constants
 */
public record GenerationRequest(String instructions, String context, String responseSchemaHint) {

    public static final String SCHEMA_KEYWORDS = "A JSON array of lowercase keyword strings, e.g. [\"graph neural networks\", \"drug discovery\"]";
    public static final String SCHEMA_SYNONYMS = "A JSON array of lowercase synonym strings, e.g. [\"gnn\", \"graph network\"]";
    public static final String SCHEMA_RUBRIC = "A JSON object {\"relevance\": number, \"novelty\": number, \"impact\": number, "
            + "\"practicality\": number, \"rationale\": string, \"review_summary\": string, \"field_insights\": string}; "
            + "every number in [0.0, 1.0]";

    public GenerationRequest {
        Objects.requireNonNull(instructions, "instructions");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(responseSchemaHint, "responseSchemaHint");
    }
}
