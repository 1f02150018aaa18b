package eu.virtualparadox.paperrank.rank.evaluate;

import eu.virtualparadox.paperrank.generation.GenerationRequest;
import org.springframework.stereotype.Component;

/**
 * Turns an {@link EvaluationContext} into the single rubric generation request.
 */
@Component
public class RubricPromptBuilder {

    private static final String INSTRUCTIONS = String.join("\n",
            "You are an expert reviewer of machine learning papers.",
            "Score the paper given by the user on four dimensions, each between 0.0 and 1.0:",
            "1. relevance: how closely the paper matches the user's research interest.",
            "2. novelty: originality of the work; prefer reviewer statements on originality or novelty.",
            "3. impact: expected academic and practical influence; consider review scores and the decision.",
            "4. practicality: ease of implementation, reproducibility and applicability.",
            "Add a short rationale (at most three sentences).",
            "Add review_summary: the reviewers' main points and the decision reasoning (at most 500 characters).",
            "Add field_insights: which review fields and scores you relied on (at most 300 characters).",
            "Do not invent facts; use only the material provided."
    );

    public GenerationRequest build(final EvaluationContext context) {
        final StringBuilder sb = new StringBuilder();
        sb.append("# Paper\n");
        sb.append("Title: ").append(context.title()).append('\n');
        sb.append("Keywords: ").append(String.join(", ", context.keywords())).append('\n');
        sb.append("Abstract:\n").append(context.abstractText()).append('\n');
        sb.append("Decision: ").append(context.decision()).append('\n');
        sb.append("Presentation: ").append(context.presentationType()).append('\n');
        sb.append("Decision comment: ").append(context.decisionComment()).append('\n');
        sb.append("\n# Reviews\n").append(context.reviewSummary()).append('\n');
        sb.append("\n# Research interest\n").append(context.researchInterest()).append('\n');
        return new GenerationRequest(INSTRUCTIONS, sb.toString(), GenerationRequest.SCHEMA_RUBRIC);
    }
}
