package eu.virtualparadox.paperrank.rank.match;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.query.synonym.SynonymSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores every paper of a corpus against the keyword groups of a run.
 * <p>
 * A group matches when any of its variants occurs in the title, the abstract
 * or the paper's keywords, case-insensitively and on word boundaries. The
 * initial score is the share of matched groups, so a keyword with many
 * synonyms weighs as much as one without. Papers without any match are kept
 * with score 0.
 */
@Slf4j
@Service
public class CandidateMatcher {

    private static final String NOT_WORD_BEFORE = "(?<![\\p{L}\\p{N}])";
    private static final String NOT_WORD_AFTER = "(?![\\p{L}\\p{N}])";

    private record VariantPattern(String variant, Pattern pattern) {
    }

    /**
     * @param papers corpus slice
     * @param groups keyword groups, at least one
     * @return one score per paper, in corpus order
     */
    public List<CandidateScore> score(final List<PaperRecord> papers, final List<SynonymSet> groups) {
        if (groups.isEmpty()) {
            throw new IllegalArgumentException("At least one keyword group is required");
        }
        final List<List<VariantPattern>> compiled = groups.stream()
                .map(CandidateMatcher::compile)
                .toList();

        // read-only inputs, one independent result per paper
        final List<CandidateScore> scores = papers.parallelStream()
                .map(paper -> scoreOne(paper, compiled))
                .toList();

        final long matched = scores.stream().filter(s -> s.initialScore() > 0).count();
        log.info("Matched {}/{} papers against {} keyword groups", matched, papers.size(), groups.size());
        return scores;
    }

    private static CandidateScore scoreOne(final PaperRecord paper, final List<List<VariantPattern>> groups) {
        final List<String> fields = new ArrayList<>();
        fields.add(paper.title());
        fields.add(paper.abstractText());
        // each paper keyword on its own, so a phrase cannot span two of them
        fields.addAll(paper.keywords());

        final TreeSet<String> hits = new TreeSet<>();
        int matchedGroups = 0;
        for (final List<VariantPattern> group : groups) {
            boolean groupMatched = false;
            for (final VariantPattern variant : group) {
                if (occurs(variant.pattern(), fields)) {
                    hits.add(variant.variant());
                    groupMatched = true;
                }
            }
            if (groupMatched) {
                matchedGroups++;
            }
        }

        final double score = (double) matchedGroups / groups.size();
        return new CandidateScore(paper.id(), score, hits);
    }

    private static boolean occurs(final Pattern pattern, final List<String> fields) {
        for (final String field : fields) {
            if (!field.isEmpty() && pattern.matcher(field).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<VariantPattern> compile(final SynonymSet group) {
        return group.variants().stream()
                .map(v -> new VariantPattern(v, toPattern(v)))
                .toList();
    }

    static Pattern toPattern(final String variant) {
        // words of a variant may be separated by any whitespace in the text
        final String body = Arrays.stream(variant.trim().split("\\s+"))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+"));
        return Pattern.compile(NOT_WORD_BEFORE + body + NOT_WORD_AFTER,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
