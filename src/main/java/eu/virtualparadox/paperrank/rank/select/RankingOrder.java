package eu.virtualparadox.paperrank.rank.select;

import java.util.Comparator;

/**
 * Deterministic ranking order shared by candidate selection and final
 * aggregation: score descending, then corpus review average descending
 * (papers without reviews last), then paper id ascending.
 */
public final class RankingOrder {

    private RankingOrder() {
        // prevent instantiation
    }

    /**
     * Key of one ranked entry.
     *
     * @param paperId       paper id
     * @param score         score being ranked on
     * @param reviewAverage corpus review average, may be {@code null}
     */
    public record Key(String paperId, double score, Double reviewAverage) {
    }

    public static final Comparator<Key> COMPARATOR = Comparator
            .comparingDouble(Key::score).reversed()
            .thenComparing(Key::reviewAverage, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Key::paperId);
}
