package com.hindsight.setforget.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.stream.Stream;

/**
 * Best-of reduction over scored candidates. The combiner keeps the higher score and, on equal scores, the lower
 * candidate index, so it is associative and commutative and gives the same answer on sequential and parallel
 * streams: the first candidate (in enumeration order) with the top score.
 */
public final class Candidates {

    public record Scored<T>(int index, int score, T value) {}

    private Candidates() {}

    public static <T> BinaryOperator<Scored<T>> preferHigher() {
        return (a, b) -> {
            if (a.score() != b.score()) return a.score() > b.score() ? a : b;
            return a.index() <= b.index() ? a : b;
        };
    }

    public static <T> Optional<Scored<T>> best(Stream<Scored<T>> candidates) {
        return candidates.reduce(preferHigher());
    }

    /** All orderings of {@code items}, lexicographic by position in the input list. */
    public static <T> List<List<T>> permutations(List<T> items) {
        List<List<T>> out = new ArrayList<>();
        permute(new ArrayList<>(items), new ArrayList<>(), out);
        return out;
    }

    private static <T> void permute(List<T> remaining, List<T> prefix, List<List<T>> out) {
        if (remaining.isEmpty()) {
            out.add(List.copyOf(prefix));
            return;
        }
        for (int i = 0; i < remaining.size(); i++) {
            T next = remaining.remove(i);
            prefix.add(next);
            permute(remaining, prefix, out);
            prefix.remove(prefix.size() - 1);
            remaining.add(i, next);
        }
    }
}
