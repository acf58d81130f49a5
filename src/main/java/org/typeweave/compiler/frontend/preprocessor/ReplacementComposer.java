package org.typeweave.compiler.frontend.preprocessor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges two rounds of replacements into one list over the original text.
 * <p>
 * The first round is expressed in original coordinates and produces an intermediate text; the second
 * round is expressed in intermediate coordinates. A second-round replacement that cuts into the output
 * of a first-round replacement is widened to cover it entirely, so every resulting replacement maps to
 * exact original boundaries.
 */
final class ReplacementComposer {

    /** A first-round replacement with its position in the intermediate text. */
    private record Placed(Replacement original, int intermediateStart, int intermediateEnd) {
    }

    private ReplacementComposer() {}

    /**
     * Composes the two rounds.
     * @param intermediate The text produced by applying {@code first} to the original.
     * @param first        The first-round replacements, sorted and non-overlapping, in original coordinates.
     * @param second       The second-round replacements, sorted and non-overlapping, in intermediate coordinates.
     * @return The combined replacements in original coordinates, sorted by start.
     */
    static List<Replacement> compose(String intermediate, List<Replacement> first, List<Replacement> second) {
        List<Placed> placed = new ArrayList<>(first.size());
        int delta = 0;
        for (Replacement r : first) {
            int start = r.start() + delta;
            int end = start + r.text().length();
            placed.add(new Placed(r, start, end));
            delta += r.text().length() - (r.end() - r.start());
        }

        // widen each second-round replacement over the first-round output it cuts into,
        // then merge widened ranges that now overlap
        List<int[]> groups = new ArrayList<>();
        List<List<Replacement>> members = new ArrayList<>();
        for (Replacement r : second) {
            int start = r.start();
            int end = r.end();
            for (Placed p : placed) {
                if (p.intermediateStart() < end && start < p.intermediateEnd()) {
                    start = Math.min(start, p.intermediateStart());
                    end = Math.max(end, p.intermediateEnd());
                }
            }
            int last = groups.size() - 1;
            if (last >= 0 && start < groups.get(last)[1]) {
                groups.get(last)[0] = Math.min(groups.get(last)[0], start);
                groups.get(last)[1] = Math.max(groups.get(last)[1], end);
                members.get(last).add(r);
            } else {
                groups.add(new int[]{start, end});
                List<Replacement> list = new ArrayList<>();
                list.add(r);
                members.add(list);
            }
        }

        List<Replacement> result = new ArrayList<>();
        for (int g = 0; g < groups.size(); g++) {
            int start = groups.get(g)[0];
            int end = groups.get(g)[1];
            StringBuilder text = new StringBuilder();
            int position = start;
            for (Replacement r : members.get(g)) {
                text.append(intermediate, position, r.start()).append(r.text());
                position = r.end();
            }
            text.append(intermediate, position, end);
            result.add(new Replacement(originalStart(placed, start), originalEnd(placed, end), text.toString()));
        }

        for (Placed p : placed) {
            boolean absorbed = groups.stream()
                    .anyMatch(g -> p.intermediateStart() < g[1] && g[0] < p.intermediateEnd());
            if (!absorbed) {
                result.add(p.original());
            }
        }
        result.sort(Comparator.comparingInt(Replacement::start)
                .thenComparingInt(x -> x.isInsertion() ? 0 : 1));
        return result;
    }

    /**
     * Maps an intermediate offset that starts a range; positions right after a first-round replacement
     * resolve to the end of the original range it replaced.
     */
    private static int originalStart(List<Placed> placed, int position) {
        int delta = 0;
        for (Placed p : placed) {
            if (p.intermediateEnd() <= position) {
                delta = p.original().end() - p.intermediateEnd();
            } else {
                break;
            }
        }
        return position + delta;
    }

    /**
     * Maps an intermediate offset that ends a range; positions right before a first-round replacement
     * resolve to the start of the original range it replaced.
     */
    private static int originalEnd(List<Placed> placed, int position) {
        int delta = 0;
        for (Placed p : placed) {
            boolean before = p.intermediateEnd() < position
                    || (p.intermediateEnd() == position && p.intermediateStart() < position);
            if (before) {
                delta = p.original().end() - p.intermediateEnd();
            } else {
                break;
            }
        }
        return position + delta;
    }
}
