package io.threadkeep.core.summarize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the units that survive compression: every code unit plus the best scored prose units,
 * returned in source order.
 */
public final class SentenceSelector {
    static final int MIN_RETAINED = 2;
    // Guards ceil() against products such as 10 * 0.3 = 3.0000000000000004.
    private static final double EPSILON = 1e-9;

    public List<TextUnit> select(List<TextUnit> units, double[] scores, double ratio) {
        if (units.size() != scores.length) {
            throw new IllegalArgumentException("expected one score per unit");
        }

        List<TextUnit> prose = units.stream().filter(unit -> !unit.code()).toList();
        int keep = retainedCount(prose.size(), ratio);
        List<TextUnit> best = prose.stream()
            .sorted(Comparator.comparingDouble((TextUnit unit) -> scores[unit.index()]).reversed()
                .thenComparingInt(TextUnit::index))
            .limit(keep)
            .toList();

        List<TextUnit> retained = new ArrayList<>(best);
        units.stream().filter(TextUnit::code).forEach(retained::add);
        retained.sort(Comparator.comparingInt(TextUnit::index));
        return retained;
    }

    public String join(List<TextUnit> units) {
        return units.stream().map(TextUnit::text).collect(Collectors.joining("\n\n"));
    }

    static int retainedCount(int proseUnits, double ratio) {
        int byRatio = (int) Math.ceil(proseUnits * ratio - EPSILON);
        return Math.min(proseUnits, Math.max(MIN_RETAINED, byRatio));
    }
}
