package com.spreadsheet.fgraph.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of {@link CalcValidator#validate}: discrepancies grouped by
 * category, plus how many cells were compared.
 */
public final class ValidationReport {
    private final Map<Discrepancy.Category, List<Discrepancy>> byCategory = new EnumMap<>(
            Discrepancy.Category.class);
    private int checked;
    private int skipped;

    void add(Discrepancy d) {
        byCategory.computeIfAbsent(d.category(), c -> new ArrayList<>()).add(d);
    }

    void countChecked() {
        checked++;
    }

    void countSkipped() {
        skipped++;
    }

    /** Formula cells whose value was compared. */
    public int checked() {
        return checked;
    }

    /** Formula cells with no cached value to compare against. */
    public int skipped() {
        return skipped;
    }

    public boolean isClean() {
        return byCategory.isEmpty();
    }

    public List<Discrepancy> discrepancies(Discrepancy.Category category) {
        return Collections.unmodifiableList(byCategory.getOrDefault(category, List.of()));
    }

    public List<Discrepancy> all() {
        List<Discrepancy> out = new ArrayList<>();
        for (List<Discrepancy> l : byCategory.values())
            out.addAll(l);
        return out;
    }

    /** Names of functions that were called but are not registered. */
    public Set<String> missingFunctions() {
        Set<String> names = new TreeSet<>();
        for (Discrepancy d : discrepancies(Discrepancy.Category.NOT_IMPLEMENTED))
            if (d.detail() != null)
                names.add(d.detail());
        return names;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder("Validated ").append(checked).append(" formulas");
        if (skipped > 0)
            sb.append(" (").append(skipped).append(" without cached values skipped)");
        if (isClean())
            return sb.append(": no discrepancies").toString();
        sb.append(':');
        for (Map.Entry<Discrepancy.Category, List<Discrepancy>> e : byCategory.entrySet())
            sb.append(' ').append(e.getKey().label()).append('=').append(e.getValue().size());
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(summary());
        for (Discrepancy d : all())
            sb.append("\n  ").append(d);
        return sb.toString();
    }
}
