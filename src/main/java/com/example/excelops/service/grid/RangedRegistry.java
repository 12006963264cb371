package com.example.excelops.service.grid;

import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ordered collection of ranged entities for one sheet. Merges and validation rules share the
 * structural shifting implemented here; subclasses only decide which ranges they accept.
 */
public abstract class RangedRegistry<T extends RangedEntity<T>> {

    protected final List<T> entries = new ArrayList<>();

    public List<T> list() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<T> covering(CellAddress address) {
        return entries.stream()
                .filter(e -> e.range().contains(address))
                .toList();
    }

    public List<T> intersecting(CellRange range) {
        return entries.stream()
                .filter(e -> e.range().intersects(range))
                .toList();
    }

    /**
     * Applies a whole-row or whole-column insertion ({@code delta > 0}) or deletion
     * ({@code delta < 0}) to every entry. Returns how many entries were dropped.
     */
    public int shiftAll(Axis axis, int start, int delta) {
        return shiftWithinBand(axis, start, delta, 0, 0);
    }

    /**
     * Like {@link #shiftAll} but only entries lying wholly between {@code crossLow} and
     * {@code crossHigh} on the other axis move; the rest stay put. Zero bounds mean no band.
     */
    public int shiftWithinBand(Axis axis, int start, int delta, int crossLow, int crossHigh) {
        Axis cross = axis == Axis.ROW ? Axis.COLUMN : Axis.ROW;
        int dropped = 0;
        List<T> shifted = new ArrayList<>(entries.size());
        for (T entry : entries) {
            CellRange range = entry.range();
            if (crossLow > 0 && (range.low(cross) < crossLow || range.high(cross) > crossHigh)) {
                shifted.add(entry);
                continue;
            }
            Optional<CellRange> moved = RangeShifter.shift(range, axis, start, delta);
            if (moved.isPresent() && accepts(moved.get())) {
                shifted.add(moved.get().equals(range) ? entry : entry.withRange(moved.get()));
            } else {
                dropped++;
            }
        }
        entries.clear();
        entries.addAll(shifted);
        return dropped;
    }

    /**
     * Replaces every entry by the mapper's result; a {@code null} result drops the entry.
     * Returns how many entries were dropped.
     */
    public int replaceAll(UnaryOperator<T> mapper) {
        int dropped = 0;
        List<T> mapped = new ArrayList<>(entries.size());
        for (T entry : entries) {
            T result = mapper.apply(entry);
            if (result != null && accepts(result.range())) {
                mapped.add(result);
            } else {
                dropped++;
            }
        }
        entries.clear();
        entries.addAll(mapped);
        return dropped;
    }

    public void clear() {
        entries.clear();
    }

    protected abstract boolean accepts(CellRange range);

    void copyInto(RangedRegistry<T> target) {
        target.entries.clear();
        target.entries.addAll(entries);
    }
}
