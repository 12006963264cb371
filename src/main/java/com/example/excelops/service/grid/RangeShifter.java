package com.example.excelops.service.grid;

import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellRange;

import java.util.Optional;

/**
 * Moves a rectangle through a whole-row or whole-column insertion or deletion.
 * <p>
 * A positive {@code delta} inserts {@code delta} lines before {@code start}; a negative one deletes
 * {@code -delta} lines beginning at {@code start}. Ranges that straddle an insertion grow at their
 * far edge; ranges that straddle a deletion are clipped. An empty result means nothing of the
 * range survives.
 */
public final class RangeShifter {

    private RangeShifter() {
    }

    public static Optional<CellRange> shift(CellRange range, Axis axis, int start, int delta) {
        if (delta == 0) {
            return Optional.of(range);
        }
        int[] bounds = shiftBounds(range.low(axis), range.high(axis), start, delta, axis.limit());
        if (bounds == null) {
            return Optional.empty();
        }
        if (bounds[0] == range.low(axis) && bounds[1] == range.high(axis)) {
            return Optional.of(range);
        }
        return Optional.of(range.withBounds(axis, bounds[0], bounds[1]));
    }

    /**
     * Shifts the inclusive interval {@code [low, high]}. Returns {@code null} when the interval
     * disappears, otherwise the new {@code {low, high}}.
     */
    public static int[] shiftBounds(int low, int high, int start, int delta, int limit) {
        if (delta > 0) {
            if (high < start) {
                return new int[]{low, high};
            }
            int newLow = low >= start ? low + delta : low;
            if (newLow > limit) {
                return null;
            }
            return new int[]{newLow, Math.min(high + delta, limit)};
        }
        int count = -delta;
        int bandEnd = start + count - 1;
        if (high < start) {
            return new int[]{low, high};
        }
        if (low > bandEnd) {
            return new int[]{low - count, high - count};
        }
        if (low >= start && high <= bandEnd) {
            return null;
        }
        int newLow = Math.min(low, start);
        int newHigh = high > bandEnd ? high - count : start - 1;
        return newLow <= newHigh ? new int[]{newLow, newHigh} : null;
    }
}
