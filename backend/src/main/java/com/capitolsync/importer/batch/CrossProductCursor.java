package com.capitolsync.importer.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Iteration over outer × inner dimensions (congress × bill type, congress × session) in declared order,
 * with a resume position. Cells before the resume cell are skipped, the resume cell continues at the stored
 * offset and every later cell starts at offset 0.
 */
public final class CrossProductCursor<O, I> {

    private final List<O> outer;
    private final List<I> inner;
    private final O resumeOuter;
    private final I resumeInner;
    private final long resumeOffset;

    /**
     * @param resumeOuter  stored outer position, or null to start at the first cell
     * @param resumeInner  stored inner position, or null to start at the first inner value of {@code resumeOuter}
     * @param resumeOffset stored offset within the resume cell
     */
    public CrossProductCursor(List<O> outer, List<I> inner, O resumeOuter, I resumeInner, long resumeOffset) {
        this.outer = List.copyOf(outer);
        this.inner = List.copyOf(inner);
        this.resumeOuter = resumeOuter;
        this.resumeInner = resumeInner;
        this.resumeOffset = resumeOffset;
    }

    /** All cells in declared order (outer-major). */
    public List<Cell<O, I>> cells() {
        List<Cell<O, I>> cells = new ArrayList<>(outer.size() * inner.size());
        for (O o : outer) {
            for (I i : inner) {
                cells.add(new Cell<>(o, i));
            }
        }
        return cells;
    }

    public boolean shouldSkip(O o, I i) {
        return shouldSkip(outer, inner, o, i, resumeOuter, resumeInner);
    }

    /** Stored offset for the exact resume cell, 0 for every other cell. */
    public long startOffset(O o, I i) {
        return isResumeCell(o, i) ? resumeOffset : 0L;
    }

    public boolean isResumeCell(O o, I i) {
        return resumeOuter != null && Objects.equals(o, resumeOuter) && Objects.equals(i, resumeInner);
    }

    /**
     * True when cell (o, i) lies strictly before the resume cell in declared order. A resume position that is not
     * part of the declared dimensions (e.g. a congress dropped from configuration) skips nothing.
     */
    public static <O, I> boolean shouldSkip(List<O> outer, List<I> inner, O o, I i, O resumeOuter, I resumeInner) {
        if (resumeOuter == null) {
            return false;
        }
        int resumeOuterIndex = outer.indexOf(resumeOuter);
        if (resumeOuterIndex < 0) {
            return false;
        }
        int outerIndex = outer.indexOf(o);
        if (outerIndex != resumeOuterIndex) {
            return outerIndex < resumeOuterIndex;
        }
        if (resumeInner == null) {
            return false;
        }
        int resumeInnerIndex = inner.indexOf(resumeInner);
        return resumeInnerIndex >= 0 && inner.indexOf(i) < resumeInnerIndex;
    }

    public record Cell<O, I>(O outer, I inner) {
    }
}
