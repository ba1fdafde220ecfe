package com.capitolsync.importer.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CrossProductCursorTest {

    private static final List<Integer> CONGRESSES = List.of(118, 119);
    private static final List<String> TYPES = List.of("hr", "s");

    @Test
    @DisplayName("resume at 119/hr offset 500 skips congress 118 and starts 119/s from zero")
    void resumesInsideSecondCongress() {
        CrossProductCursor<Integer, String> cursor = new CrossProductCursor<>(CONGRESSES, TYPES, 119, "hr", 500);

        assertThat(cursor.shouldSkip(118, "hr")).isTrue();
        assertThat(cursor.shouldSkip(118, "s")).isTrue();
        assertThat(cursor.shouldSkip(119, "hr")).isFalse();
        assertThat(cursor.startOffset(119, "hr")).isEqualTo(500);
        assertThat(cursor.shouldSkip(119, "s")).isFalse();
        assertThat(cursor.startOffset(119, "s")).isZero();
    }

    @Test
    void noResumePositionSkipsNothing() {
        CrossProductCursor<Integer, String> cursor = new CrossProductCursor<>(CONGRESSES, TYPES, null, null, 0);

        assertThat(cursor.cells()).allSatisfy(cell -> assertThat(cursor.shouldSkip(cell.outer(), cell.inner())).isFalse());
        assertThat(cursor.startOffset(118, "hr")).isZero();
    }

    @Test
    void cellsAreOuterMajor() {
        CrossProductCursor<Integer, String> cursor = new CrossProductCursor<>(CONGRESSES, TYPES, null, null, 0);

        assertThat(cursor.cells()).containsExactly(
                new CrossProductCursor.Cell<>(118, "hr"),
                new CrossProductCursor.Cell<>(118, "s"),
                new CrossProductCursor.Cell<>(119, "hr"),
                new CrossProductCursor.Cell<>(119, "s"));
    }

    @Test
    void innerPositionWithinSameOuterSkipsEarlierInnerValues() {
        assertThat(CrossProductCursor.shouldSkip(CONGRESSES, TYPES, 118, "hr", 118, "s")).isTrue();
        assertThat(CrossProductCursor.shouldSkip(CONGRESSES, TYPES, 118, "s", 118, "s")).isFalse();
    }

    @Test
    void resumeOuterWithoutInnerStartsAtItsFirstCell() {
        CrossProductCursor<Integer, String> cursor = new CrossProductCursor<>(CONGRESSES, TYPES, 119, null, 0);

        assertThat(cursor.shouldSkip(118, "s")).isTrue();
        assertThat(cursor.shouldSkip(119, "hr")).isFalse();
        assertThat(cursor.isResumeCell(119, "hr")).isFalse();
    }

    @Test
    void unknownResumePositionSkipsNothing() {
        assertThat(CrossProductCursor.shouldSkip(CONGRESSES, TYPES, 118, "hr", 117, "hr")).isFalse();
    }
}
