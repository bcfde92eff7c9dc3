package com.ryuqq.contentflow.core.cleanup;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CleanupReport 테스트.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
class CleanupReportTest {

    @Test
    void empty_HasNoRemovalsOrFailures() {
        CleanupReport report = CleanupReport.empty();

        assertEquals(0, report.totalRemoved());
        assertFalse(report.hasFailures());
    }

    @Test
    void totalRemoved_SumsBothKinds() {
        CleanupReport report = new CleanupReport(2, 3, List.of(Path.of("/out/.temp_x")));

        assertEquals(5, report.totalRemoved());
        assertTrue(report.hasFailures());
    }

    @Test
    void constructor_NegativeCount_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new CleanupReport(-1, 0, null));
    }
}
