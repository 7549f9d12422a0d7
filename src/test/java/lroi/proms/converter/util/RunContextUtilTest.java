package lroi.proms.converter.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RunContextUtil.
 * Tests the MDC entries that tag log lines with run id and source file.
 */
class RunContextUtilTest {

    // Clean MDC before and after each test to ensure isolation
    @BeforeEach
    void setUp() {
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testGetCurrentRunId_WhenNotSet_ReturnsDefaultValue() {
        assertThat(RunContextUtil.getCurrentRunId()).isEqualTo("NO-RUN-ID");
    }

    @Test
    void testStartRun_StoresShortIdInMDC() {
        // When: a run starts
        String runId = RunContextUtil.startRun();

        // Then: the id is in MDC and 8 characters long
        assertThat(runId).hasSize(8);
        assertThat(MDC.get(RunContextUtil.RUN_ID_KEY)).isEqualTo(runId);
        assertThat(RunContextUtil.getCurrentRunId()).isEqualTo(runId);
    }

    @Test
    void testStartRun_NewIdEachRun() {
        String first = RunContextUtil.startRun();
        String second = RunContextUtil.startRun();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void testSetSourceFile_SetAndRemove() {
        RunContextUtil.setSourceFile("export.xlsx");
        assertThat(MDC.get(RunContextUtil.SOURCE_FILE_KEY)).isEqualTo("export.xlsx");

        RunContextUtil.setSourceFile(null);
        assertThat(MDC.get(RunContextUtil.SOURCE_FILE_KEY)).isNull();
    }

    @Test
    void testClear_RemovesOnlyRunEntries() {
        // Given: run context plus an unrelated MDC entry
        MDC.put("other", "kept");
        RunContextUtil.startRun();
        RunContextUtil.setSourceFile("export.xlsx");

        // When
        RunContextUtil.clear();

        // Then
        assertThat(MDC.get(RunContextUtil.RUN_ID_KEY)).isNull();
        assertThat(MDC.get(RunContextUtil.SOURCE_FILE_KEY)).isNull();
        assertThat(MDC.get("other")).isEqualTo("kept");
    }
}
