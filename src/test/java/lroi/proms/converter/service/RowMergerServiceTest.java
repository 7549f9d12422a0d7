package lroi.proms.converter.service;

import lroi.proms.converter.event.ConversionEvent;
import lroi.proms.converter.model.CellValue;
import lroi.proms.converter.model.FieldMapping;
import lroi.proms.converter.model.LookupSpec;
import lroi.proms.converter.model.LutIndex;
import lroi.proms.converter.model.MergeResult;
import lroi.proms.converter.model.RowTypeDefinition;
import lroi.proms.converter.model.SourceRow;
import lroi.proms.converter.util.TestDataFactory.RecordingListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static lroi.proms.converter.util.TestDataFactory.row;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RowMergerService
 * Tests both lookup forms, their precedence, and the non-fatal failure paths
 */
class RowMergerServiceTest {

    private static final String PREFIX = "__LUT__";

    private RowMergerService merger;
    private RecordingListener events;
    private LutIndex index;

    @BeforeEach
    void setUp() {
        merger = new RowMergerService();
        events = new RecordingListener();

        Map<String, CellValue> p001 = new LinkedHashMap<>();
        p001.put("PatientRecordID", CellValue.text("P001"));
        p001.put("BSN", CellValue.number(123456782));
        p001.put("Gender", CellValue.text("M"));
        p001.put("Extra", CellValue.text("not requested"));
        index = new LutIndex("PatientRecordID", Map.of("P001", p001), 1, 0);
    }

    @Test
    void testMerge_NotRequiredLeavesRowUnchanged() {
        SourceRow source = row(2, "PatientRecordID", "P001", "OKS Score", "40");

        MergeResult result = merger.merge(source, index, rowType(LookupSpec.notRequired()), PREFIX, events);

        assertThat(result.getStatus()).isEqualTo(MergeResult.Status.NOT_REQUIRED);
        assertThat(result.getRow()).isSameAs(source);
        assertThat(events.getEvents()).isEmpty();
    }

    @Test
    void testMerge_AddColumnsCopiesRequestedColumnsOnly() {
        SourceRow source = row(2, "PatientRecordID", " P001 ", "OKS Score", "40");
        LookupSpec lookup = LookupSpec.addColumns("PatientRecordID", List.of("BSN", "Gender", "NotInLut"));

        MergeResult result = merger.merge(source, index, rowType(lookup), PREFIX, events);

        assertThat(result.getStatus()).isEqualTo(MergeResult.Status.MERGED);
        assertThat(result.getJoinKey()).isEqualTo("P001");
        SourceRow merged = result.getRow();
        assertThat(merged.get("__LUT__BSN").asText()).isEqualTo("123456782");
        assertThat(merged.get("__LUT__Gender").asText()).isEqualTo("M");
        assertThat(merged.contains("__LUT__NotInLut")).isFalse();
        assertThat(merged.contains("__LUT__Extra")).isFalse();
        assertThat(merged.get("OKS Score").asText()).isEqualTo("40");
    }

    @Test
    void testMerge_OverwritesExistingPrefixedColumn() {
        SourceRow source = row(2, "PatientRecordID", "P001", "__LUT__Gender", "stale");
        LookupSpec lookup = LookupSpec.addColumns("PatientRecordID", List.of("Gender"));

        MergeResult result = merger.merge(source, index, rowType(lookup), PREFIX, events);

        assertThat(result.getRow().get("__LUT__Gender").asText()).isEqualTo("M");
    }

    @Test
    void testMerge_LegacyFormUsesMappedColumns() {
        SourceRow source = row(2, "PatientRecordID", "P001");
        Map<String, String> legacy = new LinkedHashMap<>();
        legacy.put("UPNNUM", "BSN");
        legacy.put("GENDER", "Gender");
        LookupSpec lookup = new LookupSpec(true, "PatientRecordID", null, legacy);

        MergeResult result = merger.merge(source, index, rowType(lookup), PREFIX, events);

        assertThat(result.getStatus()).isEqualTo(MergeResult.Status.MERGED);
        assertThat(result.getRow().contains("__LUT__BSN")).isTrue();
        assertThat(result.getRow().contains("__LUT__Gender")).isTrue();
    }

    @Test
    void testMerge_AddColumnsTakesPrecedenceOverLegacyForm() {
        SourceRow source = row(2, "PatientRecordID", "P001");
        LookupSpec lookup = new LookupSpec(true, "PatientRecordID", List.of("BSN"), Map.of("GENDER", "Gender"));

        MergeResult result = merger.merge(source, index, rowType(lookup), PREFIX, events);

        assertThat(result.getRow().contains("__LUT__BSN")).isTrue();
        assertThat(result.getRow().contains("__LUT__Gender")).isFalse();
    }

    @Test
    void testMerge_MissingKeyIsLoggedAndRowProceeds() {
        // Given: P002 is not in the lookup table
        SourceRow source = row(5, "PatientRecordID", "P002", "OKS Score", "40");
        LookupSpec lookup = LookupSpec.addColumns("PatientRecordID", List.of("BSN", "Gender"));

        // When
        MergeResult result = merger.merge(source, index, rowType(lookup), PREFIX, events);

        // Then: unchanged row, error event, no prefixed columns
        assertThat(result.getStatus()).isEqualTo(MergeResult.Status.LOOKUP_MISS);
        assertThat(result.getJoinKey()).isEqualTo("P002");
        assertThat(result.getRow().asMap().keySet()).noneMatch(key -> key.startsWith(PREFIX));

        List<ConversionEvent> misses = events.ofType(ConversionEvent.Type.LOOKUP_MISS);
        assertThat(misses).hasSize(1);
        assertThat(misses.get(0).getLevel()).isEqualTo(ConversionEvent.Level.ERROR);
        assertThat(misses.get(0).getRowNumber()).isEqualTo(5L);
        assertThat(misses.get(0).getMessage()).contains("P002");
    }

    @Test
    void testMerge_EmptyJoinValue() {
        SourceRow source = row(3, "PatientRecordID", "", "OKS Score", "40");
        LookupSpec lookup = LookupSpec.addColumns("PatientRecordID", List.of("BSN"));

        MergeResult result = merger.merge(source, index, rowType(lookup), PREFIX, events);

        assertThat(result.getStatus()).isEqualTo(MergeResult.Status.NO_JOIN_KEY);
        assertThat(events.ofType(ConversionEvent.Type.JOIN_KEY_MISSING)).hasSize(1);
    }

    @Test
    void testMerge_NoJoinColumnConfigured() {
        SourceRow source = row(3, "PatientRecordID", "P001");
        LookupSpec lookup = new LookupSpec(true, null, List.of("BSN"), null);

        MergeResult result = merger.merge(source, index, rowType(lookup), PREFIX, events);

        assertThat(result.getStatus()).isEqualTo(MergeResult.Status.NO_JOIN_KEY);
        assertThat(result.getRow()).isSameAs(source);
    }

    private static RowTypeDefinition rowType(LookupSpec lookup) {
        return new RowTypeDefinition("OKS", "OKS Score", List.of(FieldMapping.direct("UPNNUM", "__LUT__BSN")), lookup);
    }
}
