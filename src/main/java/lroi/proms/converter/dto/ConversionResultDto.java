package lroi.proms.converter.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * DTO for the result of one conversion run.
 * Carries the serialized document plus converted/skipped counts, overall and per file.
 */
@Data
@NoArgsConstructor
public class ConversionResultDto {

    @JsonProperty("run_id")
    private String runId;

    @JsonIgnore
    private String document;

    @JsonProperty("converted")
    private int converted;

    @JsonProperty("skipped")
    private int skipped;

    @JsonProperty("output_file")
    private String outputFile;

    @JsonProperty("processing_start_time")
    private LocalDateTime processingStartTime;

    @JsonProperty("processing_end_time")
    private LocalDateTime processingEndTime;

    @JsonProperty("processing_duration_ms")
    private Long processingDurationMs;

    @JsonProperty("file_results")
    private List<FileResult> fileResults = new ArrayList<>();

    /**
     * A run with nothing converted is a failed run.
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return converted > 0;
    }

    // Inner class for individual file results
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileResult {

        public enum Status {
            SUCCESS,
            EMPTY,
            FAILED
        }

        @JsonProperty("file_name")
        private String fileName;

        @JsonProperty("status")
        private Status status;

        @JsonProperty("converted")
        private int converted;

        @JsonProperty("skipped")
        private int skipped;

        @JsonProperty("error_message")
        private String errorMessage;
    }
}
