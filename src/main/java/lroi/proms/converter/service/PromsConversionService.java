package lroi.proms.converter.service;

import lroi.proms.converter.dto.ConversionResultDto;
import lroi.proms.converter.dto.ConversionResultDto.FileResult;
import lroi.proms.converter.event.ConversionEvent;
import lroi.proms.converter.event.ConversionEventListener;
import lroi.proms.converter.exception.ConfigurationException;
import lroi.proms.converter.exception.UnsupportedInputException;
import lroi.proms.converter.model.LutIndex;
import lroi.proms.converter.model.MappingConfig;
import lroi.proms.converter.model.OutputDocument;
import lroi.proms.converter.model.RowTypeDefinition;
import lroi.proms.converter.model.SourceRow;
import lroi.proms.converter.reader.SheetSelection;
import lroi.proms.converter.reader.TabularReaderFactory;
import lroi.proms.converter.reader.TabularSheet;
import lroi.proms.converter.util.InputPathUtil;
import lroi.proms.converter.util.RunContextUtil;
import lroi.proms.converter.util.SchemaElementOrder;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts one or more questionnaire exports into a single registry document.
 *
 * Per input row: detect the PROM type, join lookup-table data when the type
 * asks for it, extract and convert the mapped elements, require UPNNUM and
 * DATUMINVUL, and append the record in schema order. A bad row is reported and
 * counted as skipped; it never stops the run. Only configuration problems
 * (including an unusable lookup table) abort, and they do so before the first
 * row is read.
 *
 * A run is single-threaded and owns its document; call it once per batch.
 */
@Service
public class PromsConversionService {

    private final TabularReaderFactory readerFactory;
    private final LookupTableService lookupTableService;
    private final RowTypeDetectorService rowTypeDetector;
    private final RowMergerService rowMerger;
    private final ElementExtractorService elementExtractor;
    private final DocumentAssemblerService documentAssembler;
    private final XmlDocumentWriter documentWriter;
    private final ConversionEventListener defaultListener;

    public PromsConversionService(TabularReaderFactory readerFactory,
                                  LookupTableService lookupTableService,
                                  RowTypeDetectorService rowTypeDetector,
                                  RowMergerService rowMerger,
                                  ElementExtractorService elementExtractor,
                                  DocumentAssemblerService documentAssembler,
                                  XmlDocumentWriter documentWriter,
                                  ConversionEventListener defaultListener) {
        this.readerFactory = readerFactory;
        this.lookupTableService = lookupTableService;
        this.rowTypeDetector = rowTypeDetector;
        this.rowMerger = rowMerger;
        this.elementExtractor = elementExtractor;
        this.documentAssembler = documentAssembler;
        this.documentWriter = documentWriter;
        this.defaultListener = defaultListener;
    }

    public ConversionResultDto convert(List<Path> inputFiles, MappingConfig config,
                                       Path lutFile, Path outputFile) throws IOException {
        return convert(inputFiles, config, lutFile, outputFile, defaultListener);
    }

    /**
     * @param inputFiles questionnaire exports, processed in order
     * @param config     validated mapping configuration
     * @param lutFile    lookup table, or null
     * @param outputFile where to write the document, or null to only return it
     * @param events     receives the run's events
     * @return the document and converted/skipped counts
     * @throws ConfigurationException if config is missing or the lookup table is unusable
     * @throws IOException            if the document cannot be written
     */
    public ConversionResultDto convert(List<Path> inputFiles, MappingConfig config, Path lutFile,
                                       Path outputFile, ConversionEventListener events) throws IOException {
        if (config == null) {
            throw new ConfigurationException("No mapping configuration supplied");
        }
        LocalDateTime startTime = LocalDateTime.now();
        String runId = RunContextUtil.startRun();

        try {
            List<Path> sources = new ArrayList<>(inputFiles);
            LutIndex lutIndex = LutIndex.empty();
            if (lutFile != null) {
                lutIndex = lookupTableService.load(lutFile, config.getLutJoinColumn(), events);
                sources = sources.stream()
                        .filter(path -> !InputPathUtil.isSameFile(path, lutFile))
                        .collect(Collectors.toList());
            }

            RunState state = new RunState(config, lutIndex, events);
            for (Path source : sources) {
                state.fileResults.add(processFile(source, state));
            }
            RunContextUtil.setSourceFile(null);

            events.info(ConversionEvent.Type.RUN_SUMMARY,
                    "Conversion complete: " + state.converted + " questionnaires converted");
            if (state.skipped > 0) {
                events.warning(ConversionEvent.Type.RUN_SUMMARY, state.skipped + " questionnaires skipped");
            }

            String xml = documentWriter.serialize(state.document);
            if (outputFile != null) {
                documentWriter.write(xml, outputFile);
                events.info(ConversionEvent.Type.DOCUMENT_WRITTEN, "XML written to: " + outputFile);
            }

            LocalDateTime endTime = LocalDateTime.now();
            ConversionResultDto result = new ConversionResultDto();
            result.setRunId(runId);
            result.setDocument(xml);
            result.setConverted(state.converted);
            result.setSkipped(state.skipped);
            result.setOutputFile(outputFile != null ? outputFile.toString() : null);
            result.setProcessingStartTime(startTime);
            result.setProcessingEndTime(endTime);
            result.setProcessingDurationMs(Duration.between(startTime, endTime).toMillis());
            result.setFileResults(state.fileResults);
            return result;
        } finally {
            RunContextUtil.clear();
        }
    }

    private FileResult processFile(Path source, RunState state) {
        String fileName = source.getFileName().toString();
        RunContextUtil.setSourceFile(fileName);
        state.events.onEvent(ConversionEvent.builder()
                .level(ConversionEvent.Level.INFO)
                .type(ConversionEvent.Type.FILE_STARTED)
                .sourceFile(fileName)
                .message("Processing XLS: " + source)
                .build());

        TabularSheet sheet;
        try {
            sheet = readerFactory.getReader(source).read(source, SheetSelection.ACTIVE);
        } catch (IOException | UnsupportedInputException e) {
            state.events.onEvent(ConversionEvent.builder()
                    .level(ConversionEvent.Level.ERROR)
                    .type(ConversionEvent.Type.FILE_FAILED)
                    .sourceFile(fileName)
                    .message("Cannot read " + source + ": " + e.getMessage())
                    .build());
            return new FileResult(fileName, FileResult.Status.FAILED, 0, 0, e.getMessage());
        }

        if (sheet.isEmpty()) {
            state.events.onEvent(ConversionEvent.builder()
                    .level(ConversionEvent.Level.WARNING)
                    .type(ConversionEvent.Type.FILE_EMPTY)
                    .sourceFile(fileName)
                    .message("XLS file appears to be empty: " + source)
                    .build());
            return new FileResult(fileName, FileResult.Status.EMPTY, 0, 0, null);
        }

        int convertedBefore = state.converted;
        int skippedBefore = state.skipped;
        for (SourceRow row : sheet.getRows()) {
            try {
                processRow(row, state);
            } catch (RuntimeException e) {
                skip(state, row, "Failed to extract elements: " + e.getMessage());
            }
        }
        return new FileResult(fileName, FileResult.Status.SUCCESS,
                state.converted - convertedBefore, state.skipped - skippedBefore, null);
    }

    private void processRow(SourceRow row, RunState state) {
        MappingConfig config = state.config;
        Optional<RowTypeDefinition> detected = rowTypeDetector.detect(row, config.getRowTypes());
        if (detected.isEmpty()) {
            skip(state, row, "No PROM type detected for row");
            return;
        }

        RowTypeDefinition rowType = detected.get();
        if (!rowType.getKey().equals(state.lastDetectedType)) {
            state.lastDetectedType = rowType.getKey();
            state.events.info(ConversionEvent.Type.ROW_TYPE_DETECTED, "Detected PROM type: " + rowType.getKey());
        }

        SourceRow merged = row;
        if (!state.lutIndex.isEmpty()) {
            merged = rowMerger.merge(row, state.lutIndex, rowType, config.getLutColumnPrefix(), state.events).getRow();
        }

        Map<String, String> elements = elementExtractor.extract(merged, rowType, state.events);

        for (String mandatory : SchemaElementOrder.mandatoryElements()) {
            String value = elements.get(mandatory);
            if (value == null || value.isEmpty()) {
                skip(state, row, "Row skipped: missing " + mandatory);
                return;
            }
        }

        state.document.append(documentAssembler.assemble(elements, rowType.getKey(), config.getHospital()));
        state.converted++;
        state.events.emit(ConversionEvent.Level.INFO, ConversionEvent.Type.RECORD_CONVERTED, row.getRowNumber(),
                "Converted " + rowType.getKey() + " questionnaire: UPNNUM="
                        + elements.get(SchemaElementOrder.PERSON_ID));
    }

    private void skip(RunState state, SourceRow row, String reason) {
        state.skipped++;
        state.events.emit(ConversionEvent.Level.WARNING, ConversionEvent.Type.ROW_SKIPPED, row.getRowNumber(), reason);
    }

    /**
     * Mutable state of one run; never shared between runs.
     */
    private static final class RunState {
        private final MappingConfig config;
        private final LutIndex lutIndex;
        private final ConversionEventListener events;
        private final OutputDocument document = new OutputDocument();
        private final List<FileResult> fileResults = new ArrayList<>();
        private int converted;
        private int skipped;
        private String lastDetectedType;

        private RunState(MappingConfig config, LutIndex lutIndex, ConversionEventListener events) {
            this.config = config;
            this.lutIndex = lutIndex;
            this.events = events;
        }
    }
}
