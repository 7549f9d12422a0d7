package lroi.proms.converter.service;

import lroi.proms.converter.model.RowTypeDefinition;
import lroi.proms.converter.model.SourceRow;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Decides which questionnaire a row belongs to.
 *
 * Row types are tried in configuration order and the first one whose
 * detection column is present and non-empty wins, even if later types would
 * match too.
 */
@Service
public class RowTypeDetectorService {

    public Optional<RowTypeDefinition> detect(SourceRow row, List<RowTypeDefinition> rowTypes) {
        for (RowTypeDefinition rowType : rowTypes) {
            if (row.hasValue(rowType.getDetectionColumn())) {
                return Optional.of(rowType);
            }
        }
        return Optional.empty();
    }
}
