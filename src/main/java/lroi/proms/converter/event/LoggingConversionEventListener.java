package lroi.proms.converter.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default listener: writes every event to the application log at its level.
 * Source file and row travel in the MDC (see RunContextUtil), row number is
 * prefixed to the message when known.
 */
@Slf4j
@Component
public class LoggingConversionEventListener implements ConversionEventListener {

    @Override
    public void onEvent(ConversionEvent event) {
        String message = event.getRowNumber() != null
                ? "Row " + event.getRowNumber() + ": " + event.getMessage()
                : event.getMessage();

        switch (event.getLevel()) {
            case DEBUG:
                log.debug("[{}] {}", event.getType(), message);
                break;
            case INFO:
                log.info("[{}] {}", event.getType(), message);
                break;
            case WARNING:
                log.warn("[{}] {}", event.getType(), message);
                break;
            default:
                log.error("[{}] {}", event.getType(), message);
        }
    }
}
