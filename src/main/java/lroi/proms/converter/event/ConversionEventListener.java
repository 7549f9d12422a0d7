package lroi.proms.converter.event;

/**
 * Receives the events of a conversion run.
 *
 * The engine only reports through this interface; what happens to an event
 * (console, log file, progress window) is up to the implementation.
 */
@FunctionalInterface
public interface ConversionEventListener {

    void onEvent(ConversionEvent event);

    default void emit(ConversionEvent.Level level, ConversionEvent.Type type, Long rowNumber, String message) {
        onEvent(ConversionEvent.builder().level(level).type(type).rowNumber(rowNumber).message(message).build());
    }

    default void info(ConversionEvent.Type type, String message) {
        onEvent(ConversionEvent.builder().level(ConversionEvent.Level.INFO).type(type).message(message).build());
    }

    default void warning(ConversionEvent.Type type, String message) {
        onEvent(ConversionEvent.builder().level(ConversionEvent.Level.WARNING).type(type).message(message).build());
    }

    /**
     * Listener that drops every event.
     */
    static ConversionEventListener none() {
        return event -> { };
    }
}
