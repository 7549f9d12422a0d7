package lroi.proms.converter.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility class for the diagnostic context of a conversion run.
 * Uses SLF4J MDC (Mapped Diagnostic Context) for thread-local storage, so
 * every log line of a run carries its run id and the file being processed.
 *
 * Usage:
 * - startRun() at the start of a conversion, clear() in a finally block
 * - setSourceFile() whenever processing moves to the next input file
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String SOURCE_FILE_KEY = "sourceFile";

    private RunContextUtil() {
    }

    /**
     * Starts a new run context and returns its id.
     */
    public static String startRun() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_KEY, runId);
        return runId;
    }

    /**
     * Gets the current run id from MDC
     * @return run id or "NO-RUN-ID" if not set
     */
    static String getCurrentRunId() {
        String runId = MDC.get(RUN_ID_KEY);
        return runId != null ? runId : "NO-RUN-ID";
    }

    public static void setSourceFile(String fileName) {
        if (fileName == null) {
            MDC.remove(SOURCE_FILE_KEY);
        } else {
            MDC.put(SOURCE_FILE_KEY, fileName);
        }
    }

    /**
     * Removes run id and source file from MDC.
     * IMPORTANT: Always call this in finally blocks to prevent leaking context
     * into the next run on the same thread
     */
    public static void clear() {
        MDC.remove(RUN_ID_KEY);
        MDC.remove(SOURCE_FILE_KEY);
    }
}
