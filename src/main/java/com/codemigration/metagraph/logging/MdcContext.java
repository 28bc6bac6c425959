package com.codemigration.metagraph.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * MDC keys for pipeline logging.
 */
public final class MdcContext {

    public static final String PROJECT_ID = "projectId";
    public static final String STAGE = "stage";
    public static final String FILE = "file";

    private MdcContext() {}

    public static void setProject(String projectId) {
        MDC.put(PROJECT_ID, projectId);
    }

    public static void setStage(String projectId, String stage) {
        MDC.put(PROJECT_ID, projectId);
        MDC.put(STAGE, stage);
    }

    public static void setFile(String path) {
        MDC.put(FILE, path);
    }

    public static void clearFile() {
        MDC.remove(FILE);
    }

    public static void clear() {
        MDC.remove(PROJECT_ID);
        MDC.remove(STAGE);
        MDC.remove(FILE);
    }

    /**
     * Wraps {@code task} so it runs with the caller's MDC on whatever thread executes it.
     */
    public static <T> Supplier<T> propagate(Supplier<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                return task.get();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
