package com.purchasingpower.codegraph.util;

import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import org.slf4j.Logger;

import java.util.Collection;

/**
 * Unified logging for calls against the graph store and the file system.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Short preview of a collection for log lines: the first few elements and the total.
     */
    public static String preview(Collection<?> items, int limit) {
        if (items == null || items.isEmpty()) {
            return "[]";
        }
        if (items.size() <= limit) {
            return items.toString();
        }
        StringBuilder sb = new StringBuilder("[");
        int i = 0;
        for (Object item : items) {
            if (i == limit) {
                break;
            }
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(item);
            i++;
        }
        return sb.append(", ... +").append(items.size() - limit).append(" more]").toString();
    }
}
