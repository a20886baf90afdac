package com.apogee.util;

import java.util.UUID;

/** Short identifiers used as log line prefixes. */
public final class LogIds {

    private static final int SHORT_LENGTH = 8;

    private LogIds() {
        // Utility class - no instantiation
    }

    public static String shortId(UUID id) {
        return id == null ? "--------" : shortId(id.toString());
    }

    public static String shortId(String id) {
        if (id == null) {
            return "--------";
        }
        return id.length() > SHORT_LENGTH ? id.substring(0, SHORT_LENGTH) : id;
    }
}
