package com.punchclock.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A stored row that cannot be read as its entity. Fatal on a single-row lookup; bulk scans log and skip it.
 */
public class MalformedRowException extends ProblemException {

    public static final String CODE = "MALFORMED_ROW";

    public MalformedRowException(String table, String key, String reason) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, CODE, table + "[" + key + "]: " + reason);
    }
}
