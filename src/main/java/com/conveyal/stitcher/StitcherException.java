package com.conveyal.stitcher;

import com.conveyal.stitcher.util.HttpStatus;

/**
 * An exception that should be reported to the caller of an HTTP endpoint. The HttpApi turns these into a JSON body
 * with the given type and message, and the given HTTP status code.
 */
public class StitcherException extends RuntimeException {

    public int httpCode;
    public Type type;
    public String message;

    public enum Type {
        BAD_REQUEST,
        NOT_FOUND,
        RUNTIME;
    }

    public static StitcherException badRequest(String message) {
        return new StitcherException(Type.BAD_REQUEST, message, HttpStatus.BAD_REQUEST_400);
    }

    public static StitcherException notFound(String message) {
        return new StitcherException(Type.NOT_FOUND, message, HttpStatus.NOT_FOUND_404);
    }

    public StitcherException(Type t, String m, int c) {
        httpCode = c;
        type = t;
        message = m;
    }

    @Override
    public String getMessage() {
        return message;
    }
}
