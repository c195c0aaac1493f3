package com.conveyal.stitcher.util;

/**
 * It's kind of absurd to have our own set of HTTP status code constants, but I can't find any in the Spark project.
 */
public class HttpStatus {

    public static final int OK_200 = 200;
    public static final int ACCEPTED_202 = 202;
    public static final int BAD_REQUEST_400 = 400;
    public static final int NOT_FOUND_404 = 404;
    public static final int SERVER_ERROR_500 = 500;

    /** True for any code in the 2xx range, which is what the workers use to acknowledge a request. */
    public static boolean isSuccess (int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

}
