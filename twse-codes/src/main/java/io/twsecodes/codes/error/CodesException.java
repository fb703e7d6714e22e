package io.twsecodes.codes.error;

/**
 * Root of the checked failures raised while fetching, parsing or resolving listing codes.
 */
public class CodesException extends Exception {
    public CodesException(String message) {
        super(message);
    }

    public CodesException(String message, Throwable cause) {
        super(message, cause);
    }
}
