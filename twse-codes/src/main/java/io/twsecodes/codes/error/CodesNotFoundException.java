package io.twsecodes.codes.error;

/**
 * Every tier, the forced re-fetch included, came back empty.
 */
public class CodesNotFoundException extends CodesException {
    public CodesNotFoundException(String query) {
        super("No codes found for " + query);
    }

    public CodesNotFoundException(String query, Throwable cause) {
        super("No codes found for " + query + ": " + cause.getMessage(), cause);
    }
}
