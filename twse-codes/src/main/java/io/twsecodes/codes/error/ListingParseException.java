package io.twsecodes.codes.error;

/** A fetched listing page does not have the shape the parser expects. */
public class ListingParseException extends CodesException {
    public ListingParseException(String message) {
        super(message);
    }

    public ListingParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
