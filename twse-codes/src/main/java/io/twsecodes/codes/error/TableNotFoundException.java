package io.twsecodes.codes.error;

public class TableNotFoundException extends ListingParseException {
    public TableNotFoundException(String source, String selector) {
        super("No table matching '" + selector + "' in " + source + " page");
    }
}
