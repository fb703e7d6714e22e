package io.twsecodes.codes.error;

/** A data row came before any category header row. */
public class CategorySequenceException extends ListingParseException {
    public CategorySequenceException(String source, int row) {
        super("Data row " + row + " of " + source + " page has no active category");
    }
}
