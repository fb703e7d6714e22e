package io.twsecodes.codes.error;

public class UnrecognizedCategoryException extends ListingParseException {
    private final String label;

    public UnrecognizedCategoryException(String label) {
        super("Unrecognized category header: '" + label + "'");
        this.label = label;
    }

    public String label() { return label; }
}
