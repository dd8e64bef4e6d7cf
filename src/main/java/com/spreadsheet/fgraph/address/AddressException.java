package com.spreadsheet.fgraph.address;

/**
 * Thrown when address or range text is malformed: bad column letters, a
 * non-positive or out of bounds row, unbalanced sheet quotes, or a range whose
 * parts name different sheets.
 */
public class AddressException extends IllegalArgumentException {

    private final String text;

    public AddressException(String message, String text) {
        super(message + ": '" + text + "'");
        this.text = text;
    }

    /** The offending address text. */
    public String text() {
        return text;
    }
}
