package com.spreadsheet.fgraph.api;

import java.util.Locale;
import java.util.Map;

/**
 * In-band spreadsheet error value such as {@code #DIV/0!} or {@code #N/A}.
 *
 * <p>
 * Errors are ordinary cell values: they flow through operators and most
 * functions, and they are cached like any other result. The optional detail
 * is diagnostic text (a syntax message, the name of a missing function) and
 * does not take part in equality.
 */
public final class ExcelError {
    public static final ExcelError NULL = new ExcelError("#NULL!", null);
    public static final ExcelError DIV0 = new ExcelError("#DIV/0!", null);
    public static final ExcelError VALUE = new ExcelError("#VALUE!", null);
    public static final ExcelError REF = new ExcelError("#REF!", null);
    public static final ExcelError NAME = new ExcelError("#NAME?", null);
    public static final ExcelError NUM = new ExcelError("#NUM!", null);
    public static final ExcelError NA = new ExcelError("#N/A", null);

    private static final Map<String, ExcelError> BY_CODE = Map.of(
            NULL.code, NULL, DIV0.code, DIV0, VALUE.code, VALUE, REF.code, REF,
            NAME.code, NAME, NUM.code, NUM, NA.code, NA);

    private final String code;
    private final String detail;

    private ExcelError(String code, String detail) {
        this.code = code;
        this.detail = detail;
    }

    /**
     * @return the error for the given code (case-insensitive), or null if the
     *         text is not an error code.
     */
    public static ExcelError fromCode(String code) {
        if (code == null)
            return null;
        return BY_CODE.get(code.toUpperCase(Locale.ROOT));
    }

    public static boolean isError(Object value) {
        return value instanceof ExcelError;
    }

    /** Same error code carrying diagnostic text. */
    public ExcelError withDetail(String detail) {
        return new ExcelError(code, detail);
    }

    public String code() {
        return code;
    }

    /** Diagnostic text, may be null. */
    public String detail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExcelError other && code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return detail == null ? code : code + " (" + detail + ")";
    }
}
