package com.spreadsheet.fgraph.util;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.Values;

/**
 * A formula cell whose recomputed value disagrees with the workbook, or that
 * could not be computed.
 */
public record Discrepancy(Address address, Category category, Object expected, Object actual, String detail) {

    public enum Category {
        MISMATCH("mismatch"),
        NOT_IMPLEMENTED("not-implemented"),
        EXCEPTIONS("exceptions");

        private final String label;

        Category(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(category.label()).append(' ').append(address.address()).append(": expected ")
                .append(Values.display(expected)).append(", got ").append(Values.display(actual));
        if (detail != null)
            sb.append(" (").append(detail).append(')');
        return sb.toString();
    }
}
