package com.spreadsheet.fgraph.address;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and normalization entry points for the address model.
 */
public final class Addresses {
    private static final Pattern CELL = Pattern.compile("\\$?([A-Za-z]{1,3})\\$?([0-9]+)");
    private static final Pattern COLUMN = Pattern.compile("\\$?([A-Za-z]{1,3})");
    private static final Pattern ROW = Pattern.compile("\\$?([0-9]+)");
    private static final Pattern PLAIN_SHEET = Pattern.compile("[A-Za-z0-9_.]+");

    private Addresses() {
        // Utility class
    }

    /**
     * Parses cell, range or multi-area text and normalizes it: a 1x1 single-area
     * range comes back as an {@link AddressCell}.
     *
     * @param text         e.g. {@code A1}, {@code Sheet!$A$1:$B$3},
     *                     {@code 'My Sheet'!C:C}, {@code Sheet!A1:B2,D4}
     * @param defaultSheet sheet used when the text has no sheet prefix; may be
     *                     null if the text is always qualified
     * @throws AddressException on malformed text
     */
    public static Address parse(String text, String defaultSheet) {
        return normalize(parseRange(text, defaultSheet));
    }

    /**
     * Like {@link #parse(String, String)} but returns null instead of throwing
     * when the text is not an address.
     */
    public static Address tryParse(String text, String defaultSheet) {
        if (text == null || text.isBlank())
            return null;
        try {
            return parse(text, defaultSheet);
        } catch (AddressException e) {
            return null;
        }
    }

    /** Collapses a 1x1 range to its cell; every other address is returned as is. */
    public static Address normalize(Address address) {
        if (address instanceof AddressRange range && range.isSingleCell())
            return range.start();
        return address;
    }

    /** True when the token is a plain cell coordinate such as {@code $B$12}. */
    public static boolean isCellCoordinate(String token) {
        Matcher m = CELL.matcher(token);
        if (!m.matches())
            return false;
        return AddressCell.columnIndex(m.group(1)) <= AddressCell.MAX_COLUMN;
    }

    /** Quotes a sheet name when it contains anything but letters, digits, '_' and '.'. */
    public static String quoteSheet(String sheet) {
        if (PLAIN_SHEET.matcher(sheet).matches() && !Character.isDigit(sheet.charAt(0)))
            return sheet;
        return "'" + sheet.replace("'", "''") + "'";
    }

    static AddressRange parseRange(String text, String defaultSheet) {
        if (text == null || text.isBlank())
            throw new AddressException("Empty address", String.valueOf(text));
        List<String> parts = splitAreas(text);
        String sheet = null;
        List<AddressRange.Area> areas = new ArrayList<>(parts.size());
        for (String part : parts) {
            String[] split = splitSheet(part, text);
            String partSheet = split[0] != null ? split[0] : (sheet != null ? sheet : defaultSheet);
            if (partSheet == null)
                throw new AddressException("Missing sheet name", text);
            if (sheet == null)
                sheet = partSheet;
            else if (!sheet.equals(partSheet))
                throw new AddressException("Areas on different sheets", text);
            areas.add(parseArea(split[1], sheet, text));
        }
        return AddressRange.of(sheet, areas);
    }

    private static AddressRange.Area parseArea(String coords, String sheet, String original) {
        int colon = coords.indexOf(':');
        if (colon < 0) {
            int[] cell = parseCell(coords, original);
            return new AddressRange.Area(cell[0], cell[1], cell[0], cell[1]);
        }
        String first = coords.substring(0, colon);
        String second = coords.substring(colon + 1);
        if (second.indexOf(':') >= 0)
            throw new AddressException("Malformed range", original);
        if (second.indexOf('!') >= 0) {
            String[] split = splitSheet(second, original);
            if (!sheet.equals(split[0]))
                throw new AddressException("Range spans two sheets", original);
            second = split[1];
        }
        if (CELL.matcher(first).matches() && CELL.matcher(second).matches()) {
            int[] a = parseCell(first, original);
            int[] b = parseCell(second, original);
            return new AddressRange.Area(a[0], a[1], b[0], b[1]);
        }
        Matcher ca = COLUMN.matcher(first);
        Matcher cb = COLUMN.matcher(second);
        if (ca.matches() && cb.matches()) {
            int a = checkedColumn(ca.group(1), original);
            int b = checkedColumn(cb.group(1), original);
            return new AddressRange.Area(a, 1, b, AddressCell.MAX_ROW);
        }
        Matcher ra = ROW.matcher(first);
        Matcher rb = ROW.matcher(second);
        if (ra.matches() && rb.matches()) {
            int a = checkedRow(ra.group(1), original);
            int b = checkedRow(rb.group(1), original);
            return new AddressRange.Area(1, a, AddressCell.MAX_COLUMN, b);
        }
        throw new AddressException("Malformed range", original);
    }

    private static int[] parseCell(String coords, String original) {
        Matcher m = CELL.matcher(coords.trim());
        if (!m.matches())
            throw new AddressException("Malformed cell reference", original);
        return new int[] { checkedColumn(m.group(1), original), checkedRow(m.group(2), original) };
    }

    private static int checkedColumn(String letters, String original) {
        int column = AddressCell.columnIndex(letters);
        if (column > AddressCell.MAX_COLUMN)
            throw new AddressException("Bad column letters", original);
        return column;
    }

    private static int checkedRow(String digits, String original) {
        if (digits.length() > 7)
            throw new AddressException("Row out of range", original);
        int row = Integer.parseInt(digits);
        if (row < 1 || row > AddressCell.MAX_ROW)
            throw new AddressException("Row out of range", original);
        return row;
    }

    /** Splits {@code Sheet!A1} into {sheet-or-null, coordinates}. */
    private static String[] splitSheet(String part, String original) {
        String t = part.trim();
        if (t.startsWith("'")) {
            StringBuilder sb = new StringBuilder();
            int i = 1;
            while (i < t.length()) {
                char c = t.charAt(i);
                if (c == '\'') {
                    if (i + 1 < t.length() && t.charAt(i + 1) == '\'') {
                        sb.append('\'');
                        i += 2;
                        continue;
                    }
                    break;
                }
                sb.append(c);
                i++;
            }
            if (i >= t.length())
                throw new AddressException("Unterminated sheet quote", original);
            if (i + 1 >= t.length() || t.charAt(i + 1) != '!')
                throw new AddressException("Expected '!' after quoted sheet name", original);
            if (sb.length() == 0)
                throw new AddressException("Empty sheet name", original);
            return new String[] { sb.toString(), t.substring(i + 2) };
        }
        int bang = t.indexOf('!');
        if (bang < 0)
            return new String[] { null, t };
        String sheet = t.substring(0, bang);
        if (sheet.isEmpty() || sheet.indexOf('\'') >= 0)
            throw new AddressException("Malformed sheet name", original);
        return new String[] { sheet, t.substring(bang + 1) };
    }

    /** Splits multi-area text on commas that are outside quoted sheet names. */
    private static List<String> splitAreas(String text) {
        List<String> parts = new ArrayList<>();
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'')
                quoted = !quoted;
            else if (c == ',' && !quoted) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        if (quoted)
            throw new AddressException("Unterminated sheet quote", text);
        parts.add(text.substring(start));
        for (String p : parts)
            if (p.isBlank())
                throw new AddressException("Empty area", text);
        return parts;
    }
}
