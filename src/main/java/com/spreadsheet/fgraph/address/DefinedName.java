package com.spreadsheet.fgraph.address;

import java.util.Locale;

/**
 * A workbook-level defined name. The body is either reference text
 * ({@code Rates!$B$1}, {@code Data!A1:A10,Data!C1}) or formula text starting
 * with {@code =} ({@code =0.05}, {@code =Rates!B1*2}).
 *
 * @param name the name as declared; lookups are case-insensitive
 * @param body reference or formula text
 */
public record DefinedName(String name, String body) {

    public DefinedName {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Defined name must not be blank");
        if (body == null || body.isBlank())
            throw new IllegalArgumentException("Defined name '" + name + "' has no body");
    }

    /** Key under which names are stored and looked up. */
    public static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    public boolean isFormula() {
        return body.startsWith("=");
    }

    /**
     * Resolves the body as an address.
     *
     * @throws AddressException if the body is a formula or malformed reference
     */
    public Address reference(String defaultSheet) {
        if (isFormula())
            throw new AddressException("Defined name is a formula", body);
        return Addresses.parse(body, defaultSheet);
    }
}
