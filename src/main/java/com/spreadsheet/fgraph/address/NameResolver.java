package com.spreadsheet.fgraph.address;

/**
 * Lookup of workbook-level names used while compiling formulas.
 */
public interface NameResolver {

    /** Resolver that knows no names. */
    NameResolver NONE = new NameResolver() {
        @Override
        public DefinedName definedName(String name) {
            return null;
        }

        @Override
        public TableDefinition table(String name) {
            return null;
        }
    };

    /** @return the defined name (case-insensitive), or null if unknown. */
    DefinedName definedName(String name);

    /** @return the table (case-insensitive), or null if unknown. */
    TableDefinition table(String name);
}
