package com.spreadsheet.fgraph.address;

/**
 * Identifier of a single cell or a rectangular span, always sheet-qualified.
 *
 * <p>
 * Addresses are the keys of the node store. Two addresses that denote the same
 * cells compare equal regardless of how they were written ({@code $A$1} vs
 * {@code A1}), and a 1x1 range is normalized to its {@link AddressCell} by
 * {@link Addresses#normalize(Address)} so both share one graph node.
 */
public interface Address {

    /** The sheet this address lives on. */
    String sheet();

    /** Canonical text form, e.g. {@code Sheet!A1} or {@code 'My Sheet'!A1:B3}. */
    String address();

    /** True for {@link AddressCell}, false for {@link AddressRange}. */
    boolean isCell();
}
