package com.spreadsheet.fgraph.source;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.DefinedName;
import com.spreadsheet.fgraph.address.TableDefinition;

/**
 * A workbook held entirely in memory. Used directly by tests and callers that
 * build models programmatically, and as the target of
 * {@link com.spreadsheet.fgraph.io.JsonWorkbookLoader}.
 */
public final class InMemoryWorkbook implements WorkbookSource {
    private final String name;
    private final Map<String, TreeMap<AddressCell, CellContent>> sheets = new LinkedHashMap<>();
    private final Map<String, DefinedName> names = new LinkedHashMap<>();
    private final Map<String, TableDefinition> tables = new LinkedHashMap<>();

    public InMemoryWorkbook(String name) {
        this.name = name;
    }

    /** Adds an empty sheet; no-op if it already exists. */
    public InMemoryWorkbook addSheet(String sheet) {
        sheets.computeIfAbsent(sheet, s -> new TreeMap<>());
        return this;
    }

    /**
     * Sets a cell. A string starting with {@code =} (and longer than that) is a
     * formula; anything else is a literal. Null clears the cell. Unqualified
     * addresses refer to the first sheet.
     */
    public InMemoryWorkbook set(String address, Object valueOrFormula) {
        return set(AddressCell.parse(address, firstSheet()), valueOrFormula);
    }

    public InMemoryWorkbook set(AddressCell cell, Object valueOrFormula) {
        if (valueOrFormula == null) {
            TreeMap<AddressCell, CellContent> sheet = sheets.get(cell.sheet());
            if (sheet != null)
                sheet.remove(cell);
            return this;
        }
        if (valueOrFormula instanceof String s && s.length() > 1 && s.startsWith("="))
            return put(cell, CellContent.formula(s, null));
        return put(cell, CellContent.literal(valueOrFormula));
    }

    /** Sets a literal value, even text that starts with {@code =}. */
    public InMemoryWorkbook setLiteral(AddressCell cell, Object value) {
        return put(cell, CellContent.literal(value));
    }

    /** Sets a formula together with the value the spreadsheet last computed for it. */
    public InMemoryWorkbook setFormula(String address, String formula, Object cachedValue) {
        return put(AddressCell.parse(address, firstSheet()), CellContent.formula(formula, cachedValue));
    }

    /** Replaces the cached value of an existing formula cell. */
    public InMemoryWorkbook setCached(String address, Object cachedValue) {
        AddressCell cell = AddressCell.parse(address, firstSheet());
        CellContent content = cell(cell);
        if (content == null || !content.isFormula())
            throw new IllegalArgumentException("No formula at " + cell);
        return put(cell, CellContent.formula(content.formula(), cachedValue));
    }

    public InMemoryWorkbook defineName(String name, String body) {
        DefinedName defined = new DefinedName(name, body);
        names.put(DefinedName.key(name), defined);
        return this;
    }

    public InMemoryWorkbook addTable(TableDefinition table) {
        addSheet(table.range().sheet());
        tables.put(DefinedName.key(table.name()), table);
        return this;
    }

    private InMemoryWorkbook put(AddressCell cell, CellContent content) {
        addSheet(cell.sheet());
        sheets.get(cell.sheet()).put(cell, content);
        return this;
    }

    private String firstSheet() {
        return sheets.isEmpty() ? null : sheets.keySet().iterator().next();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CellContent cell(AddressCell address) {
        TreeMap<AddressCell, CellContent> sheet = sheets.get(address.sheet());
        return sheet == null ? null : sheet.get(address);
    }

    @Override
    public Collection<String> sheetNames() {
        return Collections.unmodifiableSet(sheets.keySet());
    }

    @Override
    public Collection<AddressCell> populatedCells(String sheet) {
        TreeMap<AddressCell, CellContent> cells = sheets.get(sheet);
        return cells == null ? List.of() : new ArrayList<>(cells.keySet());
    }

    @Override
    public int maxRow(String sheet) {
        TreeMap<AddressCell, CellContent> cells = sheets.get(sheet);
        return cells == null || cells.isEmpty() ? 0 : cells.lastKey().row();
    }

    @Override
    public int maxColumn(String sheet) {
        TreeMap<AddressCell, CellContent> cells = sheets.get(sheet);
        int max = 0;
        if (cells != null)
            for (AddressCell c : cells.keySet())
                max = Math.max(max, c.column());
        return max;
    }

    @Override
    public DefinedName definedName(String name) {
        return names.get(DefinedName.key(name));
    }

    @Override
    public TableDefinition table(String name) {
        return tables.get(DefinedName.key(name));
    }

    @Override
    public Collection<DefinedName> definedNames() {
        return Collections.unmodifiableCollection(names.values());
    }

    @Override
    public Collection<TableDefinition> tables() {
        return Collections.unmodifiableCollection(tables.values());
    }
}
