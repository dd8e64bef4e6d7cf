package com.spreadsheet.fgraph.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a workbook description.
 *
 * <pre>
 * {"workbook": {"name": "model",
 *   "sheets": [{"name": "Inputs", "cells": {"A1": 100, "B1": "=A1*2"}, "cached": {"B1": 200}}],
 *   "names": {"Rate": "Inputs!$C$1"},
 *   "tables": [{"name": "Sales", "range": "Data!A1:C4", "headerRows": 1, "columns": ["Region", "Qty", "Amount"]}]}}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkbookDefinition {
    private WorkbookInfo workbook;

    /** The workbook itself. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class WorkbookInfo {
        private String name;
        private List<SheetDef> sheets;
        private Map<String, String> names;
        private List<TableDef> tables;
    }

    /** One sheet: cell contents keyed by coordinate, plus cached formula results. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SheetDef {
        private String name;
        private Map<String, Object> cells;
        private Map<String, Object> cached;
    }

    /** A table for structured references. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TableDef {
        private String name, range;
        private int headerRows = 1;
        private List<String> columns;
    }
}
