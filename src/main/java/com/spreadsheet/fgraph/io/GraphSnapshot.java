package com.spreadsheet.fgraph.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

import com.spreadsheet.fgraph.api.NodeKind;

/**
 * POJO representation of a session's graph: enough to rebuild every node with
 * its cached value and its edges, without the original workbook.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class GraphSnapshot {
    public static final String FORMAT_VERSION = "1";

    private String name;
    private String version = FORMAT_VERSION;
    private List<String> sheets;
    private Map<String, String> definedNames;
    private List<WorkbookDefinition.TableDef> tables;
    private List<NodeEntry> nodes;

    /** One graph node. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeEntry {
        private String address;
        private NodeKind kind;
        private String formula;
        private SnapshotValue value;
        private List<String> precedents;
        /** Range cells in value order; may repeat where areas overlap. */
        private List<String> cells;
        private boolean evaluated;
        private int rows, columns;
    }
}
