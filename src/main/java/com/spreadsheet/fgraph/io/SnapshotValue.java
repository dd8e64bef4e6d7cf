package com.spreadsheet.fgraph.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.RangeValue;

/**
 * Typed JSON form of a cell value. Numbers are written by Jackson in shortest
 * round-trip form, so a reloaded double is bit-identical.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SnapshotValue {
    public enum Type {
        BLANK, NUMBER, TEXT, BOOLEAN, ERROR, RANGE
    }

    private Type type;
    private Double number;
    private String text;
    private Boolean bool;
    private String error;
    private Integer rows, columns;
    private List<SnapshotValue> values;

    public static SnapshotValue of(Object value) {
        SnapshotValue v = new SnapshotValue();
        if (value == null) {
            v.setType(Type.BLANK);
        } else if (value instanceof Double d) {
            v.setType(Type.NUMBER);
            v.setNumber(d);
        } else if (value instanceof String s) {
            v.setType(Type.TEXT);
            v.setText(s);
        } else if (value instanceof Boolean b) {
            v.setType(Type.BOOLEAN);
            v.setBool(b);
        } else if (value instanceof ExcelError e) {
            v.setType(Type.ERROR);
            v.setError(e.code());
            v.setText(e.detail());
        } else if (value instanceof RangeValue rv) {
            v.setType(Type.RANGE);
            v.setRows(rv.rows());
            v.setColumns(rv.columns());
            List<SnapshotValue> items = new ArrayList<>(rv.size());
            for (int i = 0; i < rv.size(); i++)
                items.add(of(rv.get(i)));
            v.setValues(items);
        } else {
            throw new IllegalArgumentException("Cannot snapshot value of type " + value.getClass().getName());
        }
        return v;
    }

    /** Converts back to an engine value. */
    public Object toValue() {
        if (type == null)
            return null;
        return switch (type) {
            case BLANK -> null;
            case NUMBER -> number;
            case TEXT -> text;
            case BOOLEAN -> bool;
            case ERROR -> {
                ExcelError e = ExcelError.fromCode(error);
                if (e == null)
                    throw new IllegalArgumentException("Unknown error code in snapshot: " + error);
                yield text == null ? e : e.withDetail(text);
            }
            case RANGE -> {
                Object[] items = new Object[values.size()];
                for (int i = 0; i < items.length; i++)
                    items[i] = values.get(i).toValue();
                yield new RangeValue(rows, columns, items);
            }
        };
    }
}
