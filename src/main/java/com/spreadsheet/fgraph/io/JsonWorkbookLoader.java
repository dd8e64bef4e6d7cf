package com.spreadsheet.fgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.AddressRange;
import com.spreadsheet.fgraph.address.TableDefinition;
import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;

/**
 * Loads an {@link InMemoryWorkbook} from a JSON {@link WorkbookDefinition}.
 */
@Log4j2
public final class JsonWorkbookLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonWorkbookLoader() {
        // Utility class
    }

    /** Parses a JSON file into a workbook. */
    public static InMemoryWorkbook load(Path path) throws IOException {
        return build(MAPPER.readValue(path.toFile(), WorkbookDefinition.class));
    }

    /** Parses a JSON stream, e.g. a classpath resource. */
    public static InMemoryWorkbook load(InputStream in) throws IOException {
        return build(MAPPER.readValue(in, WorkbookDefinition.class));
    }

    /** Parses a JSON string into a workbook. */
    public static InMemoryWorkbook parse(String json) {
        try {
            return build(MAPPER.readValue(json, WorkbookDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid workbook JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Builds the workbook. String cells starting with {@code =} are formulas;
     * strings that spell an error code ({@code #N/A}) are error values.
     */
    public static InMemoryWorkbook build(WorkbookDefinition def) {
        WorkbookDefinition.WorkbookInfo info = def.getWorkbook();
        if (info == null)
            throw new IllegalArgumentException("Missing 'workbook' key");
        InMemoryWorkbook wb = new InMemoryWorkbook(info.getName() == null ? "workbook" : info.getName());

        int cells = 0;
        for (WorkbookDefinition.SheetDef sheet : listOf(info.getSheets())) {
            if (sheet.getName() == null || sheet.getName().isEmpty())
                throw new IllegalArgumentException("Sheet without a name in workbook " + wb.name());
            wb.addSheet(sheet.getName());
            for (Map.Entry<String, Object> e : mapOf(sheet.getCells()).entrySet()) {
                wb.set(AddressCell.parse(e.getKey(), sheet.getName()), literal(e.getValue()));
                cells++;
            }
            for (Map.Entry<String, Object> e : mapOf(sheet.getCached()).entrySet()) {
                AddressCell cell = AddressCell.parse(e.getKey(), sheet.getName());
                wb.setCached(cell.address(), literal(e.getValue()));
            }
        }
        for (Map.Entry<String, String> e : mapOf(info.getNames()).entrySet())
            wb.defineName(e.getKey(), e.getValue());
        for (WorkbookDefinition.TableDef t : listOf(info.getTables())) {
            AddressRange range = AddressRange.parse(t.getRange(), null);
            wb.addTable(new TableDefinition(t.getName(), range, t.getHeaderRows(), listOf(t.getColumns())));
        }
        log.info("Loaded workbook '{}': {} sheets, {} cells, {} names, {} tables", wb.name(), wb.sheetNames().size(),
                cells, wb.definedNames().size(), wb.tables().size());
        return wb;
    }

    private static Object literal(Object json) {
        if (json instanceof String s) {
            ExcelError error = ExcelError.fromCode(s);
            if (error != null)
                return error;
        }
        return json;
    }

    private static <T> List<T> listOf(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static <K, V> Map<K, V> mapOf(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }
}
