package com.spreadsheet.fgraph;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.spreadsheet.fgraph.engine.EvaluationConfig;
import com.spreadsheet.fgraph.fn.FunctionRegistry;
import com.spreadsheet.fgraph.io.GraphSnapshot;
import com.spreadsheet.fgraph.io.JsonGraphSerializer;
import com.spreadsheet.fgraph.io.JsonWorkbookLoader;
import com.spreadsheet.fgraph.source.WorkbookSource;

/**
 * FormulaGraph: spreadsheet formulas compiled into a lazily evaluated
 * dependency graph.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Nodes</b> are cells and ranges. A formula cell is compiled once, on
 * first reference.</li>
 * <li><b>Edges</b> run from each referenced address to the formula that reads
 * it.</li>
 * <li><b>Resolution</b> pulls values on demand and caches them; assigning an
 * input only marks its dependents dirty.</li>
 * <li><b>Focusing</b> cuts the graph down to what a chosen set of outputs
 * needs from a chosen set of inputs.</li>
 * </ul>
 *
 * <pre>
 * FormulaSession s = FormulaGraph.session(workbook);
 * s.setValue("A1", 150);
 * Object total = s.resolve("C1");
 * </pre>
 */
public final class FormulaGraph {
    private static final Logger log = LogManager.getLogger(FormulaGraph.class);

    /** Classpath resource read by {@link #loadConfig()}. */
    public static final String CONFIG_RESOURCE = "formulagraph.properties";

    private FormulaGraph() {
        // Prevent instantiation of utility class
    }

    /**
     * Opens a session with the built-in functions and the classpath
     * configuration.
     */
    public static FormulaSession session(WorkbookSource source) {
        return new FormulaSession(source, new FunctionRegistry(), loadConfig());
    }

    public static FormulaSession session(WorkbookSource source, EvaluationConfig config) {
        return new FormulaSession(source, new FunctionRegistry(), config);
    }

    /** Opens a session on a JSON workbook description. */
    public static FormulaSession open(Path workbookJson) throws IOException {
        return session(JsonWorkbookLoader.load(workbookJson));
    }

    /** Reloads a session saved with {@link #save}. */
    public static FormulaSession restore(Path snapshotJson) throws IOException {
        GraphSnapshot snapshot = JsonGraphSerializer.read(snapshotJson);
        return FormulaSession.fromSnapshot(snapshot, new FunctionRegistry(), loadConfig());
    }

    /** Writes the session's graph as a JSON snapshot. */
    public static void save(FormulaSession session, Path snapshotJson) throws IOException {
        JsonGraphSerializer.write(session.snapshot(), snapshotJson);
        log.info("Snapshot saved to {}", snapshotJson);
    }

    /**
     * Reads {@value #CONFIG_RESOURCE} from the classpath, falling back to
     * {@link EvaluationConfig#DEFAULT} when it is absent.
     */
    public static EvaluationConfig loadConfig() {
        try (InputStream in = FormulaGraph.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in == null)
                return EvaluationConfig.DEFAULT;
            Properties props = new Properties();
            props.load(in);
            EvaluationConfig config = EvaluationConfig.fromProperties(props);
            log.debug("Loaded {} from classpath: {}", CONFIG_RESOURCE, config);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, e);
        }
    }
}
