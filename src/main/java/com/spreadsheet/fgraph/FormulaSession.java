package com.spreadsheet.fgraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.AddressRange;
import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.address.DefinedName;
import com.spreadsheet.fgraph.address.TableDefinition;
import com.spreadsheet.fgraph.api.EvaluationListener;
import com.spreadsheet.fgraph.api.Node;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.engine.ConvergenceWarning;
import com.spreadsheet.fgraph.engine.EvaluationConfig;
import com.spreadsheet.fgraph.engine.Evaluator;
import com.spreadsheet.fgraph.engine.NodeFactory;
import com.spreadsheet.fgraph.engine.NodeStore;
import com.spreadsheet.fgraph.engine.Resolution;
import com.spreadsheet.fgraph.fn.FunctionRegistry;
import com.spreadsheet.fgraph.focus.FocusOptions;
import com.spreadsheet.fgraph.focus.FocusResult;
import com.spreadsheet.fgraph.focus.ModelFocuser;
import com.spreadsheet.fgraph.formula.FormulaParser;
import com.spreadsheet.fgraph.io.GraphSnapshot;
import com.spreadsheet.fgraph.io.SnapshotValue;
import com.spreadsheet.fgraph.io.WorkbookDefinition;
import com.spreadsheet.fgraph.node.CachedNode;
import com.spreadsheet.fgraph.node.ConstantNode;
import com.spreadsheet.fgraph.node.FormulaNode;
import com.spreadsheet.fgraph.node.RangeNode;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;
import com.spreadsheet.fgraph.source.WorkbookSource;
import com.spreadsheet.fgraph.util.CalcValidator;
import com.spreadsheet.fgraph.util.CompositeEvaluationListener;
import com.spreadsheet.fgraph.util.EvaluationProfileListener;
import com.spreadsheet.fgraph.util.GraphExport;
import com.spreadsheet.fgraph.util.ValidationReport;
import com.spreadsheet.fgraph.util.ValueTree;

/**
 * A compiled view of one workbook: the node store, the evaluator and the
 * function registry, built incrementally as addresses are resolved.
 *
 * <p>
 * Addresses are given as text. Unqualified addresses refer to the first sheet
 * of the workbook, and a defined name that refers to cells can be used in
 * place of an address.
 *
 * <p>
 * Not thread-safe. Use one session per thread, for example by reloading a
 * {@link #snapshot()} with {@link #fromSnapshot}.
 */
public class FormulaSession {
    private static final Logger log = LogManager.getLogger(FormulaSession.class);

    private final WorkbookSource source;
    private final FunctionRegistry functions;
    private final NodeStore store;
    private final NodeFactory factory;
    private final Evaluator evaluator;
    private final CompositeEvaluationListener listeners = new CompositeEvaluationListener();

    public FormulaSession(WorkbookSource source) {
        this(source, new FunctionRegistry(), EvaluationConfig.DEFAULT);
    }

    public FormulaSession(WorkbookSource source, FunctionRegistry functions, EvaluationConfig config) {
        this.source = source;
        this.functions = functions;
        this.store = new NodeStore();
        this.factory = new NodeFactory(store, source);
        this.evaluator = new Evaluator(store, factory, functions, config);
        log.debug("Session opened on workbook '{}' ({})", source.name(), config);
    }

    /**
     * Parses address text: a defined name referring to cells, or a cell or range
     * reference, sheet-qualified or on the first sheet.
     *
     * @throws com.spreadsheet.fgraph.address.AddressException on malformed text
     */
    public Address address(String text) {
        DefinedName name = source.definedName(text);
        if (name != null && !name.isFormula())
            return name.reference(defaultSheet());
        return Addresses.parse(text, defaultSheet());
    }

    private String defaultSheet() {
        Collection<String> sheets = source.sheetNames();
        return sheets.isEmpty() ? null : sheets.iterator().next();
    }

    // ── Evaluation ──

    /**
     * Returns the value at the address, computing whatever is dirty. Throws
     * {@link com.spreadsheet.fgraph.engine.CircularReferenceException} on a
     * cycle unless iterative solving is on.
     */
    public Object resolve(String address) {
        return evaluator.resolve(address(address));
    }

    public Object resolve(Address address) {
        return evaluator.resolve(address);
    }

    /** Resolves with iterative cycle solving enabled for this call. */
    public Object resolve(String address, int maxIterations, double tolerance) {
        return evaluator.resolve(address(address), maxIterations, tolerance);
    }

    /** Resolves and reports cycles that did not converge. */
    public Resolution resolveDetailed(String address) {
        return evaluator.resolveDetailed(address(address));
    }

    public Resolution resolveDetailed(Address address) {
        return evaluator.resolveDetailed(address);
    }

    /**
     * Assigns a value to a cell or range; dependents are recomputed on their
     * next resolve.
     */
    public void setValue(String address, Object value) {
        evaluator.setValue(address(address), value);
    }

    public void setValue(Address address, Object value) {
        evaluator.setValue(address, value);
    }

    /** Marks the node and its dependents dirty. */
    public int invalidate(String address) {
        return evaluator.invalidate(address(address));
    }

    /** Recomputes every formula and range node. */
    public List<ConvergenceWarning> recalculate() {
        return evaluator.recalculate();
    }

    // ── Focusing ──

    public FocusResult focus(Collection<String> inputs, Collection<String> outputs) {
        return focus(inputs, outputs, FocusOptions.DEFAULT);
    }

    /**
     * Reduces the graph to the nodes needed to recompute {@code outputs} after
     * changes to {@code inputs}.
     *
     * @see ModelFocuser#focus
     */
    public FocusResult focus(Collection<String> inputs, Collection<String> outputs, FocusOptions options) {
        return new ModelFocuser(store, factory, evaluator).focus(addresses(inputs), addresses(outputs), options);
    }

    private List<Address> addresses(Collection<String> texts) {
        List<Address> out = new ArrayList<>(texts.size());
        for (String t : texts)
            out.add(address(t));
        return out;
    }

    // ── Graph access ──

    /** Every node built so far, in creation order. */
    public Collection<Node> nodes() {
        return store.nodes();
    }

    /** The node at the address, or null if it has not been built. */
    public Node node(String address) {
        return store.get(address(address));
    }

    public Set<Address> precedents(String address) {
        return store.precedents(address(address));
    }

    /** Addresses of the nodes that read the given address. */
    public Set<Address> successors(String address) {
        return store.successors(address(address));
    }

    public int size() {
        return store.size();
    }

    // ── Diagnostics ──

    /** Resolves the address, then lists it with its precedents and their values. */
    public ValueTree valueTree(String address) {
        Address a = address(address);
        evaluator.resolve(a);
        return new ValueTree(store, a);
    }

    public GraphExport export() {
        return new GraphExport(store);
    }

    /** Compares every formula cell with the workbook's cached values. */
    public ValidationReport validateCalcs() {
        return validateCalcs(List.of(), CalcValidator.DEFAULT_TOLERANCE);
    }

    /**
     * Compares the formula cells feeding {@code outputs} with the workbook's
     * cached values. An empty collection checks every formula cell.
     */
    public ValidationReport validateCalcs(Collection<String> outputs, double tolerance) {
        return new CalcValidator(store, factory, evaluator).validate(addresses(outputs), tolerance);
    }

    /**
     * Adds a listener. Listeners are called synchronously from inside
     * resolution.
     */
    public void addListener(EvaluationListener listener) {
        listeners.add(listener);
        evaluator.setListener(listeners);
    }

    public void removeListener(EvaluationListener listener) {
        listeners.remove(listener);
        if (listeners.size() == 0)
            evaluator.setListener(null);
    }

    /**
     * Enables per-node profiling. Use the returned listener to dump statistics.
     */
    public EvaluationProfileListener enableProfiling() {
        EvaluationProfileListener profile = new EvaluationProfileListener();
        addListener(profile);
        return profile;
    }

    // ── Accessors ──

    public WorkbookSource source() {
        return source;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public EvaluationConfig config() {
        return evaluator.config();
    }

    public void setConfig(EvaluationConfig config) {
        evaluator.setConfig(config);
    }

    // ── Persistence ──

    /**
     * Captures every node with its cached value and edges, plus the workbook's
     * sheets, names and tables.
     */
    public GraphSnapshot snapshot() {
        GraphSnapshot snap = new GraphSnapshot();
        snap.setName(source.name());
        snap.setSheets(new ArrayList<>(source.sheetNames()));
        Map<String, String> names = new LinkedHashMap<>();
        for (DefinedName n : source.definedNames())
            names.put(n.name(), n.body());
        snap.setDefinedNames(names);
        List<WorkbookDefinition.TableDef> tables = new ArrayList<>();
        for (TableDefinition t : source.tables()) {
            WorkbookDefinition.TableDef def = new WorkbookDefinition.TableDef();
            def.setName(t.name());
            def.setRange(t.range().address());
            def.setHeaderRows(t.headerRows());
            def.setColumns(t.columns());
            tables.add(def);
        }
        snap.setTables(tables);

        List<GraphSnapshot.NodeEntry> entries = new ArrayList<>(store.size());
        for (Node n : store.nodes()) {
            GraphSnapshot.NodeEntry e = new GraphSnapshot.NodeEntry();
            e.setAddress(n.address().address());
            e.setKind(n.kind());
            e.setFormula(n.formula());
            e.setEvaluated(!n.isDirty());
            if (!n.isDirty())
                e.setValue(SnapshotValue.of(n.value()));
            List<String> precedents = new ArrayList<>(n.precedents().size());
            for (Address p : n.precedents())
                precedents.add(p.address());
            e.setPrecedents(precedents);
            if (n instanceof RangeNode r) {
                e.setRows(r.rows());
                e.setColumns(r.columns());
                List<String> cells = new ArrayList<>(r.cells().size());
                for (AddressCell c : r.cells())
                    cells.add(c.address());
                e.setCells(cells);
            }
            entries.add(e);
        }
        snap.setNodes(entries);
        log.info("Captured snapshot of '{}': {} nodes, {} edges", source.name(), store.size(), store.edgeCount());
        return snap;
    }

    /**
     * Rebuilds a session from a snapshot. Evaluated nodes come back clean with
     * their cached values; formulas are recompiled so edges and later
     * recomputation behave as before. Cells that were never built read as
     * blank.
     */
    public static FormulaSession fromSnapshot(GraphSnapshot snap, FunctionRegistry functions,
            EvaluationConfig config) {
        InMemoryWorkbook wb = new InMemoryWorkbook(snap.getName() == null ? "snapshot" : snap.getName());
        if (snap.getSheets() != null)
            snap.getSheets().forEach(wb::addSheet);
        if (snap.getDefinedNames() != null)
            snap.getDefinedNames().forEach(wb::defineName);
        if (snap.getTables() != null)
            for (WorkbookDefinition.TableDef t : snap.getTables())
                wb.addTable(new TableDefinition(t.getName(), AddressRange.parse(t.getRange(), null),
                        t.getHeaderRows(), t.getColumns()));

        List<GraphSnapshot.NodeEntry> entries = snap.getNodes() == null ? List.of() : snap.getNodes();
        for (GraphSnapshot.NodeEntry e : entries) {
            Address a = Addresses.parse(e.getAddress(), null);
            if (!(a instanceof AddressCell cell))
                continue;
            if (e.getKind() == NodeKind.FORMULA)
                wb.setFormula(cell.address(), e.getFormula(), e.isEvaluated() ? valueOf(e) : null);
            else if (e.getKind() == NodeKind.CONSTANT)
                wb.setLiteral(cell, valueOf(e));
        }

        FormulaSession session = new FormulaSession(wb, functions, config);
        for (GraphSnapshot.NodeEntry e : entries)
            session.store.add(rebuild(e, wb));
        log.info("Restored snapshot of '{}': {} nodes, {} edges", wb.name(), session.store.size(),
                session.store.edgeCount());
        return session;
    }

    private static Node rebuild(GraphSnapshot.NodeEntry e, InMemoryWorkbook wb) {
        Address a = Addresses.parse(e.getAddress(), null);
        if (e.getKind() == NodeKind.CONSTANT)
            return new ConstantNode(a, valueOf(e));
        CachedNode node = switch (e.getKind()) {
            case FORMULA -> new FormulaNode((AddressCell) a,
                    FormulaParser.compile(e.getFormula(), (AddressCell) a, wb));
            case RANGE -> new RangeNode((AddressRange) a, rangeCells(e), e.getRows(), e.getColumns());
            default -> throw new IllegalArgumentException(
                    "Unknown node kind " + e.getKind() + " at " + e.getAddress());
        };
        if (e.isEvaluated())
            node.restore(valueOf(e));
        return node;
    }

    private static List<AddressCell> rangeCells(GraphSnapshot.NodeEntry e) {
        List<AddressCell> cells = new ArrayList<>();
        // older snapshots carry only the de-duplicated precedents
        List<String> listed = e.getCells() != null ? e.getCells() : e.getPrecedents();
        for (String p : listed)
            cells.add(AddressCell.parse(p, null));
        return cells;
    }

    private static Object valueOf(GraphSnapshot.NodeEntry e) {
        return e.getValue() == null ? null : e.getValue().toValue();
    }
}
