package com.spreadsheet.fgraph.fn;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.spreadsheet.fgraph.api.ExcelErrorException;
import com.spreadsheet.fgraph.fn.builtin.InformationFunctions;
import com.spreadsheet.fgraph.fn.builtin.LogicalFunctions;
import com.spreadsheet.fgraph.fn.builtin.LookupFunctions;
import com.spreadsheet.fgraph.fn.builtin.MathFunctions;
import com.spreadsheet.fgraph.fn.builtin.TextFunctions;

/**
 * Registry mapping function names to implementations.
 *
 * Names are case-insensitive and the {@code _xlfn.} prefix that newer
 * workbooks put in front of recent functions is ignored.
 */
public final class FunctionRegistry {
    private static final String XLFN_PREFIX = "_XLFN.";

    private final Map<String, ExcelFunction> functions = new TreeMap<>();

    /** Creates a registry pre-populated with the built-in library. */
    public FunctionRegistry() {
        registerBuiltIns();
    }

    private FunctionRegistry(boolean builtIns) {
        if (builtIns)
            registerBuiltIns();
    }

    /** Creates a registry with no functions at all. */
    public static FunctionRegistry empty() {
        return new FunctionRegistry(false);
    }

    /** Registers or replaces a function. */
    public FunctionRegistry register(String name, ExcelFunction function) {
        if (function == null)
            throw new IllegalArgumentException("Function for " + name + " must not be null");
        functions.put(key(name), function);
        return this;
    }

    public boolean contains(String name) {
        return functions.containsKey(key(name));
    }

    /** Registered names, upper case and sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    /**
     * Invokes a function. An {@link ExcelErrorException} raised by the function
     * is returned as its error value; any other exception propagates.
     *
     * @throws FunctionNotImplementedException if the name is unknown
     */
    public Object invoke(String name, Object[] args) {
        ExcelFunction fn = functions.get(key(name));
        if (fn == null)
            throw new FunctionNotImplementedException(name);
        try {
            return fn.apply(args);
        } catch (ExcelErrorException e) {
            return e.error();
        }
    }

    private static String key(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        return upper.startsWith(XLFN_PREFIX) ? upper.substring(XLFN_PREFIX.length()) : upper;
    }

    private void registerBuiltIns() {
        MathFunctions.register(this);
        LogicalFunctions.register(this);
        TextFunctions.register(this);
        InformationFunctions.register(this);
        LookupFunctions.register(this);
    }
}
