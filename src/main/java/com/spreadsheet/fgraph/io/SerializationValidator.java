package com.spreadsheet.fgraph.io;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

import com.spreadsheet.fgraph.FormulaSession;
import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.util.CalcValidator;

/**
 * Checks that a session survives a JSON round trip: the outputs are resolved
 * on the live session, the session is written and read back, the copy is
 * fully recalculated and the outputs are compared.
 */
@Log4j2
public final class SerializationValidator {
    public static final double TOLERANCE = 1e-9;

    /** An output whose reloaded value differs. */
    public record Mismatch(Object expected, Object actual) {
    }

    private SerializationValidator() {
        // Utility class
    }

    /** @return mismatching outputs; empty when the round trip is faithful */
    public static Map<Address, Mismatch> validate(FormulaSession session, Collection<String> outputs) {
        Map<Address, Object> expected = new LinkedHashMap<>();
        for (String o : outputs) {
            Address a = session.address(o);
            expected.put(a, session.resolve(a));
        }

        String json = JsonGraphSerializer.write(session.snapshot());
        FormulaSession reloaded = FormulaSession.fromSnapshot(JsonGraphSerializer.read(json), session.functions(),
                session.config());
        reloaded.recalculate();

        Map<Address, Mismatch> failures = new LinkedHashMap<>();
        for (Map.Entry<Address, Object> e : expected.entrySet()) {
            Object actual = reloaded.resolve(e.getKey());
            boolean same = e.getValue() == null ? actual == null
                    : actual != null && CalcValidator.agree(e.getValue(), actual, TOLERANCE);
            if (!same)
                failures.put(e.getKey(), new Mismatch(e.getValue(), actual));
        }
        if (failures.isEmpty())
            log.info("Serialization round trip verified for {} outputs ({} bytes)", expected.size(), json.length());
        else
            log.warn("Serialization round trip changed {} of {} outputs: {}", failures.size(), expected.size(),
                    failures.keySet());
        return failures;
    }
}
