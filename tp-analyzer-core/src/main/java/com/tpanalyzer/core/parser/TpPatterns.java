package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.SymbolKind;
import com.tpanalyzer.core.model.SymbolRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared regex patterns for teach pendant program text.
 *
 * <p>Patterns are compiled once at class loading time and shared by the segment parsers
 * and the analysis steps that look into instruction text.
 */
public final class TpPatterns {

    /**
     * Register or signal reference such as {@code R[90:Program gestart]}, {@code PR[1,2]} or
     * {@code DO[101]}. Groups: prefix, index, optional name.
     */
    public static final Pattern SYMBOL_REF = Pattern.compile(
        "\\b(PR|DI|DO|RI|RO|GI|GO|AI|AO|UI|UO|SI|SO|R|F|M)\\[(\\d+)(?:,\\d+)?(?::([^\\]]*))?\\]");

    /**
     * Label reference {@code LBL[n]} or {@code LBL[n:name]}. Groups: number, optional name.
     */
    public static final Pattern LABEL_REF = Pattern.compile("LBL\\[(\\d+)(?::([^\\]]*))?\\]");

    /**
     * Pendant statement number prefix {@code "  12:"} at the start of a statement.
     */
    public static final Pattern STATEMENT_PREFIX = Pattern.compile("^\\s*(\\d+)\\s*:");

    private static final Pattern ASSIGNMENT_AFTER_REF = Pattern.compile("^\\s*=(?!=)");

    private TpPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Extracts every register and signal reference from a statement.
     *
     * <p>The reference that opens the statement and is followed by {@code =} is the
     * assignment target and is marked {@code assigned}; all others are reads.
     *
     * @param statement statement text without the pendant prefix
     * @return references in textual order
     */
    public static List<SymbolRef> extractSymbolRefs(String statement) {
        List<SymbolRef> refs = new ArrayList<>();
        if (statement == null || statement.isEmpty()) {
            return refs;
        }

        Matcher matcher = SYMBOL_REF.matcher(statement);
        while (matcher.find()) {
            Optional<SymbolKind> kind = SymbolKind.fromPrefix(matcher.group(1));
            if (kind.isEmpty()) {
                continue;
            }
            boolean assigned = matcher.start() == 0
                && ASSIGNMENT_AFTER_REF.matcher(statement.substring(matcher.end())).find();
            Integer index = parseIndex(matcher.group(2));
            if (index == null) {
                // not addressable on any controller, so not a symbol
                continue;
            }
            refs.add(new SymbolRef(kind.get(), index, matcher.group(3), assigned));
        }
        return refs;
    }

    private static Integer parseIndex(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
