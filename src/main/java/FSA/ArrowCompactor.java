package FSA;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import FSA.Model.CompactedRow;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;

/**
 * Groups the symbols of each row by shared target, so a renderer draws one labelled arrow per target.
 */
public final class ArrowCompactor {
    private ArrowCompactor() {}

    public static Map<String, CompactedRow> compact(Map<String, StateDefinition> table, boolean addSpaces) {
        final String separator = addSpaces ? ", " : ",";
        final Map<String, CompactedRow> out = new LinkedHashMap<>();
        for (Map.Entry<String, StateDefinition> entry : table.entrySet()) {
            StateDefinition row = entry.getValue();

            // transitions are sorted by symbol, so every group comes out sorted as well
            Map<Target, List<Symbol>> groups = new LinkedHashMap<>();
            for (Map.Entry<Symbol, Target> t : row.getTransitions().entrySet()) {
                groups.computeIfAbsent(t.getValue(), k -> new ArrayList<>()).add(t.getKey());
            }

            Map<String, Target> arrows = new LinkedHashMap<>();
            for (Map.Entry<Target, List<Symbol>> g : groups.entrySet()) {
                List<String> labels = new ArrayList<>(g.getValue().size());
                for (Symbol s : g.getValue()) {
                    labels.add(s.toString());
                }
                arrows.put(String.join(separator, labels), g.getKey());
            }
            out.put(entry.getKey(), new CompactedRow(arrows, row.isStart(), row.isAccept()));
        }
        return out;
    }
}
