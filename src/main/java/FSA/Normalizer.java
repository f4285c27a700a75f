package FSA;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import FSA.Model.StateDefinition;

/**
 * Canonical renaming of states to S0..S(n-1).
 */
public final class Normalizer {
    public static final String STATE_PREFIX = "S";
    private static final Pattern NUMBERED = Pattern.compile("S([0-9]+)");

    private Normalizer() {}

    public static String stateName(int index) {
        return STATE_PREFIX + index;
    }

    /**
     * Rename map for the given states, in iteration order.
     * States named S&lt;digits&gt; rank by their number; all others follow in their original order.
     * The sort is stable, so equal numbers (S1, S01) keep their relative order.
     */
    public static Map<String, String> renameMap(Iterable<String> states) {
        List<String> order = new ArrayList<>();
        Map<String, Long> suffix = new HashMap<>();
        for (String s : states) {
            order.add(s);
            suffix.put(s, numericSuffix(s));
        }
        order.sort(Comparator.comparingLong(suffix::get));

        Map<String, String> mapping = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            mapping.put(order.get(i), stateName(i));
        }
        return mapping;
    }

    /**
     * Apply a rename map to every key and every transition target.
     * @return new table ordered by the new state index
     */
    public static LinkedHashMap<String, StateDefinition> rename(Map<String, StateDefinition> table,
                                                               Map<String, String> mapping) {
        StateDefinition[] rows = new StateDefinition[table.size()];
        for (Map.Entry<String, StateDefinition> e : table.entrySet()) {
            rows[indexOf(mapping.get(e.getKey()))] = e.getValue().renameTargets(mapping::get);
        }
        LinkedHashMap<String, StateDefinition> result = new LinkedHashMap<>();
        for (int i = 0; i < rows.length; i++) {
            result.put(stateName(i), rows[i]);
        }
        return result;
    }

    /**
     * @return the index of a canonical name S&lt;i&gt;
     * @throws IllegalStateException if the name is not canonical
     */
    public static int indexOf(String canonicalName) {
        Matcher m = canonicalName == null ? null : NUMBERED.matcher(canonicalName);
        if (m == null || !m.matches()) {
            throw new IllegalStateException("Not a normalized state name: " + canonicalName);
        }
        return Integer.parseInt(m.group(1));
    }

    private static long numericSuffix(String state) {
        Matcher m = NUMBERED.matcher(state);
        if (m.matches() && m.group(1).length() < 19) {
            return Long.parseLong(m.group(1));
        }
        return Long.MAX_VALUE;
    }
}
