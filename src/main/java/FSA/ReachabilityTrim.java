package FSA;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FSA.Model.StateDefinition;
import FSA.Model.Target;
import it.unimi.dsi.fastutil.objects.ObjectArrayFIFOQueue;

/**
 * Removal of states that cannot be reached from the start state.
 */
public final class ReachabilityTrim {
    private ReachabilityTrim() {}

    /**
     * Breadth-first search over transition targets; every member of a set target is followed.
     * @return reachable states in discovery order, the start state first
     */
    public static Set<String> accessibleStates(Map<String, StateDefinition> table, String start) {
        final Set<String> reached = new LinkedHashSet<>();
        final ObjectArrayFIFOQueue<String> queue = new ObjectArrayFIFOQueue<>();
        reached.add(start);
        queue.enqueue(start);

        while (!queue.isEmpty()) {
            String current = queue.dequeue();
            for (Target target : table.get(current).getTransitions().values()) {
                for (String next : target.states()) {
                    if (reached.add(next)) {
                        queue.enqueue(next);
                    }
                }
            }
        }
        return reached;
    }

    /**
     * @return new table holding only the accessible rows, in their original order
     */
    public static LinkedHashMap<String, StateDefinition> trim(Map<String, StateDefinition> table, String start) {
        final Set<String> reached = accessibleStates(table, start);
        final LinkedHashMap<String, StateDefinition> out = new LinkedHashMap<>();
        for (Map.Entry<String, StateDefinition> e : table.entrySet()) {
            if (reached.contains(e.getKey())) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }
}
