package FSA;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Myhill-Nerode table filling over a trimmed, normalized table S0..S(n-1).
 * A pair (i, j) is marked once some word separates the two states; unmarked pairs are merged.
 */
public final class TableFillingMinimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TableFillingMinimizer.class);
    static final int NO_TRANSITION = -1;

    private TableFillingMinimizer() {}

    /**
     * Result of quotienting: the reduced table (not yet renormalized) and where every old state went.
     */
    public record Quotient(LinkedHashMap<String, StateDefinition> table, Map<String, String> representatives) { }

    /**
     * @param normalized - table whose keys are exactly S0..S(n-1)
     * @return the quotient automaton table
     * @throws IllegalStateException if the table is not normalized or has a multi-target row
     */
    public static Quotient minimize(Map<String, StateDefinition> normalized) {
        final int n = normalized.size();
        final StateDefinition[] rows = new StateDefinition[n];
        for (Map.Entry<String, StateDefinition> e : normalized.entrySet()) {
            int idx = checkIndex(Normalizer.indexOf(e.getKey()), n, e.getKey());
            rows[idx] = e.getValue();
        }

        final List<Symbol> alphabet = alphabet(normalized.values());
        final int[][] succ = createSuccArr(rows, alphabet);

        final boolean[][] table = initialTable(rows);
        final int passes = fill(table, succ);
        final List<IntList> classes = equivalenceClasses(table);
        LOGGER.debug("Table filling over {} states and {} symbols: {} passes, {} classes",
            n, alphabet.size(), passes, classes.size());
        return quotient(rows, classes);
    }

    static List<Symbol> alphabet(Iterable<StateDefinition> rows) {
        final Set<Symbol> symbols = new TreeSet<>();
        for (StateDefinition row : rows) {
            symbols.addAll(row.getTransitions().keySet());
        }
        return new ArrayList<>(symbols);
    }

    // succ[p][a] is the target index of state p on symbol a, or NO_TRANSITION
    static int[][] createSuccArr(StateDefinition[] rows, List<Symbol> alphabet) {
        final int n = rows.length;
        final Object2IntMap<Symbol> symbolIndex = new Object2IntOpenHashMap<>();
        for (int a = 0; a < alphabet.size(); a++) {
            symbolIndex.put(alphabet.get(a), a);
        }

        final int[][] succ = new int[n][alphabet.size()];
        for (int p = 0; p < n; p++) {
            Arrays.fill(succ[p], NO_TRANSITION);
            for (Map.Entry<Symbol, Target> e : rows[p].getTransitions().entrySet()) {
                String target = e.getValue().single();
                if (target == null) {
                    throw new IllegalStateException("State S" + p + " has " + e.getValue().size()
                        + " targets on symbol '" + e.getKey() + "'; table filling requires a deterministic automaton");
                }
                String where = "S" + p + " on '" + e.getKey() + "'";
                succ[p][symbolIndex.getInt(e.getKey())] = checkIndex(Normalizer.indexOf(target), n, where);
            }
        }
        return succ;
    }

    /**
     * Pairs with exactly one accepting member are distinguishable by the empty word.
     */
    static boolean[][] initialTable(StateDefinition[] rows) {
        final int n = rows.length;
        final boolean[][] table = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < i; j++) {
                if (rows[i].isAccept() != rows[j].isAccept()) {
                    table[i][j] = table[j][i] = true;
                }
            }
        }
        return table;
    }

    /**
     * Propagate marks backwards through transitions until nothing changes.
     * A transition defined on only one side of a pair marks the pair.
     * @return number of passes, including the final pass without changes
     */
    static int fill(boolean[][] table, int[][] succ) {
        final int n = table.length;
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            passes++;
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < i; j++) {
                    if (!table[i][j] && distinguishedBySuccessors(table, succ[i], succ[j])) {
                        table[i][j] = table[j][i] = true;
                        changed = true;
                    }
                }
            }
        }
        return passes;
    }

    private static boolean distinguishedBySuccessors(boolean[][] table, int[] succI, int[] succJ) {
        for (int a = 0; a < succI.length; a++) {
            int x = succI[a];
            int y = succJ[a];
            if (x == NO_TRANSITION && y == NO_TRANSITION) {
                continue;
            }
            if (x == NO_TRANSITION || y == NO_TRANSITION || table[x][y]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Group every state with all later states it is not distinguished from.
     * Indistinguishability is an equivalence after the fixpoint, so grouping by lowest member suffices.
     */
    static List<IntList> equivalenceClasses(boolean[][] table) {
        final int n = table.length;
        final boolean[] assigned = new boolean[n];
        final List<IntList> classes = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (assigned[i]) {
                continue;
            }
            IntList cls = new IntArrayList();
            cls.add(i);
            assigned[i] = true;
            for (int j = i + 1; j < n; j++) {
                if (!table[i][j]) {
                    cls.add(j);
                    assigned[j] = true;
                }
            }
            classes.add(cls);
        }
        return classes;
    }

    static Quotient quotient(StateDefinition[] rows, List<IntList> classes) {
        final Map<String, String> representative = new HashMap<>();
        final boolean[] keep = new boolean[rows.length];
        final boolean[] classStart = new boolean[rows.length];
        for (IntList cls : classes) {
            int rep = cls.getInt(0);
            keep[rep] = true;
            for (int k = 0; k < cls.size(); k++) {
                int member = cls.getInt(k);
                representative.put(Normalizer.stateName(member), Normalizer.stateName(rep));
                classStart[rep] |= rows[member].isStart();
            }
        }

        final LinkedHashMap<String, StateDefinition> out = new LinkedHashMap<>();
        for (int i = 0; i < rows.length; i++) {
            if (keep[i]) {
                StateDefinition row = rows[i].renameTargets(representative::get);
                if (row.isStart() != classStart[i]) {
                    row = row.withStart(classStart[i]);
                }
                out.put(Normalizer.stateName(i), row);
            }
        }
        return new Quotient(out, representative);
    }

    private static int checkIndex(int idx, int n, String where) {
        if (idx < 0 || idx >= n) {
            throw new IllegalStateException("State index " + idx + " outside 0.." + (n - 1) + " at " + where);
        }
        return idx;
    }
}
