package FSA;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Errors.AmbiguousTransitionException;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion between {@link Automaton} and AutomataLib acceptors.
 * AutomataLib state ids follow the row order of the automaton.
 */
public final class AutomataLibConverter {
    private AutomataLibConverter() {}

    public static Alphabet<Symbol> alphabet(Automaton automaton) {
        return Alphabets.fromCollection(automaton.getAlphabet());
    }

    /**
     * Undefined transitions stay undefined in the result, so the DFA may be partial.
     * @throws AmbiguousTransitionException if a row has more than one target for a symbol
     */
    public static CompactDFA<Symbol> toCompactDFA(Automaton automaton) {
        final Alphabet<Symbol> alphabet = alphabet(automaton);
        final Map<String, StateDefinition> table = automaton.getDefinition();
        final CompactDFA<Symbol> dfa = new CompactDFA<>(alphabet, table.size());
        final Object2IntMap<String> ids = addStates(table, dfa::addState);
        dfa.setInitialState(ids.getInt(automaton.getStartState()));

        for (Map.Entry<String, StateDefinition> e : table.entrySet()) {
            int id = ids.getInt(e.getKey());
            for (Map.Entry<Symbol, Target> t : e.getValue().getTransitions().entrySet()) {
                String succ = t.getValue().single();
                if (succ == null) {
                    throw new AmbiguousTransitionException(e.getKey(), t.getKey(), t.getValue().states());
                }
                dfa.setTransition(id, alphabet.getSymbolIndex(t.getKey()), ids.getInt(succ));
            }
        }
        return dfa;
    }

    public static CompactNFA<Symbol> toCompactNFA(Automaton automaton) {
        final Alphabet<Symbol> alphabet = alphabet(automaton);
        final Map<String, StateDefinition> table = automaton.getDefinition();
        final CompactNFA<Symbol> nfa = new CompactNFA<>(alphabet, table.size());
        final Object2IntMap<String> ids = addStates(table, nfa::addState);
        nfa.setInitial(ids.getInt(automaton.getStartState()), true);

        for (Map.Entry<String, StateDefinition> e : table.entrySet()) {
            int id = ids.getInt(e.getKey());
            for (Map.Entry<Symbol, Target> t : e.getValue().getTransitions().entrySet()) {
                int symbolIdx = alphabet.getSymbolIndex(t.getKey());
                for (String succ : t.getValue().states()) {
                    nfa.addTransition(id, symbolIdx, ids.getInt(succ));
                }
            }
        }
        return nfa;
    }

    private static Object2IntMap<String> addStates(Map<String, StateDefinition> table, StateAdder adder) {
        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>(table.size());
        for (Map.Entry<String, StateDefinition> e : table.entrySet()) {
            ids.put(e.getKey(), adder.addState(e.getValue().isAccept()));
        }
        return ids;
    }

    @FunctionalInterface
    private interface StateAdder {
        int addState(boolean accepting);
    }

    /**
     * Import a DFA. States are named S&lt;k&gt; in the order of {@link DFA#getStates()}.
     * @param inputs - symbols to read transitions for; must be coercible by {@link Symbol#of(Object)}
     */
    public static <S, I> Automaton fromDFA(DFA<S, I> dfa, Collection<? extends I> inputs) {
        final Object2IntMap<S> ids = stateIds(dfa.getStates());
        final S init = dfa.getInitialState();
        final Map<String, StateDefinition> definition = new LinkedHashMap<>();
        for (S s : dfa.getStates()) {
            StateDefinition.Builder row = StateDefinition.builder()
                .start(s.equals(init))
                .accept(dfa.isAccepting(s));
            for (I i : inputs) {
                S succ = dfa.getSuccessor(s, i);
                if (succ != null) {
                    row.on(Symbol.of(i), Target.of(Normalizer.stateName(ids.getInt(succ))));
                }
            }
            definition.put(Normalizer.stateName(ids.getInt(s)), row.build());
        }
        return new Automaton(definition);
    }

    /**
     * Import an NFA with exactly one initial state. A symbol with several successors becomes a sorted set target.
     */
    public static <S, I> Automaton fromNFA(NFA<S, I> nfa, Collection<? extends I> inputs) {
        final Object2IntMap<S> ids = stateIds(nfa.getStates());
        final Set<S> inits = nfa.getInitialStates();
        final Map<String, StateDefinition> definition = new LinkedHashMap<>();
        for (S s : nfa.getStates()) {
            StateDefinition.Builder row = StateDefinition.builder()
                .start(inits.contains(s))
                .accept(nfa.isAccepting(s));
            for (I i : inputs) {
                Collection<S> succs = nfa.getTransitions(s, i);
                if (succs == null || succs.isEmpty()) {
                    continue;
                }
                List<String> names = new ArrayList<>(succs.size());
                for (S t : succs) {
                    names.add(Normalizer.stateName(ids.getInt(t)));
                }
                row.on(Symbol.of(i), Target.union(names));
            }
            definition.put(Normalizer.stateName(ids.getInt(s)), row.build());
        }
        return new Automaton(definition);
    }

    private static <S> Object2IntMap<S> stateIds(Collection<S> states) {
        final Object2IntMap<S> ids = new Object2IntOpenHashMap<>(states.size());
        int next = 0;
        for (S s : states) {
            ids.put(s, next++);
        }
        return ids;
    }
}
