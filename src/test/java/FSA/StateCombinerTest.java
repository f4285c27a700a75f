package FSA;

import FSA.Errors.InvalidStateException;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static FSA.TestAutomata.row;

public class StateCombinerTest {
  @Test
  void testUnionAndCollapse() {
    Map<String, StateDefinition> def = new LinkedHashMap<>();
    def.put("S0", row(true, false, "S1", "S1"));
    def.put("S1", row(false, false, "S1", "S2"));
    def.put("S2", row(false, true, "S2", "S2"));
    Automaton fsa = new Automaton(def);

    Map<String, StateDefinition> combined = fsa.combineStates("S1", "S0");
    Assertions.assertEquals(1, combined.size());
    StateDefinition row = combined.get("{S0,S1}");
    Assertions.assertNotNull(row);
    Assertions.assertEquals(Target.of("S1"), row.getTarget(Symbol.of(0)));
    Assertions.assertEquals(Target.ofSet("S1", "S2"), row.getTarget(Symbol.of(1)));
    Assertions.assertTrue(row.isStart());
    Assertions.assertFalse(row.isAccept());
  }

  @Test
  void testCombineMinimizedWikipedia() {
    Automaton fsa = new Automaton(TestAutomata.wikipediaMinimized());
    Map<String, StateDefinition> expected = Map.of("{S1,S2}", StateDefinition.builder()
        .onAny(0, "S1", "S2").on(1, "S2").start(false).accept(true).build());
    Assertions.assertEquals(expected, fsa.combineStates("S1", "S2"));
  }

  @Test
  void testDoesNotModifyAutomaton() {
    Automaton fsa = new Automaton(TestAutomata.wikipedia());
    Map<String, StateDefinition> before = Map.copyOf(fsa.getDefinition());
    fsa.combineStates(List.of("S2", "S3", "S4"));
    Assertions.assertEquals(before, fsa.getDefinition());
    Assertions.assertEquals(6, fsa.size());
  }

  @Test
  void testMergesSetTargetsAndDisjointSymbols() {
    Map<String, StateDefinition> def = new LinkedHashMap<>();
    def.put("S0", StateDefinition.builder().onAny(0, "S2", "S1").on("x", "S0").start(true).accept(false).build());
    def.put("S1", StateDefinition.builder().onAny(0, "S1").on("y", "S2").start(false).accept(false).build());
    def.put("S2", StateDefinition.builder().start(false).accept(false).build());
    Automaton fsa = new Automaton(def);

    StateDefinition row = fsa.combineStates("S0", "S1").get("{S0,S1}");
    Assertions.assertEquals(Target.ofSet("S1", "S2"), row.getTarget(Symbol.of(0)));
    Assertions.assertEquals(Target.of("S0"), row.getTarget(Symbol.of("x")));
    Assertions.assertEquals(Target.of("S2"), row.getTarget(Symbol.of("y")));
    Assertions.assertEquals(List.of(Symbol.of(0), Symbol.of("x"), Symbol.of("y")),
        List.copyOf(row.getTransitions().keySet()));
  }

  @Test
  void testSingleState() {
    Automaton fsa = new Automaton(TestAutomata.simpleNFA());
    StateDefinition row = fsa.combineStates("S0").get("{S0}");
    Assertions.assertEquals(Target.ofSet("S0", "S1"), row.getTarget(Symbol.of(1)));
    Assertions.assertTrue(row.isStart());
  }

  @Test
  void testInvalidArguments() {
    Automaton fsa = Automaton.createDivisibilityChecker(2, 3);
    InvalidStateException e = Assertions.assertThrows(InvalidStateException.class, () -> fsa.combineStates("S1", "S9"));
    Assertions.assertEquals("S9", e.getState());
    Assertions.assertThrows(IllegalArgumentException.class, () -> fsa.combineStates());
  }
}
