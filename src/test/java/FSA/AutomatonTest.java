package FSA;

import FSA.Errors.AmbiguousTransitionException;
import FSA.Errors.InvalidTransitionException;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AutomatonTest {
  @Test
  void testDivisibilityCheckerStartsAtS0() {
    for (int base = 2; base < 5; base++) {
      for (int divisor = 1; divisor < 5; divisor++) {
        Automaton fsa = Automaton.createDivisibilityChecker(base, divisor);
        Assertions.assertEquals("S0", fsa.getState());
        Assertions.assertEquals("S0", fsa.getStartState());
        Assertions.assertTrue(fsa.isAccepting());
        Assertions.assertEquals(divisor, fsa.size());
        Assertions.assertEquals(base, fsa.getAlphabet().size());
      }
    }
  }

  @Test
  void testDivisibilityCheckerArguments() {
    IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
        () -> Automaton.createDivisibilityChecker(1, 3));
    Assertions.assertTrue(e.getMessage().contains("Base must be at least 2"));

    e = Assertions.assertThrows(IllegalArgumentException.class,
        () -> Automaton.createDivisibilityChecker(2, 0));
    Assertions.assertTrue(e.getMessage().contains("Divisor must be at least 1"));
  }

  @Test
  void testDivisibilityCheckerTransitions() {
    Automaton fsa = Automaton.createDivisibilityChecker(10, 7);
    StateDefinition s3 = fsa.getDefinition().get("S3");
    // (10 * 3 + 5) mod 7 = 0
    Assertions.assertEquals(Target.of("S0"), s3.getTarget(Symbol.of(5)));
    Assertions.assertFalse(s3.isStart());
    Assertions.assertFalse(s3.isAccept());

    for (int n = 0; n < 200; n++) {
      Assertions.assertEquals(n % 7 == 0, fsa.accepts(digits(n)), "n=" + n);
    }
  }

  private static List<Integer> digits(int n) {
    String s = Integer.toString(n);
    Integer[] out = new Integer[s.length()];
    for (int i = 0; i < s.length(); i++) {
      out[i] = s.charAt(i) - '0';
    }
    return List.of(out);
  }

  @Test
  void testThreeInBinary() {
    Assertions.assertTrue(Automaton.createDivisibilityChecker(2, 3).process(1, 1).isAccepting());
    Assertions.assertTrue(Automaton.createDivisibilityChecker(2, 3).process(0, 1, 1).isAccepting());
    Assertions.assertTrue(Automaton.createDivisibilityChecker(2, 3).process(List.of(1, 1)).isAccepting());
    Assertions.assertTrue(Automaton.createDivisibilityChecker(2, 3).process(1).process(1).isAccepting());
    Assertions.assertTrue(Automaton.createDivisibilityChecker(2, 3).process(new int[] {1, 1}).isAccepting());
    Assertions.assertTrue(Automaton.createDivisibilityChecker(2, 3).process("1", "1").isAccepting());
    Assertions.assertTrue(Automaton.createDivisibilityChecker(2, 3).process(List.of(1, List.of(1))).isAccepting());
  }

  @Test
  void testSimulationContinuesAcrossCalls() {
    Automaton fsa = Automaton.createDivisibilityChecker(2, 3);
    fsa.process(1);
    Assertions.assertEquals("S1", fsa.getState());
    Assertions.assertFalse(fsa.isAccepting());
    fsa.process(0);
    Assertions.assertEquals("S2", fsa.getState());
    fsa.process(1);
    // 101 = 5
    Assertions.assertEquals("S2", fsa.getState());

    fsa.reset();
    Assertions.assertEquals("S0", fsa.getState());
    Assertions.assertTrue(fsa.isAccepting());
  }

  @Test
  void testUndefinedSymbolKeepsPointer() {
    Automaton fsa = Automaton.createDivisibilityChecker(2, 3);
    InvalidTransitionException e = Assertions.assertThrows(InvalidTransitionException.class, () -> fsa.process(2));
    Assertions.assertEquals("S0", e.getState());
    Assertions.assertEquals(Symbol.of(2), e.getSymbol());
    Assertions.assertTrue(e.getMessage().contains("No transition defined"));
    Assertions.assertEquals("S0", fsa.getState());
    Assertions.assertTrue(fsa.isAccepting());

    // earlier symbols of the same call stay applied
    Assertions.assertThrows(InvalidTransitionException.class, () -> fsa.process(1, 2));
    Assertions.assertEquals("S1", fsa.getState());
    Assertions.assertFalse(fsa.isAccepting());
  }

  @Test
  void testUnsupportedSymbolTypeMovesNothing() {
    Automaton fsa = Automaton.createDivisibilityChecker(2, 3);
    Assertions.assertThrows(IllegalArgumentException.class, () -> fsa.process(1, 1.5));
    Assertions.assertEquals("S0", fsa.getState());
  }

  @Test
  void testAmbiguousTransition() {
    Automaton nfa = new Automaton(TestAutomata.simpleNFA());
    Assertions.assertFalse(nfa.isDeterministic());
    nfa.process(0);
    AmbiguousTransitionException e = Assertions.assertThrows(AmbiguousTransitionException.class, () -> nfa.process(1));
    Assertions.assertEquals("S0", e.getState());
    Assertions.assertEquals(List.of("S0", "S1"), e.getTargets());
    Assertions.assertEquals("S0", nfa.getState());
  }

  @Test
  void testSingletonSetIsDeterministic() {
    Map<String, StateDefinition> def = new LinkedHashMap<>();
    def.put("S0", StateDefinition.builder().onAny(0, "S1").start(true).accept(false).build());
    def.put("S1", StateDefinition.builder().start(false).accept(true).build());
    Automaton fsa = new Automaton(def);
    Assertions.assertTrue(fsa.isDeterministic());
    Assertions.assertTrue(fsa.process(0).isAccepting());
    Assertions.assertEquals("S1", fsa.getState());
  }

  @Test
  void testAcceptsDoesNotMovePointer() {
    Automaton fsa = Automaton.createDivisibilityChecker(2, 3);
    fsa.process(1);
    Assertions.assertTrue(fsa.accepts(List.of(1, 1)));
    Assertions.assertFalse(fsa.accepts(1, 0));
    Assertions.assertFalse(fsa.accepts(1, 2)); // undefined symbol rejects
    Assertions.assertEquals("S1", fsa.getState());
  }

  @Test
  void testCopyIsIndependent() {
    Automaton fsa = Automaton.createDivisibilityChecker(2, 3);
    Automaton copy = fsa.copy();
    copy.process(1);
    Assertions.assertEquals("S0", fsa.getState());
    Assertions.assertEquals("S1", copy.getState());
    Assertions.assertEquals(fsa.getDefinition(), copy.getDefinition());

    copy.minimize();
    Assertions.assertTrue(copy.isMinimized());
    Assertions.assertFalse(fsa.isMinimized());
  }

  @Test
  void testValueEquality() {
    Automaton a = new Automaton(TestAutomata.wikipedia());
    Automaton b = new Automaton(TestAutomata.wikipedia());
    Assertions.assertEquals(a, b);
    Assertions.assertEquals(a.hashCode(), b.hashCode());

    // the pointer does not take part
    b.process(1);
    Assertions.assertEquals(a, b);

    Assertions.assertNotEquals(a, b.minimize());
    Assertions.assertEquals(new Automaton(TestAutomata.wikipediaMinimized()), b);
    Assertions.assertNotEquals(Automaton.createDivisibilityChecker(2, 3), Automaton.createDivisibilityChecker(3, 3));
  }

  @Test
  void testDefensiveCopyOfDefinition() {
    Map<String, StateDefinition> def = TestAutomata.wikipedia();
    Automaton fsa = new Automaton(def);
    def.clear();
    Assertions.assertEquals(6, fsa.size());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> fsa.getDefinition().clear());
  }

  @Test
  void testStringRepresentation() {
    String expected = String.join("\n",
        "S0: | 0: S0, 1: S1, start: true , accept: true  |",
        "S1: | 0: S2, 1: S0, start: false, accept: false |",
        "S2: | 0: S1, 1: S2, start: false, accept: false |");
    Assertions.assertEquals(expected, Automaton.createDivisibilityChecker(2, 3).toString());
  }

  @Test
  void testNondeterministicStringRepresentation() {
    String dump = new Automaton(TestAutomata.simpleNFA()).toString();
    Assertions.assertTrue(dump.startsWith("S0: | 0: S0, 1: [S0, S1], start: true , accept: false |"), dump);
  }

  @Test
  void testTextSymbols() {
    Automaton fsa = new Automaton(TestAutomata.malta());
    Assertions.assertEquals(List.of(Symbol.of("a"), Symbol.of("b")), List.copyOf(fsa.getAlphabet()));
    Assertions.assertFalse(fsa.process("a", "b").isAccepting());
    Assertions.assertEquals("S2", fsa.getState());
  }
}
