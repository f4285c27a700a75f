package FSA;

import FSA.Model.CompactedRow;
import FSA.Model.Target;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class ArrowCompactorTest {
  @Test
  void testDecimalParity() {
    Map<String, CompactedRow> arrows = Automaton.createDivisibilityChecker(10, 2).compactTransitions();
    CompactedRow s0 = arrows.get("S0");
    Assertions.assertEquals(Map.of("0,2,4,6,8", Target.of("S0"), "1,3,5,7,9", Target.of("S1")), s0.arrows());
    Assertions.assertTrue(s0.start());
    Assertions.assertTrue(s0.accept());
    Assertions.assertFalse(arrows.get("S1").start());
  }

  @Test
  void testSpaces() {
    CompactedRow s1 = Automaton.createDivisibilityChecker(10, 2).compactTransitions(true).get("S1");
    Assertions.assertEquals(List.of("0, 2, 4, 6, 8", "1, 3, 5, 7, 9"), List.copyOf(s1.arrows().keySet()));
  }

  @Test
  void testSymbolsSortNumerically() {
    CompactedRow s0 = Automaton.createDivisibilityChecker(12, 1).compactTransitions().get("S0");
    Assertions.assertEquals(Map.of("0,1,2,3,4,5,6,7,8,9,10,11", Target.of("S0")), s0.arrows());
  }

  @Test
  void testSetTargetsGroupTogether() {
    Map<String, CompactedRow> arrows = new Automaton(TestAutomata.simpleNFA()).compactTransitions();
    Assertions.assertEquals(Map.of("0", Target.of("S0"), "1", Target.ofSet("S0", "S1")), arrows.get("S0").arrows());
    Assertions.assertEquals(Map.of("0,1", Target.of("S1")), arrows.get("S1").arrows());
  }
}
