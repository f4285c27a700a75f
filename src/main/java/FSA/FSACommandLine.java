package FSA;

import FSA.Errors.FSAException;
import FSA.Model.CompactedRow;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class FSACommandLine {
  static boolean DEBUG = false;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * @return the process exit status: 0 on success, 1 if the automaton could not be built, run or checked
   */
  static int run(String[] args) {
    boolean minimize = false;
    boolean spaces = false;
    boolean check = false;
    List<String> positional = new ArrayList<>();

    for (String arg : args) {
      if ("--debug".equalsIgnoreCase(arg)) {
        DEBUG = true;
      } else if ("--minimize".equalsIgnoreCase(arg)) {
        minimize = true;
      } else if ("--spaces".equalsIgnoreCase(arg)) {
        spaces = true;
      } else if ("--check".equalsIgnoreCase(arg)) {
        check = true;
      } else if (arg.startsWith("--")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 3) {
      printUsageAndExit();
    }

    try {
      final String command = positional.get(0);
      final Automaton fsa = Automaton.createDivisibilityChecker(
          parseInt(positional.get(1)), parseInt(positional.get(2)));
      final List<String> rest = positional.subList(3, positional.size());
      switch (command.toLowerCase()) {
        case "div" -> runDivisibility(fsa, rest, minimize, spaces, check);
        case "combine" -> runCombine(fsa, rest, minimize);
        default -> printUsageAndExit();
      }
    } catch (FSAException | IllegalArgumentException | IllegalStateException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
    return 0;
  }

  private static void printUsageAndExit() {
    System.out.println("FSA [--debug] [--minimize] [--spaces] [--check] div <base> <divisor> [symbol ...]");
    System.out.println("FSA [--debug] [--minimize] combine <base> <divisor> <state> [<state> ...]");
    System.out.println("[--debug] : Print intermediate tables");
    System.out.println("[--minimize] : Minimize before printing or simulating");
    System.out.println("[--spaces] : Separate compacted arrow labels with \", \"");
    System.out.println("[--check] : Cross-check minimization against AutomataLib's Hopcroft minimizer");
    System.out.println();
    System.out.println("div : build the base/divisor divisibility checker, print it, and run the symbols if given.");
    System.out.println("combine : build the divisibility checker and print the union of the given states.");
    System.exit(0);
  }

  private static int parseInt(String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not an integer: " + value, e);
    }
  }

  static void runDivisibility(Automaton fsa, List<String> symbols, boolean minimize, boolean spaces, boolean check) {
    System.out.println("States: " + fsa.size());
    if (DEBUG) {
      System.out.println(fsa);
    }
    if (minimize) {
      final Automaton original = check ? fsa.copy() : null;
      fsa.minimize();
      System.out.println("Minimized states: " + fsa.size());
      if (check) {
        crossCheck(original, fsa);
      }
    }
    System.out.println(fsa);

    System.out.println();
    for (Map.Entry<String, CompactedRow> e : fsa.compactTransitions(spaces).entrySet()) {
      System.out.println(e.getKey() + ": " + e.getValue());
    }

    if (!symbols.isEmpty()) {
      fsa.process(symbols);
      System.out.println();
      System.out.println("Input " + String.join("", symbols) + " ends in " + fsa.getState()
          + (fsa.isAccepting() ? ": accepted" : ": rejected"));
    }
  }

  static void runCombine(Automaton fsa, List<String> states, boolean minimize) {
    if (minimize) {
      fsa.minimize();
    }
    if (DEBUG) {
      System.out.println(fsa);
    }
    for (Map.Entry<String, StateDefinition> e : fsa.combineStates(states).entrySet()) {
      System.out.println(e.getKey() + ": " + e.getValue());
    }
  }

  /**
   * Compare table filling with AutomataLib's Hopcroft minimization.
   * @throws IllegalStateException if sizes or languages differ
   */
  static void crossCheck(Automaton original, Automaton minimized) {
    final Alphabet<Symbol> alphabet = AutomataLibConverter.alphabet(original);
    final CompactDFA<Symbol> reference =
        HopcroftMinimizer.minimizeDFA(AutomataLibConverter.toCompactDFA(original), alphabet);
    final CompactDFA<Symbol> ours = AutomataLibConverter.toCompactDFA(minimized);
    if (reference.size() != ours.size() || !Automata.testEquivalence(reference, ours, alphabet)) {
      throw new IllegalStateException("Table filling and Hopcroft disagree: " + ours.size() + " vs " + reference.size());
    }
    System.out.println("Hopcroft cross-check: OK (" + reference.size() + " states)");
  }
}
