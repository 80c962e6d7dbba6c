package ENFA.Model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class ModelTest {
  private static Automaton worked() {
    return Automaton.builder()
        .states("A", "B", "C")
        .symbols("0", "1", "ε")
        .transition("A", "0", "A")
        .epsilon("A", "B")
        .transition("B", "1", "B")
        .epsilon("B", "C")
        .transition("C", "0", "C")
        .initialState("A")
        .finalStates("C")
        .build();
  }

  @Test
  void testEmptySymbolIsEpsilon() {
    Transition t = new Transition("A", "B", "");
    Assertions.assertEquals(Epsilon.SYMBOL, t.symbol());
    Assertions.assertTrue(t.isEpsilon());
    Assertions.assertEquals(Transition.epsilon("A", "B"), t);

    Automaton a = Automaton.builder().states("A").symbols("", "x").initialState("A").build();
    Assertions.assertEquals(Set.of("ε", "x"), a.getAlphabet());
    Assertions.assertEquals(List.of("x"), a.getInputSymbols());
  }

  @Test
  void testDuplicateTransitionsCollapse() {
    Automaton a = Automaton.builder()
        .states("A", "B")
        .symbols("a")
        .transition("A", "a", "B")
        .transition("A", "a", "B")
        .epsilon("A", "B")
        .transition("A", "", "B")
        .initialState("A")
        .build();
    Assertions.assertEquals(2, a.getTransitions().size());
    Assertions.assertTrue(a.hasEpsilonTransitions());
  }

  @Test
  void testEqualityIgnoresOrder() {
    Automaton a = worked();
    Automaton b = Automaton.builder()
        .states("C", "B", "A")
        .symbols("ε", "1", "0")
        .transition("C", "0", "C")
        .epsilon("B", "C")
        .transition("B", "1", "B")
        .epsilon("A", "B")
        .transition("A", "0", "A")
        .initialState("A")
        .finalStates("C")
        .build();
    Assertions.assertEquals(a, b);
    Assertions.assertEquals(a.hashCode(), b.hashCode());
    Assertions.assertEquals(a, a.toBuilder().build());
    Assertions.assertNotEquals(a, a.withFinal("A", true));
  }

  @Test
  void testBuilderRequiresInitialState() {
    Assertions.assertThrows(IllegalStateException.class, () -> Automaton.builder().states("A").build());
  }

  @Test
  void testWithoutState() {
    Automaton a = worked().withoutState("C");
    Assertions.assertEquals(List.of("A", "B"), List.copyOf(a.getStates()));
    Assertions.assertEquals(3, a.getTransitions().size());
    Assertions.assertTrue(a.getFinalStates().isEmpty());
    Assertions.assertEquals("A", a.getInitialState());

    // removing the initial state promotes the first remaining state
    Automaton b = worked().withoutState("A");
    Assertions.assertEquals("B", b.getInitialState());
    for (Transition t : b.getTransitions()) {
      Assertions.assertNotEquals("A", t.from());
      Assertions.assertNotEquals("A", t.to());
    }

    Automaton single = Automaton.builder().states("A").initialState("A").build();
    Assertions.assertEquals("", single.withoutState("A").getInitialState());

    Assertions.assertEquals(worked(), worked().withoutState("Q"));
  }

  @Test
  void testWithoutSymbol() {
    Automaton a = worked().withoutSymbol("0");
    Assertions.assertEquals(Set.of("1", "ε"), a.getAlphabet());
    Assertions.assertEquals(3, a.getTransitions().size());
    Assertions.assertThrows(IllegalArgumentException.class, () -> worked().withoutSymbol("ε"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> worked().withoutSymbol(""));
  }

  @Test
  void testEdits() {
    Automaton a = worked()
        .withInitialState("B")
        .withFinal("C", false)
        .withFinal("A", true)
        .withTransition(new Transition("C", "A", "1"));
    Assertions.assertEquals("B", a.getInitialState());
    Assertions.assertEquals(Set.of("A"), a.getFinalStates());
    Assertions.assertTrue(a.getTransitions().contains(new Transition("C", "A", "1")));
    // the original is untouched
    Assertions.assertEquals("A", worked().getInitialState());
  }

  @Test
  void testTransitionIndex() {
    TransitionIndex index = TransitionIndex.of(worked());
    Assertions.assertEquals(Set.of("A"), index.getSuccessors("A", "0"));
    Assertions.assertEquals(Set.of("B"), index.getEpsilonSuccessors("A"));
    Assertions.assertTrue(index.getSuccessors("A", "1").isEmpty());
    Assertions.assertTrue(index.getSuccessors("Q", "0").isEmpty());
  }

  @Test
  void testClosureMap() {
    ClosureMap map = new ClosureMap(Map.of("A", Set.of("C", "A", "B")));
    Assertions.assertEquals(List.of("A", "B", "C"), List.copyOf(map.get("A")));
    Assertions.assertThrows(IllegalArgumentException.class, () -> map.get("B"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> map.get("A").add("D"));
    Assertions.assertEquals(new ClosureMap(Map.of("A", Set.of("A", "B", "C"))), map);
  }
}
