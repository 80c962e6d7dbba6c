package ENFA.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency view of a transition relation: (state, symbol) to target states.
 * Built once per conversion so lookups don't rescan the transition list.
 */
public final class TransitionIndex {
    private final Map<String, Map<String, Set<String>>> successors = new HashMap<>();

    public TransitionIndex(Collection<Transition> transitions) {
        for (Transition t : transitions) {
            successors.computeIfAbsent(t.from(), k -> new HashMap<>())
                .computeIfAbsent(t.symbol(), k -> new LinkedHashSet<>())
                .add(t.to());
        }
    }

    public static TransitionIndex of(Automaton automaton) {
        return new TransitionIndex(automaton.getTransitions());
    }

    /**
     * @param state - source state
     * @param symbol - input symbol, or {@link Epsilon#SYMBOL}
     * @return - targets, empty if none
     */
    public Set<String> getSuccessors(String state, String symbol) {
        Map<String, Set<String>> bySymbol = successors.get(state);
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        Set<String> targets = bySymbol.get(symbol);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    public Set<String> getEpsilonSuccessors(String state) {
        return getSuccessors(state, Epsilon.SYMBOL);
    }
}
