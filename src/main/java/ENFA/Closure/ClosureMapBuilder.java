package ENFA.Closure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.concurrent.ForkJoinPool;

import ENFA.Model.Automaton;
import ENFA.Model.ClosureMap;
import ENFA.Model.TransitionIndex;

public class ClosureMapBuilder {

    private ClosureMapBuilder() {}

    public static ClosureMap build(Automaton automaton) {
        return build(automaton, TransitionIndex.of(automaton), false);
    }

    public static ClosureMap build(Automaton automaton, boolean parallel) {
        return build(automaton, TransitionIndex.of(automaton), parallel);
    }

    /**
     * Compute the epsilon-closure of every declared state. Closures are independent of each other,
     * so the parallel variant splits the state list over the common fork/join pool.
     * The map is only assembled once every closure is done.
     * @param automaton - source automaton
     * @param index - adjacency of automaton's transitions
     * @param parallel - whether to compute closures in parallel
     * @return - total closure map, in state order
     */
    public static ClosureMap build(Automaton automaton, TransitionIndex index, boolean parallel) {
        List<String> states = new ArrayList<>(automaton.getStates());
        List<SortedSet<String>> slots = new ArrayList<>(states.size());
        for (int i = 0; i < states.size(); i++) {
            slots.add(null);
        }

        if (parallel) {
            ForkJoinPool.commonPool().invoke(new ParClosureTask(0, states.size(), states, index, slots));
        } else {
            ParClosureTask.computeRange(0, states.size(), states, index, slots);
        }

        Map<String, SortedSet<String>> closures = new LinkedHashMap<>();
        for (int i = 0; i < states.size(); i++) {
            closures.put(states.get(i), slots.get(i));
        }
        return new ClosureMap(closures);
    }
}
