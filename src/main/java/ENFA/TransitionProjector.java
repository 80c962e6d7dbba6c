package ENFA;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import ENFA.Model.Automaton;
import ENFA.Model.ClosureMap;
import ENFA.Model.Transition;
import ENFA.Model.TransitionIndex;

public class TransitionProjector {

    private TransitionProjector() {}

    public static Set<Transition> project(Automaton automaton, ClosureMap closures) {
        return project(automaton, automaton.getInputSymbols(), TransitionIndex.of(automaton), closures);
    }

    /**
     * Epsilon-free transition relation: delta'(q, a) = eps-closure(delta(eps-closure(q), a)).
     * Output order is state order, then symbol order, then sorted target.
     * @param automaton - source automaton
     * @param inputs - input symbols, epsilon excluded
     * @param index - adjacency of automaton's transitions
     * @param closures - complete closure map of automaton
     * @return - projected transitions, duplicates suppressed
     */
    public static Set<Transition> project(Automaton automaton, Collection<String> inputs,
                                          TransitionIndex index, ClosureMap closures) {
        Set<Transition> result = new LinkedHashSet<>();

        for (String q : automaton.getStates()) {
            SortedSet<String> qClosure = closures.get(q);
            for (String a : inputs) {
                // states reached on a from anywhere in q's closure
                Set<String> reached = new LinkedHashSet<>();
                for (String p : qClosure) {
                    reached.addAll(index.getSuccessors(p, a));
                }
                if (reached.isEmpty()) {
                    continue;
                }

                // close again after consuming a
                SortedSet<String> targets = new TreeSet<>();
                for (String s : reached) {
                    targets.addAll(closures.get(s));
                }
                for (String target : targets) {
                    result.add(new Transition(q, target, a));
                }
            }
        }
        return result;
    }
}
