package ENFA.Closure;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.SortedSet;
import java.util.TreeSet;

import ENFA.Model.Transition;
import ENFA.Model.TransitionIndex;

public class EpsilonClosure {

    private EpsilonClosure() {}

    /**
     * Epsilon-closure of a single state over a raw transition relation.
     * @param state - any state, not necessarily the initial one
     * @param transitions - full transition relation, epsilon edges included
     * @return - states reachable from state by epsilon moves alone, state included, sorted
     */
    public static SortedSet<String> closureOf(String state, Collection<Transition> transitions) {
        return closureOf(state, new TransitionIndex(transitions));
    }

    /**
     * Work-list walk over epsilon edges. A state is pushed only when it is first inserted into the
     * result, so each state is expanded at most once and epsilon cycles terminate.
     * @param state - start state
     * @param index - adjacency of the transition relation
     * @return - sorted epsilon-closure of state
     */
    public static SortedSet<String> closureOf(String state, TransitionIndex index) {
        SortedSet<String> closure = new TreeSet<>();
        closure.add(state);
        Deque<String> stack = new ArrayDeque<>();
        stack.push(state);

        while (!stack.isEmpty()) {
            String current = stack.pop();
            for (String next : index.getEpsilonSuccessors(current)) {
                if (closure.add(next)) {
                    stack.push(next);
                }
            }
        }
        return closure;
    }
}
