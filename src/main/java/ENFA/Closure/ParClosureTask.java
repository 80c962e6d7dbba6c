package ENFA.Closure;

import java.io.Serial;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.RecursiveAction;

import ENFA.Model.TransitionIndex;

/**
 * Fork/join task computing the closures of states [lo, hi).
 * Each task writes only its own slots; the index and state list are read-only.
 */
final class ParClosureTask extends RecursiveAction {
    // Below this many states a task runs sequentially
    private static final int MIN_SUBPROBLEM_SIZE = 8;
    @Serial
    private static final long serialVersionUID = 1L;

    private final int lo, hi;
    private final List<String> states;
    private final TransitionIndex index;
    private final List<SortedSet<String>> slots;

    ParClosureTask(int lo, int hi, List<String> states, TransitionIndex index, List<SortedSet<String>> slots) {
        this.lo = lo;
        this.hi = hi;
        this.states = states;
        this.index = index;
        this.slots = slots;
    }

    @Override
    protected void compute() {
        if (hi - lo <= MIN_SUBPROBLEM_SIZE) {
            computeRange(lo, hi, states, index, slots);
            return;
        }
        int mid = lo + (hi - lo) / 2;
        invokeAll(new ParClosureTask(lo, mid, states, index, slots),
                  new ParClosureTask(mid, hi, states, index, slots));
    }

    static void computeRange(int lo, int hi, List<String> states, TransitionIndex index,
                             List<SortedSet<String>> slots) {
        for (int i = lo; i < hi; i++) {
            slots.set(i, EpsilonClosure.closureOf(states.get(i), index));
        }
    }
}
