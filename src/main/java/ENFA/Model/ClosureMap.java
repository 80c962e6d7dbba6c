package ENFA.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Total mapping from every state of an automaton to its epsilon-closure.
 * Keys iterate in the automaton's state order, closures are sorted lexicographically.
 */
public final class ClosureMap {
    private final Map<String, SortedSet<String>> closures;

    public ClosureMap(Map<String, ? extends Set<String>> closures) {
        Map<String, SortedSet<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Set<String>> e : closures.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
        }
        this.closures = Collections.unmodifiableMap(copy);
    }

    /**
     * @param state - state of the automaton the map was built for
     * @return - sorted closure of state
     * @throws IllegalArgumentException if the state has no entry
     */
    public SortedSet<String> get(String state) {
        SortedSet<String> closure = closures.get(state);
        if (closure == null) {
            throw new IllegalArgumentException("No epsilon-closure for state " + state);
        }
        return closure;
    }

    public Set<String> states() {
        return closures.keySet();
    }

    public int size() {
        return closures.size();
    }

    public Map<String, SortedSet<String>> asMap() {
        return closures;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ClosureMap && closures.equals(((ClosureMap) o).closures);
    }

    @Override
    public int hashCode() {
        return closures.hashCode();
    }

    @Override
    public String toString() {
        return closures.toString();
    }
}
