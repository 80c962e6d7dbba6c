package ENFA.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable finite automaton over string states and symbols, possibly with epsilon transitions.
 * <p>
 * States, alphabet and transitions keep insertion order for display; equality ignores order.
 * Nothing is validated here, see {@link ENFA.AutomatonValidator}.
 */
public final class Automaton {
    private final Set<String> states;
    private final Set<String> alphabet;
    private final Set<Transition> transitions;
    private final String initialState;
    private final Set<String> finalStates;

    public Automaton(Collection<String> states,
                     Collection<String> alphabet,
                     Collection<Transition> transitions,
                     String initialState,
                     Collection<String> finalStates) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        Set<String> symbols = new LinkedHashSet<>();
        for (String a : alphabet) {
            symbols.add(Epsilon.normalize(a));
        }
        this.alphabet = Collections.unmodifiableSet(symbols);
        this.transitions = Collections.unmodifiableSet(new LinkedHashSet<>(transitions));
        this.initialState = Objects.requireNonNull(initialState, "initialState");
        this.finalStates = Collections.unmodifiableSet(new LinkedHashSet<>(finalStates));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getStates() {
        return states;
    }

    public Set<String> getAlphabet() {
        return alphabet;
    }

    public Set<Transition> getTransitions() {
        return transitions;
    }

    public String getInitialState() {
        return initialState;
    }

    public Set<String> getFinalStates() {
        return finalStates;
    }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    public boolean hasEpsilonTransitions() {
        for (Transition t : transitions) {
            if (t.isEpsilon()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Alphabet without the epsilon symbol, in declaration order.
     */
    public List<String> getInputSymbols() {
        List<String> result = new ArrayList<>(alphabet.size());
        for (String a : alphabet) {
            if (!Epsilon.isEpsilon(a)) {
                result.add(a);
            }
        }
        return result;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.states.addAll(states);
        b.alphabet.addAll(alphabet);
        b.transitions.addAll(transitions);
        b.initialState = initialState;
        b.finalStates.addAll(finalStates);
        return b;
    }

    /**
     * Remove a state together with every transition touching it and its final marking.
     * If it was the initial state, the first remaining state becomes initial (empty string if none remain).
     * @param state - state to remove
     * @return - new automaton; this one if the state is unknown
     */
    public Automaton withoutState(String state) {
        if (!states.contains(state)) {
            return this;
        }
        Builder b = new Builder();
        for (String s : states) {
            if (!s.equals(state)) {
                b.states.add(s);
            }
        }
        b.alphabet.addAll(alphabet);
        for (Transition t : transitions) {
            if (!t.from().equals(state) && !t.to().equals(state)) {
                b.transitions.add(t);
            }
        }
        if (initialState.equals(state)) {
            b.initialState = b.states.isEmpty() ? "" : b.states.iterator().next();
        } else {
            b.initialState = initialState;
        }
        for (String f : finalStates) {
            if (!f.equals(state)) {
                b.finalStates.add(f);
            }
        }
        return b.build();
    }

    /**
     * Remove a symbol and every transition labelled with it. The epsilon symbol stays.
     * @param symbol - symbol to remove
     * @return - new automaton
     * @throws IllegalArgumentException if asked to remove epsilon
     */
    public Automaton withoutSymbol(String symbol) {
        String a = Epsilon.normalize(symbol);
        if (Epsilon.isEpsilon(a)) {
            throw new IllegalArgumentException("The epsilon symbol cannot be removed");
        }
        Builder b = toBuilder();
        b.alphabet.remove(a);
        b.transitions.removeIf(t -> t.symbol().equals(a));
        return b.build();
    }

    public Automaton withTransition(Transition transition) {
        return toBuilder().transition(transition).build();
    }

    public Automaton withInitialState(String state) {
        return toBuilder().initialState(state).build();
    }

    public Automaton withFinal(String state, boolean isFinal) {
        Builder b = toBuilder();
        if (isFinal) {
            b.finalStates.add(state);
        } else {
            b.finalStates.remove(state);
        }
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton other = (Automaton) o;
        return states.equals(other.states)
            && alphabet.equals(other.alphabet)
            && transitions.equals(other.transitions)
            && initialState.equals(other.initialState)
            && finalStates.equals(other.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, initialState, finalStates);
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states + ", alphabet=" + alphabet + ", transitions=" + transitions
            + ", initialState=" + initialState + ", finalStates=" + finalStates + "}";
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<Transition> transitions = new LinkedHashSet<>();
        private final Set<String> finalStates = new LinkedHashSet<>();
        private String initialState;

        private Builder() {}

        public Builder states(String... names) {
            Collections.addAll(states, names);
            return this;
        }

        public Builder symbols(String... symbols) {
            for (String a : symbols) {
                alphabet.add(Epsilon.normalize(a));
            }
            return this;
        }

        public Builder transition(String from, String symbol, String to) {
            return transition(new Transition(from, to, symbol));
        }

        public Builder epsilon(String from, String to) {
            return transition(Transition.epsilon(from, to));
        }

        public Builder transition(Transition transition) {
            transitions.add(transition);
            return this;
        }

        public Builder initialState(String state) {
            this.initialState = state;
            return this;
        }

        public Builder finalStates(String... names) {
            Collections.addAll(finalStates, names);
            return this;
        }

        public Automaton build() {
            if (initialState == null) {
                throw new IllegalStateException("No initial state set");
            }
            return new Automaton(states, alphabet, transitions, initialState, finalStates);
        }
    }
}
