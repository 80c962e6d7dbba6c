package ENFA;

import java.util.Set;

import ENFA.Model.Automaton;
import ENFA.Model.InvalidAutomatonException;
import ENFA.Model.InvalidAutomatonException.Kind;
import ENFA.Model.Transition;

public class AutomatonValidator {

    private AutomatonValidator() {}

    /**
     * Check that the automaton is well-formed: known initial and final states, transitions between
     * declared states, and every non-epsilon symbol declared in the alphabet.
     * The first violation found is reported.
     * @param automaton - automaton to check
     * @throws InvalidAutomatonException on the first violation
     */
    public static void validate(Automaton automaton) {
        final Set<String> states = automaton.getStates();

        if (!states.contains(automaton.getInitialState())) {
            throw new InvalidAutomatonException(Kind.UNKNOWN_INITIAL_STATE,
                "Initial state '" + automaton.getInitialState() + "' is not a declared state");
        }

        for (String f : automaton.getFinalStates()) {
            if (!states.contains(f)) {
                throw new InvalidAutomatonException(Kind.UNKNOWN_FINAL_STATE,
                    "Final state '" + f + "' is not a declared state");
            }
        }

        for (Transition t : automaton.getTransitions()) {
            if (!states.contains(t.from()) || !states.contains(t.to())) {
                String missing = states.contains(t.from()) ? t.to() : t.from();
                throw new InvalidAutomatonException(Kind.DANGLING_TRANSITION_ENDPOINT,
                    "Transition " + t + " references unknown state '" + missing + "'");
            }
        }

        for (Transition t : automaton.getTransitions()) {
            if (!t.isEpsilon() && !automaton.getAlphabet().contains(t.symbol())) {
                throw new InvalidAutomatonException(Kind.UNDECLARED_SYMBOL,
                    "Transition " + t + " uses symbol '" + t.symbol() + "' missing from the alphabet");
            }
        }
    }
}
