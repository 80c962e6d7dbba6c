package ENFA;

import java.util.List;
import java.util.Set;

import ENFA.Closure.ClosureMapBuilder;
import ENFA.Model.Automaton;
import ENFA.Model.ClosureMap;
import ENFA.Model.ConversionResult;
import ENFA.Model.Transition;
import ENFA.Model.TransitionIndex;

/**
 * Epsilon elimination: turns an epsilon-NFA into an equivalent NFA without epsilon transitions.
 * The input is never modified; equal inputs give equal results.
 */
public class ENFAConverter {
    public static boolean DEBUG = false;

    private ENFAConverter() {}

    public static ConversionResult convert(Automaton enfa) {
        return convert(enfa, false);
    }

    /**
     * Validate, compute all closures, then project transitions and final states through them.
     * @param enfa - epsilon-NFA
     * @param parallel - whether closures are computed in parallel
     * @return - the NFA (same states and initial state, epsilon-free alphabet) and the closure map
     * @throws ENFA.Model.InvalidAutomatonException if enfa is not well-formed
     */
    public static ConversionResult convert(Automaton enfa, boolean parallel) {
        AutomatonValidator.validate(enfa);

        final TransitionIndex index = TransitionIndex.of(enfa);
        // every closure must be known before projection starts
        final ClosureMap closures = ClosureMapBuilder.build(enfa, index, parallel);
        if (DEBUG) {
            System.out.println("DEBUG: Computed " + closures.size() + " epsilon-closures");
        }

        final List<String> inputs = enfa.getInputSymbols();
        final Set<Transition> transitions = TransitionProjector.project(enfa, inputs, index, closures);
        final Set<String> finalStates = FinalStateSelector.selectFinalStates(enfa, closures);
        if (DEBUG) {
            System.out.println("DEBUG: " + enfa.getTransitions().size() + " transitions -> "
                + transitions.size() + " epsilon-free transitions, "
                + enfa.getFinalStates().size() + " -> " + finalStates.size() + " final states");
        }

        final Automaton nfa = new Automaton(enfa.getStates(), inputs, transitions, enfa.getInitialState(), finalStates);
        return new ConversionResult(nfa, closures);
    }
}
