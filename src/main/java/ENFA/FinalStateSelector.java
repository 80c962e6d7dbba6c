package ENFA;

import java.util.LinkedHashSet;
import java.util.Set;

import ENFA.Model.Automaton;
import ENFA.Model.ClosureMap;

public class FinalStateSelector {

    private FinalStateSelector() {}

    /**
     * A state accepts iff its epsilon-closure contains an original final state.
     * @return - accepting states, in state order
     */
    public static Set<String> selectFinalStates(Automaton automaton, ClosureMap closures) {
        Set<String> result = new LinkedHashSet<>();
        for (String q : automaton.getStates()) {
            for (String s : closures.get(q)) {
                if (automaton.isFinal(s)) {
                    result.add(q);
                    break;
                }
            }
        }
        return result;
    }
}
