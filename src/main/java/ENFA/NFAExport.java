package ENFA;

import java.io.IOException;
import java.io.OutputStream;

import ENFA.Model.Automaton;
import ENFA.Model.Transition;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.serialization.ba.BAWriter;
import net.automatalib.util.automaton.fsa.NFAs;

/**
 * Bridge from epsilon-free automata to AutomataLib.
 */
public class NFAExport {
    public static final int MISSING_STATE = -1;

    private NFAExport() {}

    /**
     * State name to AutomataLib state id; ids follow the automaton's state order.
     */
    public static Object2IntMap<String> stateIndex(Automaton nfa) {
        Object2IntMap<String> ids = new Object2IntOpenHashMap<>(nfa.getStates().size());
        ids.defaultReturnValue(MISSING_STATE);
        int id = 0;
        for (String s : nfa.getStates()) {
            ids.put(s, id++);
        }
        return ids;
    }

    /**
     * @param nfa - well-formed automaton without epsilon transitions, e.g. a conversion result
     * @return - equivalent CompactNFA over the automaton's input symbols
     * @throws IllegalArgumentException if nfa still has epsilon transitions
     */
    public static CompactNFA<String> toCompactNFA(Automaton nfa) {
        if (nfa.hasEpsilonTransitions()) {
            throw new IllegalArgumentException("Automaton has epsilon transitions; convert it first");
        }
        final Alphabet<String> alphabet = Alphabets.fromCollection(nfa.getInputSymbols());
        final CompactNFA<String> out = new CompactNFA<>(alphabet, nfa.getStates().size());
        final Object2IntMap<String> ids = stateIndex(nfa);

        for (String s : nfa.getStates()) {
            out.addState(nfa.isFinal(s));
        }
        out.setInitial(ids.getInt(nfa.getInitialState()), true);
        for (Transition t : nfa.getTransitions()) {
            out.addTransition(ids.getInt(t.from()), t.symbol(), ids.getInt(t.to()));
        }
        return out;
    }

    /**
     * Drop states that are unreachable from the initial state or cannot reach a final state.
     */
    public static CompactNFA<String> trim(CompactNFA<String> nfa) {
        final Alphabet<String> alphabet = nfa.getInputAlphabet();
        return NFAs.trim(nfa, alphabet, new CompactNFA<>(alphabet));
    }

    public static void writeBA(CompactNFA<String> nfa, OutputStream os) throws IOException {
        BAWriter<String> baWriter = new BAWriter<>();
        baWriter.writeModel(os, nfa, nfa.getInputAlphabet());
    }
}
