package ENFA;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import ENFA.Model.Automaton;
import ENFA.Model.ClosureMap;
import ENFA.Model.TransitionIndex;

/**
 * Plain-text tables for a conversion result: the closures and the new transition function.
 */
public class TransitionTable {
    static final String EMPTY_SET = "Ø";
    static final String INITIAL_MARKER = "->";

    private TransitionTable() {}

    public static String renderClosures(ClosureMap closures) {
        StringBuilder sb = new StringBuilder();
        for (String q : closures.states()) {
            sb.append("ε-closure(").append(q).append(") = ").append(braces(closures.get(q))).append('\n');
        }
        return sb.toString();
    }

    /**
     * One row per state, one column per input symbol holding delta'(q, a), plus an accepting column.
     * The initial state is prefixed with "->".
     */
    public static String render(Automaton nfa) {
        final TransitionIndex index = TransitionIndex.of(nfa);
        final List<String> inputs = nfa.getInputSymbols();

        List<String[]> rows = new ArrayList<>();
        String[] header = new String[inputs.size() + 2];
        header[0] = "State";
        for (int i = 0; i < inputs.size(); i++) {
            header[i + 1] = "δ'(q, " + inputs.get(i) + ")";
        }
        header[header.length - 1] = "Accepting?";
        rows.add(header);

        for (String q : nfa.getStates()) {
            String[] row = new String[header.length];
            row[0] = (q.equals(nfa.getInitialState()) ? INITIAL_MARKER + " " : "   ") + q;
            for (int i = 0; i < inputs.size(); i++) {
                Set<String> targets = index.getSuccessors(q, inputs.get(i));
                row[i + 1] = targets.isEmpty() ? EMPTY_SET : braces(new TreeSet<>(targets));
            }
            row[row.length - 1] = nfa.isFinal(q) ? "YES" : "no";
            rows.add(row);
        }
        return layout(rows);
    }

    private static String braces(Set<String> states) {
        return "{" + String.join(", ", states) + "}";
    }

    private static String layout(List<String[]> rows) {
        int[] widths = new int[rows.get(0).length];
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }
        StringBuilder sb = new StringBuilder();
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                if (i > 0) {
                    sb.append(" | ");
                }
                sb.append(row[i]);
                if (i < row.length - 1) {
                    sb.append(" ".repeat(widths[i] - row[i].length()));
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
