package ENFA.Model;

import java.util.Objects;

/**
 * One edge of the transition relation. Equal triples are the same edge.
 */
public record Transition(String from, String to, String symbol) {

    public Transition {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        symbol = Epsilon.normalize(Objects.requireNonNull(symbol, "symbol"));
    }

    public static Transition epsilon(String from, String to) {
        return new Transition(from, to, Epsilon.SYMBOL);
    }

    public boolean isEpsilon() {
        return Epsilon.isEpsilon(symbol);
    }

    @Override
    public String toString() {
        return from + " -" + symbol + "-> " + to;
    }
}
