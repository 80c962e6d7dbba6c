package ENFA.Model;

/**
 * The epsilon (empty input) symbol.
 * "ε" is the only form the algorithms compare against; the empty string is accepted when automata are
 * built or parsed and is normalized to "ε" there.
 */
public final class Epsilon {
    public static final String SYMBOL = "ε";

    private Epsilon() {}

    public static boolean isEpsilon(String symbol) {
        return SYMBOL.equals(symbol);
    }

    /**
     * Map the empty string to the canonical epsilon symbol, leave everything else alone.
     * @param symbol - symbol as written by the caller
     * @return - canonical symbol
     */
    public static String normalize(String symbol) {
        return symbol.isEmpty() ? SYMBOL : symbol;
    }
}
