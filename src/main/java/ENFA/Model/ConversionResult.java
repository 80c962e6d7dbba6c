package ENFA.Model;

/**
 * Output of a conversion: the epsilon-free automaton and the closures it was derived from.
 */
public record ConversionResult(Automaton nfa, ClosureMap closures) {
}
