package ENFA;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import ENFA.Model.Automaton;
import ENFA.Model.ConversionResult;
import ENFA.Model.Transition;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import net.automatalib.exception.FormatException;

/**
 * JSON form of an automaton:
 * {"states": [...], "alphabet": [...], "transitions": [{"from", "to", "symbol"}], "initialState", "finalStates": [...]}.
 * An empty symbol means epsilon. A conversion result is written as {"nfa": automaton, "closures": {state: [...]}}.
 */
public class JSONFormat {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private JSONFormat() {}

    static final class AutomatonJson {
        List<String> states;
        List<String> alphabet;
        List<TransitionJson> transitions;
        String initialState;
        List<String> finalStates;
    }

    static final class TransitionJson {
        String from;
        String to;
        String symbol;

        TransitionJson() {}

        TransitionJson(String from, String to, String symbol) {
            this.from = from;
            this.to = to;
            this.symbol = symbol;
        }
    }

    static final class ResultJson {
        AutomatonJson nfa;
        Map<String, List<String>> closures;
    }

    public static Automaton read(Reader reader) throws FormatException {
        final AutomatonJson json;
        try {
            json = GSON.fromJson(reader, AutomatonJson.class);
        } catch (JsonParseException e) {
            throw new FormatException(e);
        }
        if (json == null) {
            throw new FormatException("Empty automaton document");
        }
        return fromJson(json);
    }

    public static Automaton readString(String document) throws FormatException {
        return read(new StringReader(document));
    }

    public static Automaton readFile(Path path) throws IOException, FormatException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    private static Automaton fromJson(AutomatonJson json) throws FormatException {
        if (json.states == null || json.alphabet == null || json.transitions == null
            || json.initialState == null || json.finalStates == null) {
            throw new FormatException(
                "Invalid automaton format. Required: states, alphabet, transitions, initialState, finalStates");
        }
        Set<String> seen = new HashSet<>();
        for (String s : json.states) {
            if (s == null || !seen.add(s)) {
                throw new FormatException("Duplicate or null state: " + s);
            }
        }
        List<Transition> transitions = new ArrayList<>(json.transitions.size());
        for (TransitionJson t : json.transitions) {
            if (t == null || t.from == null || t.to == null || t.symbol == null) {
                throw new FormatException("Transition requires from, to and symbol");
            }
            transitions.add(new Transition(t.from, t.to, t.symbol));
        }
        for (String a : json.alphabet) {
            if (a == null) {
                throw new FormatException("Null symbol in alphabet");
            }
        }
        return new Automaton(json.states, json.alphabet, transitions, json.initialState, json.finalStates);
    }

    public static void write(Automaton automaton, Writer writer) {
        GSON.toJson(toJson(automaton), writer);
    }

    public static String toString(Automaton automaton) {
        return GSON.toJson(toJson(automaton));
    }

    public static void writeResult(ConversionResult result, Writer writer) {
        GSON.toJson(toJson(result), writer);
    }

    public static String toString(ConversionResult result) {
        return GSON.toJson(toJson(result));
    }

    private static AutomatonJson toJson(Automaton automaton) {
        AutomatonJson json = new AutomatonJson();
        json.states = new ArrayList<>(automaton.getStates());
        json.alphabet = new ArrayList<>(automaton.getAlphabet());
        json.transitions = new ArrayList<>(automaton.getTransitions().size());
        for (Transition t : automaton.getTransitions()) {
            json.transitions.add(new TransitionJson(t.from(), t.to(), t.symbol()));
        }
        json.initialState = automaton.getInitialState();
        json.finalStates = new ArrayList<>(automaton.getFinalStates());
        return json;
    }

    private static ResultJson toJson(ConversionResult result) {
        ResultJson json = new ResultJson();
        json.nfa = toJson(result.nfa());
        json.closures = new LinkedHashMap<>();
        for (Map.Entry<String, SortedSet<String>> e : result.closures().asMap().entrySet()) {
            json.closures.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        return json;
    }
}
