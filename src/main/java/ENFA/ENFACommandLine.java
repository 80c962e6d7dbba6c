package ENFA;

import ENFA.Model.Automaton;
import ENFA.Model.ConversionResult;
import ENFA.Model.InvalidAutomatonException;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class ENFACommandLine {
  public static void main(String[] args) {
    String jsonFilename = null;
    String baFilename = null;
    boolean parallel = false;
    boolean trim = false;
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        ENFAConverter.DEBUG = true;
      } else if ("--parallel".equalsIgnoreCase(arg)) {
        parallel = true;
      } else if ("--trim".equalsIgnoreCase(arg)) {
        trim = true;
      } else if ("--writeJSON".equalsIgnoreCase(arg) || "--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for " + arg);
          printUsageAndExit(1);
        }
        if ("--writeJSON".equalsIgnoreCase(arg)) {
          jsonFilename = args[++i];
        } else {
          baFilename = args[++i];
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit(1);
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 1) {
      printUsageAndExit(1);
    }

    final ConversionResult result;
    try {
      result = run(Paths.get(positional.get(0)), parallel);
    } catch (InvalidAutomatonException e) {
      System.err.println("Invalid automaton (" + e.getKind() + "): " + e.getMessage());
      System.exit(1);
      return;
    }
    System.out.println(report(result));

    if (jsonFilename != null) {
      writeJSONFile(jsonFilename, result);
    }
    if (baFilename != null) {
      writeBAFile(baFilename, result.nfa(), trim);
    }
  }

  private static void printUsageAndExit(int status) {
    System.out.println(
        "ENFA [--debug] [--parallel] [--trim] [--writeJSON <JSON output file>] [--writeBA <BA output file>] <ε-NFA JSON file>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--parallel] : Compute epsilon-closures in parallel");
    System.out.println("[--trim] : Remove unreachable and dead states before writing BA");
    System.out.println("[--writeJSON <JSON output file>] : Write NFA and closures to specified file");
    System.out.println("[--writeBA <BA output file>] : Write NFA to specified file in the BA format");
    System.out.println();
    System.out.println("<ε-NFA JSON file> : {\"states\", \"alphabet\", \"transitions\": [{\"from\", \"to\", \"symbol\"}],"
        + " \"initialState\", \"finalStates\"}");
    System.out.println("  An empty symbol or \"ε\" denotes an epsilon transition.");
    System.exit(status);
  }

  /**
   * Read and convert an ε-NFA.
   * @param path - JSON input file
   * @param parallel - whether closures are computed in parallel
   * @return - conversion result
   */
  static ConversionResult run(Path path, boolean parallel) {
    final Automaton enfa = readJSONFile(path);
    System.out.println("Original ε-NFA: " + enfa.getStates().size() + " states, "
        + enfa.getTransitions().size() + " transitions");

    long before = System.currentTimeMillis();
    ConversionResult result = ENFAConverter.convert(enfa, parallel);
    long after = System.currentTimeMillis();
    System.out.println("NFA: " + result.nfa().getTransitions().size() + " transitions, "
        + result.nfa().getFinalStates().size() + " final states");
    System.out.println("conversion duration: " + ((after - before) / 1000f) + "s");
    return result;
  }

  static String report(ConversionResult result) {
    return System.lineSeparator()
        + TransitionTable.renderClosures(result.closures())
        + System.lineSeparator()
        + TransitionTable.render(result.nfa());
  }

  static Automaton readJSONFile(Path path) {
    try {
      return JSONFormat.readFile(path);
    } catch (IOException | FormatException ex) {
      throw new RuntimeException(ex);
    }
  }

  private static void writeJSONFile(String filename, ConversionResult result) {
    System.out.println("Writing to file: " + filename);
    try (Writer writer = Files.newBufferedWriter(Paths.get(filename), StandardCharsets.UTF_8)) {
      JSONFormat.writeResult(result, writer);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  private static void writeBAFile(String filename, Automaton nfa, boolean trim) {
    CompactNFA<String> compact = NFAExport.toCompactNFA(nfa);
    if (trim) {
      int prevSize = compact.size();
      compact = NFAExport.trim(compact);
      if (compact.size() < prevSize) {
        System.out.println("Trimmed to: " + compact.size());
      }
    }
    System.out.println("Writing to file: " + filename);
    try (OutputStream os = new FileOutputStream(filename)) {
      NFAExport.writeBA(compact, os);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
