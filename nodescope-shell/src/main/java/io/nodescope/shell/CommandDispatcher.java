package io.nodescope.shell;

import io.nodescope.api.DotGraph;
import io.nodescope.api.InspectorOptions;
import io.nodescope.api.NodeHandle;
import io.nodescope.api.NodeInspector;
import io.nodescope.api.TraversalOrder;
import io.nodescope.api.TraversalResult;
import io.nodescope.core.CandidateFieldSet;
import io.nodescope.core.FieldNames;
import io.nodescope.core.FieldResolver;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.export.GraphExporter;
import io.nodescope.shell.export.DotFileWriter;
import io.nodescope.shell.export.WebGraphWriter;
import io.nodescope.shell.format.FormatterRegistry;
import io.nodescope.shell.format.SummaryFormatter;
import io.nodescope.shell.render.Palette;
import io.nodescope.shell.render.TreeDrawer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.jline.reader.Parser;
import org.jline.reader.SyntaxError;
import org.jline.reader.impl.DefaultParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches the inspection commands typed at the debugger console. Arguments are split with
 * JLine's parser, so quoted file names may contain spaces.
 */
public final class CommandDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

  private static final String TREE_EMPTY = "Tree is empty.";
  private static final String NO_HEAD = "Error: Could not find head pointer member.";

  private static final List<String> HELP =
      List.of(
          "Configuration:",
          "  formatter_config [<key> <value>]       view or change settings",
          "Summaries:",
          "  summary <variable>                     one-line summary of a container",
          "Console tree printing:",
          "  pptree <variable>                      draw a tree (alias: pptree_preorder)",
          "  pptree_inorder <variable>",
          "  pptree_postorder <variable>",
          "File exporters (Graphviz .dot):",
          "  export_tree <variable> [file.dot] [order]",
          "  export_list <variable> [file.dot]",
          "  export_graph <variable> [file.dot]",
          "Web visualizer data (JSON):",
          "  export_web <variable> [file.json]",
          "Help:",
          "  formatter_help (alias: fhelp)");

  /** Writes one export file. */
  @FunctionalInterface
  private interface FileExport {
    void write(Path file) throws IOException;
  }

  private final DebuggerFrame frame;
  private final FormatterConfig config;
  private final OutputWriter io;
  private final Palette palette;
  private final Path workingDirectory;
  private final Parser parser = new DefaultParser();

  /** Creates a dispatcher writing to the console, with colours chosen from the environment. */
  public CommandDispatcher(DebuggerFrame frame, FormatterConfig config) {
    this(
        frame,
        config,
        OutputWriter.console(),
        Palette.forEnvironment(System.getenv()),
        Path.of(""));
  }

  /**
   * @param palette console colours for summaries and drawings
   * @param workingDirectory directory relative export file names resolve against
   */
  public CommandDispatcher(
      DebuggerFrame frame,
      FormatterConfig config,
      OutputWriter io,
      Palette palette,
      Path workingDirectory) {
    this.frame = Objects.requireNonNull(frame, "frame must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.io = Objects.requireNonNull(io, "io must not be null");
    this.palette = Objects.requireNonNull(palette, "palette must not be null");
    this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
  }

  /**
   * Runs one command line.
   *
   * @return false if the command is not one of ours, true otherwise (including on errors)
   */
  public boolean dispatch(String line) {
    List<String> words;
    try {
      words = tokenize(line);
    } catch (SyntaxError e) {
      io.error("Error: " + e.getMessage());
      return true;
    }
    if (words.isEmpty()) {
      return true;
    }

    String cmd = words.get(0).toLowerCase(Locale.ROOT);
    List<String> args = words.subList(1, words.size());

    try {
      switch (cmd) {
        case "formatter_config":
          cmdConfig(args);
          return true;
        case "formatter_help":
        case "fhelp":
          cmdHelp();
          return true;
        case "summary":
          cmdSummary(args);
          return true;
        case "pptree":
        case "pptree_preorder":
          cmdPptree(args, TraversalOrder.PREORDER);
          return true;
        case "pptree_inorder":
          cmdPptree(args, TraversalOrder.INORDER);
          return true;
        case "pptree_postorder":
          cmdPptree(args, TraversalOrder.POSTORDER);
          return true;
        case "export_tree":
          cmdExportTree(args);
          return true;
        case "export_list":
          cmdExportList(args);
          return true;
        case "export_graph":
          cmdExportGraph(args);
          return true;
        case "export_web":
          cmdExportWeb(args);
          return true;
        default:
          return false;
      }
    } catch (RuntimeException e) {
      LOG.debug("Command '{}' failed", cmd, e);
      io.error("Error: " + e.getMessage());
      return true;
    }
  }

  private List<String> tokenize(String line) {
    if (line == null || line.isBlank()) {
      return List.of();
    }
    return parser.parse(line, line.length()).words().stream()
        .filter(w -> !w.isEmpty())
        .collect(Collectors.toList());
  }

  private void cmdConfig(List<String> args) {
    if (args.isEmpty()) {
      io.println("Current Formatter Settings:");
      for (String key : FormatterConfig.keys()) {
        io.println(
            "  - " + key + ": " + config.get(key) + " (" + FormatterConfig.description(key) + ")");
      }
      io.println("");
      io.println("Use 'formatter_config <key> <value>' to change a setting.");
      return;
    }
    if (args.size() != 2) {
      io.error("Usage: formatter_config <setting_name> <value>");
      return;
    }
    try {
      String value = config.set(args.get(0), args.get(1));
      io.println("Set " + args.get(0) + " -> " + value);
    } catch (ConfigException e) {
      io.error(e.getMessage());
    }
  }

  private void cmdHelp() {
    io.printLines(HELP);
  }

  private void cmdSummary(List<String> args) {
    if (args.isEmpty()) {
      io.error("Usage: summary <variable_name>");
      return;
    }
    Optional<Variable> variable = variable(args.get(0));
    if (variable.isEmpty()) {
      return;
    }
    Variable v = variable.get();
    Optional<SummaryFormatter> formatter = FormatterRegistry.find(v.typeName());
    if (formatter.isEmpty()) {
      io.error("No summary formatter registered for type '" + v.typeName() + "'.");
      return;
    }
    io.println(
        v.name() + " = " + formatter.get().summarize(v.value(), config.snapshot(), palette));
  }

  private void cmdPptree(List<String> args, TraversalOrder order) {
    if (args.isEmpty()) {
      io.error("Usage: pptree_" + order.id() + " <variable_name>");
      return;
    }
    Optional<Variable> variable = variable(args.get(0));
    if (variable.isEmpty()) {
      return;
    }
    Variable v = variable.get();
    NodeHandle root = member(v, FieldNames.ROOT);
    if (!PointerNormalizer.isNonNull(root)) {
      io.println(TREE_EMPTY);
      return;
    }

    InspectorOptions options = config.snapshot();
    long address = PointerNormalizer.address(v.value());
    io.println(v.typeName() + " at " + hex(address) + " (" + title(order) + "):");
    if (order == TraversalOrder.PREORDER) {
      io.printLines(TreeDrawer.draw(root, palette, options.exportMaxItems()));
      return;
    }

    TraversalResult result = NodeInspector.tree(order).traverse(root, options.exportMaxItems());
    if (result.isEmpty()) {
      io.println("[]");
      return;
    }
    io.println(
        result.values().stream().map(palette::item).collect(Collectors.joining(" -> ", "[", "]")));
  }

  private void cmdExportTree(List<String> args) {
    if (args.isEmpty()) {
      io.error("Usage: export_tree <variable> [file.dot] [order]");
      return;
    }
    String fileName = args.size() > 1 ? args.get(1) : "tree.dot";
    TraversalOrder order = null;
    if (args.size() > 2) {
      Optional<TraversalOrder> parsed = TraversalOrder.fromId(args.get(2));
      if (parsed.isEmpty()) {
        io.error(
            "Invalid order '"
                + args.get(2)
                + "'. Use one of "
                + Arrays.toString(TraversalOrder.values()));
        return;
      }
      order = parsed.get();
    }

    Optional<Variable> variable = variable(args.get(0));
    if (variable.isEmpty()) {
      return;
    }
    NodeHandle root = member(variable.get(), FieldNames.ROOT);
    if (!PointerNormalizer.isNonNull(root)) {
      io.println(TREE_EMPTY);
      return;
    }

    DotGraph graph = NodeInspector.exportTree(root, order);
    export(
        fileName,
        file -> DotFileWriter.write(file, graph, DotFileWriter.Layout.TREE),
        "tree",
        "Run: dot -Tpng " + fileName + " -o tree.png");
  }

  private void cmdExportList(List<String> args) {
    if (args.isEmpty()) {
      io.error("Usage: export_list <variable> [file.dot]");
      return;
    }
    String fileName = args.size() > 1 ? args.get(1) : "list.dot";
    Optional<Variable> variable = variable(args.get(0));
    if (variable.isEmpty()) {
      return;
    }
    NodeHandle head = member(variable.get(), FieldNames.HEAD);
    if (head == null) {
      io.error(NO_HEAD);
      return;
    }
    if (!PointerNormalizer.isNonNull(head)) {
      io.println("List is empty.");
      return;
    }

    DotGraph graph = NodeInspector.exportList(head, config.snapshot());
    if (graph.isEmpty()) {
      io.error(TraversalResult.STRUCTURE_UNRESOLVED);
      return;
    }
    export(
        fileName,
        file -> DotFileWriter.write(file, graph, DotFileWriter.Layout.LIST),
        "list",
        "Run: dot -Tpng " + fileName + " -o list.png");
  }

  private void cmdExportGraph(List<String> args) {
    if (args.isEmpty()) {
      io.error("Usage: export_graph <variable_name> [output_file.dot]");
      return;
    }
    String fileName = args.size() > 1 ? args.get(1) : "graph.dot";
    Optional<Variable> variable = variable(args.get(0));
    if (variable.isEmpty()) {
      return;
    }
    if (GraphExporter.nodeContainer(variable.get().value()) == null) {
      io.println("Graph is empty or nodes container not found.");
      return;
    }

    DotGraph graph = NodeInspector.exportGraph(variable.get().value());
    export(
        fileName,
        file -> DotFileWriter.write(file, graph, DotFileWriter.Layout.GRAPH),
        "graph",
        "Run: dot -Tpng " + fileName + " -o graph.png");
  }

  private void cmdExportWeb(List<String> args) {
    if (args.isEmpty()) {
      io.error("Usage: export_web <variable> [file.json]");
      return;
    }
    Optional<Variable> variable = variable(args.get(0));
    if (variable.isEmpty()) {
      return;
    }
    Variable v = variable.get();

    String kind;
    DotGraph graph;
    NodeHandle root = member(v, FieldNames.ROOT);
    NodeHandle head = member(v, FieldNames.HEAD);
    if (root != null) {
      kind = "tree";
      graph = NodeInspector.exportTree(root, config.treeTraversalStrategy());
    } else if (head != null) {
      kind = "list";
      graph = NodeInspector.exportList(head, config.snapshot());
    } else if (GraphExporter.nodeContainer(v.value()) != null) {
      kind = "graph";
      graph = NodeInspector.exportGraph(v.value());
    } else {
      io.error(
          "Cannot determine the structure of '" + v.name() + "' (expected a list, tree or graph).");
      return;
    }

    String fileName = args.size() > 1 ? args.get(1) : kind + ".json";
    export(fileName, file -> WebGraphWriter.write(file, graph), kind, null);
  }

  private void export(String fileName, FileExport export, String kind, String hint) {
    Path file = workingDirectory.resolve(fileName);
    try {
      export.write(file);
    } catch (IOException e) {
      LOG.debug("Export to {} failed", file, e);
      io.error("Failed to write to file '" + fileName + "': " + e.getMessage());
      return;
    }
    io.println("Successfully exported " + kind + " to '" + fileName + "'.");
    if (hint != null) {
      io.println(hint);
    }
  }

  private Optional<Variable> variable(String name) {
    if (!frame.isValid()) {
      io.error("Cannot execute command: invalid execution context.");
      return Optional.empty();
    }
    Optional<Variable> variable = frame.findVariable(name);
    if (variable.isEmpty()) {
      io.error("Could not find variable '" + name + "'.");
    }
    return variable;
  }

  private static NodeHandle member(Variable variable, CandidateFieldSet names) {
    return FieldResolver.resolve(PointerNormalizer.dereference(variable.value()), names);
  }

  private static String hex(long address) {
    return "0x" + Long.toHexString(address);
  }

  private static String title(TraversalOrder order) {
    String id = order.id();
    return Character.toUpperCase(id.charAt(0)) + id.substring(1);
  }
}
