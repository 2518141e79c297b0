package skein;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a {@link CompilationJob} by folding a fixed list of steps over one {@link
 * CompilationIntermediate}. Problems in the source are reported as diagnostics; compilation
 * always produces a result.
 */
public final class Compiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

  private Compiler() {}

  private enum Step {
    REGISTER_STRINGS(Compiler::registerStrings),
    GET_DECLARATIONS(Compiler::getDeclarations),
    FIND_TRACKING_NODES(Compiler::findTrackingNodes),
    ADD_TRACKING_DECLARATIONS(Compiler::addTrackingDeclarations);

    private final UnaryOperator<CompilationIntermediate> impl;

    Step(UnaryOperator<CompilationIntermediate> impl) {
      this.impl = impl;
    }
  }

  public static CompilationResult compile(CompilationJob job) {
    CompilationIntermediate state = new CompilationIntermediate(job);
    for (Step step : Step.values()) {
      LOGGER.debug("Running {} over {} file(s)", step, job.files().size());
      state = step.impl.apply(state);
    }

    CompilationResult result = state.toResult();
    LOGGER.debug("Compiled {} file(s): {}", job.files().size(), result.summary());
    return result;
  }

  // Parses every file, tags the lines before options, then registers every line's text.
  // The tagging has to happen first so #lastline ends up in the string table.
  private static CompilationIntermediate registerStrings(CompilationIntermediate state) {
    for (SourceFile file : state.job.files()) {
      ParsedFile parsed = ParsedFile.parse(file, state.diagnostics::add);
      parsed.tree().accept(new LastLineBeforeOptionsVisitor(), null);

      StringTableManager fileStrings = new StringTableManager(state.stringTable);
      StringTableGeneratorVisitor visitor =
          new StringTableGeneratorVisitor(file.fileName(), fileStrings);
      parsed.tree().accept(visitor, null);
      state.diagnostics.addAll(visitor.diagnostics());
      state.stringTable.extend(visitor.stringTable());
      state.parsedFiles.add(parsed);
    }
    return state;
  }

  private static CompilationIntermediate getDeclarations(CompilationIntermediate state) {
    for (ParsedFile file : state.parsedFiles) {
      DeclarationVisitor visitor = new DeclarationVisitor(file.name(), file.tokens());
      file.tree().accept(visitor, null);
      state.diagnostics.addAll(visitor.diagnostics());
      state.declarations.addAll(visitor.newDeclarations());
      state.knownVariableDeclarations.addAll(visitor.newDeclarations());
      state.fileTags.put(file.name(), visitor.fileTags());
    }
    return state;
  }

  private static CompilationIntermediate findTrackingNodes(CompilationIntermediate state) {
    Set<String> trackingNodes = new LinkedHashSet<>();
    Set<String> ignoringNodes = new LinkedHashSet<>();
    for (ParsedFile file : state.parsedFiles) {
      NodeTrackingVisitor visitor = new NodeTrackingVisitor(state.library);
      file.tree().accept(visitor, null);
      trackingNodes.addAll(visitor.trackingNodes());
      ignoringNodes.addAll(visitor.ignoringNodes());
    }
    state.trackingNodes =
        ImmutableSortedSet.copyOf(Sets.difference(trackingNodes, ignoringNodes));
    LOGGER.debug("Tracking visits of {}", state.trackingNodes);
    return state;
  }

  private static CompilationIntermediate addTrackingDeclarations(CompilationIntermediate state) {
    for (String node : state.trackingNodes) {
      Declaration declaration =
          Declaration.builder(Library.generateUniqueVisitedVariableForNode(node), Value.number(0))
              .setType(ValueType.NUMBER)
              .setDescription("The generated variable for tracking visits of node " + node)
              .setOrigin(Declaration.Origin.DERIVED)
              .build();
      state.knownVariableDeclarations.add(declaration);
      state.derivedVariableDeclarations.add(declaration);
    }
    return state;
  }

  static final class CompilationIntermediate {
    final CompilationJob job;
    final Library library;
    final List<Diagnostic> diagnostics = new ArrayList<>();
    final StringTableManager stringTable = new StringTableManager();
    final Map<String, ImmutableList<String>> fileTags = new LinkedHashMap<>();
    final List<ParsedFile> parsedFiles = new ArrayList<>();

    // Declared in source files.
    final List<Declaration> declarations = new ArrayList<>();
    // Synthesized by the compiler.
    final List<Declaration> derivedVariableDeclarations = new ArrayList<>();
    // Supplied with the job, declared, or synthesized.
    final List<Declaration> knownVariableDeclarations;

    ImmutableSortedSet<String> trackingNodes = ImmutableSortedSet.of();

    CompilationIntermediate(CompilationJob job) {
      this.job = job;
      this.library = job.library().map(Library.standard()::union).orElse(Library.standard());
      this.knownVariableDeclarations = new ArrayList<>(job.variableDeclarations());
    }

    CompilationResult toResult() {
      return CompilationResult.create(
          job.compilationType(),
          diagnostics,
          ImmutableList.<Declaration>builder()
              .addAll(declarations)
              .addAll(derivedVariableDeclarations)
              .build(),
          knownVariableDeclarations,
          stringTable.build(),
          fileTags);
    }
  }
}
