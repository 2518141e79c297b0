package skein;

import java.util.List;
import java.util.Map;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class CompilationResult {
  public abstract CompilationJob.CompilationType compilationType();

  public abstract ImmutableList<Diagnostic> diagnostics();

  /** Declarations found in the source files, followed by the generated visit counters. */
  public abstract ImmutableList<Declaration> declarations();

  public abstract ImmutableList<Declaration> knownDeclarations();

  public abstract ImmutableMap<String, StringInfo> stringTable();

  public abstract ImmutableMap<String, ImmutableList<String>> fileTags();

  @Memoized
  public boolean hasErrors() {
    return diagnostics().stream().anyMatch(Diagnostic::isError);
  }

  public String summary() {
    return String.format(
        "%d diagnostic(s), %d declaration(s), %d string(s)",
        diagnostics().size(),
        declarations().size(),
        stringTable().size());
  }

  static CompilationResult create(
      CompilationJob.CompilationType compilationType,
      List<Diagnostic> diagnostics,
      List<Declaration> declarations,
      List<Declaration> knownDeclarations,
      Map<String, StringInfo> stringTable,
      Map<String, ImmutableList<String>> fileTags) {
    return new AutoValue_CompilationResult(
        compilationType,
        ImmutableList.copyOf(diagnostics),
        ImmutableList.copyOf(declarations),
        ImmutableList.copyOf(knownDeclarations),
        ImmutableMap.copyOf(stringTable),
        ImmutableMap.copyOf(fileTags));
  }
}
