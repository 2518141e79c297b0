package skein;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class DiagnosticCollectingVisitor extends VoidDefaultASTVisitor {
  private final String fileName;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  protected DiagnosticCollectingVisitor(String fileName) {
    this.fileName = fileName;
  }

  protected String fileName() {
    return fileName;
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  protected void logError(Token token, String msg) {
    logDiagnostic(Diagnostic.error(fileName, token, msg));
  }

  protected void logDiagnostic(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }
}
