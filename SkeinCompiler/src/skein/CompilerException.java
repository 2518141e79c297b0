package skein;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Token token;
  private final String errorMsg;

  public CompilerException(Token token, String errorMsg) {
    super(errorMsg);
    this.token = token;
    this.errorMsg = errorMsg;
  }

  public Token token() {
    return token;
  }

  public Diagnostic toDiagnostic(String fileName) {
    return Diagnostic.error(fileName, token, errorMsg);
  }
}
