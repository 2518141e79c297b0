package skein;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.Range;

@AutoValue
public abstract class Diagnostic {

  public enum Severity {
    ERROR,
    WARNING,
    INFO;
  }

  public abstract Severity severity();

  public abstract String message();

  public abstract String fileName();

  // 1-based, or 0 for no particular line.
  public abstract int line();

  public abstract Optional<Range<Integer>> characters();

  public abstract String context();

  public final boolean isError() {
    return severity() == Severity.ERROR;
  }

  public String format() {
    int column = characters().map(r -> r.lowerEndpoint() + 1).orElse(1);
    return String.format("%s: %s@%d:%d %s", severity(), fileName(), line(), column, message());
  }

  public void print() {
    System.out.println(format());
  }

  public static Builder builder(String fileName, String message) {
    return new AutoValue_Diagnostic.Builder()
        .setFileName(fileName)
        .setMessage(message)
        .setSeverity(Severity.ERROR)
        .setLine(0)
        .setContext("");
  }

  public static Diagnostic error(String fileName, Token token, String message) {
    return atToken(fileName, token, message).build();
  }

  public static Builder atToken(String fileName, Token token, String message) {
    return builder(fileName, message)
        .setLine(token.line())
        .setCharacters(
            Range.closedOpen(token.column(), token.column() + Math.max(token.text().length(), 1)))
        .setContext(CharMatcher.anyOf("\r\n").removeFrom(token.text()));
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSeverity(Severity severity);

    public abstract Builder setMessage(String message);

    public abstract Builder setFileName(String fileName);

    public abstract Builder setLine(int line);

    public abstract Builder setCharacters(Range<Integer> characters);

    public abstract Builder setContext(String context);

    public abstract Diagnostic build();
  }
}
