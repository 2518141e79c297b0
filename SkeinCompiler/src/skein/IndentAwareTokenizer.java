package skein;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Consumer;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.Range;

/**
 * Wraps a {@link TokenSource} and inserts INDENT, DEDENT and BLANK_LINE_FOLLOWING_OPTION tokens
 * around shortcut option blocks, the only place where indentation is significant.
 *
 * <p>Indentation is only tracked after a line containing {@code ->}. A deeper following line opens
 * a block; a shallower line closes every block deeper than it. A blank line directly after option
 * content ends the option group. All state is dropped at {@code ===}.
 *
 * <p>Synthesized tokens have empty text and the position the delegate has reached.
 */
public class IndentAwareTokenizer implements TokenSource {

  private static final int TAB_WIDTH = 8;

  private final TokenSource delegate;
  private final String fileName;
  private final Consumer<Diagnostic> diagnostics;

  private boolean hitEof = false;
  private final Deque<Token> pendingTokens = new ArrayDeque<>();
  private Optional<Token> lastToken = Optional.empty();
  private boolean lineContainsShortcut = false;
  private int lastIndent = 0;
  private final Deque<Integer> unbalancedIndents = new ArrayDeque<>();
  private OptionalInt lastSeenOptionContent = OptionalInt.empty();

  public IndentAwareTokenizer(TokenSource delegate, Consumer<Diagnostic> diagnostics) {
    this.delegate = delegate;
    this.fileName = delegate.sourceName();
    this.diagnostics = diagnostics;
  }

  @Override
  public Token nextToken() {
    if (hitEof && !pendingTokens.isEmpty()) {
      return pendingTokens.remove();
    } else if (hitEof || delegate.isExhausted()) {
      hitEof = true;
      return Token.create(
          Token.Type.EOF,
          Token.EOF_TEXT,
          delegate.line(),
          delegate.column(),
          Token.DEFAULT_CHANNEL,
          delegate.charIndex(),
          delegate.charIndex() - 1);
    }

    // Always queues at least the token it read.
    checkNextToken();
    return pendingTokens.remove();
  }

  private void checkNextToken() {
    Token current = delegate.nextToken();

    switch (current.type()) {
      case NEWLINE:
        handleNewlineToken(current);
        break;
      case EOF:
        handleEofToken(current);
        break;
      case SHORTCUT_ARROW:
        pendingTokens.add(current);
        lineContainsShortcut = true;
        break;
      case BODY_END:
        // Indentation never carries across nodes. The stack should already be empty here.
        lineContainsShortcut = false;
        lastIndent = 0;
        unbalancedIndents.clear();
        lastSeenOptionContent = OptionalInt.empty();
        pendingTokens.add(current);
        break;
      default:
        pendingTokens.add(current);
        break;
    }

    lastToken = Optional.of(current);
  }

  private void handleNewlineToken(Token current) {
    pendingTokens.add(current);

    if (lastSeenOptionContent.isPresent()) {
      // Two newlines in a row: this line is blank.
      if (lastToken.isPresent() && lastToken.get().type() == current.type()) {
        if (delegate.line() - lastSeenOptionContent.getAsInt() == 1) {
          insertToken(Token.Type.BLANK_LINE_FOLLOWING_OPTION);
        }
        lastSeenOptionContent = OptionalInt.empty();
      }
    }

    int currentIndentationLength = getLengthOfNewlineToken(current);

    if (lineContainsShortcut) {
      if (currentIndentationLength > lastIndent) {
        unbalancedIndents.push(currentIndentationLength);
        insertToken(Token.Type.INDENT);
      }

      lineContainsShortcut = false;
      lastSeenOptionContent = OptionalInt.of(delegate.line());
    }

    if (!unbalancedIndents.isEmpty()) {
      int top = unbalancedIndents.peek();
      while (currentIndentationLength < top) {
        insertToken(Token.Type.DEDENT);
        unbalancedIndents.pop();

        if (unbalancedIndents.isEmpty()) {
          // Dedented out of the whole option block.
          lastSeenOptionContent = OptionalInt.of(delegate.line());
          top = 0;
        } else {
          top = unbalancedIndents.peek();
        }
      }
    }

    lastIndent = currentIndentationLength;
  }

  private void handleEofToken(Token current) {
    while (!unbalancedIndents.isEmpty()) {
      unbalancedIndents.pop();
      insertToken(Token.Type.DEDENT);
    }

    pendingTokens.add(current);
    hitEof = true;
  }

  /**
   * Measures the indentation carried by a NEWLINE token: one per space, {@value #TAB_WIDTH} per
   * tab. Mixing tabs and spaces is reported as a warning.
   */
  @VisibleForTesting
  int getLengthOfNewlineToken(Token token) {
    Preconditions.checkArgument(
        token.is(Token.Type.NEWLINE), "expected a NEWLINE token, got %s", token.type());

    int length = 0;
    boolean sawSpaces = false;
    boolean sawTabs = false;
    for (char ch : token.text().toCharArray()) {
      if (ch == ' ') {
        length += 1;
        sawSpaces = true;
      } else if (ch == '\t') {
        length += TAB_WIDTH;
        sawTabs = true;
      }
    }

    if (sawSpaces && sawTabs) {
      diagnostics.accept(
          Diagnostic.builder(fileName, "Indentation contains tabs and spaces")
              .setSeverity(Diagnostic.Severity.WARNING)
              .setLine(token.line() + 1)
              .setCharacters(Range.closedOpen(0, token.text().length()))
              .setContext(CharMatcher.anyOf("\r\n").trimLeadingFrom(token.text()))
              .build());
    }

    return length;
  }

  private void insertToken(Token.Type type) {
    int startIndex = delegate.charIndex();
    pendingTokens.add(
        Token.create(
            type,
            "",
            delegate.line(),
            delegate.column(),
            Token.DEFAULT_CHANNEL,
            startIndex,
            startIndex - 1));
  }

  @VisibleForTesting
  int unbalancedIndentDepth() {
    return unbalancedIndents.size();
  }

  @Override
  public int line() {
    return delegate.line();
  }

  @Override
  public int column() {
    return delegate.column();
  }

  @Override
  public int charIndex() {
    return delegate.charIndex();
  }

  @Override
  public boolean isExhausted() {
    return hitEof && pendingTokens.isEmpty();
  }

  @Override
  public String sourceName() {
    return fileName;
  }
}
