package skein;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;

public class Tokenizer implements TokenSource {

  private enum Mode {
    DEFAULT,
    HEADER,
    HASHTAG,
    BODY,
    TEXT,
    // Text is over; only a condition, hashtags and comments may follow.
    TEXT_TAIL,
    COMMAND,
    COMMAND_TEXT,
    COMMAND_ID,
    BRACE_EXPRESSION,
    COMMAND_EXPRESSION;

    boolean isLineScoped() {
      return this == COMMAND
          || this == COMMAND_TEXT
          || this == COMMAND_ID
          || this == BRACE_EXPRESSION
          || this == COMMAND_EXPRESSION
          || this == HASHTAG;
    }
  }

  private static final ImmutableMap<String, Token.Type> COMMAND_KEYWORDS =
      ImmutableMap.<String, Token.Type>builder()
          .put("if", Token.Type.COMMAND_IF)
          .put("elseif", Token.Type.COMMAND_ELSEIF)
          .put("else", Token.Type.COMMAND_ELSE)
          .put("endif", Token.Type.COMMAND_ENDIF)
          .put("set", Token.Type.COMMAND_SET)
          .put("call", Token.Type.COMMAND_CALL)
          .put("declare", Token.Type.COMMAND_DECLARE)
          .put("jump", Token.Type.COMMAND_JUMP)
          .build();

  private static final ImmutableMap<String, Token.Type> EXPRESSION_KEYWORDS =
      ImmutableMap.<String, Token.Type>builder()
          .put("true", Token.Type.KEYWORD_TRUE)
          .put("false", Token.Type.KEYWORD_FALSE)
          .put("null", Token.Type.KEYWORD_NULL)
          .put("as", Token.Type.EXPRESSION_AS)
          .put("to", Token.Type.OPERATOR_ASSIGN)
          .put("is", Token.Type.OPERATOR_EQ)
          .put("eq", Token.Type.OPERATOR_EQ)
          .put("neq", Token.Type.OPERATOR_NEQ)
          .put("lt", Token.Type.OPERATOR_LT)
          .put("lte", Token.Type.OPERATOR_LTE)
          .put("gt", Token.Type.OPERATOR_GT)
          .put("gte", Token.Type.OPERATOR_GTE)
          .put("and", Token.Type.OPERATOR_AND)
          .put("or", Token.Type.OPERATOR_OR)
          .put("xor", Token.Type.OPERATOR_XOR)
          .put("not", Token.Type.OPERATOR_NOT)
          .build();

  // Longest first.
  private static final ImmutableMap<String, Token.Type> OPERATORS =
      ImmutableMap.<String, Token.Type>builder()
          .put("==", Token.Type.OPERATOR_EQ)
          .put("!=", Token.Type.OPERATOR_NEQ)
          .put("<=", Token.Type.OPERATOR_LTE)
          .put(">=", Token.Type.OPERATOR_GTE)
          .put("&&", Token.Type.OPERATOR_AND)
          .put("||", Token.Type.OPERATOR_OR)
          .put("+=", Token.Type.OPERATOR_ADD_ASSIGN)
          .put("-=", Token.Type.OPERATOR_SUB_ASSIGN)
          .put("*=", Token.Type.OPERATOR_MUL_ASSIGN)
          .put("/=", Token.Type.OPERATOR_DIV_ASSIGN)
          .put("%=", Token.Type.OPERATOR_MOD_ASSIGN)
          .put("<", Token.Type.OPERATOR_LT)
          .put(">", Token.Type.OPERATOR_GT)
          .put("=", Token.Type.OPERATOR_ASSIGN)
          .put("!", Token.Type.OPERATOR_NOT)
          .put("^", Token.Type.OPERATOR_XOR)
          .put("+", Token.Type.OPERATOR_ADD)
          .put("-", Token.Type.OPERATOR_SUB)
          .put("*", Token.Type.OPERATOR_MUL)
          .put("/", Token.Type.OPERATOR_DIV)
          .put("%", Token.Type.OPERATOR_MOD)
          .put("(", Token.Type.LPAREN)
          .put(")", Token.Type.RPAREN)
          .put(",", Token.Type.COMMA)
          .build();

  private static final String ESCAPABLE = "\\<>{}#/";

  private final String fileName;
  private final String content;
  private final Consumer<Diagnostic> diagnostics;
  private final Deque<Mode> modes = new ArrayDeque<>();

  private int index = 0;
  private int line = 1;
  private int column = 0;
  private boolean exhausted = false;

  private int tokenStart;
  private int tokenLine;
  private int tokenColumn;

  public Tokenizer(String fileName, String content, Consumer<Diagnostic> diagnostics) {
    this.fileName = fileName;
    this.content = content;
    this.diagnostics = diagnostics;
    modes.push(Mode.DEFAULT);
  }

  @Override
  public Token nextToken() {
    while (index < content.length()) {
      tokenStart = index;
      tokenLine = line;
      tokenColumn = column;

      Optional<Token> token = lexToken(modes.peek());
      if (token.isPresent()) return token.get();
    }

    exhausted = true;
    return Token.create(
        Token.Type.EOF, Token.EOF_TEXT, line, column, Token.DEFAULT_CHANNEL, index, index - 1);
  }

  @Override
  public int line() {
    return line;
  }

  @Override
  public int column() {
    return column;
  }

  @Override
  public int charIndex() {
    return index;
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public String sourceName() {
    return fileName;
  }

  // Either returns a token or makes progress by consuming input or changing mode.
  private Optional<Token> lexToken(Mode mode) {
    switch (mode) {
      case DEFAULT:
        return lexDefault();
      case HEADER:
        return lexHeader();
      case HASHTAG:
        return lexHashtag();
      case BODY:
        return lexBody();
      case TEXT:
        return lexText();
      case TEXT_TAIL:
        return lexTextTail();
      case COMMAND:
        return lexCommand();
      case COMMAND_TEXT:
        return lexCommandText();
      case COMMAND_ID:
        return lexCommandId();
      case BRACE_EXPRESSION:
      case COMMAND_EXPRESSION:
        return lexExpression(mode);
    }
    throw new AssertionError(mode);
  }

  private Optional<Token> lexDefault() {
    if (atLineBreak()) return newline(Token.HIDDEN_CHANNEL);
    if (atSpace()) return whitespace();
    if (lookingAt("//")) return comment();
    if (lookingAt("---")) {
      advance(3);
      modes.push(Mode.BODY);
      return emit(Token.Type.BODY_START);
    }

    char ch = current();
    if (ch == '#') {
      advance(1);
      modes.push(Mode.HASHTAG);
      return emit(Token.Type.HASHTAG);
    } else if (ch == ':') {
      advance(1);
      while (index < content.length() && current() == ' ') advance(1);
      modes.push(Mode.HEADER);
      return emit(Token.Type.HEADER_DELIMITER);
    } else if (isIdStart(ch)) {
      return identifier(Token.Type.ID);
    }

    return recognitionError();
  }

  private Optional<Token> lexHeader() {
    if (atLineBreak()) {
      modes.pop();
      return newline(Token.HIDDEN_CHANNEL);
    }

    while (index < content.length() && !atLineBreak()) advance(1);
    return emit(Token.Type.REST_OF_LINE);
  }

  private Optional<Token> lexHashtag() {
    if (atSpace()) return whitespace();

    if (!isHashtagChar(current())) {
      // A bare '#'; let the enclosing mode deal with what follows.
      modes.pop();
      return Optional.empty();
    }

    while (index < content.length() && isHashtagChar(current())) advance(1);
    modes.pop();
    return emit(Token.Type.HASHTAG_TEXT);
  }

  private Optional<Token> lexBody() {
    if (atLineBreak()) return newline(Token.HIDDEN_CHANNEL);
    if (atSpace()) return whitespace();
    if (lookingAt("//")) return comment();
    if (lookingAt("===")) {
      advance(3);
      modes.pop();
      return emit(Token.Type.BODY_END);
    } else if (lookingAt("->")) {
      advance(2);
      return emit(Token.Type.SHORTCUT_ARROW);
    } else if (lookingAt("<<")) {
      advance(2);
      modes.push(Mode.COMMAND);
      return emit(Token.Type.COMMAND_START);
    } else if (current() == '#') {
      advance(1);
      modes.push(Mode.HASHTAG);
      return emit(Token.Type.HASHTAG);
    }

    modes.push(Mode.TEXT);
    return Optional.empty();
  }

  private Optional<Token> lexText() {
    if (atLineBreak()) {
      modes.pop();
      return newline(Token.DEFAULT_CHANNEL);
    } else if (current() == '{') {
      advance(1);
      modes.push(Mode.BRACE_EXPRESSION);
      return emit(Token.Type.EXPRESSION_START);
    } else if (lookingAt("<<")) {
      advance(2);
      replaceMode(Mode.TEXT_TAIL);
      modes.push(Mode.COMMAND);
      return emit(Token.Type.COMMAND_START);
    } else if (current() == '#') {
      advance(1);
      replaceMode(Mode.TEXT_TAIL);
      modes.push(Mode.HASHTAG);
      return emit(Token.Type.HASHTAG);
    } else if (lookingAt("//")) {
      return comment();
    }

    while (index < content.length() && !atTextBoundary()) {
      if (current() == '\\'
          && index + 1 < content.length()
          && ESCAPABLE.indexOf(content.charAt(index + 1)) >= 0) {
        advance(2);
      } else {
        advance(1);
      }
    }
    return emit(Token.Type.TEXT);
  }

  private boolean atTextBoundary() {
    return atLineBreak()
        || current() == '{'
        || current() == '#'
        || lookingAt("<<")
        || lookingAt("//");
  }

  private Optional<Token> lexTextTail() {
    if (atLineBreak()) {
      modes.pop();
      return newline(Token.DEFAULT_CHANNEL);
    }
    if (atSpace()) return whitespace();
    if (lookingAt("//")) return comment();
    if (lookingAt("<<")) {
      advance(2);
      modes.push(Mode.COMMAND);
      return emit(Token.Type.COMMAND_START);
    } else if (current() == '#') {
      advance(1);
      modes.push(Mode.HASHTAG);
      return emit(Token.Type.HASHTAG);
    }

    return recognitionError();
  }

  private Optional<Token> lexCommand() {
    if (atLineBreak()) return unwindLine();
    if (atSpace()) return whitespace();
    if (lookingAt(">>")) {
      advance(2);
      modes.pop();
      return emit(Token.Type.COMMAND_END);
    }

    String word = peekWord();
    Token.Type keyword = COMMAND_KEYWORDS.get(word);
    if (keyword == null) {
      replaceMode(Mode.COMMAND_TEXT);
      return Optional.empty();
    }

    advance(word.length());
    switch (keyword) {
      case COMMAND_IF:
      case COMMAND_ELSEIF:
      case COMMAND_SET:
      case COMMAND_CALL:
      case COMMAND_DECLARE:
        replaceMode(Mode.COMMAND_EXPRESSION);
        break;
      case COMMAND_JUMP:
        replaceMode(Mode.COMMAND_ID);
        break;
      default:
        break;
    }
    return emit(keyword);
  }

  private Optional<Token> lexCommandText() {
    if (atLineBreak()) return unwindLine();
    if (lookingAt(">>")) {
      advance(2);
      modes.pop();
      return emit(Token.Type.COMMAND_TEXT_END);
    } else if (current() == '{') {
      advance(1);
      modes.push(Mode.BRACE_EXPRESSION);
      return emit(Token.Type.COMMAND_EXPRESSION_START);
    }

    while (index < content.length() && !atLineBreak() && !lookingAt(">>") && current() != '{') {
      advance(1);
    }
    return emit(Token.Type.COMMAND_TEXT);
  }

  private Optional<Token> lexCommandId() {
    if (atLineBreak()) return unwindLine();
    if (atSpace()) return whitespace();
    if (lookingAt(">>")) {
      advance(2);
      modes.pop();
      return emit(Token.Type.COMMAND_END);
    } else if (current() == '{') {
      advance(1);
      modes.push(Mode.BRACE_EXPRESSION);
      return emit(Token.Type.EXPRESSION_START);
    } else if (isIdStart(current())) {
      return identifier(Token.Type.ID);
    }

    return recognitionError();
  }

  private Optional<Token> lexExpression(Mode mode) {
    if (atLineBreak()) return unwindLine();
    if (atSpace()) return whitespace();

    if (mode == Mode.COMMAND_EXPRESSION && lookingAt(">>")) {
      advance(2);
      modes.pop();
      return emit(Token.Type.COMMAND_END);
    } else if (mode == Mode.BRACE_EXPRESSION && current() == '}') {
      advance(1);
      modes.pop();
      return emit(Token.Type.EXPRESSION_END);
    }

    char ch = current();
    if (ch == '"') {
      return string();
    } else if (Character.isDigit(ch)) {
      return number();
    } else if (ch == '$') {
      advance(1);
      while (index < content.length() && isIdPart(current())) advance(1);
      return emit(Token.Type.VAR_ID);
    } else if (isIdStart(ch)) {
      String word = peekWord();
      advance(word.length());
      return emit(EXPRESSION_KEYWORDS.getOrDefault(word, Token.Type.FUNC_ID));
    }

    for (Map.Entry<String, Token.Type> operator : OPERATORS.entrySet()) {
      if (lookingAt(operator.getKey())) {
        advance(operator.getKey().length());
        return emit(operator.getValue());
      }
    }

    return recognitionError();
  }

  private Optional<Token> string() {
    advance(1);
    while (index < content.length() && !atLineBreak() && current() != '"') {
      advance(current() == '\\' && index + 1 < content.length() ? 2 : 1);
    }

    if (index < content.length() && current() == '"') {
      advance(1);
    } else {
      report("Unterminated string literal");
    }
    return emit(Token.Type.STRING);
  }

  private Optional<Token> number() {
    while (index < content.length() && Character.isDigit(current())) advance(1);
    if (index + 1 < content.length()
        && current() == '.'
        && Character.isDigit(content.charAt(index + 1))) {
      advance(1);
      while (index < content.length() && Character.isDigit(current())) advance(1);
    }
    return emit(Token.Type.NUMBER);
  }

  // A line break inside a command or expression ends it; the enclosing mode lexes the newline.
  private Optional<Token> unwindLine() {
    while (modes.peek().isLineScoped()) modes.pop();
    return Optional.empty();
  }

  private Optional<Token> newline(int channel) {
    advance(lookingAt("\r\n") ? 2 : 1);
    while (index < content.length() && atSpace()) advance(1);
    return emit(Token.Type.NEWLINE, channel);
  }

  private Optional<Token> whitespace() {
    while (index < content.length() && atSpace()) advance(1);
    return emit(Token.Type.WS, Token.HIDDEN_CHANNEL);
  }

  private Optional<Token> comment() {
    while (index < content.length() && !atLineBreak()) advance(1);
    return emit(Token.Type.COMMENT, Token.COMMENTS_CHANNEL);
  }

  private Optional<Token> identifier(Token.Type type) {
    while (index < content.length() && isIdPart(current())) advance(1);
    return emit(type);
  }

  private Optional<Token> recognitionError() {
    advance(1);
    report(String.format("token recognition error at: '%s'", content.substring(tokenStart, index)));
    return Optional.empty();
  }

  private void report(String message) {
    diagnostics.accept(
        Diagnostic.builder(fileName, message)
            .setLine(tokenLine)
            .setCharacters(Range.closedOpen(tokenColumn, tokenColumn + index - tokenStart))
            .setContext(content.substring(tokenStart, index))
            .build());
  }

  private Optional<Token> emit(Token.Type type) {
    return emit(type, Token.DEFAULT_CHANNEL);
  }

  private Optional<Token> emit(Token.Type type, int channel) {
    return Optional.of(
        Token.create(
            type,
            content.substring(tokenStart, index),
            tokenLine,
            tokenColumn,
            channel,
            tokenStart,
            index - 1));
  }

  private void replaceMode(Mode mode) {
    modes.pop();
    modes.push(mode);
  }

  private void advance(int count) {
    for (int i = 0; i < count && index < content.length(); i++) {
      char ch = content.charAt(index++);
      boolean crOnly =
          ch == '\r' && (index >= content.length() || content.charAt(index) != '\n');
      boolean lineBreak = ch == '\n' || crOnly;
      if (lineBreak) {
        line++;
        column = 0;
      } else {
        column++;
      }
    }
  }

  private char current() {
    return content.charAt(index);
  }

  private boolean lookingAt(String prefix) {
    return content.startsWith(prefix, index);
  }

  private boolean atLineBreak() {
    char ch = current();
    return ch == '\n' || ch == '\r';
  }

  private boolean atSpace() {
    char ch = current();
    return ch == ' ' || ch == '\t';
  }

  private String peekWord() {
    int end = index;
    if (end < content.length() && isIdStart(content.charAt(end))) {
      end++;
      while (end < content.length() && isIdPart(content.charAt(end))) end++;
    }
    return content.substring(index, end);
  }

  private static boolean isIdStart(char ch) {
    return Character.isLetter(ch) || ch == '_';
  }

  private static boolean isIdPart(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_' || ch == '.';
  }

  private static boolean isHashtagChar(char ch) {
    return " \t\r\n#$<".indexOf(ch) < 0;
  }
}
