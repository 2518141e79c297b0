package skein;

import com.google.auto.value.AutoValue;

/**
 * A lexed token. Lines are 1-based and columns 0-based; start and stop are inclusive character
 * indices into the source. Synthesized tokens have empty text and {@code stop == start - 1}.
 */
@AutoValue
public abstract class Token {

  public static final int DEFAULT_CHANNEL = 0;
  public static final int HIDDEN_CHANNEL = 1;
  public static final int COMMENTS_CHANNEL = 2;

  public static final String EOF_TEXT = "<EOF>";

  public enum Type {
    EOF,

    // Synthesized by IndentAwareTokenizer.
    INDENT,
    DEDENT,
    BLANK_LINE_FOLLOWING_OPTION,

    WS,
    COMMENT,
    NEWLINE,

    // Headers and node boundaries.
    ID,
    HEADER_DELIMITER,
    REST_OF_LINE,
    BODY_START,
    BODY_END,

    // Body.
    SHORTCUT_ARROW,
    HASHTAG,
    HASHTAG_TEXT,
    TEXT,
    EXPRESSION_START,
    EXPRESSION_END,

    // Commands.
    COMMAND_START,
    COMMAND_END,
    COMMAND_IF,
    COMMAND_ELSEIF,
    COMMAND_ELSE,
    COMMAND_ENDIF,
    COMMAND_SET,
    COMMAND_CALL,
    COMMAND_DECLARE,
    COMMAND_JUMP,
    COMMAND_TEXT,
    COMMAND_TEXT_END,
    COMMAND_EXPRESSION_START,

    // Expressions.
    KEYWORD_TRUE,
    KEYWORD_FALSE,
    KEYWORD_NULL,
    EXPRESSION_AS,
    OPERATOR_ASSIGN,
    OPERATOR_ADD_ASSIGN,
    OPERATOR_SUB_ASSIGN,
    OPERATOR_MUL_ASSIGN,
    OPERATOR_DIV_ASSIGN,
    OPERATOR_MOD_ASSIGN,
    OPERATOR_EQ,
    OPERATOR_NEQ,
    OPERATOR_LT,
    OPERATOR_LTE,
    OPERATOR_GT,
    OPERATOR_GTE,
    OPERATOR_AND,
    OPERATOR_OR,
    OPERATOR_XOR,
    OPERATOR_NOT,
    OPERATOR_ADD,
    OPERATOR_SUB,
    OPERATOR_MUL,
    OPERATOR_DIV,
    OPERATOR_MOD,
    LPAREN,
    RPAREN,
    COMMA,
    NUMBER,
    STRING,
    VAR_ID,
    FUNC_ID;
  }

  public abstract Type type();

  public abstract String text();

  public abstract int line();

  public abstract int column();

  public abstract int channel();

  public abstract int startIndex();

  public abstract int stopIndex();

  // -1 until buffered by a TokenStream.
  public abstract int tokenIndex();

  public static Token create(
      Type type, String text, int line, int column, int channel, int startIndex, int stopIndex) {
    return new AutoValue_Token(type, text, line, column, channel, startIndex, stopIndex, -1);
  }

  public Token withTokenIndex(int tokenIndex) {
    return new AutoValue_Token(
        type(), text(), line(), column(), channel(), startIndex(), stopIndex(), tokenIndex);
  }

  public final boolean isDefaultChannel() {
    return channel() == DEFAULT_CHANNEL;
  }

  public final boolean is(Type type) {
    return type() == type;
  }

  public final String describe() {
    switch (type()) {
      case EOF:
        return "end of file";
      case NEWLINE:
        return "end of line";
      case INDENT:
        return "indentation";
      case DEDENT:
        return "end of indentation";
      case BLANK_LINE_FOLLOWING_OPTION:
        return "blank line";
      default:
        return "'" + text() + "'";
    }
  }
}
