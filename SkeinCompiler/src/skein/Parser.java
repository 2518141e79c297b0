package skein;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import skein.AST.IfStatement.Clause;

/**
 * Recursive descent parser over an indentation-aware {@link TokenStream}.
 *
 * <p>Syntax errors never abort parsing. Each one is reported as a {@link Diagnostic}, the rest of
 * the offending line is skipped and parsing resumes at the next statement.
 */
public class Parser {

  private static final EnumSet<Token.Type> ASSIGNMENT_OPERATORS =
      EnumSet.of(
          Token.Type.OPERATOR_ASSIGN,
          Token.Type.OPERATOR_ADD_ASSIGN,
          Token.Type.OPERATOR_SUB_ASSIGN,
          Token.Type.OPERATOR_MUL_ASSIGN,
          Token.Type.OPERATOR_DIV_ASSIGN,
          Token.Type.OPERATOR_MOD_ASSIGN);

  private static final EnumSet<Token.Type> CLAUSE_KEYWORDS =
      EnumSet.of(Token.Type.COMMAND_ELSEIF, Token.Type.COMMAND_ELSE, Token.Type.COMMAND_ENDIF);

  // Recovery never skips these; they close enclosing structures.
  private static final EnumSet<Token.Type> SYNC_TOKENS =
      EnumSet.of(Token.Type.EOF, Token.Type.BODY_END, Token.Type.INDENT, Token.Type.DEDENT);

  private final TokenStream tokens;
  private final String fileName;
  private final Consumer<Diagnostic> diagnostics;

  private Token previous;

  public Parser(TokenStream tokens, Consumer<Diagnostic> diagnostics) {
    this.tokens = tokens;
    this.fileName = tokens.sourceName();
    this.diagnostics = diagnostics;
  }

  public AST parse() {
    List<AST.FileHashtag> fileHashtags = new ArrayList<>();
    while (la(1) == Token.Type.HASHTAG) {
      try {
        Token hashtag = consume();
        fileHashtags.add(
            new AST.FileHashtag(hashtag, expect(Token.Type.HASHTAG_TEXT, "hashtag text")));
      } catch (CompilerException ex) {
        report(ex);
      }
    }

    List<AST.Node> nodes = new ArrayList<>();
    while (la(1) != Token.Type.EOF) {
      try {
        nodes.add(parseNode());
      } catch (CompilerException ex) {
        report(ex);
        while (la(1) != Token.Type.EOF && la(1) != Token.Type.BODY_END) consume();
        if (la(1) == Token.Type.BODY_END) consume();
      }
    }

    return new AST(fileName, fileHashtags, nodes);
  }

  private AST.Node parseNode() throws CompilerException {
    List<AST.Header> headers = new ArrayList<>();
    while (la(1) == Token.Type.ID) {
      Token key = consume();
      expect(Token.Type.HEADER_DELIMITER, "':'");
      Optional<Token> value = Optional.empty();
      if (la(1) == Token.Type.REST_OF_LINE) value = Optional.of(consume());
      headers.add(new AST.Header(key, value));
    }
    if (headers.isEmpty()) throw expected("a node header");

    Token bodyStart = expect(Token.Type.BODY_START, "'---'");
    List<AST.Statement> body = parseStatements(() -> false);

    Optional<Token> bodyEnd = Optional.empty();
    if (la(1) == Token.Type.BODY_END) {
      bodyEnd = Optional.of(consume());
    } else {
      report(new CompilerException(lt(1), "missing '===' at the end of the node"));
    }
    return new AST.Node(headers, bodyStart, body, bodyEnd);
  }

  // Parses until atEnd, the end of the node, or the end of the file.
  private List<AST.Statement> parseStatements(BooleanSupplier atEnd) {
    List<AST.Statement> statements = new ArrayList<>();
    while (la(1) != Token.Type.EOF && la(1) != Token.Type.BODY_END && !atEnd.getAsBoolean()) {
      int startIndex = tokens.index();
      try {
        parseStatement().ifPresent(statements::add);
      } catch (CompilerException ex) {
        report(ex);
        recover(ex.token());
      }

      // Always make progress.
      if (tokens.index() == startIndex) consume();
    }
    return statements;
  }

  private void recover(Token errorToken) {
    while (!SYNC_TOKENS.contains(la(1)) && lt(1).line() == errorToken.line()) consume();
  }

  private Optional<AST.Statement> parseStatement() throws CompilerException {
    switch (la(1)) {
      case TEXT:
      case EXPRESSION_START:
        return Optional.of(parseLine());
      case SHORTCUT_ARROW:
        return Optional.of(parseShortcutOptions());
      case INDENT:
        return Optional.of(parseIndentedBlock());
      case COMMAND_START:
        return Optional.of(parseCommandStatement());
      case BLANK_LINE_FOLLOWING_OPTION:
        // Only meaningful right after an option group.
        consume();
        return Optional.empty();
      default:
        throw expected("a statement");
    }
  }

  private AST.LineStatement parseLine() throws CompilerException {
    Token start = lt(1);
    List<AST.LinePart> parts = new ArrayList<>();
    while (true) {
      if (la(1) == Token.Type.TEXT) {
        parts.add(new AST.TextPart(consume()));
      } else if (la(1) == Token.Type.EXPRESSION_START) {
        consume();
        parts.add(new AST.InlineExpression(parseExpression()));
        expect(Token.Type.EXPRESSION_END, "'}'");
      } else {
        break;
      }
    }
    if (parts.isEmpty()) throw expected("line text");

    Optional<Expression> condition = Optional.empty();
    if (la(1) == Token.Type.COMMAND_START && la(2) == Token.Type.COMMAND_IF) {
      consume();
      consume();
      condition = Optional.of(parseExpression());
      expect(Token.Type.COMMAND_END, "'>>'");
    }

    List<AST.Hashtag> hashtags = parseHashtags();
    Token stop = previous;

    // The last line of a file may end without a line break.
    if (la(1) != Token.Type.EOF) expect(Token.Type.NEWLINE, "end of line");
    return new AST.LineStatement(start, stop, parts, condition, hashtags);
  }

  private List<AST.Hashtag> parseHashtags() throws CompilerException {
    List<AST.Hashtag> hashtags = new ArrayList<>();
    while (la(1) == Token.Type.HASHTAG) {
      consume();
      hashtags.add(AST.Hashtag.parsed(expect(Token.Type.HASHTAG_TEXT, "hashtag text")));
    }
    return hashtags;
  }

  private AST.ShortcutOptionStatement parseShortcutOptions() throws CompilerException {
    Token start = lt(1);
    List<AST.ShortcutOption> options = new ArrayList<>();
    while (la(1) == Token.Type.SHORTCUT_ARROW) {
      Token arrow = consume();
      AST.LineStatement line = parseLine();

      List<AST.Statement> body = new ArrayList<>();
      if (la(1) == Token.Type.INDENT) {
        consume();
        body = parseStatements(() -> la(1) == Token.Type.DEDENT);
        expect(Token.Type.DEDENT, "end of indentation");
      }
      options.add(new AST.ShortcutOption(arrow, line, body));
    }

    boolean endsWithBlankLine = false;
    if (la(1) == Token.Type.BLANK_LINE_FOLLOWING_OPTION) {
      consume();
      endsWithBlankLine = true;
    }
    return new AST.ShortcutOptionStatement(start, previous, options, endsWithBlankLine);
  }

  private AST.IndentedBlock parseIndentedBlock() throws CompilerException {
    Token start = consume();
    List<AST.Statement> statements = parseStatements(() -> la(1) == Token.Type.DEDENT);
    Token stop = expect(Token.Type.DEDENT, "end of indentation");
    return new AST.IndentedBlock(start, stop, statements);
  }

  private AST.Statement parseCommandStatement() throws CompilerException {
    Token start = consume();
    switch (la(1)) {
      case COMMAND_IF:
        return parseIf(start);
      case COMMAND_SET:
        return parseSet(start);
      case COMMAND_CALL:
        return parseCall(start);
      case COMMAND_DECLARE:
        return parseDeclare(start);
      case COMMAND_JUMP:
        return parseJump(start);
      case COMMAND_TEXT:
      case COMMAND_EXPRESSION_START:
        return parseCommand(start);
      case COMMAND_ELSEIF:
      case COMMAND_ELSE:
      case COMMAND_ENDIF:
        throw new CompilerException(
            lt(1), String.format("<<%s>> without a matching <<if>>", lt(1).text()));
      default:
        throw expected("a command");
    }
  }

  private AST.IfStatement parseIf(Token start) throws CompilerException {
    List<Clause> clauses = new ArrayList<>();

    Token keyword = consume();
    Expression condition = parseExpression();
    expect(Token.Type.COMMAND_END, "'>>'");
    clauses.add(
        new Clause(
            Clause.Kind.IF, keyword, Optional.of(condition), parseStatements(this::atClauseEnd)));

    while (la(1) == Token.Type.COMMAND_START && la(2) == Token.Type.COMMAND_ELSEIF) {
      consume();
      keyword = consume();
      condition = parseExpression();
      expect(Token.Type.COMMAND_END, "'>>'");
      clauses.add(
          new Clause(
              Clause.Kind.ELSE_IF,
              keyword,
              Optional.of(condition),
              parseStatements(this::atClauseEnd)));
    }

    if (la(1) == Token.Type.COMMAND_START && la(2) == Token.Type.COMMAND_ELSE) {
      consume();
      keyword = consume();
      expect(Token.Type.COMMAND_END, "'>>'");
      clauses.add(
          new Clause(
              Clause.Kind.ELSE, keyword, Optional.empty(), parseStatements(this::atClauseEnd)));
    }

    if (la(1) != Token.Type.COMMAND_START || la(2) != Token.Type.COMMAND_ENDIF) {
      throw expected("<<endif>>");
    }
    consume();
    consume();
    Token stop = expect(Token.Type.COMMAND_END, "'>>'");
    return new AST.IfStatement(start, stop, clauses);
  }

  private boolean atClauseEnd() {
    return la(1) == Token.Type.COMMAND_START && CLAUSE_KEYWORDS.contains(la(2));
  }

  private AST.SetStatement parseSet(Token start) throws CompilerException {
    consume();
    Token variable = expect(Token.Type.VAR_ID, "a variable");
    if (!ASSIGNMENT_OPERATORS.contains(la(1))) throw expected("'=' or 'to'");
    Token operator = consume();
    Expression value = parseExpression();
    Token stop = expect(Token.Type.COMMAND_END, "'>>'");
    return new AST.SetStatement(start, stop, variable, operator, value);
  }

  private AST.CallStatement parseCall(Token start) throws CompilerException {
    consume();
    Token name = lt(1);
    Expression call = parseExpression();
    if (!(call instanceof Expression.FunctionCall)) {
      throw new CompilerException(name, "expected a function call");
    }
    Token stop = expect(Token.Type.COMMAND_END, "'>>'");
    return new AST.CallStatement(start, stop, (Expression.FunctionCall) call);
  }

  private AST.DeclareStatement parseDeclare(Token start) throws CompilerException {
    consume();
    Token variable = expect(Token.Type.VAR_ID, "a variable");
    expect(Token.Type.OPERATOR_ASSIGN, "'=' or 'to'");
    Expression value = parseExpression();

    Optional<Token> typeName = Optional.empty();
    if (la(1) == Token.Type.EXPRESSION_AS) {
      consume();
      typeName = Optional.of(expect(Token.Type.FUNC_ID, "a type name"));
    }

    Token stop = expect(Token.Type.COMMAND_END, "'>>'");
    return new AST.DeclareStatement(start, stop, variable, value, typeName);
  }

  private AST.JumpStatement parseJump(Token start) throws CompilerException {
    consume();
    Optional<Token> target = Optional.empty();
    Optional<Expression> destination = Optional.empty();
    if (la(1) == Token.Type.ID) {
      target = Optional.of(consume());
    } else if (la(1) == Token.Type.EXPRESSION_START) {
      consume();
      destination = Optional.of(parseExpression());
      expect(Token.Type.EXPRESSION_END, "'}'");
    } else {
      throw expected("a node name");
    }

    Token stop = expect(Token.Type.COMMAND_END, "'>>'");
    return new AST.JumpStatement(start, stop, target, destination);
  }

  private AST.CommandStatement parseCommand(Token start) throws CompilerException {
    List<AST.LinePart> parts = new ArrayList<>();
    while (la(1) != Token.Type.COMMAND_TEXT_END) {
      if (la(1) == Token.Type.COMMAND_TEXT) {
        parts.add(new AST.TextPart(consume()));
      } else if (la(1) == Token.Type.COMMAND_EXPRESSION_START) {
        consume();
        parts.add(new AST.InlineExpression(parseExpression()));
        expect(Token.Type.EXPRESSION_END, "'}'");
      } else {
        throw expected("'>>'");
      }
    }
    Token stop = consume();
    return new AST.CommandStatement(start, stop, parts, parseHashtags());
  }

  private Expression parseExpression() throws CompilerException {
    return parseBinary(1);
  }

  // Precedence climbing; see Expression.BinaryOperator#precedence.
  private Expression parseBinary(int minPrecedence) throws CompilerException {
    Expression left = parseUnary();
    while (true) {
      Optional<Expression.BinaryOperator> operator = Expression.BinaryOperator.forToken(la(1));
      if (!operator.isPresent() || operator.get().precedence() < minPrecedence) break;

      consume();
      Expression right = parseBinary(operator.get().precedence() + 1);
      left = new Expression.Binary(operator.get(), left, right);
    }
    return left;
  }

  private Expression parseUnary() throws CompilerException {
    if (la(1) == Token.Type.OPERATOR_SUB) {
      Token operator = consume();
      return new Expression.Unary(operator, Expression.UnaryOperator.NEGATE, parseUnary());
    } else if (la(1) == Token.Type.OPERATOR_NOT) {
      Token operator = consume();
      return new Expression.Unary(operator, Expression.UnaryOperator.NOT, parseUnary());
    }
    return parsePrimary();
  }

  private Expression parsePrimary() throws CompilerException {
    switch (la(1)) {
      case NUMBER:
        return new Expression.NumberLiteral(consume());
      case STRING:
        return new Expression.StringLiteral(consume());
      case KEYWORD_TRUE:
      case KEYWORD_FALSE:
        return new Expression.BooleanLiteral(consume());
      case KEYWORD_NULL:
        return new Expression.NullLiteral(consume());
      case VAR_ID:
        return new Expression.Variable(consume());
      case FUNC_ID:
        {
          Token name = consume();
          expect(Token.Type.LPAREN, "'('");
          List<Expression> arguments = new ArrayList<>();
          if (la(1) != Token.Type.RPAREN) {
            arguments.add(parseExpression());
            while (la(1) == Token.Type.COMMA) {
              consume();
              arguments.add(parseExpression());
            }
          }
          expect(Token.Type.RPAREN, "')'");
          return new Expression.FunctionCall(name, arguments);
        }
      case LPAREN:
        {
          consume();
          Expression inner = parseExpression();
          expect(Token.Type.RPAREN, "')'");
          return inner;
        }
      default:
        throw expected("an expression");
    }
  }

  private Token.Type la(int k) {
    return tokens.la(k);
  }

  private Token lt(int k) {
    return tokens.lt(k);
  }

  private Token consume() {
    previous = tokens.lt(1);
    tokens.consume();
    return previous;
  }

  private Token expect(Token.Type type, String description) throws CompilerException {
    if (la(1) != type) throw expected(description);
    return consume();
  }

  private CompilerException expected(String description) {
    return new CompilerException(
        lt(1), String.format("expected %s, found %s", description, lt(1).describe()));
  }

  private void report(CompilerException ex) {
    diagnostics.accept(ex.toDiagnostic(fileName));
  }
}
