package skein;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import skein.processor.ASTChild;
import skein.processor.ASTNode;

@ASTNode
public class AST implements AST_ASTNode {
  private final String fileName;
  private final ImmutableList<FileHashtag> fileHashtags;
  private final ImmutableList<Node> nodes;

  public AST(String fileName, List<FileHashtag> fileHashtags, List<Node> nodes) {
    this.fileName = fileName;
    this.fileHashtags = ImmutableList.copyOf(fileHashtags);
    this.nodes = ImmutableList.copyOf(nodes);
  }

  public String fileName() {
    return fileName;
  }

  @ASTChild
  @Override
  public ImmutableList<FileHashtag> fileHashtags() {
    return fileHashtags;
  }

  @ASTChild
  @Override
  public ImmutableList<Node> nodes() {
    return nodes;
  }

  // #tag before the first node
  @ASTNode
  public static class FileHashtag implements AST_FileHashtag_ASTNode {
    private final Token hashtag;
    private final Token text;

    public FileHashtag(Token hashtag, Token text) {
      this.hashtag = hashtag;
      this.text = text;
    }

    public Token hashtag() {
      return hashtag;
    }

    public String text() {
      return text.text();
    }
  }

  @ASTNode
  public static class Node implements AST_Node_ASTNode {
    public static final String TITLE_HEADER = "title";

    private final ImmutableList<Header> headers;
    private final Token bodyStart;
    private final ImmutableList<Statement> body;
    private final Optional<Token> bodyEnd;

    public Node(
        List<Header> headers, Token bodyStart, List<Statement> body, Optional<Token> bodyEnd) {
      this.headers = ImmutableList.copyOf(headers);
      this.bodyStart = bodyStart;
      this.body = ImmutableList.copyOf(body);
      this.bodyEnd = bodyEnd;
    }

    @ASTChild
    @Override
    public ImmutableList<Header> headers() {
      return headers;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    public Token bodyStart() {
      return bodyStart;
    }

    public Optional<Token> bodyEnd() {
      return bodyEnd;
    }

    public Optional<String> header(String key) {
      return headers.stream().filter(h -> h.key().equals(key)).map(Header::value).findFirst();
    }

    public Optional<String> title() {
      return header(TITLE_HEADER);
    }
  }

  // key: value
  @ASTNode
  public static class Header implements AST_Header_ASTNode {
    private final Token key;
    private final Optional<Token> value;

    public Header(Token key, Optional<Token> value) {
      this.key = key;
      this.value = value;
    }

    public Token keyToken() {
      return key;
    }

    public String key() {
      return key.text();
    }

    public String value() {
      return value.map(v -> v.text().trim()).orElse("");
    }
  }

  public abstract static class Statement implements ASTNodeInterface {
    private final Token start;
    private final Token stop;

    protected Statement(Token start, Token stop) {
      this.start = start;
      this.stop = stop;
    }

    public Token start() {
      return start;
    }

    public Token stop() {
      return stop;
    }
  }

  public abstract static class LinePart implements ASTNodeInterface {}

  @ASTNode
  public static class TextPart extends LinePart implements AST_TextPart_ASTNode {
    private final Token token;

    public TextPart(Token token) {
      this.token = token;
    }

    public Token token() {
      return token;
    }

    public String text() {
      return token.text();
    }
  }

  // {expression}
  @ASTNode
  public static class InlineExpression extends LinePart implements AST_InlineExpression_ASTNode {
    private final Expression expression;

    public InlineExpression(Expression expression) {
      this.expression = expression;
    }

    @ASTChild
    @Override
    public Expression expression() {
      return expression;
    }
  }

  @ASTNode
  public static class Hashtag implements AST_Hashtag_ASTNode {
    private final String text;
    private final Optional<Token> token;

    private Hashtag(String text, Optional<Token> token) {
      this.text = text;
      this.token = token;
    }

    public static Hashtag parsed(Token textToken) {
      return new Hashtag(textToken.text(), Optional.of(textToken));
    }

    public static Hashtag synthesized(String text) {
      return new Hashtag(text, Optional.empty());
    }

    public String text() {
      return text;
    }

    public Optional<Token> token() {
      return token;
    }

    public boolean isSynthesized() {
      return !token.isPresent();
    }
  }

  @ASTNode
  public static class LineStatement extends Statement implements AST_LineStatement_ASTNode {
    public static final String LINE_ID_PREFIX = "line:";

    private final ImmutableList<LinePart> parts;
    private final Optional<Expression> condition;
    private final List<Hashtag> hashtags;

    public LineStatement(
        Token start,
        Token stop,
        List<LinePart> parts,
        Optional<Expression> condition,
        List<Hashtag> hashtags) {
      super(start, stop);
      Preconditions.checkArgument(!parts.isEmpty(), "a line needs text");
      this.parts = ImmutableList.copyOf(parts);
      this.condition = condition;
      this.hashtags = new ArrayList<>(hashtags);
    }

    @ASTChild
    @Override
    public ImmutableList<LinePart> parts() {
      return parts;
    }

    @ASTChild
    @Override
    public Optional<Expression> condition() {
      return condition;
    }

    @ASTChild
    @Override
    public ImmutableList<Hashtag> hashtags() {
      return ImmutableList.copyOf(hashtags);
    }

    public void addHashtag(Hashtag hashtag) {
      hashtags.add(hashtag);
    }

    public boolean hasHashtag(String text) {
      return hashtags.stream().anyMatch(h -> h.text().equals(text));
    }

    public Optional<Hashtag> lineIdHashtag() {
      return hashtags.stream().filter(h -> h.text().startsWith(LINE_ID_PREFIX)).findFirst();
    }

    public int lineNumber() {
      return start().line();
    }
  }

  @ASTNode
  public static class ShortcutOptionStatement extends Statement
      implements AST_ShortcutOptionStatement_ASTNode {
    private final ImmutableList<ShortcutOption> options;
    private final boolean endsWithBlankLine;

    public ShortcutOptionStatement(
        Token start, Token stop, List<ShortcutOption> options, boolean endsWithBlankLine) {
      super(start, stop);
      this.options = ImmutableList.copyOf(options);
      this.endsWithBlankLine = endsWithBlankLine;
    }

    @ASTChild
    @Override
    public ImmutableList<ShortcutOption> options() {
      return options;
    }

    public boolean endsWithBlankLine() {
      return endsWithBlankLine;
    }
  }

  @ASTNode
  public static class ShortcutOption implements AST_ShortcutOption_ASTNode {
    private final Token arrow;
    private final LineStatement line;
    private final ImmutableList<Statement> body;

    public ShortcutOption(Token arrow, LineStatement line, List<Statement> body) {
      this.arrow = arrow;
      this.line = line;
      this.body = ImmutableList.copyOf(body);
    }

    public Token arrow() {
      return arrow;
    }

    @ASTChild
    @Override
    public LineStatement line() {
      return line;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  @ASTNode
  public static class IndentedBlock extends Statement implements AST_IndentedBlock_ASTNode {
    private final ImmutableList<Statement> statements;

    public IndentedBlock(Token start, Token stop, List<Statement> statements) {
      super(start, stop);
      this.statements = ImmutableList.copyOf(statements);
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> statements() {
      return statements;
    }
  }

  @ASTNode
  public static class IfStatement extends Statement implements AST_IfStatement_ASTNode {
    // Always size 1 or more; the first is an IF.
    private final ImmutableList<Clause> clauses;

    public IfStatement(Token start, Token stop, List<Clause> clauses) {
      super(start, stop);
      Preconditions.checkArgument(!clauses.isEmpty());
      this.clauses = ImmutableList.copyOf(clauses);
    }

    @ASTChild
    @Override
    public ImmutableList<Clause> clauses() {
      return clauses;
    }

    @ASTNode
    public static class Clause implements AST_IfStatement_Clause_ASTNode {
      public enum Kind {
        IF,
        ELSE_IF,
        ELSE;
      }

      private final Kind kind;
      private final Token keyword;
      private final Optional<Expression> condition;
      private final ImmutableList<Statement> statements;

      public Clause(
          Kind kind, Token keyword, Optional<Expression> condition, List<Statement> statements) {
        Preconditions.checkArgument(condition.isPresent() == (kind != Kind.ELSE));
        this.kind = kind;
        this.keyword = keyword;
        this.condition = condition;
        this.statements = ImmutableList.copyOf(statements);
      }

      public Kind kind() {
        return kind;
      }

      public Token keyword() {
        return keyword;
      }

      @ASTChild
      @Override
      public Optional<Expression> condition() {
        return condition;
      }

      @ASTChild
      @Override
      public ImmutableList<Statement> statements() {
        return statements;
      }
    }
  }

  // <<set $x = expr>>
  @ASTNode
  public static class SetStatement extends Statement implements AST_SetStatement_ASTNode {
    private final Token variable;
    private final Token operator;
    private final Expression value;

    public SetStatement(Token start, Token stop, Token variable, Token operator, Expression value) {
      super(start, stop);
      this.variable = variable;
      this.operator = operator;
      this.value = value;
    }

    public String variableName() {
      return variable.text();
    }

    public Token operator() {
      return operator;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }
  }

  // <<call fn(args)>>
  @ASTNode
  public static class CallStatement extends Statement implements AST_CallStatement_ASTNode {
    private final Expression.FunctionCall call;

    public CallStatement(Token start, Token stop, Expression.FunctionCall call) {
      super(start, stop);
      this.call = call;
    }

    @ASTChild
    @Override
    public Expression.FunctionCall call() {
      return call;
    }
  }

  // <<declare $x = constant as Type>>
  @ASTNode
  public static class DeclareStatement extends Statement implements AST_DeclareStatement_ASTNode {
    private final Token variable;
    private final Expression value;
    private final Optional<Token> typeName;

    public DeclareStatement(
        Token start, Token stop, Token variable, Expression value, Optional<Token> typeName) {
      super(start, stop);
      this.variable = variable;
      this.value = value;
      this.typeName = typeName;
    }

    public Token variable() {
      return variable;
    }

    public String variableName() {
      return variable.text();
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    public Optional<Token> typeName() {
      return typeName;
    }
  }

  // <<jump Node>> or <<jump {expr}>>
  @ASTNode
  public static class JumpStatement extends Statement implements AST_JumpStatement_ASTNode {
    private final Optional<Token> target;
    private final Optional<Expression> destination;

    public JumpStatement(
        Token start, Token stop, Optional<Token> target, Optional<Expression> destination) {
      super(start, stop);
      Preconditions.checkArgument(target.isPresent() != destination.isPresent());
      this.target = target;
      this.destination = destination;
    }

    public Optional<String> target() {
      return target.map(Token::text);
    }

    @ASTChild
    @Override
    public Optional<Expression> destination() {
      return destination;
    }
  }

  // <<anything else {with expressions}>>
  @ASTNode
  public static class CommandStatement extends Statement implements AST_CommandStatement_ASTNode {
    private final ImmutableList<LinePart> parts;
    private final ImmutableList<Hashtag> hashtags;

    public CommandStatement(Token start, Token stop, List<LinePart> parts, List<Hashtag> hashtags) {
      super(start, stop);
      this.parts = ImmutableList.copyOf(parts);
      this.hashtags = ImmutableList.copyOf(hashtags);
    }

    @ASTChild
    @Override
    public ImmutableList<LinePart> parts() {
      return parts;
    }

    @ASTChild
    @Override
    public ImmutableList<Hashtag> hashtags() {
      return hashtags;
    }
  }
}
