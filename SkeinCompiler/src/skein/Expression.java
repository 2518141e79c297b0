package skein;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import skein.processor.ASTChild;
import skein.processor.ASTNode;

public abstract class Expression implements ASTNodeInterface {

  public enum UnaryOperator {
    NEGATE("-"),
    NOT("not");

    private final String repr;

    UnaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }
  }

  public enum BinaryOperator {
    AND("and", 1),
    OR("or", 1),
    XOR("xor", 1),
    EQUAL("==", 2),
    NOT_EQUAL("!=", 2),
    LESS_THAN("<", 3),
    LESS_THAN_OR_EQUAL("<=", 3),
    GREATER_THAN(">", 3),
    GREATER_THAN_OR_EQUAL(">=", 3),
    ADD("+", 4),
    SUBTRACT("-", 4),
    MULTIPLY("*", 5),
    DIVIDE("/", 5),
    MODULO("%", 5);

    private final String repr;
    private final int precedence;

    BinaryOperator(String repr, int precedence) {
      this.repr = repr;
      this.precedence = precedence;
    }

    public String repr() {
      return repr;
    }

    // Higher binds tighter; all are left-associative.
    public int precedence() {
      return precedence;
    }

    private static final ImmutableMap<Token.Type, BinaryOperator> TOKEN_MAP =
        ImmutableMap.<Token.Type, BinaryOperator>builder()
            .put(Token.Type.OPERATOR_AND, AND)
            .put(Token.Type.OPERATOR_OR, OR)
            .put(Token.Type.OPERATOR_XOR, XOR)
            .put(Token.Type.OPERATOR_EQ, EQUAL)
            .put(Token.Type.OPERATOR_NEQ, NOT_EQUAL)
            .put(Token.Type.OPERATOR_LT, LESS_THAN)
            .put(Token.Type.OPERATOR_LTE, LESS_THAN_OR_EQUAL)
            .put(Token.Type.OPERATOR_GT, GREATER_THAN)
            .put(Token.Type.OPERATOR_GTE, GREATER_THAN_OR_EQUAL)
            .put(Token.Type.OPERATOR_ADD, ADD)
            .put(Token.Type.OPERATOR_SUB, SUBTRACT)
            .put(Token.Type.OPERATOR_MUL, MULTIPLY)
            .put(Token.Type.OPERATOR_DIV, DIVIDE)
            .put(Token.Type.OPERATOR_MOD, MODULO)
            .build();

    public static Optional<BinaryOperator> forToken(Token.Type type) {
      return Optional.ofNullable(TOKEN_MAP.get(type));
    }
  }

  private final Token start;

  protected Expression(Token start) {
    this.start = start;
  }

  public Token start() {
    return start;
  }

  public Optional<Value> constantValue() {
    return Optional.empty();
  }

  @ASTNode
  public static class NumberLiteral extends Expression implements Expression_NumberLiteral_ASTNode {
    private final double value;

    public NumberLiteral(Token token) {
      super(token);
      this.value = Double.parseDouble(token.text());
    }

    public double value() {
      return value;
    }

    @Override
    public Optional<Value> constantValue() {
      return Optional.of(Value.number(value));
    }
  }

  @ASTNode
  public static class StringLiteral extends Expression implements Expression_StringLiteral_ASTNode {
    private final String literal;

    public StringLiteral(Token token) {
      super(token);
      this.literal = unquote(token.text());
    }

    public String literal() {
      return literal;
    }

    @Override
    public Optional<Value> constantValue() {
      return Optional.of(Value.string(literal));
    }

    // "a \"b\"" -> a "b"
    private static String unquote(String quoted) {
      int end = quoted.length();
      if (end > 1 && quoted.endsWith("\"")) end--;
      StringBuilder sb = new StringBuilder();
      for (int i = 1; i < end; i++) {
        char ch = quoted.charAt(i);
        if (ch == '\\' && i + 1 < end) {
          ch = quoted.charAt(++i);
        }
        sb.append(ch);
      }
      return sb.toString();
    }
  }

  @ASTNode
  public static class BooleanLiteral extends Expression
      implements Expression_BooleanLiteral_ASTNode {
    private final boolean value;

    public BooleanLiteral(Token token) {
      super(token);
      this.value = token.is(Token.Type.KEYWORD_TRUE);
    }

    public boolean value() {
      return value;
    }

    @Override
    public Optional<Value> constantValue() {
      return Optional.of(Value.bool(value));
    }
  }

  // Has no constant value: null cannot be a declaration's default.
  @ASTNode
  public static class NullLiteral extends Expression implements Expression_NullLiteral_ASTNode {
    public NullLiteral(Token token) {
      super(token);
    }
  }

  // $name
  @ASTNode
  public static class Variable extends Expression implements Expression_Variable_ASTNode {
    public Variable(Token token) {
      super(token);
    }

    public String name() {
      return start().text();
    }
  }

  // name(arg, ...)
  @ASTNode
  public static class FunctionCall extends Expression implements Expression_FunctionCall_ASTNode {
    private final ImmutableList<Expression> arguments;

    public FunctionCall(Token name, List<Expression> arguments) {
      super(name);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public String functionName() {
      return start().text();
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> arguments() {
      return arguments;
    }
  }

  @ASTNode
  public static class Unary extends Expression implements Expression_Unary_ASTNode {
    private final UnaryOperator operator;
    private final Expression operand;

    public Unary(Token operatorToken, UnaryOperator operator, Expression operand) {
      super(operatorToken);
      this.operator = operator;
      this.operand = operand;
    }

    public UnaryOperator operator() {
      return operator;
    }

    @ASTChild
    @Override
    public Expression operand() {
      return operand;
    }

    @Override
    public Optional<Value> constantValue() {
      Optional<Value> value = operand.constantValue();
      if (!value.isPresent()) return Optional.empty();

      switch (operator) {
        case NEGATE:
          if (value.get().type() != ValueType.NUMBER) return Optional.empty();
          return Optional.of(Value.number(-value.get().asNumber()));
        case NOT:
          if (value.get().type() != ValueType.BOOLEAN) return Optional.empty();
          return Optional.of(Value.bool(!value.get().asBool()));
      }
      throw new AssertionError(operator);
    }
  }

  @ASTNode
  public static class Binary extends Expression implements Expression_Binary_ASTNode {
    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;

    public Binary(BinaryOperator operator, Expression left, Expression right) {
      super(left.start());
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    public BinaryOperator operator() {
      return operator;
    }

    @ASTChild
    @Override
    public Expression left() {
      return left;
    }

    @ASTChild
    @Override
    public Expression right() {
      return right;
    }
  }
}
