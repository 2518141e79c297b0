package skein;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class ParserTest {

  private final StringBuilder file = new StringBuilder();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private AST parse() {
    return ParsedFile.parse(SourceFile.create("test.skein", file.toString()), diagnostics::add)
        .tree();
  }

  private AST.Node parseSingleNode() {
    AST ast = parse();
    assertThat(ast.nodes()).hasSize(1);
    return ast.nodes().get(0);
  }

  @Test
  public void emptyFile() {
    AST ast = parse();

    assertThat(ast.nodes()).isEmpty();
    assertThat(ast.fileHashtags()).isEmpty();
    assertThat(diagnostics).isEmpty();
  }

  @Test
  public void headersAndLines() {
    println("title: Start");
    println("tags: intro  ");
    println("---");
    println("Hello");
    println("Goodbye {$name}");
    println("===");
    println("title: Other");
    println("---");
    println("===");

    AST ast = parse();

    assertThat(diagnostics).isEmpty();
    assertThat(ast.nodes()).hasSize(2);
    AST.Node start = ast.nodes().get(0);
    assertThat(start.title().get()).isEqualTo("Start");
    assertThat(start.header("tags").get()).isEqualTo("intro");
    assertThat(start.body()).hasSize(2);
    AST.LineStatement goodbye = (AST.LineStatement) start.body().get(1);
    assertThat(goodbye.parts()).hasSize(2);
    assertThat(goodbye.parts().get(1)).isInstanceOf(AST.InlineExpression.class);
    assertThat(goodbye.lineNumber()).isEqualTo(5);
    assertThat(ast.nodes().get(1).body()).isEmpty();
  }

  @Test
  public void fileHashtags() {
    println("#chapter1");
    println("#draft");
    println("title: Start");
    println("---");
    println("===");

    AST ast = parse();

    assertThat(diagnostics).isEmpty();
    assertThat(ast.fileHashtags()).hasSize(2);
    assertThat(ast.fileHashtags().get(0).text()).isEqualTo("chapter1");
    assertThat(ast.fileHashtags().get(1).text()).isEqualTo("draft");
  }

  @Test
  public void lineConditionAndHashtags() {
    println("title: Start");
    println("---");
    println("Hello <<if $friendly>> #line:abc #happy");
    println("===");

    AST.Node node = parseSingleNode();

    assertThat(diagnostics).isEmpty();
    AST.LineStatement line = (AST.LineStatement) node.body().get(0);
    assertThat(line.condition().isPresent()).isTrue();
    assertThat(line.condition().get()).isInstanceOf(Expression.Variable.class);
    assertThat(line.hasHashtag("happy")).isTrue();
    assertThat(line.lineIdHashtag().get().text()).isEqualTo("line:abc");
  }

  @Test
  public void shortcutOptions() {
    println("title: Start");
    println("---");
    println("-> Yes");
    println("    Great");
    println("    <<set $agreed to true>>");
    println("-> No");
    println("");
    println("After");
    println("===");

    AST.Node node = parseSingleNode();

    assertThat(diagnostics).isEmpty();
    assertThat(node.body()).hasSize(2);
    AST.ShortcutOptionStatement options = (AST.ShortcutOptionStatement) node.body().get(0);
    assertThat(options.options()).hasSize(2);
    assertThat(options.endsWithBlankLine()).isTrue();
    assertThat(options.options().get(0).body()).hasSize(2);
    assertThat(options.options().get(0).body().get(1)).isInstanceOf(AST.SetStatement.class);
    assertThat(options.options().get(1).body()).isEmpty();
    assertThat(node.body().get(1)).isInstanceOf(AST.LineStatement.class);
  }

  @Test
  public void ifStatement() {
    println("title: Start");
    println("---");
    println("<<if $gold > 10>>");
    println("    Rich");
    println("<<elseif $gold > 0>>");
    println("    Fine");
    println("<<else>>");
    println("    Broke");
    println("<<endif>>");
    println("===");

    AST.Node node = parseSingleNode();

    assertThat(diagnostics).isEmpty();
    AST.IfStatement ifStatement = (AST.IfStatement) node.body().get(0);
    assertThat(ifStatement.clauses()).hasSize(3);
    assertThat(ifStatement.clauses().get(0).kind()).isEqualTo(AST.IfStatement.Clause.Kind.IF);
    assertThat(ifStatement.clauses().get(1).kind())
        .isEqualTo(AST.IfStatement.Clause.Kind.ELSE_IF);
    assertThat(ifStatement.clauses().get(2).kind()).isEqualTo(AST.IfStatement.Clause.Kind.ELSE);
    assertThat(ifStatement.clauses().get(2).condition().isPresent()).isFalse();
    for (AST.IfStatement.Clause clause : ifStatement.clauses()) {
      assertThat(clause.statements()).hasSize(1);
    }
  }

  @Test
  public void commands() {
    println("title: Start");
    println("---");
    println("<<declare $gold = 5 as Number>>");
    println("<<call play_sound(\"door\", 2)>>");
    println("<<jump Other>>");
    println("<<jump {$next}>>");
    println("<<wait 2>> #skippable");
    println("===");

    AST.Node node = parseSingleNode();

    assertThat(diagnostics).isEmpty();
    assertThat(node.body()).hasSize(5);

    AST.DeclareStatement declare = (AST.DeclareStatement) node.body().get(0);
    assertThat(declare.variableName()).isEqualTo("$gold");
    assertThat(declare.typeName().get().text()).isEqualTo("Number");

    AST.CallStatement call = (AST.CallStatement) node.body().get(1);
    assertThat(call.call().functionName()).isEqualTo("play_sound");
    assertThat(call.call().arguments()).hasSize(2);

    assertThat(((AST.JumpStatement) node.body().get(2)).target().get()).isEqualTo("Other");
    assertThat(((AST.JumpStatement) node.body().get(3)).destination().isPresent()).isTrue();

    AST.CommandStatement command = (AST.CommandStatement) node.body().get(4);
    assertThat(command.hashtags()).hasSize(1);
    assertThat(command.hashtags().get(0).text()).isEqualTo("skippable");
  }

  @Test
  public void operatorPrecedence() {
    println("title: Start");
    println("---");
    println("<<set $x to 1 + 2 * 3 == 7 and not false>>");
    println("===");

    AST.Node node = parseSingleNode();

    assertThat(diagnostics).isEmpty();
    Expression value = ((AST.SetStatement) node.body().get(0)).value();
    Expression.Binary and = (Expression.Binary) value;
    assertThat(and.operator()).isEqualTo(Expression.BinaryOperator.AND);
    assertThat(and.right()).isInstanceOf(Expression.Unary.class);

    Expression.Binary equal = (Expression.Binary) and.left();
    assertThat(equal.operator()).isEqualTo(Expression.BinaryOperator.EQUAL);

    Expression.Binary add = (Expression.Binary) equal.left();
    assertThat(add.operator()).isEqualTo(Expression.BinaryOperator.ADD);
    assertThat(((Expression.Binary) add.right()).operator())
        .isEqualTo(Expression.BinaryOperator.MULTIPLY);
  }

  @Test
  public void syntaxErrorRecoversAtNextLine() {
    println("title: Start");
    println("---");
    println("<<set x = 1>>");
    println("Hello");
    println("===");

    AST.Node node = parseSingleNode();

    assertThat(diagnostics).hasSize(1);
    Diagnostic error = diagnostics.get(0);
    assertThat(error.isError()).isTrue();
    assertThat(error.message()).isEqualTo("expected a variable, found 'x'");
    assertThat(error.line()).isEqualTo(3);
    assertThat(error.context()).isEqualTo("x");
    assertThat(node.body()).hasSize(1);
    assertThat(node.body().get(0)).isInstanceOf(AST.LineStatement.class);
  }

  @Test
  public void strayEndif() {
    println("title: Start");
    println("---");
    println("<<endif>>");
    println("===");

    parseSingleNode();

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).message()).isEqualTo("<<endif>> without a matching <<if>>");
  }

  @Test
  public void missingBodyEnd() {
    println("title: Start");
    println("---");
    println("Hello");

    AST.Node node = parseSingleNode();

    assertThat(node.bodyEnd().isPresent()).isFalse();
    assertThat(node.body()).hasSize(1);
    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).message()).isEqualTo("missing '===' at the end of the node");
  }

  @Test
  public void errorInOneNodeDoesNotAffectTheNext() {
    println("title: Broken");
    println("---");
    println("<<if true>>");
    println("Never closed");
    println("===");
    println("title: Fine");
    println("---");
    println("Hello");
    println("===");

    AST ast = parse();

    assertThat(diagnostics).isNotEmpty();
    assertThat(ast.nodes().get(ast.nodes().size() - 1).title().get()).isEqualTo("Fine");
    assertThat(ast.nodes().get(ast.nodes().size() - 1).body()).hasSize(1);
  }
}
