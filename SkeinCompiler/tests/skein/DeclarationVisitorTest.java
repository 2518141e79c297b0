package skein;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class DeclarationVisitorTest {

  private final StringBuilder file = new StringBuilder();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private DeclarationVisitor visit() {
    ParsedFile parsed =
        ParsedFile.parse(SourceFile.create("test.skein", file.toString()), diagnostics::add);
    assertThat(diagnostics).isEmpty();
    DeclarationVisitor visitor = new DeclarationVisitor(parsed.name(), parsed.tokens());
    parsed.tree().accept(visitor, null);
    diagnostics.addAll(visitor.diagnostics());
    return visitor;
  }

  private void declare(String statement) {
    println("title: Start");
    println("---");
    println(statement);
    println("===");
  }

  @Test
  public void numberDeclaration() {
    declare("<<declare $gold = 10>>");

    DeclarationVisitor visitor = visit();

    assertThat(diagnostics).isEmpty();
    assertThat(visitor.newDeclarations()).hasSize(1);
    Declaration gold = visitor.newDeclarations().get(0);
    assertThat(gold.name()).isEqualTo("$gold");
    assertThat(gold.type()).isEqualTo(ValueType.NUMBER);
    assertThat(gold.defaultValue()).isEqualTo(Value.number(10));
    assertThat(gold.origin()).isEqualTo(Declaration.Origin.EXPLICIT);
    assertThat(gold.sourceFileName().get()).isEqualTo("test.skein");
    assertThat(gold.sourceNodeName().get()).isEqualTo("Start");
    assertThat(gold.sourceLine().getAsInt()).isEqualTo(3);
    assertThat(gold.description().isPresent()).isFalse();
  }

  @Test
  public void typesOfConstants() {
    println("title: Start");
    println("---");
    println("<<declare $name to \"Alice\" as String>>");
    println("<<declare $brave = true as Bool>>");
    println("<<declare $debt = -5>>");
    println("===");

    DeclarationVisitor visitor = visit();

    assertThat(diagnostics).isEmpty();
    assertThat(visitor.newDeclarations().get(0).defaultValue()).isEqualTo(Value.string("Alice"));
    assertThat(visitor.newDeclarations().get(1).type()).isEqualTo(ValueType.BOOLEAN);
    assertThat(visitor.newDeclarations().get(2).defaultValue()).isEqualTo(Value.number(-5));
  }

  @Test
  public void duplicateNamesAreKept() {
    println("title: Start");
    println("---");
    println("<<declare $gold = 1>>");
    println("<<declare $gold = 2>>");
    println("===");

    DeclarationVisitor visitor = visit();

    assertThat(diagnostics).isEmpty();
    assertThat(visitor.newDeclarations()).hasSize(2);
  }

  @Test
  public void nullIsRejected() {
    declare("<<declare $nothing = null>>");

    DeclarationVisitor visitor = visit();

    assertThat(visitor.newDeclarations()).isEmpty();
    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).isError()).isTrue();
  }

  @Test
  public void nonConstantIsRejected() {
    declare("<<declare $copy = $gold + 1>>");

    DeclarationVisitor visitor = visit();

    assertThat(visitor.newDeclarations()).isEmpty();
    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).message())
        .isEqualTo("the default value of $copy must be a constant");
  }

  @Test
  public void unknownType() {
    declare("<<declare $gold = 10 as Money>>");

    visit();

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).message()).isEqualTo("unknown type 'Money'");
  }

  @Test
  public void typeMismatch() {
    declare("<<declare $gold = \"lots\" as Number>>");

    DeclarationVisitor visitor = visit();

    assertThat(visitor.newDeclarations()).isEmpty();
    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).message()).contains("$gold is declared as Number");
  }

  @Test
  public void precedingDocumentation() {
    println("title: Start");
    println("---");
    println("Hello // not documentation");
    println("/// The player's name.");
    println("///   Shown on the title screen.");
    println("<<declare $name = \"Alice\">>");
    println("===");

    DeclarationVisitor visitor = visit();

    assertThat(visitor.newDeclarations().get(0).description().get())
        .isEqualTo("The player's name. Shown on the title screen.");
  }

  @Test
  public void trailingDocumentationWins() {
    println("title: Start");
    println("---");
    println("/// Above.");
    println("<<declare $gold = 0>> /// How rich the player is.");
    println("/// Belongs to the next declaration.");
    println("<<declare $gems = 0>>");
    println("===");

    DeclarationVisitor visitor = visit();

    assertThat(visitor.newDeclarations().get(0).description().get())
        .isEqualTo("How rich the player is.");
    assertThat(visitor.newDeclarations().get(1).description().get())
        .isEqualTo("Belongs to the next declaration.");
  }

  @Test
  public void trailingDocumentationOfThePreviousDeclarationIsNotReused() {
    println("title: Start");
    println("---");
    println("<<declare $gold = 0>> /// How rich the player is.");
    println("<<declare $gems = 0>>");
    println("===");

    DeclarationVisitor visitor = visit();

    assertThat(visitor.newDeclarations().get(1).description().isPresent()).isFalse();
  }

  @Test
  public void fileTags() {
    println("#chapter1");
    println("#draft");
    declare("Hello");

    DeclarationVisitor visitor = visit();

    assertThat(visitor.fileTags()).containsExactly("chapter1", "draft").inOrder();
  }
}
