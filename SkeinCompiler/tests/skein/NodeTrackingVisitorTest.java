package skein;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class NodeTrackingVisitorTest {

  private final StringBuilder file = new StringBuilder();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private NodeTrackingVisitor visit(Library library) {
    AST ast =
        ParsedFile.parse(SourceFile.create("test.skein", file.toString()), diagnostics::add)
            .tree();
    assertThat(diagnostics).isEmpty();
    NodeTrackingVisitor visitor = new NodeTrackingVisitor(library);
    ast.accept(visitor, null);
    return visitor;
  }

  @Test
  public void visitTrackingCalls() {
    println("title: Start");
    println("---");
    println("<<if visited(\"Cave\")>>");
    println("    Back again?");
    println("<<endif>>");
    println("You came here {visited_count(\"Start\")} times.");
    println("<<set $x to visited($somewhere)>>");
    println("===");

    NodeTrackingVisitor visitor = visit(Library.standard());

    assertThat(visitor.trackingNodes()).containsExactly("Cave", "Start").inOrder();
    assertThat(visitor.ignoringNodes()).isEmpty();
  }

  @Test
  public void trackingHeaders() {
    println("title: Always");
    println("tracking: always");
    println("---");
    println("===");
    println("title: Never");
    println("tracking: never");
    println("---");
    println("<<if visited(\"Never\")>>");
    println("<<endif>>");
    println("===");

    NodeTrackingVisitor visitor = visit(Library.standard());

    assertThat(visitor.trackingNodes()).containsExactly("Always", "Never");
    assertThat(visitor.ignoringNodes()).containsExactly("Never");
  }

  @Test
  public void otherFunctionsDoNotTrack() {
    println("title: Start");
    println("---");
    println("<<call play_sound(\"Cave\")>>");
    println("===");

    assertThat(visit(Library.standard()).trackingNodes()).isEmpty();
  }

  @Test
  public void libraryFunctionsCanTrackVisits() {
    println("title: Start");
    println("---");
    println("<<call remember(\"Cave\")>>");
    println("===");

    Library library =
        Library.standard()
            .union(
                Library.builder()
                    .addFunction(Library.Function.visitTracking("remember", ValueType.BOOLEAN))
                    .build());

    assertThat(visit(library).trackingNodes()).containsExactly("Cave");
  }
}
