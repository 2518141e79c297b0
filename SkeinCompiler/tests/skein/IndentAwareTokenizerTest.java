package skein;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;

public class IndentAwareTokenizerTest {

  private final StringBuilder file = new StringBuilder();
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private IndentAwareTokenizer tokenizer;

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ImmutableList<Token> tokenize() {
    tokenizer =
        new IndentAwareTokenizer(
            new Tokenizer("test.skein", file.toString(), diagnostics::add), diagnostics::add);
    return tokenizer.tokenize();
  }

  private ImmutableList<Token.Type> bodyTypes() {
    return tokenize()
        .stream()
        .filter(Token::isDefaultChannel)
        .map(Token::type)
        .dropWhile(t -> t != Token.Type.BODY_START)
        .collect(ImmutableList.toImmutableList());
  }

  private static Token newline(String text, int line) {
    return Token.create(Token.Type.NEWLINE, text, line, 0, Token.HIDDEN_CHANNEL, 0, 0);
  }

  @Test
  public void optionBodyIsIndented() {
    println("title: Start");
    println("---");
    println("-> A");
    println("    Inside");
    println("-> B");
    println("===");

    assertThat(bodyTypes())
        .containsExactly(
            Token.Type.BODY_START,
            Token.Type.SHORTCUT_ARROW,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.INDENT,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.DEDENT,
            Token.Type.SHORTCUT_ARROW,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.BODY_END,
            Token.Type.EOF)
        .inOrder();
    assertThat(diagnostics).isEmpty();
  }

  @Test
  public void nestedOptions() {
    println("title: Start");
    println("---");
    println("-> A");
    println("    -> A1");
    println("        Deep");
    println("After");
    println("===");

    ImmutableList<Token.Type> types = bodyTypes();

    assertThat(types.stream().filter(t -> t == Token.Type.INDENT).count()).isEqualTo(2);
    assertThat(types.stream().filter(t -> t == Token.Type.DEDENT).count()).isEqualTo(2);
    assertThat(tokenizer.unbalancedIndentDepth()).isEqualTo(0);
  }

  @Test
  public void indentationOutsideOptionsIsIgnored() {
    println("title: Start");
    println("---");
    println("Hello");
    println("    Indented");
    println("===");

    assertThat(bodyTypes())
        .containsExactly(
            Token.Type.BODY_START,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.BODY_END,
            Token.Type.EOF)
        .inOrder();
  }

  @Test
  public void blankLineFollowingOption() {
    println("title: Start");
    println("---");
    println("-> A");
    println("-> B");
    println("");
    println("After");
    println("===");

    assertThat(bodyTypes())
        .containsExactly(
            Token.Type.BODY_START,
            Token.Type.SHORTCUT_ARROW,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.SHORTCUT_ARROW,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.BLANK_LINE_FOLLOWING_OPTION,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.BODY_END,
            Token.Type.EOF)
        .inOrder();
  }

  @Test
  public void dedentThenBlankLineEndsOptionGroup() {
    println("title: Start");
    println("---");
    println("-> A");
    println("    in");
    println("");
    println("After");
    println("===");

    assertThat(bodyTypes())
        .containsExactly(
            Token.Type.BODY_START,
            Token.Type.SHORTCUT_ARROW,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.INDENT,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.DEDENT,
            Token.Type.BLANK_LINE_FOLLOWING_OPTION,
            Token.Type.TEXT,
            Token.Type.NEWLINE,
            Token.Type.BODY_END,
            Token.Type.EOF)
        .inOrder();
    assertThat(diagnostics).isEmpty();

    AST ast =
        ParsedFile.parse(SourceFile.create("test.skein", file.toString()), diagnostics::add)
            .tree();
    AST.ShortcutOptionStatement options =
        (AST.ShortcutOptionStatement) ast.nodes().get(0).body().get(0);
    assertThat(options.endsWithBlankLine()).isTrue();
    assertThat(diagnostics).isEmpty();
  }

  @Test
  public void blankLineAfterOrdinaryLineIsNotMarked() {
    println("title: Start");
    println("---");
    println("-> A");
    println("Text");
    println("");
    println("After");
    println("===");

    assertThat(bodyTypes()).doesNotContain(Token.Type.BLANK_LINE_FOLLOWING_OPTION);
    assertThat(diagnostics).isEmpty();
  }

  @Test
  public void onlyOneBlankLineTokenForSeveralBlankLines() {
    println("title: Start");
    println("---");
    println("-> A");
    println("");
    println("");
    println("After");
    println("===");

    ImmutableList<Token> tokens = tokenize();

    ImmutableList<Token> blanks =
        tokens
            .stream()
            .filter(t -> t.is(Token.Type.BLANK_LINE_FOLLOWING_OPTION))
            .collect(ImmutableList.toImmutableList());
    assertThat(blanks).hasSize(1);
    assertThat(blanks.get(0).text()).isEmpty();
  }

  @Test
  public void noBlankLineTokenWithoutOptions() {
    println("title: Start");
    println("---");
    println("Hello");
    println("");
    println("After");
    println("===");

    assertThat(bodyTypes()).doesNotContain(Token.Type.BLANK_LINE_FOLLOWING_OPTION);
  }

  @Test
  public void bodyEndDropsOpenIndentation() {
    println("title: Start");
    println("---");
    println("-> A");
    println("    Inside");
    println("    ===");
    println("title: Next");
    println("---");
    println("Hello");
    println("===");

    ImmutableList<Token.Type> types = bodyTypes();

    assertThat(types).contains(Token.Type.INDENT);
    assertThat(types).doesNotContain(Token.Type.DEDENT);
    assertThat(tokenizer.unbalancedIndentDepth()).isEqualTo(0);
  }

  @Test
  public void endOfFileClosesIndentation() {
    file.append("title: Start\n---\n-> A\n    Inside");

    ImmutableList<Token.Type> types = bodyTypes();

    assertThat(types.subList(types.size() - 3, types.size()))
        .containsExactly(Token.Type.TEXT, Token.Type.DEDENT, Token.Type.EOF)
        .inOrder();
    assertThat(tokenizer.unbalancedIndentDepth()).isEqualTo(0);
  }

  @Test
  public void endOfFileIsRepeated() {
    println("title: Start");

    tokenize();

    assertThat(tokenizer.isExhausted()).isTrue();
    assertThat(tokenizer.nextToken().type()).isEqualTo(Token.Type.EOF);
    assertThat(tokenizer.nextToken().type()).isEqualTo(Token.Type.EOF);
  }

  @Test
  public void synthesizedTokensHaveNoText() {
    println("title: Start");
    println("---");
    println("-> A");
    println("    Inside");
    println("===");

    ImmutableList<Token> tokens = tokenize();

    Token indent = tokens.stream().filter(t -> t.is(Token.Type.INDENT)).findFirst().get();
    assertThat(indent.text()).isEmpty();
    assertThat(indent.line()).isEqualTo(4);
    assertThat(indent.stopIndex()).isEqualTo(indent.startIndex() - 1);
  }

  @Test
  public void indentationLength() {
    tokenize();

    assertThat(tokenizer.getLengthOfNewlineToken(newline("\n", 1))).isEqualTo(0);
    assertThat(tokenizer.getLengthOfNewlineToken(newline("\n    ", 1))).isEqualTo(4);
    assertThat(tokenizer.getLengthOfNewlineToken(newline("\n\t", 1))).isEqualTo(8);
    assertThat(tokenizer.getLengthOfNewlineToken(newline("\r\n\t\t", 1))).isEqualTo(16);
    assertThat(diagnostics).isEmpty();
  }

  @Test
  public void mixedIndentationWarns() {
    tokenize();

    assertThat(tokenizer.getLengthOfNewlineToken(newline("\n\t ", 3))).isEqualTo(9);

    assertThat(diagnostics).hasSize(1);
    Diagnostic warning = diagnostics.get(0);
    assertThat(warning.severity()).isEqualTo(Diagnostic.Severity.WARNING);
    assertThat(warning.line()).isEqualTo(4);
    assertThat(warning.characters().get()).isEqualTo(Range.closedOpen(0, 3));
    assertThat(warning.context()).isEqualTo("\t ");
  }

  @Test
  public void mixedIndentationInSourceWarnsOncePerLine() {
    println("title: Start");
    println("---");
    println("-> A");
    println("\t Inside");
    println("===");

    ImmutableList<Token.Type> types = bodyTypes();

    assertThat(types).contains(Token.Type.INDENT);
    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).line()).isEqualTo(4);
  }

  @Test
  public void lengthOfNonNewlineTokenFails() {
    tokenize();

    assertThrows(
        IllegalArgumentException.class,
        () ->
            tokenizer.getLengthOfNewlineToken(
                Token.create(Token.Type.TEXT, "text", 1, 0, Token.DEFAULT_CHANNEL, 0, 3)));
  }
}
