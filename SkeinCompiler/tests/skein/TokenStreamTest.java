package skein;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TokenStreamTest {

  private static final String SOURCE = "title: Start\n---\n// note\nHello // trailing\n===\n";

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private TokenStream stream() {
    return new TokenStream(
        new IndentAwareTokenizer(
            new Tokenizer("test.skein", SOURCE, diagnostics::add), diagnostics::add));
  }

  @Test
  public void lookaheadSkipsHiddenTokens() {
    TokenStream tokens = stream();

    assertThat(tokens.la(1)).isEqualTo(Token.Type.ID);
    assertThat(tokens.la(2)).isEqualTo(Token.Type.HEADER_DELIMITER);
    assertThat(tokens.la(3)).isEqualTo(Token.Type.REST_OF_LINE);
    assertThat(tokens.la(4)).isEqualTo(Token.Type.BODY_START);
    assertThat(tokens.la(5)).isEqualTo(Token.Type.TEXT);

    for (int i = 0; i < 4; i++) tokens.consume();
    assertThat(tokens.lt(1).text()).isEqualTo("Hello ");
  }

  @Test
  public void cannotConsumeEof() {
    TokenStream tokens = stream();
    while (tokens.la(1) != Token.Type.EOF) tokens.consume();

    assertThrows(IllegalStateException.class, tokens::consume);
  }

  @Test
  public void hiddenTokensAroundADefaultToken() {
    TokenStream tokens = stream();
    for (int i = 0; i < 4; i++) tokens.consume();
    int hello = tokens.index();
    tokens.fill();

    ImmutableList<Token> left = tokens.hiddenTokensToLeft(hello, Token.COMMENTS_CHANNEL);
    ImmutableList<Token> right = tokens.hiddenTokensToRight(hello, Token.COMMENTS_CHANNEL);

    assertThat(left).hasSize(1);
    assertThat(left.get(0).text()).isEqualTo("// note");
    assertThat(right).hasSize(1);
    assertThat(right.get(0).text()).isEqualTo("// trailing");
    assertThat(tokens.previousDefaultToken(hello).get().type()).isEqualTo(Token.Type.BODY_START);
  }

  @Test
  public void textRebuildsTheSource() {
    TokenStream tokens = stream();

    assertThat(tokens.text()).isEqualTo(SOURCE);
  }
}
