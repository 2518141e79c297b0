package skein;

import com.google.common.collect.ImmutableList;

/** A pull-based source of tokens. After {@link Token.Type#EOF}, every call returns EOF again. */
public interface TokenSource {
  Token nextToken();

  int line();

  int column();

  int charIndex();

  boolean isExhausted();

  String sourceName();

  default ImmutableList<Token> tokenize() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    Token token;
    do {
      token = nextToken();
      tokens.add(token);
    } while (!token.is(Token.Type.EOF));
    return tokens.build();
  }
}
