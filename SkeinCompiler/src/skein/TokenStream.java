package skein;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public class TokenStream {
  private final TokenSource source;
  private final List<Token> tokens = new ArrayList<>();
  private boolean fetchedEof = false;

  // Index of the current default-channel token.
  private int p = -1;

  public TokenStream(TokenSource source) {
    this.source = source;
  }

  public String sourceName() {
    return source.sourceName();
  }

  /** The k-th default-channel token from the current position, 1-based. */
  public Token lt(int k) {
    Preconditions.checkArgument(k >= 1, "k must be positive: %s", k);
    lazyInit();
    int i = p;
    for (int n = 1; n < k; n++) {
      i = nextOnChannel(i + 1);
    }
    return tokens.get(i);
  }

  public Token.Type la(int k) {
    return lt(k).type();
  }

  public void consume() {
    lazyInit();
    Preconditions.checkState(!tokens.get(p).is(Token.Type.EOF), "cannot consume EOF");
    p = nextOnChannel(p + 1);
  }

  public int index() {
    lazyInit();
    return p;
  }

  public Token get(int index) {
    sync(index);
    return tokens.get(index);
  }

  public void fill() {
    while (!fetchedEof) fetch();
  }

  public ImmutableList<Token> tokens() {
    return ImmutableList.copyOf(tokens);
  }

  public ImmutableList<Token> hiddenTokensToLeft(int tokenIndex, int channel) {
    ImmutableList.Builder<Token> result = ImmutableList.builder();
    int i = tokenIndex - 1;
    while (i >= 0 && !tokens.get(i).isDefaultChannel()) i--;
    for (int j = i + 1; j < tokenIndex; j++) {
      if (tokens.get(j).channel() == channel) result.add(tokens.get(j));
    }
    return result.build();
  }

  public ImmutableList<Token> hiddenTokensToRight(int tokenIndex, int channel) {
    ImmutableList.Builder<Token> result = ImmutableList.builder();
    for (int i = tokenIndex + 1; ; i++) {
      sync(i);
      if (i >= tokens.size()) break;
      Token token = tokens.get(i);
      if (token.isDefaultChannel()) break;
      if (token.channel() == channel) result.add(token);
    }
    return result.build();
  }

  public Optional<Token> previousDefaultToken(int tokenIndex) {
    for (int i = tokenIndex - 1; i >= 0; i--) {
      if (tokens.get(i).isDefaultChannel()) return Optional.of(tokens.get(i));
    }
    return Optional.empty();
  }

  public String text(int start, int stop) {
    StringBuilder sb = new StringBuilder();
    for (int i = start; i <= stop && i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.is(Token.Type.EOF)) break;
      sb.append(token.text());
    }
    return sb.toString();
  }

  public String text() {
    fill();
    return text(0, tokens.size() - 1);
  }

  private void lazyInit() {
    if (p == -1) p = nextOnChannel(0);
  }

  // First default-channel token at or after i. EOF is on the default channel, so this terminates.
  private int nextOnChannel(int i) {
    sync(i);
    if (i >= tokens.size()) return tokens.size() - 1;
    while (!tokens.get(i).isDefaultChannel()) {
      i++;
      sync(i);
      if (i >= tokens.size()) return tokens.size() - 1;
    }
    return i;
  }

  // Makes index i available, if the source has that many tokens.
  private void sync(int i) {
    while (tokens.size() <= i && !fetchedEof) fetch();
  }

  private void fetch() {
    Token token = source.nextToken().withTokenIndex(tokens.size());
    tokens.add(token);
    if (token.is(Token.Type.EOF)) fetchedEof = true;
  }
}
