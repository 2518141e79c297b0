package skein;

import java.util.function.Consumer;

public final class ParsedFile {
  private final String name;
  private final AST tree;
  private final TokenStream tokens;

  private ParsedFile(String name, AST tree, TokenStream tokens) {
    this.name = name;
    this.tree = tree;
    this.tokens = tokens;
  }

  public static ParsedFile parse(SourceFile file, Consumer<Diagnostic> diagnostics) {
    Tokenizer lexer = new Tokenizer(file.fileName(), file.source(), diagnostics);
    TokenStream tokens = new TokenStream(new IndentAwareTokenizer(lexer, diagnostics));
    AST tree = new Parser(tokens, diagnostics).parse();
    tokens.fill();
    return new ParsedFile(file.fileName(), tree, tokens);
  }

  public String name() {
    return name;
  }

  public AST tree() {
    return tree;
  }

  public TokenStream tokens() {
    return tokens;
  }
}
