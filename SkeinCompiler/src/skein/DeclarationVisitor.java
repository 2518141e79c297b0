package skein;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

class DeclarationVisitor extends DiagnosticCollectingVisitor {
  private static final String DOC_COMMENT_PREFIX = "///";

  private final TokenStream tokens;
  private final List<Declaration> newDeclarations = new ArrayList<>();
  private final List<String> fileTags = new ArrayList<>();
  private Optional<String> currentNodeName = Optional.empty();

  DeclarationVisitor(String fileName, TokenStream tokens) {
    super(fileName);
    this.tokens = tokens;
  }

  public ImmutableList<Declaration> newDeclarations() {
    return ImmutableList.copyOf(newDeclarations);
  }

  public ImmutableList<String> fileTags() {
    return ImmutableList.copyOf(fileTags);
  }

  @Override
  public void visitImpl(AST.FileHashtag hashtag) {
    fileTags.add(hashtag.text());
  }

  @Override
  public void visitImpl(AST.Node node) {
    currentNodeName = node.title();
    super.visitImpl(node);
    currentNodeName = Optional.empty();
  }

  @Override
  public void visitImpl(AST.DeclareStatement declare) {
    Expression value = declare.value();
    if (value instanceof Expression.NullLiteral) {
      logError(
          value.start(),
          String.format("null is not a permitted default value for %s", declare.variableName()));
      return;
    }

    Optional<Value> constant = value.constantValue();
    if (!constant.isPresent()) {
      logError(
          value.start(),
          String.format("the default value of %s must be a constant", declare.variableName()));
      return;
    }

    if (declare.typeName().isPresent()) {
      Token typeToken = declare.typeName().get();
      Optional<ValueType> explicitType = ValueType.parse(typeToken.text());
      if (!explicitType.isPresent()) {
        logError(typeToken, String.format("unknown type '%s'", typeToken.text()));
        return;
      }
      if (explicitType.get() != constant.get().type()) {
        logError(
            typeToken,
            String.format(
                "%s is declared as %s, but its default value %s is a %s",
                declare.variableName(),
                explicitType.get(),
                constant.get(),
                constant.get().type()));
        return;
      }
    }

    Declaration.Builder builder =
        Declaration.builder(declare.variableName(), constant.get())
            .setSourceFileName(fileName())
            .setSourceLine(declare.start().line());
    currentNodeName.ifPresent(builder::setSourceNodeName);
    documentation(declare).ifPresent(builder::setDescription);
    newDeclarations.add(builder.build());
  }

  // A trailing /// comment on the declaration's own line wins over /// lines above it.
  private Optional<String> documentation(AST.DeclareStatement declare) {
    Token stop = declare.stop();
    Optional<Token> trailing =
        tokens
            .hiddenTokensToRight(stop.tokenIndex(), Token.COMMENTS_CHANNEL)
            .stream()
            .filter(t -> t.line() == stop.line() && isDocComment(t))
            .findFirst();
    if (trailing.isPresent()) return Optional.of(stripDocComment(trailing.get()));

    Token start = declare.start();
    // Synthesized tokens have no text and no line of their own.
    int previousLine =
        tokens
            .previousDefaultToken(start.tokenIndex())
            .filter(t -> !t.text().isEmpty())
            .map(Token::line)
            .orElse(-1);
    String preceding =
        tokens
            .hiddenTokensToLeft(start.tokenIndex(), Token.COMMENTS_CHANNEL)
            .stream()
            .filter(t -> t.line() != previousLine && isDocComment(t))
            .map(DeclarationVisitor::stripDocComment)
            .filter(text -> !text.isEmpty())
            .collect(Collectors.joining(" "));
    return preceding.isEmpty() ? Optional.empty() : Optional.of(preceding);
  }

  private static boolean isDocComment(Token token) {
    return token.text().startsWith(DOC_COMMENT_PREFIX);
  }

  private static String stripDocComment(Token token) {
    return token.text().substring(DOC_COMMENT_PREFIX.length()).trim();
  }
}
