package skein;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Registers the text of every line in a file with the string table. Lines without a {@code #line:}
 * hashtag get a generated id, which is written back onto the line as a synthesized hashtag.
 */
class StringTableGeneratorVisitor extends DiagnosticCollectingVisitor {
  private final StringTableManager stringTable;
  private String currentNodeName = "";

  StringTableGeneratorVisitor(String fileName, StringTableManager stringTable) {
    super(fileName);
    this.stringTable = stringTable;
  }

  StringTableManager stringTable() {
    return stringTable;
  }

  @Override
  public void visitImpl(AST.Node node) {
    Optional<String> title = node.title();
    if (!title.isPresent()) {
      Token token = node.headers().isEmpty() ? node.bodyStart() : node.headers().get(0).keyToken();
      logError(token, "node has no 'title' header; its lines will not be localized");
      return;
    }

    currentNodeName = title.get();
    super.visitImpl(node);
  }

  @Override
  public void visitImpl(AST.LineStatement line) {
    String text = composeText(line);
    ImmutableList<String> tags =
        line.hashtags().stream().map(AST.Hashtag::text).collect(ImmutableList.toImmutableList());

    Optional<AST.Hashtag> idTag = line.lineIdHashtag();
    if (idTag.isPresent()) {
      String lineId = idTag.get().text();
      if (stringTable.containsKey(lineId)) {
        logError(idTag.get().token().orElse(line.start()), "Duplicate line ID " + lineId);
        return;
      }
      stringTable.register(
          lineId,
          StringInfo.create(text, fileName(), currentNodeName, line.lineNumber(), false, tags));
      return;
    }

    String lineId =
        String.format(
            "%s%s-%s-%d",
            AST.LineStatement.LINE_ID_PREFIX, fileName(), currentNodeName, stringTable.size());
    stringTable.register(
        lineId,
        StringInfo.create(text, fileName(), currentNodeName, line.lineNumber(), true, tags));
    line.addHashtag(AST.Hashtag.synthesized(lineId));
  }

  // Literal text, with {0}, {1}, ... standing in for inline expressions.
  private static String composeText(AST.LineStatement line) {
    StringBuilder sb = new StringBuilder();
    int expressionCount = 0;
    for (AST.LinePart part : line.parts()) {
      if (part instanceof AST.TextPart) {
        sb.append(((AST.TextPart) part).text());
      } else {
        sb.append('{').append(expressionCount++).append('}');
      }
    }
    return sb.toString().trim();
  }
}
