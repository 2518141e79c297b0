package skein;

import java.util.List;

/**
 * Tags the line shown right before a group of shortcut options with {@code #lastline}, so a runner
 * can keep it on screen while the options are presented. When an if statement precedes the
 * options, the last line of each of its clauses is tagged instead.
 */
class LastLineBeforeOptionsVisitor extends VoidDefaultASTVisitor {
  public static final String LAST_LINE_TAG = "lastline";

  private void tagStatements(List<AST.Statement> statements) {
    for (int i = 1; i < statements.size(); i++) {
      if (statements.get(i) instanceof AST.ShortcutOptionStatement) {
        tagLastLine(statements.get(i - 1));
      }
    }
  }

  private void tagLastLine(AST.Statement statement) {
    if (statement instanceof AST.LineStatement) {
      AST.LineStatement line = (AST.LineStatement) statement;
      if (!line.hasHashtag(LAST_LINE_TAG)) {
        line.addHashtag(AST.Hashtag.synthesized(LAST_LINE_TAG));
      }
    } else if (statement instanceof AST.IfStatement) {
      for (AST.IfStatement.Clause clause : ((AST.IfStatement) statement).clauses()) {
        List<AST.Statement> statements = clause.statements();
        if (!statements.isEmpty()) tagLastLine(statements.get(statements.size() - 1));
      }
    }
  }

  @Override
  public void visitImpl(AST.Node node) {
    tagStatements(node.body());
    super.visitImpl(node);
  }

  @Override
  public void visitImpl(AST.ShortcutOption option) {
    tagStatements(option.body());
    super.visitImpl(option);
  }

  @Override
  public void visitImpl(AST.IfStatement.Clause clause) {
    tagStatements(clause.statements());
    super.visitImpl(clause);
  }

  @Override
  public void visitImpl(AST.IndentedBlock block) {
    tagStatements(block.statements());
    super.visitImpl(block);
  }
}
