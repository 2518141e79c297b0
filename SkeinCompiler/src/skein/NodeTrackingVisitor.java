package skein;

import java.util.LinkedHashSet;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

class NodeTrackingVisitor extends VoidDefaultASTVisitor {
  public static final String TRACKING_HEADER = "tracking";

  private final Library library;
  private final Set<String> trackingNodes = new LinkedHashSet<>();
  private final Set<String> ignoringNodes = new LinkedHashSet<>();

  NodeTrackingVisitor(Library library) {
    this.library = library;
  }

  public ImmutableSet<String> trackingNodes() {
    return ImmutableSet.copyOf(trackingNodes);
  }

  public ImmutableSet<String> ignoringNodes() {
    return ImmutableSet.copyOf(ignoringNodes);
  }

  @Override
  public void visitImpl(AST.Node node) {
    if (node.title().isPresent()) {
      String tracking = node.header(TRACKING_HEADER).orElse("");
      if (tracking.equals("always")) {
        trackingNodes.add(node.title().get());
      } else if (tracking.equals("never")) {
        ignoringNodes.add(node.title().get());
      }
    }
    super.visitImpl(node);
  }

  @Override
  public void visitImpl(Expression.FunctionCall call) {
    if (library.tracksVisits(call.functionName())
        && !call.arguments().isEmpty()
        && call.arguments().get(0) instanceof Expression.StringLiteral) {
      trackingNodes.add(((Expression.StringLiteral) call.arguments().get(0)).literal());
    }
    super.visitImpl(call);
  }
}
