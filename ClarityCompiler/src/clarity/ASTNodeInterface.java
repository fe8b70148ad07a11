package clarity;

/** Implemented through the generated {@code *_ASTNode} interface of each node type. */
public interface ASTNodeInterface {
  <V> V accept(ASTVisitor<V> visitor, V value);

  <V> V visitChildren(ASTVisitor<V> visitor, V value);
}
