package clarity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/** Every component defined anywhere in a document, by name. Later definitions win. */
public final class ComponentTable {
  private final ImmutableMap<String, AST.ComponentDefinition> components;

  private ComponentTable(Map<String, AST.ComponentDefinition> components) {
    this.components = ImmutableMap.copyOf(components);
  }

  public static ComponentTable collect(AST ast) {
    Map<String, AST.ComponentDefinition> components = new LinkedHashMap<>();
    ast.accept(
        new VoidDefaultASTVisitor() {
          @Override
          public void visitImpl(AST.ComponentDefinition definition) {
            components.put(definition.name(), definition);
            definition.visitChildren(this, null);
          }
        },
        null);
    return new ComponentTable(components);
  }

  public Optional<AST.ComponentDefinition> get(String name) {
    return Optional.ofNullable(components.get(name));
  }

  public ImmutableMap<String, AST.ComponentDefinition> components() {
    return components;
  }
}
