package clarity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import clarity.processor.ASTChild;
import clarity.processor.ASTNode;

/** The document root. Built once by {@link Parser} and never modified afterwards. */
@ASTNode
public class AST implements AST_ASTNode {

  /** Any statement that can appear in a block. */
  public interface Node extends ASTNodeInterface {
    Tokenizer.Pos pos();
  }

  private final ImmutableList<Node> nodes;

  public AST(List<? extends Node> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }

  @ASTChild
  @Override
  public ImmutableList<Node> nodes() {
    return nodes;
  }

  /** Either a bare (boolean) attribute or one with a text value. */
  @AutoValue
  public abstract static class AttributeValue {
    public abstract Optional<String> text();

    public boolean isFlag() {
      return !text().isPresent();
    }

    public static AttributeValue flag() {
      return new AutoValue_AST_AttributeValue(Optional.empty());
    }

    public static AttributeValue of(String text) {
      return new AutoValue_AST_AttributeValue(Optional.of(text));
    }
  }

  @ASTNode
  public static class Element implements Node, AST_Element_ASTNode {
    private final String name;
    private final Tokenizer.Pos pos;
    private final ImmutableMap<String, AttributeValue> attributes;
    private final Optional<String> content;
    private final ImmutableList<Node> children;

    private Element(
        String name,
        Tokenizer.Pos pos,
        Map<String, AttributeValue> attributes,
        Optional<String> content,
        List<? extends Node> children) {
      Preconditions.checkArgument(
          !content.isPresent() || children.isEmpty(),
          "element '%s' has both inline content and children",
          name);
      this.name = name;
      this.pos = pos;
      this.attributes = ImmutableMap.copyOf(attributes);
      this.content = content;
      this.children = ImmutableList.copyOf(children);
    }

    public static Element withContent(
        String name, Tokenizer.Pos pos, Map<String, AttributeValue> attributes, String content) {
      return new Element(name, pos, attributes, Optional.of(content), ImmutableList.of());
    }

    public static Element withChildren(
        String name,
        Tokenizer.Pos pos,
        Map<String, AttributeValue> attributes,
        List<? extends Node> children) {
      return new Element(name, pos, attributes, Optional.empty(), children);
    }

    public String name() {
      return name;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }

    public ImmutableMap<String, AttributeValue> attributes() {
      return attributes;
    }

    public Optional<String> content() {
      return content;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> children() {
      return children;
    }
  }

  /** Literal text. Multiline text keeps its triple-quote delimiters. */
  @ASTNode
  @AutoValue
  public abstract static class TextContent implements Node, AST_TextContent_ASTNode {
    public abstract String text();

    public abstract boolean multiline();

    @Override
    public abstract Tokenizer.Pos pos();

    public static TextContent create(String text, boolean multiline, Tokenizer.Pos pos) {
      return new AutoValue_AST_TextContent(text, multiline, pos);
    }
  }

  @ASTNode
  @AutoValue
  public abstract static class VariableDeclaration
      implements Node, AST_VariableDeclaration_ASTNode {
    public abstract String name();

    public abstract String value();

    @Override
    public abstract Tokenizer.Pos pos();

    public static VariableDeclaration create(String name, String value, Tokenizer.Pos pos) {
      return new AutoValue_AST_VariableDeclaration(name, value, pos);
    }
  }

  @ASTNode
  @AutoValue
  public abstract static class VariableReference
      implements Node, AST_VariableReference_ASTNode {
    /** The name without its leading '$'. */
    public abstract String name();

    @Override
    public abstract Tokenizer.Pos pos();

    public static VariableReference create(String name, Tokenizer.Pos pos) {
      return new AutoValue_AST_VariableReference(name, pos);
    }
  }

  @ASTNode
  public static class ForLoop implements Node, AST_ForLoop_ASTNode {
    private final String iterator;
    private final String iterable;
    private final Tokenizer.Pos pos;
    private final ImmutableList<Node> body;

    public ForLoop(String iterator, String iterable, Tokenizer.Pos pos, List<? extends Node> body) {
      this.iterator = iterator;
      this.iterable = iterable;
      this.pos = pos;
      this.body = ImmutableList.copyOf(body);
    }

    public String iterator() {
      return iterator;
    }

    /** The raw iterable expression, e.g. {@code $items}. */
    public String iterable() {
      return iterable;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }
  }

  @ASTNode
  public static class Conditional implements Node, AST_Conditional_ASTNode {
    private final String condition;
    private final Tokenizer.Pos pos;
    private final ImmutableList<Node> ifBody;
    private final Optional<ImmutableList<Node>> elseBody;

    public Conditional(
        String condition,
        Tokenizer.Pos pos,
        List<? extends Node> ifBody,
        Optional<? extends List<? extends Node>> elseBody) {
      this.condition = condition;
      this.pos = pos;
      this.ifBody = ImmutableList.copyOf(ifBody);
      this.elseBody = elseBody.map(b -> ImmutableList.<Node>copyOf(b));
    }

    public String condition() {
      return condition;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> ifBody() {
      return ifBody;
    }

    public boolean hasElseBranch() {
      return elseBody.isPresent();
    }

    /** Empty when there is no else branch. */
    @ASTChild
    @Override
    public ImmutableList<Node> elseBody() {
      return elseBody.orElse(ImmutableList.of());
    }
  }

  @ASTNode
  public static class ComponentDefinition implements Node, AST_ComponentDefinition_ASTNode {
    private final String name;
    private final Tokenizer.Pos pos;
    private final ImmutableList<String> parameters;
    private final ImmutableMap<String, String> defaultValues;
    private final ImmutableList<Node> body;

    public ComponentDefinition(
        String name,
        Tokenizer.Pos pos,
        List<String> parameters,
        Map<String, String> defaultValues,
        List<? extends Node> body) {
      this.name = name;
      this.pos = pos;
      this.parameters = ImmutableList.copyOf(parameters);
      this.defaultValues = ImmutableMap.copyOf(defaultValues);
      this.body = ImmutableList.copyOf(body);
    }

    public String name() {
      return name;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }

    public ImmutableList<String> parameters() {
      return parameters;
    }

    public ImmutableMap<String, String> defaultValues() {
      return defaultValues;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> body() {
      return body;
    }
  }

  @ASTNode
  @AutoValue
  public abstract static class ComponentUse implements Node, AST_ComponentUse_ASTNode {
    public abstract String name();

    public abstract ImmutableMap<String, String> arguments();

    @Override
    public abstract Tokenizer.Pos pos();

    public static ComponentUse create(
        String name, Map<String, String> arguments, Tokenizer.Pos pos) {
      return new AutoValue_AST_ComponentUse(name, ImmutableMap.copyOf(arguments), pos);
    }
  }
}
