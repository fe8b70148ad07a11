package clarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Emits HTML for a parsed document.
 *
 * <p>Each visit takes the variable bindings in effect before the node and returns the bindings in
 * effect after it. Output is an append-only list of lines, indented by {@code indentWidth} spaces
 * per nesting level.
 */
public class Compiler implements ASTVisitor<Environment> {
  private static final String DOCUMENT = "document";
  private static final ImmutableList<String> RAW_TEXT_ELEMENTS =
      ImmutableList.of("style", "script");

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');
  private static final Splitter ITEM_SPLITTER = Splitter.on(',').trimResults();

  private final AST ast;
  private final int indentWidth;
  private final ComponentTable components;
  private final ErrorCollector errors = new ErrorCollector(Compiler.class);

  private final List<String> lines = new ArrayList<>();
  private int depth = 0;
  private final Deque<String> activeComponents = new ArrayDeque<>();
  private Optional<String> output = Optional.empty();

  public Compiler(AST ast, int indentWidth) {
    Preconditions.checkArgument(indentWidth >= 0, "negative indent width: %s", indentWidth);
    this.ast = ast;
    this.indentWidth = indentWidth;
    this.components = ComponentTable.collect(ast);
  }

  public Compiler(AST ast) {
    this(ast, 2);
  }

  /** Returns the HTML, lines joined with '\n'. Repeated calls return the same text. */
  public String compile() {
    if (!output.isPresent()) {
      ast.accept(this, Environment.empty());
      output = Optional.of(String.join("\n", lines));
    }
    return output.get();
  }

  public ImmutableList<CompilerException> errors() {
    return errors.errors();
  }

  public ComponentTable components() {
    return components;
  }

  private void emit(String line) {
    lines.add(Strings.repeat(" ", depth * indentWidth) + line);
  }

  private Environment visitBlock(List<AST.Node> nodes, Environment env) {
    for (AST.Node node : nodes) {
      env = node.accept(this, env);
    }
    return env;
  }

  private Environment visitIndentedBlock(List<AST.Node> nodes, Environment env) {
    depth++;
    try {
      return visitBlock(nodes, env);
    } finally {
      depth--;
    }
  }

  @Override
  public Environment visit(AST root, Environment env) {
    return visitBlock(root.nodes(), env);
  }

  @Override
  public Environment visit(AST.Element element, Environment env) {
    if (element.name().equals(DOCUMENT)) return visitDocument(element, env);
    if (RAW_TEXT_ELEMENTS.contains(element.name())) return visitRawTextElement(element, env);

    String openTag = openTag(element);
    if (element.content().isPresent()) {
      emit(
          String.format(
              "%s%s</%s>", openTag, env.substitute(element.content().get()), element.name()));
      return env;
    }

    emit(openTag);
    env = visitIndentedBlock(element.children(), env);
    emit(closeTag(element));
    return env;
  }

  private Environment visitDocument(AST.Element document, Environment env) {
    emit("<!DOCTYPE html>");
    emit("<html>");
    depth++;
    try {
      if (document.content().isPresent()) emit(env.substitute(document.content().get()));
      env = visitBlock(document.children(), env);
    } finally {
      depth--;
    }
    emit("</html>");
    return env;
  }

  // style and script bodies are copied through untouched.
  private Environment visitRawTextElement(AST.Element element, Environment env) {
    emit(openTag(element));
    depth++;
    try {
      findRawBlock(element).ifPresent(block -> LINE_SPLITTER.split(block).forEach(this::emit));
    } finally {
      depth--;
    }
    emit(closeTag(element));
    return env;
  }

  private static Optional<String> findRawBlock(AST.Element element) {
    Optional<String> block = element.content().flatMap(Compiler::betweenTripleQuotes);
    if (block.isPresent()) return block;

    for (AST.Node child : element.children()) {
      if (child instanceof AST.TextContent) {
        String text = ((AST.TextContent) child).text().trim();
        if (isTripleQuoted(text)) return Optional.of(text.substring(3, text.length() - 3));
      }
    }

    for (AST.Node child : element.children()) {
      if (child instanceof AST.Element) {
        block = ((AST.Element) child).content().flatMap(Compiler::betweenTripleQuotes);
        if (block.isPresent()) return block;
      }
    }
    return Optional.empty();
  }

  private static boolean isTripleQuoted(String text) {
    if (text.length() < 6) return false;

    String delimiter = text.substring(0, 3);
    return (delimiter.equals(Tokenizer.TRIPLE_QUOTE)
            || delimiter.equals(Tokenizer.TRIPLE_SINGLE_QUOTE))
        && text.endsWith(delimiter);
  }

  // The text between the first and last triple quote, if there are two of them.
  private static Optional<String> betweenTripleQuotes(String text) {
    for (String delimiter :
        ImmutableList.of(Tokenizer.TRIPLE_QUOTE, Tokenizer.TRIPLE_SINGLE_QUOTE)) {
      int start = text.indexOf(delimiter);
      int end = text.lastIndexOf(delimiter);
      if (start >= 0 && end >= start + 3) return Optional.of(text.substring(start + 3, end));
    }
    return Optional.empty();
  }

  private static String openTag(AST.Element element) {
    if (element.attributes().isEmpty()) return "<" + element.name() + ">";

    String attributes =
        element
            .attributes()
            .entrySet()
            .stream()
            .map(Compiler::renderAttribute)
            .collect(Collectors.joining(" "));
    return String.format("<%s %s>", element.name(), attributes);
  }

  private static String renderAttribute(Map.Entry<String, AST.AttributeValue> attribute) {
    if (attribute.getValue().isFlag()) return attribute.getKey();
    return String.format("%s=\"%s\"", attribute.getKey(), attribute.getValue().text().get());
  }

  private static String closeTag(AST.Element element) {
    return "</" + element.name() + ">";
  }

  @Override
  public Environment visit(AST.TextContent text, Environment env) {
    if (!text.multiline()) {
      emit(env.substitute(text.text()));
      return env;
    }

    String raw = text.text().trim();
    String inner = isTripleQuoted(raw) ? raw.substring(3, raw.length() - 3) : raw;
    LINE_SPLITTER.split(env.substitute(inner)).forEach(this::emit);
    return env;
  }

  @Override
  public Environment visit(AST.VariableDeclaration declaration, Environment env) {
    return env.with(declaration.name(), declaration.value());
  }

  @Override
  public Environment visit(AST.VariableReference reference, Environment env) {
    emit(env.lookup(reference.name()).orElse("$" + reference.name()));
    return env;
  }

  @Override
  public Environment visit(AST.ForLoop loop, Environment env) {
    Optional<List<String>> items = loopItems(loop, env);
    if (!items.isPresent()) return env;

    for (String item : items.get()) {
      env = visitBlock(loop.body(), env.with(loop.iterator(), item)).without(loop.iterator());
    }
    return env;
  }

  private Optional<List<String>> loopItems(AST.ForLoop loop, Environment env) {
    String iterable = loop.iterable();
    if (!iterable.startsWith("$")) {
      errors.logError(loop.pos(), "for loop iterable must be a variable: " + iterable);
      return Optional.empty();
    }

    Optional<String> value = env.lookup(iterable.substring(1));
    if (!value.isPresent()) {
      errors.logError(loop.pos(), "unknown variable in for loop: " + iterable);
      return Optional.empty();
    }

    String list = value.get().trim();
    if (!list.startsWith("[") || !list.endsWith("]")) {
      errors.logError(loop.pos(), String.format("%s is not a list: %s", iterable, list));
      return Optional.empty();
    }

    // Naive: nested brackets and quoted commas are not understood.
    List<String> items = ITEM_SPLITTER.splitToList(list.substring(1, list.length() - 1));
    if (items.stream().allMatch(Compiler::isDoubleQuoted)) {
      items = items.stream().map(Compiler::stripDoubleQuotes).collect(Collectors.toList());
    }
    return Optional.of(items);
  }

  private static boolean isDoubleQuoted(String item) {
    return item.startsWith("\"") && item.endsWith("\"");
  }

  // A lone '"' counts as quoted and strips to nothing.
  private static String stripDoubleQuotes(String item) {
    return item.length() < 2 ? "" : item.substring(1, item.length() - 1);
  }

  @Override
  public Environment visit(AST.Conditional conditional, Environment env) {
    String condition = env.substituteQuoted(conditional.condition());

    boolean result;
    try {
      result = Condition.test(condition, conditional.pos());
    } catch (CompilerException ex) {
      errors.logError(
          conditional.pos(),
          String.format("failed to evaluate condition '%s': %s", condition, ex.errorMsg()));
      result = false;
    }

    if (result) return visitBlock(conditional.ifBody(), env);
    return visitBlock(conditional.elseBody(), env);
  }

  @Override
  public Environment visit(AST.ComponentDefinition definition, Environment env) {
    return env;
  }

  @Override
  public Environment visit(AST.ComponentUse use, Environment env) {
    Optional<AST.ComponentDefinition> definition = components.get(use.name());
    if (!definition.isPresent()) {
      errors.logError(use.pos(), "unknown component: " + use.name());
      return env;
    }

    if (activeComponents.contains(use.name())) {
      errors.logError(
          use.pos(),
          String.format(
              "recursive use of component %s: %s",
              use.name(),
              String.join(" -> ", ImmutableList.copyOf(activeComponents.descendingIterator()))));
      return env;
    }

    // The component body sees its own scope; the caller's bindings come back untouched.
    Environment scope = env.with(definition.get().defaultValues()).with(use.arguments());
    activeComponents.push(use.name());
    try {
      visitBlock(definition.get().body(), scope);
    } finally {
      activeComponents.pop();
    }
    return env;
  }
}
