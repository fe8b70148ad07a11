package clarity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import clarity.Tokenizer.Token;
import clarity.Tokenizer.TokenType;

/**
 * Recursive descent over the token list, one token of lookahead.
 *
 * <p>Malformed input never aborts the parse: the problem is recorded in {@link #errors()}, an
 * empty placeholder construct takes the place of the statement, and parsing resumes with the next
 * token.
 */
public class Parser {
  private static final Pattern VARIABLE_DECLARATION =
      Pattern.compile("\\$(\\w+)\\s*=\\s*(.*)", Pattern.UNICODE_CHARACTER_CLASS | Pattern.DOTALL);
  private static final Pattern FOR_LOOP =
      Pattern.compile("for\\s+(\\w+)\\s+in\\s+(.+)", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern IF_STATEMENT = Pattern.compile("if\\s+(.+)");
  private static final Pattern COMPONENT_DEFINITION =
      Pattern.compile("@component\\s+(\\w+)\\s*\\(([^)]*)\\)", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern COMPONENT_USE =
      Pattern.compile("@(\\w+)(?:\\s*\\(([^)]*)\\))?", Pattern.UNICODE_CHARACTER_CLASS);

  private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  static final String ERROR_NAME = "error";

  private final ImmutableList<Token> tokens;
  private int position = 0;

  private final ErrorCollector errors = new ErrorCollector(Parser.class);

  // Forward-only: a declaration is visible to attributes parsed after it.
  private final Map<String, String> variables = new LinkedHashMap<>();
  private final Map<String, AST.ComponentDefinition> components = new LinkedHashMap<>();

  public Parser(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
  }

  public AST parse() {
    List<AST.Node> nodes = new ArrayList<>();
    while (!isAtEnd()) {
      parseStatement().ifPresent(nodes::add);
    }
    return new AST(nodes);
  }

  public ImmutableList<CompilerException> errors() {
    return errors.errors();
  }

  /** Component definitions in the order they were parsed. */
  public ImmutableMap<String, AST.ComponentDefinition> components() {
    return ImmutableMap.copyOf(components);
  }

  private Optional<AST.Node> parseStatement() {
    Token token = peek();
    switch (token.type()) {
      case VARIABLE_DECL:
        return Optional.of(parseVariableDeclaration());
      case COMPONENT_DEF:
        return Optional.of(parseComponentDefinition());
      case ELEMENT:
        return Optional.of(parseElement());
      case FOR_LOOP:
        return Optional.of(parseForLoop());
      case IF_STATEMENT:
        return Optional.of(parseConditional());
      case COMPONENT_USE:
        return Optional.of(parseComponentUse());
      case STRING:
        advance();
        return Optional.of(AST.TextContent.create(unquote(token.text()), false, token.pos()));
      case MULTILINE_STRING:
        advance();
        return Optional.of(AST.TextContent.create(token.text(), true, token.pos()));
      case CONTENT:
        advance();
        return Optional.of(AST.TextContent.create(token.text(), false, token.pos()));
      case VARIABLE_REF:
        advance();
        return Optional.of(AST.VariableReference.create(token.text().substring(1), token.pos()));
      case NEWLINE:
      case COMMENT:
        advance();
        return Optional.empty();
      default:
        errors.logError(token.pos(), "unexpected token: " + token.type());
        advance();
        return Optional.empty();
    }
  }

  private AST.VariableDeclaration parseVariableDeclaration() {
    Token token = consume(TokenType.VARIABLE_DECL);
    Matcher m = VARIABLE_DECLARATION.matcher(token.text());
    if (!m.lookingAt()) {
      errors.logError(token.pos(), "invalid variable declaration: " + token.text());
      return AST.VariableDeclaration.create(ERROR_NAME, "", token.pos());
    }

    String name = m.group(1);
    String value = unquoteDouble(m.group(2).trim());
    variables.put(name, value);

    return AST.VariableDeclaration.create(name, value, token.pos());
  }

  private AST.Element parseElement() {
    Token token = consume(TokenType.ELEMENT);

    Map<String, AST.AttributeValue> attributes = ImmutableMap.of();
    if (check(TokenType.ATTRIBUTE)) {
      attributes = parseAttributes(advance().text());
    }

    consume(TokenType.COLON);

    if (check(TokenType.STRING)
        || check(TokenType.MULTILINE_STRING)
        || check(TokenType.CONTENT)
        || check(TokenType.VARIABLE_REF)) {
      return AST.Element.withContent(token.text(), token.pos(), attributes, parseContent());
    }

    List<AST.Node> children = ImmutableList.of();
    skipComments();
    if (check(TokenType.NEWLINE)) {
      advance();
      if (check(TokenType.INDENT)) {
        advance();
        children = parseBlock();
        consume(TokenType.DEDENT);
      }
    }

    return AST.Element.withChildren(token.text(), token.pos(), attributes, children);
  }

  private String parseContent() {
    Token token = advance();
    switch (token.type()) {
      case STRING:
        return unquote(token.text());
      default:
        // Variable references keep their '$name' form and are resolved when emitted.
        return token.text();
    }
  }

  // Splits on spaces outside of quotes: 'key' is a flag, 'key=value' has a text value.
  private Map<String, AST.AttributeValue> parseAttributes(String raw) {
    List<String> parts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    char quote = 0;
    for (int i = 0; i < raw.length(); i++) {
      char ch = raw.charAt(i);
      if (quote == 0 && (ch == Tokenizer.QUOTE || ch == Tokenizer.SINGLE_QUOTE)) {
        quote = ch;
      } else if (ch == quote) {
        quote = 0;
      }

      if (ch == ' ' && quote == 0) {
        addAttributePart(current, parts);
      } else {
        current.append(ch);
      }
    }
    addAttributePart(current, parts);

    Map<String, AST.AttributeValue> attributes = new LinkedHashMap<>();
    for (String part : parts) {
      int eq = part.indexOf('=');
      if (eq < 0) {
        attributes.put(part, AST.AttributeValue.flag());
        continue;
      }

      String key = part.substring(0, eq).trim();
      String value = unquote(part.substring(eq + 1).trim());
      for (Map.Entry<String, String> variable : variables.entrySet()) {
        value = value.replace("$" + variable.getKey(), variable.getValue());
      }
      attributes.put(key, AST.AttributeValue.of(value));
    }
    return attributes;
  }

  private static void addAttributePart(StringBuilder current, List<String> parts) {
    String part = current.toString().trim();
    if (!part.isEmpty()) parts.add(part);
    current.setLength(0);
  }

  private AST.ForLoop parseForLoop() {
    Token token = consume(TokenType.FOR_LOOP);
    Matcher m = FOR_LOOP.matcher(token.text());
    if (!m.lookingAt()) {
      errors.logError(token.pos(), "invalid for loop syntax: " + token.text());
      skipBlock();
      return new AST.ForLoop(ERROR_NAME, ERROR_NAME, token.pos(), ImmutableList.of());
    }

    consume(TokenType.COLON);
    List<AST.Node> body = parseIndentedBlock();
    return new AST.ForLoop(m.group(1), m.group(2).trim(), token.pos(), body);
  }

  private AST.Conditional parseConditional() {
    Token token = consume(TokenType.IF_STATEMENT);
    Matcher m = IF_STATEMENT.matcher(token.text());
    if (!m.lookingAt()) {
      errors.logError(token.pos(), "invalid if statement syntax: " + token.text());
      skipBlock();
      return new AST.Conditional("True", token.pos(), ImmutableList.of(), Optional.empty());
    }

    consume(TokenType.COLON);
    List<AST.Node> ifBody = parseIndentedBlock();

    Optional<List<AST.Node>> elseBody = Optional.empty();
    if (check(TokenType.ELSE_STATEMENT)) {
      advance();
      elseBody = Optional.of(parseIndentedBlock());
    }

    return new AST.Conditional(m.group(1).trim(), token.pos(), ifBody, elseBody);
  }

  private AST.ComponentDefinition parseComponentDefinition() {
    Token token = consume(TokenType.COMPONENT_DEF);
    Matcher m = COMPONENT_DEFINITION.matcher(token.text());
    if (!m.lookingAt()) {
      errors.logError(token.pos(), "invalid component definition: " + token.text());
      skipBlock();
      return new AST.ComponentDefinition(
          ERROR_NAME, token.pos(), ImmutableList.of(), ImmutableMap.of(), ImmutableList.of());
    }

    List<String> parameters = new ArrayList<>();
    Map<String, String> defaultValues = new LinkedHashMap<>();
    for (String param : COMMA_SPLITTER.split(m.group(2))) {
      int eq = param.indexOf('=');
      if (eq < 0) {
        parameters.add(param);
      } else {
        String name = param.substring(0, eq).trim();
        parameters.add(name);
        defaultValues.put(name, unquote(param.substring(eq + 1).trim()));
      }
    }

    if (!token.text().endsWith(":")) {
      consume(TokenType.COLON);
    }
    List<AST.Node> body = parseIndentedBlock();

    AST.ComponentDefinition definition =
        new AST.ComponentDefinition(m.group(1), token.pos(), parameters, defaultValues, body);
    components.put(definition.name(), definition);
    return definition;
  }

  private AST.ComponentUse parseComponentUse() {
    Token token = consume(TokenType.COMPONENT_USE);
    Matcher m = COMPONENT_USE.matcher(token.text());
    if (!m.lookingAt()) {
      errors.logError(token.pos(), "invalid component use: " + token.text());
      return AST.ComponentUse.create(ERROR_NAME, ImmutableMap.of(), token.pos());
    }

    Map<String, String> arguments = new LinkedHashMap<>();
    if (m.group(2) != null) {
      for (String arg : COMMA_SPLITTER.split(m.group(2))) {
        int eq = arg.indexOf('=');
        if (eq < 0) {
          errors.logError(token.pos(), "positional arguments are not supported: " + arg);
          continue;
        }
        arguments.put(arg.substring(0, eq).trim(), unquote(arg.substring(eq + 1).trim()));
      }
    }

    return AST.ComponentUse.create(m.group(1), arguments, token.pos());
  }

  // NEWLINE INDENT <block> DEDENT
  private List<AST.Node> parseIndentedBlock() {
    skipComments();
    consume(TokenType.NEWLINE);
    consume(TokenType.INDENT);
    List<AST.Node> body = parseBlock();
    consume(TokenType.DEDENT);
    return body;
  }

  private List<AST.Node> parseBlock() {
    List<AST.Node> nodes = new ArrayList<>();
    while (!isAtEnd() && !check(TokenType.DEDENT)) {
      parseStatement().ifPresent(nodes::add);
    }
    return nodes;
  }

  // Drops the rest of a malformed header line and the block indented under it.
  private void skipBlock() {
    while (!isAtEnd() && !check(TokenType.NEWLINE)) advance();
    if (!check(TokenType.NEWLINE)) return;
    advance();

    if (!check(TokenType.INDENT)) return;
    int depth = 0;
    do {
      if (check(TokenType.INDENT)) depth++;
      if (check(TokenType.DEDENT)) depth--;
      advance();
    } while (depth > 0 && !isAtEnd());
  }

  private void skipComments() {
    while (check(TokenType.COMMENT)) advance();
  }

  private Token consume(TokenType type) {
    if (check(type)) return advance();

    Token token = peek();
    errors.logError(token.pos(), String.format("expected %s but got %s", type, token.type()));
    return token;
  }

  private boolean check(TokenType type) {
    return !isAtEnd() && peek().is(type);
  }

  private Token advance() {
    Token token = peek();
    if (!isAtEnd()) position++;
    return token;
  }

  private Token peek() {
    return tokens.get(position);
  }

  private boolean isAtEnd() {
    return position >= tokens.size() || peek().is(TokenType.EOF);
  }

  static boolean isQuoted(String value) {
    if (value.length() < 2) return false;

    char first = value.charAt(0);
    return (first == Tokenizer.QUOTE || first == Tokenizer.SINGLE_QUOTE)
        && value.charAt(value.length() - 1) == first;
  }

  static String unquote(String value) {
    return isQuoted(value) ? value.substring(1, value.length() - 1) : value;
  }

  // Declaration values only drop double quotes; 'x' keeps its quotes.
  static String unquoteDouble(String value) {
    return isQuoted(value) && value.charAt(0) == Tokenizer.QUOTE
        ? value.substring(1, value.length() - 1)
        : value;
  }
}
