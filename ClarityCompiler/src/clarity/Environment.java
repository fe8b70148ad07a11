package clarity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * Variable bindings in effect at some point of emission.
 *
 * <p>Immutable: every update returns a new environment. Bindings keep the order in which their
 * names were first bound, and substitution visits them in that order.
 */
public final class Environment {
  private static final Environment EMPTY = new Environment(ImmutableMap.of());

  public static Environment empty() {
    return EMPTY;
  }

  private final ImmutableMap<String, String> variables;

  private Environment(ImmutableMap<String, String> variables) {
    this.variables = variables;
  }

  public ImmutableMap<String, String> variables() {
    return variables;
  }

  public Optional<String> lookup(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  /** Binds {@code name}; rebinding an existing name keeps its original position. */
  public Environment with(String name, String value) {
    Map<String, String> copy = new LinkedHashMap<>(variables);
    copy.put(name, value);
    return new Environment(ImmutableMap.copyOf(copy));
  }

  public Environment with(Map<String, String> bindings) {
    Map<String, String> copy = new LinkedHashMap<>(variables);
    copy.putAll(bindings);
    return new Environment(ImmutableMap.copyOf(copy));
  }

  public Environment without(String name) {
    if (!variables.containsKey(name)) return this;

    Map<String, String> copy = new LinkedHashMap<>(variables);
    copy.remove(name);
    return new Environment(ImmutableMap.copyOf(copy));
  }

  /** Replaces every {@code $name} occurrence with its bound value. Unbound names are kept. */
  public String substitute(String text) {
    for (Map.Entry<String, String> entry : variables.entrySet()) {
      text = text.replace("$" + entry.getKey(), entry.getValue());
    }
    return text;
  }

  /** Like {@link #substitute} but each value becomes a double-quoted string literal. */
  public String substituteQuoted(String text) {
    for (Map.Entry<String, String> entry : variables.entrySet()) {
      text = text.replace("$" + entry.getKey(), quote(entry.getValue()));
    }
    return text;
  }

  private static String quote(String value) {
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Environment && ((Environment) obj).variables.equals(variables);
  }

  @Override
  public int hashCode() {
    return variables.hashCode();
  }

  @Override
  public String toString() {
    return variables.toString();
  }
}
