package clarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

// Infix parser and evaluator for the boolean expressions of if-statements.
public abstract class Condition {

  public enum Type {
    // Intermediary atoms, gone once parsing is complete.
    PARENTHESIS,
    UNARY_OPERATOR,
    BINARY_OPERATOR,

    // Values
    LITERAL,
    UNARY,
    BINARY;

    public boolean isOperator() {
      return this == UNARY_OPERATOR || this == BINARY_OPERATOR;
    }

    public boolean isIntermediary() {
      return this == PARENTHESIS || isOperator();
    }
  }

  public enum BinaryOperator {
    AND("and"),
    OR("or"),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String repr;

    BinaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    private static final ImmutableMap<String, BinaryOperator> REPR_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), BinaryOperator::repr);

    public static Optional<BinaryOperator> parse(String atom) {
      return Optional.ofNullable(REPR_MAP.get(atom));
    }

    private static final ImmutableSet<BinaryOperator> COMPARISONS =
        ImmutableSet.of(
            LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL, EQUAL, NOT_EQUAL);

    static {
      Verify.verify(
          Arrays.asList(values())
              .stream()
              .allMatch(b -> COMPARISONS.contains(b) || b == AND || b == OR));
    }

    public boolean isComparison() {
      return COMPARISONS.contains(this);
    }
  }

  /** A runtime value: a string, a number or a boolean. */
  public static final class Value {
    public enum Kind {
      STRING,
      NUMBER,
      BOOLEAN;
    }

    private static final Value TRUE = new Value(Kind.BOOLEAN, "True", 1);
    private static final Value FALSE = new Value(Kind.BOOLEAN, "False", 0);

    private final Kind kind;
    private final String text;
    private final double number;

    private Value(Kind kind, String text, double number) {
      this.kind = kind;
      this.text = text;
      this.number = number;
    }

    public static Value of(String text) {
      return new Value(Kind.STRING, text, 0);
    }

    public static Value of(double number) {
      return new Value(Kind.NUMBER, Double.toString(number), number);
    }

    public static Value of(boolean bool) {
      return bool ? TRUE : FALSE;
    }

    public boolean isTruthy() {
      return kind == Kind.STRING ? !text.isEmpty() : number != 0;
    }

    // Booleans compare as 0 and 1.
    private boolean isNumeric() {
      return kind != Kind.STRING;
    }

    boolean equalTo(Value other) {
      if (isNumeric() && other.isNumeric()) return number == other.number;
      return kind == other.kind && text.equals(other.text);
    }

    int compareTo(Value other, Tokenizer.Pos pos) throws CompilerException {
      if (isNumeric() && other.isNumeric()) return Double.compare(number, other.number);
      if (kind == Kind.STRING && other.kind == Kind.STRING) return text.compareTo(other.text);

      throw new CompilerException(
          pos, String.format("cannot order %s against %s", kind, other.kind));
    }

    @Override
    public String toString() {
      return kind == Kind.STRING ? '"' + text + '"' : text;
    }
  }

  public static class Parenthesis extends Condition {
    private final boolean open;

    private Parenthesis(boolean open, Tokenizer.Pos pos) {
      super(Type.PARENTHESIS, open ? "(" : ")", pos);
      this.open = open;
    }

    public boolean isOpen() {
      return open;
    }
  }

  public static class UnaryOperatorAtom extends Condition {
    private UnaryOperatorAtom(Tokenizer.Pos pos) {
      super(Type.UNARY_OPERATOR, "not", pos);
    }
  }

  public static class BinaryOperatorAtom extends Condition {
    private final BinaryOperator op;

    private BinaryOperatorAtom(BinaryOperator op, Tokenizer.Pos pos) {
      super(Type.BINARY_OPERATOR, op.repr(), pos);
      this.op = op;
    }

    public BinaryOperator op() {
      return op;
    }
  }

  public static class Literal extends Condition {
    private final Value value;

    private Literal(Value value, String raw, Tokenizer.Pos pos) {
      super(Type.LITERAL, raw, pos);
      this.value = value;
    }

    @Override
    public Value evaluate() {
      return value;
    }
  }

  /** {@code not <operand>} */
  public static class Unary extends Condition {
    private final Condition operand;

    private Unary(UnaryOperatorAtom op, Condition operand) {
      super(Type.UNARY, op.raw() + " " + operand.raw(), op.pos());
      this.operand = operand;
    }

    @Override
    public Value evaluate() throws CompilerException {
      return Value.of(!operand.evaluate().isTruthy());
    }
  }

  public static class Binary extends Condition {
    private final Condition left;
    private final BinaryOperator op;
    private final Condition right;

    private Binary(Condition left, BinaryOperatorAtom op, Condition right) {
      super(Type.BINARY, left.raw() + " " + op.raw() + " " + right.raw(), left.pos());
      this.left = left;
      this.op = op.op();
      this.right = right;
    }

    public Condition left() {
      return left;
    }

    public BinaryOperator op() {
      return op;
    }

    public Condition right() {
      return right;
    }

    @Override
    public Value evaluate() throws CompilerException {
      Value lhs = left.evaluate();
      switch (op) {
        case AND:
          return lhs.isTruthy() ? right.evaluate() : lhs;
        case OR:
          return lhs.isTruthy() ? lhs : right.evaluate();
        default:
          break;
      }

      Value rhs = right.evaluate();
      switch (op) {
        case EQUAL:
          return Value.of(lhs.equalTo(rhs));
        case NOT_EQUAL:
          return Value.of(!lhs.equalTo(rhs));
        case LESS_THAN:
          return Value.of(lhs.compareTo(rhs, pos()) < 0);
        case LESS_THAN_OR_EQUAL:
          return Value.of(lhs.compareTo(rhs, pos()) <= 0);
        case GREATER_THAN:
          return Value.of(lhs.compareTo(rhs, pos()) > 0);
        case GREATER_THAN_OR_EQUAL:
          return Value.of(lhs.compareTo(rhs, pos()) >= 0);
        default:
          throw new IllegalStateException("unhandled operator: " + op);
      }
    }
  }

  // Operator precedence, tightest first. 'not' binds between comparisons and 'and'.
  private static final ImmutableList<ImmutableSet<BinaryOperator>> ORDER_OF_OPERATIONS =
      ImmutableList.of(
          ImmutableSet.of(BinaryOperator.AND), ImmutableSet.of(BinaryOperator.OR));

  /** Parses {@code text} into a condition tree. Variables must already be substituted. */
  public static Condition parse(String text, Tokenizer.Pos pos) throws CompilerException {
    List<Condition> atoms = splitAtoms(text, pos);
    if (atoms.isEmpty()) throw new CompilerException(pos, "empty condition");

    // Parse parenthesis
    ArrayDeque<Integer> stack = new ArrayDeque<>();
    for (int i = 0; i < atoms.size(); i++) {
      Condition atom = atoms.get(i);
      if (atom.type() != Type.PARENTHESIS) continue;

      if (((Parenthesis) atom).isOpen()) {
        stack.push(i);
      } else {
        if (stack.isEmpty()) throw new CompilerException(atom.pos(), "unmatched parenthesis");

        int start = stack.pop();
        if (start + 1 == i) throw new CompilerException(atom.pos(), "empty parenthesis");

        Condition inner = parseNoParenthesis(new ArrayList<>(atoms.subList(start + 1, i)));
        atoms.subList(start + 1, i + 1).clear();
        atoms.set(start, inner);
        i = start;
      }
    }

    if (!stack.isEmpty()) {
      throw new CompilerException(atoms.get(stack.pop()).pos(), "unmatched parenthesis");
    }

    return parseNoParenthesis(atoms);
  }

  /** Parses and evaluates {@code text} to its truthiness. */
  public static boolean test(String text, Tokenizer.Pos pos) throws CompilerException {
    return parse(text, pos).evaluate().isTruthy();
  }

  private static Condition parseNoParenthesis(List<Condition> atoms) throws CompilerException {
    Preconditions.checkArgument(!atoms.isEmpty());

    // Pass 1: comparisons, left to right.
    parseBinaryOperators(atoms, BinaryOperator::isComparison);

    // Pass 2: prefix negation, innermost first.
    for (int i = atoms.size() - 1; i >= 0; i--) {
      Condition atom = atoms.get(i);
      if (atom.type() != Type.UNARY_OPERATOR) continue;

      if (i + 1 >= atoms.size() || atoms.get(i + 1).type().isIntermediary()) {
        throw new CompilerException(atom.pos(), "'not' has no argument");
      }
      atoms.set(i, new Unary((UnaryOperatorAtom) atom, atoms.remove(i + 1)));
    }

    // Pass 3: boolean operators
    for (ImmutableSet<BinaryOperator> ops : ORDER_OF_OPERATIONS) {
      parseBinaryOperators(atoms, ops::contains);
    }

    // In the end, we should be left with a single expression.
    if (atoms.size() > 1) {
      throw new CompilerException(
          atoms.get(1).pos(), "unexpected token: expected end of condition");
    }

    Condition result = atoms.get(0);
    if (result.type().isIntermediary()) {
      throw new CompilerException(result.pos(), "unexpected operator: " + result.raw());
    }
    return result;
  }

  @FunctionalInterface
  private interface OperatorFilter {
    boolean test(BinaryOperator op);
  }

  private static void parseBinaryOperators(List<Condition> atoms, OperatorFilter filter)
      throws CompilerException {
    for (int i = 0; i < atoms.size(); i++) {
      Condition atom = atoms.get(i);
      if (atom.type() != Type.BINARY_OPERATOR) continue;

      BinaryOperatorAtom binary = (BinaryOperatorAtom) atom;
      if (!filter.test(binary.op())) continue;

      // Consume the previous and subsequent arguments.
      if (i - 1 < 0
          || i + 1 >= atoms.size()
          || atoms.get(i - 1).type().isIntermediary()
          || atoms.get(i + 1).type().isIntermediary()) {
        throw new CompilerException(
            binary.pos(), String.format("'%s' is missing left or right arguments", binary.raw()));
      }

      // Removal of 'i - 1' shifts 'i + 1' to 'i'
      atoms.set(i - 1, new Binary(atoms.remove(i - 1), binary, atoms.remove(i)));
      i--;
    }
  }

  private static List<Condition> splitAtoms(String text, Tokenizer.Pos pos)
      throws CompilerException {
    List<Condition> atoms = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      char ch = text.charAt(i);
      Tokenizer.Pos atomPos = pos.addColumns(i);

      if (Character.isWhitespace(ch)) {
        i++;
      } else if (ch == '(' || ch == ')') {
        atoms.add(new Parenthesis(ch == '(', atomPos));
        i++;
      } else if (ch == Tokenizer.QUOTE || ch == Tokenizer.SINGLE_QUOTE) {
        StringBuilder sb = new StringBuilder();
        int start = i++;
        while (i < text.length() && text.charAt(i) != ch) {
          if (text.charAt(i) == '\\' && i + 1 < text.length()) i++;
          sb.append(text.charAt(i++));
        }
        if (i >= text.length()) throw new CompilerException(atomPos, "unterminated string");

        i++;
        atoms.add(new Literal(Value.of(sb.toString()), text.substring(start, i), atomPos));
      } else if (isNumberStart(text, i, atoms)) {
        int start = i++;
        while (i < text.length()
            && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
          i++;
        }

        String raw = text.substring(start, i);
        try {
          atoms.add(new Literal(Value.of(Double.parseDouble(raw)), raw, atomPos));
        } catch (NumberFormatException ex) {
          throw new CompilerException(atomPos, "malformed number: " + raw);
        }
      } else if (Character.isLetter(ch) || ch == '_') {
        int start = i;
        while (i < text.length()
            && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
          i++;
        }
        atoms.add(parseWord(text.substring(start, i), atomPos));
      } else {
        int start = i;
        while (i < text.length() && "<>=!".indexOf(text.charAt(i)) >= 0) i++;

        String raw = text.substring(start, i);
        Optional<BinaryOperator> op = BinaryOperator.parse(raw);
        if (raw.isEmpty() || !op.isPresent() || !op.get().isComparison()) {
          throw new CompilerException(
              atomPos, String.format("unexpected character '%c'", text.charAt(start)));
        }
        atoms.add(new BinaryOperatorAtom(op.get(), atomPos));
      }
    }
    return atoms;
  }

  // A '-' starts a number only where an operand is expected.
  private static boolean isNumberStart(String text, int i, List<Condition> atoms) {
    char ch = text.charAt(i);
    if (Character.isDigit(ch)) return true;
    if (ch != '-' && ch != '.') return false;
    if (i + 1 >= text.length() || !Character.isDigit(text.charAt(i + 1))) return false;
    if (ch == '.') return true;

    return atoms.isEmpty() || atoms.get(atoms.size() - 1).type().isIntermediary();
  }

  private static Condition parseWord(String word, Tokenizer.Pos pos) throws CompilerException {
    switch (word) {
      case "True":
        return new Literal(Value.of(true), word, pos);
      case "False":
        return new Literal(Value.of(false), word, pos);
      case "not":
        return new UnaryOperatorAtom(pos);
      case "and":
        return new BinaryOperatorAtom(BinaryOperator.AND, pos);
      case "or":
        return new BinaryOperatorAtom(BinaryOperator.OR, pos);
      default:
        throw new CompilerException(pos, String.format("undefined name '%s'", word));
    }
  }

  private final Type type;
  private final String raw;
  private final Tokenizer.Pos pos;

  private Condition(Type type, String raw, Tokenizer.Pos pos) {
    this.type = type;
    this.raw = raw;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  public String raw() {
    return raw;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public Value evaluate() throws CompilerException {
    throw new CompilerException(pos(), String.format("cannot evaluate %s", type()));
  }

  @Override
  public String toString() {
    return raw;
  }
}
