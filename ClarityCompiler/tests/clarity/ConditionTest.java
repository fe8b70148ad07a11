package clarity;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ConditionTest {

  private static final Tokenizer.Pos POS = new Tokenizer.Pos("/test/file.clar", 0, 3);

  private static boolean test(String condition) throws CompilerException {
    return Condition.test(condition, POS);
  }

  private static CompilerException failure(String condition) {
    return assertThrows(CompilerException.class, () -> Condition.test(condition, POS));
  }

  @Test
  public void literals() throws CompilerException {
    assertThat(test("True")).isTrue();
    assertThat(test("False")).isFalse();
    assertThat(test("\"yes\"")).isTrue();
    assertThat(test("''")).isFalse();
    assertThat(test("0")).isFalse();
    assertThat(test("2.5")).isTrue();
  }

  @Test
  public void stringEquality() throws CompilerException {
    assertThat(test("\"yes\" == \"yes\"")).isTrue();
    assertThat(test("\"yes\" == 'no'")).isFalse();
    assertThat(test("\"yes\" != \"no\"")).isTrue();
    assertThat(test("\"1\" == 1")).isFalse();
  }

  @Test
  public void numericComparison() throws CompilerException {
    assertThat(test("3 > 2")).isTrue();
    assertThat(test("3 >= 3.0")).isTrue();
    assertThat(test("-1 < 0")).isTrue();
    assertThat(test("2 <= 1")).isFalse();
    assertThat(test("True == 1")).isTrue();
  }

  @Test
  public void stringOrdering() throws CompilerException {
    assertThat(test("\"apple\" < \"banana\"")).isTrue();
  }

  @Test
  public void booleanOperators() throws CompilerException {
    assertThat(test("True and False")).isFalse();
    assertThat(test("True or False")).isTrue();
    assertThat(test("not False")).isTrue();
    assertThat(test("not not 'x'")).isTrue();
  }

  @Test
  public void precedence() throws CompilerException {
    // and binds tighter than or
    assertThat(test("True or False and False")).isTrue();
    // not applies to the whole comparison
    assertThat(test("not \"a\" == \"b\"")).isTrue();
    assertThat(test("(True or False) and False")).isFalse();
    assertThat(test("not (1 > 2 or 2 > 3)")).isTrue();
  }

  @Test
  public void escapedQuotesInStrings() throws CompilerException {
    assertThat(test("\"say \\\"hi\\\"\" == 'say \"hi\"'")).isTrue();
  }

  @Test
  public void parseTree() throws CompilerException {
    Condition condition = Condition.parse("'a' == 'a' and not False", POS);

    assertThat(condition.type()).isEqualTo(Condition.Type.BINARY);
    Condition.Binary and = (Condition.Binary) condition;
    assertThat(and.op()).isEqualTo(Condition.BinaryOperator.AND);
    assertThat(and.left().type()).isEqualTo(Condition.Type.BINARY);
    assertThat(and.right().type()).isEqualTo(Condition.Type.UNARY);
  }

  @Test
  public void errors() {
    assertThat(failure("").errorMsg()).isEqualTo("empty condition");
    assertThat(failure("$flag == \"yes\"").errorMsg()).contains("unexpected character '$'");
    assertThat(failure("x == 1").errorMsg()).isEqualTo("undefined name 'x'");
    assertThat(failure("(True").errorMsg()).isEqualTo("unmatched parenthesis");
    assertThat(failure("True)").errorMsg()).isEqualTo("unmatched parenthesis");
    assertThat(failure("1 ==").errorMsg()).contains("missing left or right arguments");
    assertThat(failure("not").errorMsg()).isEqualTo("'not' has no argument");
    assertThat(failure("1 2").errorMsg()).contains("expected end of condition");
    assertThat(failure("'a' < 1").errorMsg()).isEqualTo("cannot order STRING against NUMBER");
    assertThat(failure("'open").errorMsg()).isEqualTo("unterminated string");
  }

  @Test
  public void keywordsAreCaseSensitive() {
    assertThat(failure("true").errorMsg()).isEqualTo("undefined name 'true'");
    assertThat(failure("FALSE").errorMsg()).isEqualTo("undefined name 'FALSE'");
    assertThat(failure("True AND False").errorMsg()).isEqualTo("undefined name 'AND'");
    assertThat(failure("Not True").errorMsg()).isEqualTo("undefined name 'Not'");
  }

  @Test
  public void errorPositionsPointIntoTheCondition() {
    CompilerException ex = failure("True and nope");

    assertThat(ex.pos().column()).isEqualTo(3 + 9);
  }
}
