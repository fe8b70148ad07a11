package clarity;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

public class EnvironmentTest {

  @Test
  public void updatesReturnNewEnvironments() {
    Environment empty = Environment.empty();
    Environment one = empty.with("a", "1");

    assertThat(empty.variables()).isEmpty();
    assertThat(one.lookup("a")).hasValue("1");
    assertThat(one.without("a")).isEqualTo(empty);
    assertThat(one.without("missing")).isSameInstanceAs(one);
  }

  @Test
  public void rebindingKeepsPosition() {
    Environment env = Environment.empty().with("a", "1").with("b", "2").with("a", "3");

    assertThat(env.variables()).containsExactly("a", "3", "b", "2").inOrder();
  }

  @Test
  public void substitutesInBindingOrder() {
    Environment env = Environment.empty().with("name", "World").with("greeting", "Hello");

    assertThat(env.substitute("$greeting, $name!")).isEqualTo("Hello, World!");
    assertThat(env.substitute("$unknown stays")).isEqualTo("$unknown stays");
  }

  @Test
  public void shorterNamesMatchPrefixesOfLongerOnes() {
    Environment env = Environment.empty().with("item", "x").with("items", "[1]");

    assertThat(env.substitute("$items")).isEqualTo("xs");
  }

  @Test
  public void quotedSubstitutionEscapes() {
    Environment env = Environment.empty().with("v", "say \"hi\"");

    assertThat(env.substituteQuoted("$v == 1")).isEqualTo("\"say \\\"hi\\\"\" == 1");
  }

  @Test
  public void bulkBindingOverlays() {
    Environment env =
        Environment.empty()
            .with("color", "green")
            .with(ImmutableMap.of("color", "blue", "size", "m"));

    assertThat(env.variables()).containsExactly("color", "blue", "size", "m").inOrder();
  }
}
