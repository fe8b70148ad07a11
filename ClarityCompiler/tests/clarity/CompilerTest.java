package clarity;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class CompilerTest {

  private StringBuilder file = new StringBuilder();
  private Compiler compiler;

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private String compile(int indentWidth) throws CompilerException {
    Parser parser = new Parser(new Tokenizer("/test/file.clar", file.toString()).tokenize());
    AST ast = parser.parse();
    assertThat(parser.errors()).isEmpty();

    compiler = new Compiler(ast, indentWidth);
    return compiler.compile();
  }

  private String compile() throws CompilerException {
    return compile(2);
  }

  private static String lines(String... lines) {
    return String.join("\n", lines);
  }

  @Test
  public void emptyDocument() throws CompilerException {
    assertThat(compile()).isEmpty();
  }

  @Test
  public void documentWrapper() throws CompilerException {
    println("document:");
    println("  div:");
    println("    \"Hello\"");

    assertThat(compile())
        .isEqualTo(
            lines("<!DOCTYPE html>", "<html>", "  <div>", "    Hello", "  </div>", "</html>"));
  }

  @Test
  public void textSubstitution() throws CompilerException {
    println("$name = \"World\"");
    println("\"Hello, $name!\"");

    assertThat(compile()).isEqualTo("Hello, World!");
  }

  @Test
  public void forLoopOverList() throws CompilerException {
    println("$items = [\"a\", \"b\", \"c\"]");
    println("for x in $items:");
    println("  li: $x");

    assertThat(compile()).isEqualTo(lines("<li>a</li>", "<li>b</li>", "<li>c</li>"));
    assertThat(compiler.errors()).isEmpty();
  }

  @Test
  public void loopIteratorIsUnboundAfterLoop() throws CompilerException {
    println("$items = [\"1\", \"2\"]");
    println("for n in $items:");
    println("  li: $n");
    println("p: \"$n\"");

    assertThat(compile()).isEqualTo(lines("<li>1</li>", "<li>2</li>", "<p>$n</p>"));
  }

  @Test
  public void listItemsKeepQuotesUnlessAllAreQuoted() throws CompilerException {
    println("$xs = [\"a\", b]");
    println("$single = ['c', 'd']");
    println("for x in $xs:");
    println("  li: $x");
    println("for x in $single:");
    println("  li: $x");

    assertThat(compile())
        .isEqualTo(lines("<li>\"a\"</li>", "<li>b</li>", "<li>'c'</li>", "<li>'d'</li>"));
  }

  @Test
  public void emptyListYieldsOneEmptyItem() throws CompilerException {
    println("$none = []");
    println("for x in $none:");
    println("  li: \"[$x]\"");

    assertThat(compile()).isEqualTo("<li>[]</li>");
  }

  @Test
  public void conditionSelectsIfBranch() throws CompilerException {
    println("$flag = \"yes\"");
    println("if $flag == \"yes\":");
    println("  p: \"Yes\"");
    println("else:");
    println("  p: \"No\"");

    assertThat(compile()).isEqualTo("<p>Yes</p>");
  }

  @Test
  public void conditionSelectsElseBranch() throws CompilerException {
    println("$flag = \"no\"");
    println("if $flag == \"yes\":");
    println("  p: \"Yes\"");
    println("else:");
    println("  p: \"No\"");

    assertThat(compile()).isEqualTo("<p>No</p>");
  }

  @Test
  public void falseConditionWithoutElseEmitsNothing() throws CompilerException {
    println("if False:");
    println("  p: \"Yes\"");
    println("p: \"after\"");

    assertThat(compile()).isEqualTo("<p>after</p>");
  }

  @Test
  public void conditionFailureIsFalse() throws CompilerException {
    println("$x = \"a\"");
    println("if $x > 1:");
    println("  p: \"big\"");
    println("else:");
    println("  p: \"fallback\"");

    assertThat(compile()).isEqualTo("<p>fallback</p>");
    assertThat(compiler.errors()).hasSize(1);
    assertThat(compiler.errors().get(0).errorMsg()).contains("failed to evaluate condition");
    assertThat(compiler.errors().get(0).pos().lineNumber()).isEqualTo(1);
  }

  @Test
  public void componentDefaultsArgumentsAndRestore() throws CompilerException {
    println("@component Badge(color=\"blue\"):");
    println("  span class=\"badge\": \"$color\"");
    println("$color = \"green\"");
    println("@Badge");
    println("@Badge(color=\"red\")");
    println("p: \"$color\"");

    assertThat(compile())
        .isEqualTo(
            lines(
                "<span class=\"badge\">blue</span>",
                "<span class=\"badge\">red</span>",
                "<p>green</p>"));
  }

  @Test
  public void componentDeclarationsDoNotLeak() throws CompilerException {
    println("@component Setter():");
    println("  $inner = \"set\"");
    println("  p: \"$inner\"");
    println("@Setter");
    println("p: \"$inner\"");

    assertThat(compile()).isEqualTo(lines("<p>set</p>", "<p>$inner</p>"));
  }

  @Test
  public void componentsAreCollectedFromTheWholeTree() throws CompilerException {
    println("@Greeting");
    println("@component Greeting():");
    println("  p: \"first\"");
    println("div:");
    println("  @component Greeting():");
    println("    p: \"second\"");

    assertThat(compile()).isEqualTo(lines("<p>second</p>", "<div>", "</div>"));
    assertThat(compiler.components().get("Greeting")).isPresent();
  }

  @Test
  public void recursiveComponentIsCut() throws CompilerException {
    println("@component Echo():");
    println("  p: \"x\"");
    println("  @Echo");
    println("@Echo");

    assertThat(compile()).isEqualTo("<p>x</p>");
    assertThat(compiler.errors()).hasSize(1);
    assertThat(compiler.errors().get(0).errorMsg()).contains("recursive use of component Echo");
  }

  @Test
  public void undefinedConstructsEmitNothing() throws CompilerException {
    println("p: \"before\"");
    println("@Missing");
    println("for x in $nothing:");
    println("  li: $x");
    println("$plain = \"text\"");
    println("for x in $plain:");
    println("  li: $x");
    println("p: \"after\"");

    assertThat(compile()).isEqualTo(lines("<p>before</p>", "<p>after</p>"));
    assertThat(compiler.errors()).hasSize(3);
    assertThat(compiler.errors().get(0).errorMsg()).isEqualTo("unknown component: Missing");
    assertThat(compiler.errors().get(1).errorMsg())
        .isEqualTo("unknown variable in for loop: $nothing");
    assertThat(compiler.errors().get(2).errorMsg()).isEqualTo("$plain is not a list: text");
  }

  @Test
  public void attributesAndEmptyElements() throws CompilerException {
    println("div class=\"box\" hidden:");
    println("  p: \"x\"");
    println("  span:");

    assertThat(compile())
        .isEqualTo(
            lines("<div class=\"box\" hidden>", "  <p>x</p>", "  <span>", "  </span>", "</div>"));
  }

  @Test
  public void variableReferenceStatements() throws CompilerException {
    println("$who = \"me\"");
    println("p:");
    println("  $who");
    println("  $nobody");

    assertThat(compile()).isEqualTo(lines("<p>", "  me", "  $nobody", "</p>"));
  }

  @Test
  public void styleBlockIsCopiedVerbatim() throws CompilerException {
    println("style:");
    println("  \"\"\"");
    println("  body { margin: 0; }");
    println("  \"\"\"");

    assertThat(compile())
        .isEqualTo(lines("<style>", "  ", "    body { margin: 0; }", "    ", "</style>"));
  }

  @Test
  public void inlineScriptBlock() throws CompilerException {
    println("script type=\"module\": \"\"\"console.log($x)\"\"\"");

    assertThat(compile())
        .isEqualTo(lines("<script type=\"module\">", "  console.log($x)", "</script>"));
  }

  @Test
  public void styleWithoutBlockHasOnlyTags() throws CompilerException {
    println("style:");

    assertThat(compile()).isEqualTo(lines("<style>", "</style>"));
  }

  @Test
  public void multilineTextDropsDelimiters() throws CompilerException {
    println("div:");
    println("  \"\"\"one");
    println("  two\"\"\"");

    assertThat(compile()).isEqualTo(lines("<div>", "  one", "    two", "</div>"));
  }

  @Test
  public void multilineTextIsSubstituted() throws CompilerException {
    println("$name = \"World\"");
    println("div:");
    println("  \"\"\"Hello, $name!");
    println("  Bye, $name.\"\"\"");

    assertThat(compile())
        .isEqualTo(lines("<div>", "  Hello, World!", "    Bye, World.", "</div>"));
  }

  @Test
  public void rawBlocksAreNotSubstituted() throws CompilerException {
    println("$color = \"red\"");
    println("style: \"\"\"p { color: $color; }\"\"\"");

    assertThat(compile()).isEqualTo(lines("<style>", "  p { color: $color; }", "</style>"));
  }

  @Test
  public void customIndentWidth() throws CompilerException {
    println("div:");
    println("  p: \"x\"");

    assertThat(compile(4)).isEqualTo(lines("<div>", "    <p>x</p>", "</div>"));
  }

  @Test
  public void compileIsRepeatable() throws CompilerException {
    println("p: \"once\"");

    String first = compile();

    assertThat(compiler.compile()).isEqualTo(first);
  }
}
