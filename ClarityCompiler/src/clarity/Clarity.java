package clarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Runs the whole pipeline: tokenize, parse, then emit HTML. */
public final class Clarity {
  private static final Logger logger = LoggerFactory.getLogger(Clarity.class);

  private Clarity() {}

  @AutoValue
  public abstract static class Result {
    public abstract String html();

    /** Recovered problems from parsing and emission, in that order. */
    public abstract ImmutableList<CompilerException> warnings();

    public boolean hasWarnings() {
      return !warnings().isEmpty();
    }

    static Result create(String html, Iterable<CompilerException> warnings) {
      return new AutoValue_Clarity_Result(html, ImmutableList.copyOf(warnings));
    }
  }

  public static String compile(String source) throws CompilerException {
    return compile(source, CompilerOptions.defaults()).html();
  }

  public static Result compile(String source, CompilerOptions options) throws CompilerException {
    return compile(options.file(), source, options);
  }

  public static Result compile(String file, String source, CompilerOptions options)
      throws CompilerException {
    ImmutableList<Tokenizer.Token> tokens = new Tokenizer(file, source).tokenize();
    logger.debug("{}: {} tokens", file, tokens.size());

    Parser parser = new Parser(tokens);
    AST ast = parser.parse();
    if (options.strict() && !parser.errors().isEmpty()) throw parser.errors().get(0);

    Compiler compiler = new Compiler(ast, options.indentWidth());
    String html = compiler.compile();
    logger.debug("{}: {} output chars", file, html.length());

    return Result.create(
        html,
        ImmutableList.<CompilerException>builder()
            .addAll(parser.errors())
            .addAll(compiler.errors())
            .build());
  }
}
