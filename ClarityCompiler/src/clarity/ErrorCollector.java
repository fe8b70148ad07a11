package clarity;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Non-fatal diagnostics. Each one is recorded as a {@link CompilerException} that is never thrown,
 * and is logged at WARN under the logger of the stage that reported it.
 */
final class ErrorCollector {
  private final Logger logger;
  private final List<CompilerException> errors = new ArrayList<>();

  ErrorCollector(Class<?> stage) {
    this.logger = LoggerFactory.getLogger(stage);
  }

  void logError(Tokenizer.Pos pos, String msg) {
    logError(new CompilerException(pos, msg));
  }

  void logError(CompilerException ex) {
    logger.warn(ex.describe());
    errors.add(ex);
  }

  ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }
}
