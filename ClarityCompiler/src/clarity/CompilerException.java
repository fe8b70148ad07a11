package clarity;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Pos pos;
  private final String errorMsg;

  public CompilerException(Tokenizer.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  /** One-line form, positions printed one-based. */
  public String describe() {
    return String.format(
        "%s@%d:%d %s", pos.file(), pos.lineNumber() + 1, pos.column() + 1, errorMsg);
  }

  public void print() {
    System.out.println("ERROR: " + describe());
  }
}
