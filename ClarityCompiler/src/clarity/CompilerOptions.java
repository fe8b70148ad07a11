package clarity;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** Settings for one compilation. */
@AutoValue
public abstract class CompilerOptions {
  public static final String DEFAULT_FILE = "<input>";

  /** Fail on the first parse warning instead of recovering. */
  public abstract boolean strict();

  /** Spaces per nesting level in the output. */
  public abstract int indentWidth();

  /** Name used for positions in diagnostics. */
  public abstract String file();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setStrict(false)
        .setIndentWidth(2)
        .setFile(DEFAULT_FILE);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setStrict(boolean strict);

    public abstract Builder setIndentWidth(int indentWidth);

    public abstract Builder setFile(String file);

    abstract CompilerOptions autoBuild();

    public CompilerOptions build() {
      CompilerOptions options = autoBuild();
      Preconditions.checkArgument(
          options.indentWidth() >= 0, "negative indent width: %s", options.indentWidth());
      return options;
    }
  }
}
