package clarity;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.io.Files;

public class CompilerMain {

  static final String VERSION = "0.1.0";

  private static final String USAGE =
      "Usage: $COMPILER [--strict] input.clar [output.html]\n"
          + "\n"
          + "Options:\n"
          + "  --strict         Fail on the first parse warning\n"
          + "  -v, --version    Display version information\n"
          + "  -h, --help       Display this help message";

  public static void main(String[] args) throws IOException {
    System.exit(run(args));
  }

  // Returns the process exit code.
  static int run(String[] args) throws IOException {
    CompilerOptions.Builder options = CompilerOptions.builder();
    List<String> paths = new ArrayList<>();
    for (String arg : args) {
      switch (arg) {
        case "-h":
        case "--help":
          System.out.println(USAGE);
          return 0;
        case "-v":
        case "--version":
          System.out.println("Clarity compiler " + VERSION);
          return 0;
        case "--strict":
          options.setStrict(true);
          break;
        default:
          if (arg.startsWith("-")) {
            System.err.println("Unknown option: " + arg);
            System.err.println(USAGE);
            return 1;
          }
          paths.add(arg);
      }
    }

    if (paths.isEmpty() || paths.size() > 2) {
      System.err.println(USAGE);
      return 1;
    }

    File input = new File(paths.get(0));
    if (!input.isFile()) {
      System.out.println("File not found: " + input);
      return 1;
    }
    File output = paths.size() > 1 ? new File(paths.get(1)) : defaultOutput(input);

    System.out.println("Compiling " + input + "...");
    String source = Files.asCharSource(input, StandardCharsets.UTF_8).read();

    Clarity.Result result;
    try {
      result = Clarity.compile(source, options.setFile(input.toString()).build());
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      return 1;
    }

    Files.asCharSink(output, StandardCharsets.UTF_8).write(result.html());
    System.out.println(
        String.format(
            "Compiled to %s (%d warning%s)",
            output, result.warnings().size(), result.warnings().size() == 1 ? "" : "s"));
    return 0;
  }

  static File defaultOutput(File input) {
    String name = Files.getNameWithoutExtension(input.getName()) + ".html";
    File dir = input.getAbsoluteFile().getParentFile();
    return new File(dir, name);
  }
}
