package clarity;

import static com.google.common.truth.Truth.assertThat;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class CompilerMainTest {

  @TempDir File dir;

  private File write(String name, String content) throws IOException {
    File file = new File(dir, name);
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
    return file;
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  @Test
  public void writesNextToInputByDefault() throws IOException {
    File input = write("index.clar", "p: \"hi\"\n");

    assertThat(CompilerMain.run(new String[] {input.getPath()})).isEqualTo(0);
    assertThat(read(new File(dir, "index.html"))).isEqualTo("<p>hi</p>");
  }

  @Test
  public void explicitOutputPath() throws IOException {
    File input = write("index.clar", "p: \"hi\"\n");
    File output = new File(dir, "out.htm");

    assertThat(CompilerMain.run(new String[] {input.getPath(), output.getPath()})).isEqualTo(0);
    assertThat(read(output)).isEqualTo("<p>hi</p>");
  }

  @Test
  public void strictFlag() throws IOException {
    File input = write("bad.clar", "if:\n  p: \"x\"\n");

    assertThat(CompilerMain.run(new String[] {"--strict", input.getPath()})).isEqualTo(1);
    assertThat(new File(dir, "bad.html").exists()).isFalse();

    assertThat(CompilerMain.run(new String[] {input.getPath()})).isEqualTo(0);
    assertThat(new File(dir, "bad.html").exists()).isTrue();
  }

  @Test
  public void fatalErrorExitsWithOne() throws IOException {
    File input = write("broken.clar", "p: \"open\n");

    assertThat(CompilerMain.run(new String[] {input.getPath()})).isEqualTo(1);
  }

  @Test
  public void usageAndOptions() throws IOException {
    assertThat(CompilerMain.run(new String[] {})).isEqualTo(1);
    assertThat(CompilerMain.run(new String[] {"--help"})).isEqualTo(0);
    assertThat(CompilerMain.run(new String[] {"-v"})).isEqualTo(0);
    assertThat(CompilerMain.run(new String[] {"--bogus"})).isEqualTo(1);
    assertThat(CompilerMain.run(new String[] {new File(dir, "missing.clar").getPath()}))
        .isEqualTo(1);
  }

  @Test
  public void defaultOutputReplacesExtension() {
    assertThat(CompilerMain.defaultOutput(new File(dir, "site.page.clar")).getName())
        .isEqualTo("site.page.html");
  }
}
