package minic.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import minic.common.Settings;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void resetSettings() {
    Settings.reset(Settings.OPT_CONSTANT_FOLD);
    Settings.reset(Settings.DOT_OUTPUT_FILE);
    Settings.reset(Settings.INPUT_FILENAME);
  }

  private File source(String name, String text) throws IOException {
    File f = new File(tmp.getRoot(), name);
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f;
  }

  @Test
  public void testCompileWithGraph() throws IOException {
    File src = source("ok.c", "int main() { int x = 2 + 3; return x; }");
    File dot = new File(tmp.getRoot(), "ok.dot");
    int rc = Main.run(new String[] {"-o", dot.getPath(), src.getPath()});
    assertEquals(ExitCode.SUCCESS.code(), rc);
    String text = FileUtils.readFileToString(dot, StandardCharsets.UTF_8);
    assertTrue(text.startsWith("digraph AST {"));
    // Folded before export
    assertTrue(text.contains("[label=\"5\", shape=rectangle]"));
    assertFalse(text.contains("[label=\"+\""));
  }

  @Test
  public void testNoFoldOption() throws IOException, ParseException {
    File src = source("nofold.c", "int main() { int x = 2 + 3; }");
    File dot = new File(tmp.getRoot(), "nofold.dot");
    int rc = Main.run(new String[] {"--no-fold", "--output", dot.getPath(),
                                    src.getPath()});
    assertEquals(ExitCode.SUCCESS.code(), rc);
    String text = FileUtils.readFileToString(dot, StandardCharsets.UTF_8);
    assertTrue(text.contains("[label=\"+\", shape=ellipse]"));
  }

  @Test
  public void testArgsRecordedInSettings() throws ParseException {
    Main.Args args = Main.processArgs(new String[] {"-n", "-o", "g.dot",
                                                    "in.c"});
    assertEquals("in.c", args.inputFilename);
    assertEquals("g.dot", args.dotFilename);
    assertTrue(args.noFold);
    assertEquals("in.c", Settings.get(Settings.INPUT_FILENAME));
    assertEquals("g.dot", Settings.get(Settings.DOT_OUTPUT_FILE));
    assertEquals("false", Settings.get(Settings.OPT_CONSTANT_FOLD));
  }

  @Test
  public void testSyntaxError() throws IOException {
    File src = source("bad.c", "int main() { int = 3; }");
    assertEquals(ExitCode.ERROR_PARSER.code(),
                 Main.run(new String[] {src.getPath()}));
  }

  @Test
  public void testMissingInput() {
    File missing = new File(tmp.getRoot(), "missing.c");
    assertEquals(ExitCode.ERROR_IO.code(),
                 Main.run(new String[] {missing.getPath()}));
  }

  @Test
  public void testBadCommandLine() {
    assertEquals(ExitCode.ERROR_COMMAND.code(), Main.run(new String[0]));
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 Main.run(new String[] {"--bogus", "x.c"}));
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 Main.run(new String[] {"a.c", "b.c"}));
  }

  @Test
  public void testDeeplyNestedInput() throws IOException {
    String open = StringUtils.repeat('(', 20000);
    String close = StringUtils.repeat(')', 20000);
    File src = source("deep.c",
        "int main() { int x = " + open + "1" + close + "; }");
    assertEquals(ExitCode.ERROR_PARSER.code(),
                 Main.run(new String[] {src.getPath()}));
  }

  @Test
  public void testLongOperatorChain() throws IOException {
    String sum = StringUtils.repeat("1", " + ", 400);
    File src = source("chain.c", "int main() { int x = " + sum + "; }");

    File folded = new File(tmp.getRoot(), "folded.dot");
    assertEquals(ExitCode.SUCCESS.code(),
                 Main.run(new String[] {"-o", folded.getPath(),
                                        src.getPath()}));
    String text = FileUtils.readFileToString(folded, StandardCharsets.UTF_8);
    assertTrue(text.contains("[label=\"400\", shape=rectangle]"));

    File unfolded = new File(tmp.getRoot(), "unfolded.dot");
    assertEquals(ExitCode.SUCCESS.code(),
                 Main.run(new String[] {"-n", "-o", unfolded.getPath(),
                                        src.getPath()}));
    text = FileUtils.readFileToString(unfolded, StandardCharsets.UTF_8);
    assertEquals(399, StringUtils.countMatches(text,
                                               "[label=\"+\", shape=ellipse]"));
  }
}
