package wavetrace.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileWriterTest {

  private static final String SOURCE = "module m (\n  input a\n);\nendmodule";

  @TempDir Path dir;

  @Test
  void testNoEditsKeepsText() {
    Assertions.assertEquals(SOURCE, FileWriter.patch(SOURCE, List.of()));
    String crlf = "a\r\n\r\nb\r\n";
    Assertions.assertEquals(crlf, FileWriter.patch(crlf, List.of()));
  }

  @Test
  void testInlineInsertion() {
    String patched = FileWriter.patch(SOURCE, List.of(ToWrite.inline(0, 8, "_wt0")));
    Assertions.assertEquals("module m_wt0 (\n  input a\n);\nendmodule", patched);
  }

  @Test
  void testBlockSplitsLine() {
    String patched = FileWriter.patch("module m (input a);\n", List.of(ToWrite.block(0, 10, "  output x,\n")));
    Assertions.assertEquals("module m (\n"
                                + "//---WT_DEBUG---\n"
                                + "  output x,\n"
                                + "//---WT_DEBUG---\n"
                                + "input a);\n",
                            patched);
  }

  @Test
  void testBlockAtEndOfLine() {
    String patched = FileWriter.patch(SOURCE, List.of(ToWrite.block(0, 10, "  output x,\n")));
    Assertions.assertEquals("module m (\n"
                                + "//---WT_DEBUG---\n"
                                + "  output x,\n"
                                + "//---WT_DEBUG---\n"
                                + "  input a\n"
                                + ");\n"
                                + "endmodule",
                            patched);
  }

  @Test
  void testBlockBeforeLastLine() {
    String patched = FileWriter.patch(SOURCE, List.of(ToWrite.block(3, 0, "  assign x = a;\n")));
    Assertions.assertTrue(patched.endsWith(");\n\n//---WT_DEBUG---\n  assign x = a;\n//---WT_DEBUG---\nendmodule"));
  }

  @Test
  void testCrlfIsKept() {
    String source = "module m (\r\n  input a\r\n);\r\nendmodule\r\n";
    String patched = FileWriter.patch(source, List.of(ToWrite.block(0, 10, "  output x,\n  output y,\n")));
    Assertions.assertEquals("module m (\r\n"
                                + "//---WT_DEBUG---\r\n"
                                + "  output x,\r\n"
                                + "  output y,\r\n"
                                + "//---WT_DEBUG---\r\n"
                                + "  input a\r\n"
                                + ");\r\n"
                                + "endmodule\r\n",
                            patched);
    Assertions.assertEquals("\r\n", FileWriter.lineSeparator(source));
  }

  @Test
  void testSameLineEditsIndependentOfOrder() {
    String source = "module f(a, b); input a;\n";
    List<ToWrite> edits =
        List.of(ToWrite.inline(0, 8, "_wt1"), ToWrite.block(0, 9, "  wt_debug,\n"), ToWrite.block(0, 15, "  output d;\n"));
    String expected = "module f_wt1(\n"
                      + "//---WT_DEBUG---\n"
                      + "  wt_debug,\n"
                      + "//---WT_DEBUG---\n"
                      + "a, b);\n"
                      + "//---WT_DEBUG---\n"
                      + "  output d;\n"
                      + "//---WT_DEBUG---\n"
                      + " input a;\n";
    Assertions.assertEquals(expected, FileWriter.patch(source, edits));
    Assertions.assertEquals(expected, FileWriter.patch(source, List.of(edits.get(2), edits.get(0), edits.get(1))));
  }

  @Test
  void testInvalidEdits() {
    Assertions.assertThrows(IllegalStateException.class, () -> FileWriter.patch(SOURCE, List.of(ToWrite.inline(4, 0, "x"))));
    Assertions.assertThrows(IllegalStateException.class, () -> FileWriter.patch(SOURCE, List.of(ToWrite.inline(1, 10, "x"))));
    Assertions.assertThrows(IllegalStateException.class,
                            () -> FileWriter.patch(SOURCE, List.of(ToWrite.inline(0, 8, "x"), ToWrite.inline(0, 8, "y"))));
    Assertions.assertThrows(IllegalArgumentException.class, () -> ToWrite.inline(-1, 0, "x"));
  }

  @Test
  void testWriteFilesLeavesSourceUntouched() throws Exception {
    Path in = dir.resolve("m.v");
    Files.writeString(in, SOURCE);
    Path out = dir.resolve("out/m_wt0.v");
    FileWriter writer = new FileWriter();
    writer.addFile(out, in);
    writer.updateContent(out, ToWrite.inline(0, 8, "_wt0"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> writer.addFile(out, in));
    Assertions.assertThrows(IllegalArgumentException.class, () -> writer.updateContent(dir.resolve("other.v"), ToWrite.inline(0, 0, "")));

    Assertions.assertEquals(List.of(out), writer.writeFiles());
    Assertions.assertEquals(SOURCE, Files.readString(in));
    Assertions.assertTrue(Files.readString(out).startsWith("module m_wt0 ("));
  }
}
