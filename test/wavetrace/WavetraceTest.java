package wavetrace;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import wavetrace.hierarchy.DebugNet;

class WavetraceTest {

  @TempDir Path dir;

  private Path src;
  private Path out;

  @BeforeEach
  void setUp() throws Exception {
    src = dir.resolve("rtl");
    out = dir.resolve("output");
    VerilogFixtures.writeDesign(src);
  }

  private Wavetrace configured() throws Exception {
    Wavetrace wt = new Wavetrace(80.0);
    wt.addSources(src.toString()).setTop("top").setClock("clk").setReset("rst").setOutputDir(out);
    return wt;
  }

  @Test
  void testGenerate() throws Exception {
    Wavetrace wt = configured();
    wt.addNets("core0.din_valid");
    wt.addNets("core0", List.of("dout[7:0]"));
    GenerationResult result = wt.generate();

    Assertions.assertEquals(9, result.getDataBits());
    Assertions.assertEquals(List.of(out.resolve("top_wt0.v"), out.resolve("core_wt0.v")), result.getGeneratedFiles());
    Assertions.assertEquals(List.of("core0.din_valid", "core0.dout[7:0]"), result.getSignalOrder());
    Assertions.assertEquals("core0.din_valid\ncore0.dout[7:0]\n", Files.readString(result.getSignalListFile()));

    List<DebugNet> nets = result.getTop().getChild("core0").orElseThrow().getLocalNets();
    Assertions.assertEquals(0, nets.get(0).getVectorPosition());
    Assertions.assertEquals(8, nets.get(1).getVectorPosition());
    Assertions.assertTrue(Files.readString(out.resolve("top_wt0.v")).contains("    .ClockHz     (80000000),\n"));
  }

  @Test
  void testGenerateIsRepeatable() throws Exception {
    Wavetrace wt = configured();
    wt.addNets(List.of("core0.din_valid", "core1.u_sub.busy"));
    wt.generate();
    String first = Files.readString(out.resolve("core_wt1.v"));
    try (Stream<Path> files = Files.list(out)) {
      Assertions.assertEquals(5, files.count());
    }

    GenerationResult second = wt.generate();
    Assertions.assertEquals(first, Files.readString(out.resolve("core_wt1.v")));
    Assertions.assertEquals(List.of(out.resolve("top_wt0.v"), out.resolve("core_wt0.v"), out.resolve("core_wt1.v"),
                                    out.resolve("sub_wt0.v")),
                            second.getGeneratedFiles());
  }

  @Test
  void testSourceEditedAfterAddSources() throws Exception {
    Wavetrace wt = configured();
    wt.addNets("core0.din_valid");
    VerilogFixtures.write(src, "core.v", "// rev 2\n" + VerilogFixtures.CORE);
    wt.generate();
    String core = Files.readString(out.resolve("core_wt0.v"));
    Assertions.assertTrue(core.startsWith("// rev 2\n// simple core\nmodule core_wt0 (\n"));
    Assertions.assertTrue(core.contains("      dout <= dout + 8'd1;\n\n//---WT_DEBUG---\n  assign wt_debug = {din_valid};\n"));
  }

  @Test
  void testSourceEditedBetweenRuns() throws Exception {
    Wavetrace wt = configured();
    wt.addNets("core0.din_valid");
    wt.generate();
    VerilogFixtures.write(src, "top.v", "// rev 2\n\n" + VerilogFixtures.TOP);
    wt.generate();
    String top = Files.readString(out.resolve("top_wt0.v"));
    Assertions.assertTrue(top.startsWith("// rev 2\n\nmodule top (\n//---WT_DEBUG---\n"));
    Assertions.assertTrue(top.contains("  core_wt0 core0 (\n//---WT_DEBUG---\n    .wt_debug(core0_wt_debug),\n"));
  }

  @Test
  void testStaleOutputIsRemoved() throws Exception {
    Files.createDirectories(out);
    Files.writeString(out.resolve("core_wt7.v"), "stale");
    Files.writeString(out.resolve("signal_list.txt"), "stale");
    Files.writeString(out.resolve("notes.md"), "keep");

    Wavetrace wt = configured();
    wt.addNets("core0.din_valid");
    wt.generate();
    Assertions.assertFalse(Files.exists(out.resolve("core_wt7.v")));
    Assertions.assertTrue(Files.exists(out.resolve("notes.md")));
    Assertions.assertEquals("core0.din_valid\n", Files.readString(out.resolve("signal_list.txt")));
  }

  @Test
  void testFailedGenerationKeepsOutput() throws Exception {
    Files.createDirectories(out);
    Files.writeString(out.resolve("core_wt0.v"), "previous");
    Wavetrace wt = configured();
    wt.addNets("core0.not_there");
    Assertions.assertThrows(ResolutionException.class, wt::generate);
    Assertions.assertEquals("previous", Files.readString(out.resolve("core_wt0.v")));
  }

  @Test
  void testAmbiguousModuleCanBeExcluded() throws Exception {
    VerilogFixtures.write(src, "old/core.v", VerilogFixtures.CORE);
    Wavetrace wt = configured();
    wt.addNets("core0.din_valid");
    ResolutionException e = Assertions.assertThrows(ResolutionException.class, wt::generate);
    Assertions.assertEquals(ResolutionException.Kind.AMBIGUOUS_MODULE, e.getKind());

    wt.removeSources(src.resolve("old").toString());
    Assertions.assertEquals(1, wt.generate().getDataBits());
  }

  @Test
  void testMissingSettings() throws Exception {
    Wavetrace wt = new Wavetrace(80.0);
    Assertions.assertThrows(ConfigurationException.class, wt::generate);
    wt.addSources(src.toString());
    Assertions.assertThrows(ConfigurationException.class, wt::generate);
    wt.setTop("top");
    Assertions.assertThrows(ConfigurationException.class, wt::generate);
    wt.setReset("rst");
    Assertions.assertThrows(ConfigurationException.class, wt::generate);
    wt.setClock("clk");
    ConfigurationException noNets = Assertions.assertThrows(ConfigurationException.class, wt::generate);
    Assertions.assertTrue(noNets.getMessage().contains("addNets"));
    wt.addNets("core0.din_valid").setClockMhz(0);
    Assertions.assertThrows(ConfigurationException.class, wt::generate);
  }

  @ParameterizedTest
  @ValueSource(strings = {"core0.mem[3:0][7:0]", "core0..x", "", "core0.dout[7:", "core0.dout[99999999999:0]",
                          "core0.dout[2147483647:-2147483648]"})
  void testBadNetNames(String net) throws Exception {
    Assertions.assertThrows(ConfigurationException.class, () -> configured().addNets(net));
  }

  @Test
  void testHierarchicalClockAndReset() {
    Wavetrace wt = new Wavetrace(80.0);
    Assertions.assertThrows(ConfigurationException.class, () -> wt.setClock("core0.clk"));
    Assertions.assertThrows(ConfigurationException.class, () -> wt.setReset("core0.rst"));
    Assertions.assertThrows(ConfigurationException.class, () -> wt.setTop(" "));
  }

  @Test
  void testInvalidSourcePath() {
    Wavetrace wt = new Wavetrace(80.0);
    Assertions.assertThrows(ConfigurationException.class, () -> wt.addSources(dir.resolve("nope").toString()));
  }
}
