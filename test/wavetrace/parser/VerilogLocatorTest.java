package wavetrace.parser;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import wavetrace.AnchorNotFoundException;
import wavetrace.VerilogFixtures;

class VerilogLocatorTest {

  @TempDir Path dir;

  private VerilogLocator locator;

  @BeforeEach
  void setUp() {
    locator = new VerilogLocator();
  }

  @Test
  void testAnsiModuleAnchors() throws Exception {
    Path core = VerilogFixtures.write(dir, "core.v", VerilogFixtures.CORE);
    ModuleAnchors anchors = locator.locateModule(core, "core");
    Assertions.assertEquals(new SourceAnchor(2, 8), anchors.getHeader());
    Assertions.assertEquals(2, anchors.getPortList().getLine());
    Assertions.assertEquals(13, anchors.getPortList().getColumn());
    Assertions.assertEquals(PortStyle.ANSI, anchors.getPortList().getStyle());
    Assertions.assertFalse(anchors.getPortList().isEmpty());
    Assertions.assertEquals(new SourceAnchor(6, 2), anchors.getDeclarationPoint());
    Assertions.assertEquals(new SourceAnchor(16, 1), anchors.getEndmodule());

    Assertions.assertEquals(anchors.getHeader(), locator.findModuleHeader(core, "core"));
    Assertions.assertEquals(anchors.getDeclarationPoint(), locator.findDeclarationPoint(core, "core"));
    Assertions.assertEquals(anchors.getEndmodule(), locator.findEndmodule(core, "core"));
  }

  @Test
  void testLegacyHeaderOnOneLine() throws Exception {
    Path fifo = VerilogFixtures.write(dir, "fifo.v", VerilogFixtures.FIFO);
    PortListAnchor ports = locator.findPortList(fifo, "fifo");
    Assertions.assertEquals(PortStyle.LEGACY, ports.getStyle());
    Assertions.assertEquals(1, ports.getLine());
    Assertions.assertEquals(12, ports.getColumn());
    Assertions.assertEquals(new SourceAnchor(1, 28), locator.findDeclarationPoint(fifo, "fifo"));
  }

  @Test
  void testParameterizedHeader() throws Exception {
    Path file = VerilogFixtures.write(dir, "p.v", "module p #(parameter W = 8) (input [W-1:0] a);\nendmodule\n");
    PortListAnchor ports = locator.findPortList(file, "p");
    Assertions.assertEquals(29, ports.getColumn());
    Assertions.assertEquals(PortStyle.ANSI, ports.getStyle());
    Assertions.assertEquals(NetKind.VECTOR, locator.classifyNet(file, "p", "a"));
  }

  @Test
  void testModuleWithoutPortList() throws Exception {
    Path file = VerilogFixtures.write(dir, "tb.v", "module tb;\n  reg clk;\nendmodule\n");
    Assertions.assertEquals(new SourceAnchor(1, 10), locator.findDeclarationPoint(file, "tb"));
    AnchorNotFoundException e = Assertions.assertThrows(AnchorNotFoundException.class, () -> locator.findPortList(file, "tb"));
    Assertions.assertEquals("findPortList", e.getOperation());
  }

  @Test
  void testEmptyPortList() throws Exception {
    Path file = VerilogFixtures.write(dir, "e.v", "module e ();\nendmodule\n");
    Assertions.assertTrue(locator.findPortList(file, "e").isEmpty());
  }

  @Test
  void testUnknownModule() throws Exception {
    Path core = VerilogFixtures.write(dir, "core.v", VerilogFixtures.CORE);
    AnchorNotFoundException e = Assertions.assertThrows(AnchorNotFoundException.class, () -> locator.findModuleHeader(core, "cor"));
    Assertions.assertEquals("cor", e.getModuleType());
    Assertions.assertNull(e.getInstanceName());
    Assertions.assertTrue(e.getMessage().contains("findModuleHeader"));
  }

  @Test
  void testFindInstance() throws Exception {
    Path top = VerilogFixtures.write(dir, "top.v", VerilogFixtures.TOP);
    InstanceAnchor core1 = locator.findInstance(top, "top", "core1");
    Assertions.assertEquals("core", core1.getInstanceType());
    Assertions.assertEquals(new SourceAnchor(13, 3), core1.getTypeLocation());
    Assertions.assertEquals(new SourceAnchor(13, 14), core1.getPortConnLocation());
    Assertions.assertFalse(core1.hasEmptyConnections());

    Path legacy = VerilogFixtures.write(dir, "top2.v", VerilogFixtures.TOP_LEGACY);
    InstanceAnchor fifo = locator.findInstance(legacy, "top2", "u_fifo");
    Assertions.assertEquals(new SourceAnchor(4, 3), fifo.getTypeLocation());
    Assertions.assertEquals(new SourceAnchor(4, 15), fifo.getPortConnLocation());
  }

  @Test
  void testFindInstanceVariants() throws Exception {
    Path file = VerilogFixtures.write(dir, "v.v",
                                      "module v (input clk);\n"
                                          + "  // sub u_comment (.clk(clk));\n"
                                          + "  sub #(.W(8)) u_p [1:0] (.clk(clk)), u_q (.clk(clk));\n"
                                          + "  sub #4 u_d (.clk(clk));\n"
                                          + "  sub u_e ();\n"
                                          + "endmodule\n");
    InstanceAnchor param = locator.findInstance(file, "v", "u_p");
    Assertions.assertEquals(new SourceAnchor(3, 3), param.getTypeLocation());
    Assertions.assertEquals(new SourceAnchor(3, 26), param.getPortConnLocation());
    Assertions.assertEquals("sub", locator.findInstance(file, "v", "u_d").getInstanceType());
    Assertions.assertTrue(locator.findInstance(file, "v", "u_e").hasEmptyConnections());

    // only the first instance of a statement is recognized
    Assertions.assertThrows(AnchorNotFoundException.class, () -> locator.findInstance(file, "v", "u_q"));
    Assertions.assertThrows(AnchorNotFoundException.class, () -> locator.findInstance(file, "v", "u_comment"));
  }

  @Test
  void testFindInstanceNeedsExactName() throws Exception {
    Path top = VerilogFixtures.write(dir, "top.v", VerilogFixtures.TOP);
    AnchorNotFoundException e = Assertions.assertThrows(AnchorNotFoundException.class, () -> locator.findInstance(top, "top", "core"));
    Assertions.assertEquals("core", e.getInstanceName());
    Assertions.assertEquals("top", e.getModuleType());
    Assertions.assertThrows(AnchorNotFoundException.class, () -> locator.findInstance(top, "top", "core01"));
  }

  @ParameterizedTest
  @CsvSource({"clk, SCALAR", "din_valid, SCALAR", "dout, VECTOR", "state, VECTOR", "busy, NOT_FOUND", "dou, NOT_FOUND"})
  void testClassifyNet(String net, NetKind expected) throws Exception {
    Path core = VerilogFixtures.write(dir, "core.v", VerilogFixtures.CORE);
    Assertions.assertEquals(expected, locator.classifyNet(core, "core", net));
  }

  @Test
  void testClassifyNetDeclarationForms() throws Exception {
    Path file = VerilogFixtures.write(dir, "d.v",
                                      "module d (clk, q);\n"
                                          + "  input clk;\n"
                                          + "  output wire signed [3:0] q;\n"
                                          + "  reg a, b = 1'b0, c;\n"
                                          + "  reg [7:0] mem [0:15], shadow;\n"
                                          + "  logic flag;\n"
                                          + "endmodule\n"
                                          + "module other;\n"
                                          + "  wire [1:0] only_here;\n"
                                          + "endmodule\n");
    Assertions.assertEquals(NetKind.VECTOR, locator.classifyNet(file, "d", "q"));
    Assertions.assertEquals(NetKind.SCALAR, locator.classifyNet(file, "d", "c"));
    Assertions.assertEquals(NetKind.VECTOR, locator.classifyNet(file, "d", "shadow"));
    Assertions.assertEquals(NetKind.SCALAR, locator.classifyNet(file, "d", "flag"));
    Assertions.assertEquals(NetKind.NOT_FOUND, locator.classifyNet(file, "d", "only_here"));
    Assertions.assertEquals(NetKind.VECTOR, locator.classifyNet(file, "only_here"));
  }

  @Test
  void testListModules() throws Exception {
    Path file = VerilogFixtures.write(dir, "multi.v",
                                      "/* module hidden; endmodule */\n"
                                          + "module a; endmodule\n"
                                          + "module automatic b (input x); endmodule\n"
                                          + "macromodule c; endmodule\n"
                                          + "module unfinished;\n");
    Assertions.assertEquals(List.of("a", "b", "c"), locator.listModules(file));
  }

  @Test
  void testTokensAreCached() throws Exception {
    Path core = VerilogFixtures.write(dir, "core.v", VerilogFixtures.CORE);
    List<VerilogToken> first = locator.tokens(core);
    Assertions.assertSame(first, locator.tokens(dir.resolve("./core.v")));
    locator.clear();
    Assertions.assertNotSame(first, locator.tokens(core));
  }
}
