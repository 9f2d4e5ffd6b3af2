package wavetrace.parser;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavetrace.AnchorNotFoundException;

/**
 * Finds structural anchors in Verilog sources without elaborating them.
 * Each file is tokenized once and cached; every lookup runs a small matcher over the token stream and returns the
 * first structural match. Lookups that fail throw {@link AnchorNotFoundException}.
 */
public class VerilogLocator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Sources are decoded byte for byte so columns and untouched bytes survive a rewrite unchanged. */
  public static final Charset SOURCE_CHARSET = StandardCharsets.ISO_8859_1;

  static final Set<String> MODULE_KEYWORDS = Set.of("module", "macromodule");
  static final Set<String> PORT_DIRECTIONS = Set.of("input", "output", "inout");
  static final Set<String> NET_TYPES = Set.of("wire", "reg", "logic");
  private static final Set<String> DECL_MODIFIERS = Set.of("signed", "unsigned", "scalared", "vectored", "var", "tri");
  private static final Set<String> KEYWORDS =
      Set.of("module", "macromodule", "endmodule", "input", "output", "inout", "wire", "reg", "logic", "integer", "real", "time",
             "genvar", "parameter", "localparam", "defparam", "assign", "always", "always_ff", "always_comb", "always_latch",
             "initial", "begin", "end", "if", "else", "case", "casez", "casex", "endcase", "for", "while", "repeat", "forever",
             "function", "endfunction", "task", "endtask", "generate", "endgenerate", "default", "posedge", "negedge", "or", "and",
             "nand", "nor", "xor", "xnor", "not", "buf", "signed", "unsigned", "automatic", "supply0", "supply1", "tri", "wand",
             "wor", "typedef", "enum", "struct", "return", "import", "export", "var", "static");

  /** Token positions of one module definition. Indices point into the file's token list. */
  private static class ModuleScan {
    int typeIdx;
    int portOpenIdx = -1;
    int portCloseIdx = -1;
    int semiIdx;
    int endIdx;
  }

  private final HashMap<Path, List<VerilogToken>> tokenCache = new HashMap<>();

  /**
   * Returns the token stream of a file, tokenizing it on first use.
   */
  public List<VerilogToken> tokens(Path file) throws IOException, VerilogParseException {
    Path key = file.toAbsolutePath().normalize();
    List<VerilogToken> tokens = tokenCache.get(key);
    if (tokens == null) {
      tokens = VerilogTokenizer.tokenize(file, Files.readString(file, SOURCE_CHARSET));
      tokenCache.put(key, tokens);
    }
    return tokens;
  }

  /**
   * Lists every module defined in a file, in file order. A module counts only if it has a matching 'endmodule'.
   */
  public List<String> listModules(Path file) throws IOException, VerilogParseException {
    List<VerilogToken> toks = tokens(file);
    List<String> modules = new ArrayList<>();
    int i = 0;
    while (i < toks.size() - 1) {
      VerilogToken tok = toks.get(i);
      if (tok.isIdentifier() && MODULE_KEYWORDS.contains(tok.getText())) {
        int nameIdx = skipLifetime(toks, i + 1);
        if (nameIdx < toks.size() && toks.get(nameIdx).isIdentifier()) {
          int end = indexOf(toks, "endmodule", nameIdx + 1, toks.size());
          if (end < 0)
            break;
          modules.add(toks.get(nameIdx).getText());
          i = end + 1;
          continue;
        }
      }
      i++;
    }
    return modules;
  }

  /**
   * Locates the module type token that follows the 'module' keyword.
   */
  public SourceAnchor findModuleHeader(Path file, String moduleType)
      throws IOException, VerilogParseException, AnchorNotFoundException {
    List<VerilogToken> toks = tokens(file);
    return toks.get(scanModule(file, toks, moduleType, "findModuleHeader").typeIdx).toAnchor();
  }

  /**
   * Locates the '(' opening the module port list and determines the port declaration style.
   */
  public PortListAnchor findPortList(Path file, String moduleType)
      throws IOException, VerilogParseException, AnchorNotFoundException {
    List<VerilogToken> toks = tokens(file);
    ModuleScan scan = scanModule(file, toks, moduleType, "findPortList");
    if (scan.portOpenIdx < 0)
      throw new AnchorNotFoundException(file, moduleType, "findPortList");
    return portListAnchor(toks, scan);
  }

  /**
   * Locates the point after the module header's terminating ';' where new declarations may be inserted.
   */
  public SourceAnchor findDeclarationPoint(Path file, String moduleType)
      throws IOException, VerilogParseException, AnchorNotFoundException {
    List<VerilogToken> toks = tokens(file);
    return toks.get(scanModule(file, toks, moduleType, "findDeclarationPoint").semiIdx).toAnchor();
  }

  /**
   * Locates the 'endmodule' keyword closing the module body.
   */
  public SourceAnchor findEndmodule(Path file, String moduleType)
      throws IOException, VerilogParseException, AnchorNotFoundException {
    List<VerilogToken> toks = tokens(file);
    return toks.get(scanModule(file, toks, moduleType, "findEndmodule").endIdx).toAnchor();
  }

  /**
   * Locates all module level anchors of a module at once.
   */
  public ModuleAnchors locateModule(Path file, String moduleType)
      throws IOException, VerilogParseException, AnchorNotFoundException {
    List<VerilogToken> toks = tokens(file);
    ModuleScan scan = scanModule(file, toks, moduleType, "locateModule");
    if (scan.portOpenIdx < 0)
      throw new AnchorNotFoundException(file, moduleType, "findPortList");
    ModuleAnchors anchors = new ModuleAnchors(moduleType, toks.get(scan.typeIdx).toAnchor(), portListAnchor(toks, scan),
                                              toks.get(scan.semiIdx).toAnchor(), toks.get(scan.endIdx).toAnchor());
    logger.debug("{}: {}", file, anchors);
    return anchors;
  }

  /**
   * Locates an instantiation inside the body of a module.
   * Matches {@code type [#(...)] name [range] (...)} followed by ';' or ','; the type must not be a keyword.
   * Only the first instance of a multi-instance statement is recognized.
   * @param file the file holding the parent module
   * @param moduleType the parent module type to search in
   * @param instanceName the instance name to look for
   */
  public InstanceAnchor findInstance(Path file, String moduleType, String instanceName)
      throws IOException, VerilogParseException, AnchorNotFoundException {
    List<VerilogToken> toks = tokens(file);
    ModuleScan scan = scanModule(file, toks, moduleType, "findInstance");
    for (int k = scan.semiIdx + 1; k < scan.endIdx; k++) {
      VerilogToken typeTok = toks.get(k);
      if (!typeTok.isIdentifier() || KEYWORDS.contains(typeTok.getText()))
        continue;
      Optional<InstanceAnchor> match = matchInstance(toks, k, scan.endIdx, instanceName);
      if (match.isPresent()) {
        logger.debug("{}: {}", file, match.get());
        return match.get();
      }
    }
    throw new AnchorNotFoundException(file, moduleType, instanceName, "findInstance");
  }

  /**
   * Classifies a net by the first declaration in the file that names it.
   * @param file the file to search
   * @param netName the net name without any bit range
   */
  public NetKind classifyNet(Path file, String netName) throws IOException, VerilogParseException {
    List<VerilogToken> toks = tokens(file);
    return classifyNet(toks, 0, toks.size(), netName);
  }

  /**
   * Classifies a net by the first declaration naming it within one module definition (header and body).
   */
  public NetKind classifyNet(Path file, String moduleType, String netName)
      throws IOException, VerilogParseException, AnchorNotFoundException {
    List<VerilogToken> toks = tokens(file);
    ModuleScan scan = scanModule(file, toks, moduleType, "classifyNet");
    return classifyNet(toks, scan.typeIdx + 1, scan.endIdx, netName);
  }

  /** Drops cached token streams. */
  public void clear() { tokenCache.clear(); }

  private static PortListAnchor portListAnchor(List<VerilogToken> toks, ModuleScan scan) {
    PortStyle style = PortStyle.LEGACY;
    for (int i = scan.portOpenIdx + 1; i < scan.portCloseIdx; i++) {
      VerilogToken tok = toks.get(i);
      if (tok.isIdentifier() && PORT_DIRECTIONS.contains(tok.getText())) {
        style = PortStyle.ANSI;
        break;
      }
    }
    VerilogToken open = toks.get(scan.portOpenIdx);
    return new PortListAnchor(open.getLine(), open.getColumn(), style, scan.portCloseIdx == scan.portOpenIdx + 1);
  }

  /**
   * Finds the first definition of the module whose header parses as
   * {@code module name [#(...)] [(...)] ;} and has a closing 'endmodule'.
   */
  private static ModuleScan scanModule(Path file, List<VerilogToken> toks, String moduleType, String operation)
      throws AnchorNotFoundException {
    for (int i = 0; i < toks.size() - 1; i++) {
      VerilogToken tok = toks.get(i);
      if (!tok.isIdentifier() || !MODULE_KEYWORDS.contains(tok.getText()))
        continue;
      int j = skipLifetime(toks, i + 1);
      if (j >= toks.size() || !toks.get(j).isIdentifier(moduleType))
        continue;
      ModuleScan scan = new ModuleScan();
      scan.typeIdx = j++;
      if (j < toks.size() && toks.get(j).isSymbol('#')) {
        if (j + 1 >= toks.size() || !toks.get(j + 1).isSymbol('('))
          continue;
        j = matchClose(toks, j + 1, '(', ')');
        if (j < 0)
          continue;
        j++;
      }
      if (j < toks.size() && toks.get(j).isSymbol('(')) {
        int close = matchClose(toks, j, '(', ')');
        if (close < 0)
          continue;
        scan.portOpenIdx = j;
        scan.portCloseIdx = close;
        j = close + 1;
      }
      if (j >= toks.size() || !toks.get(j).isSymbol(';'))
        continue;
      scan.semiIdx = j;
      scan.endIdx = indexOf(toks, "endmodule", j + 1, toks.size());
      if (scan.endIdx < 0)
        continue;
      return scan;
    }
    throw new AnchorNotFoundException(file, moduleType, operation);
  }

  private static Optional<InstanceAnchor> matchInstance(List<VerilogToken> toks, int typeIdx, int limit, String instanceName) {
    int j = typeIdx + 1;
    if (j < limit && toks.get(j).isSymbol('#')) {
      j++;
      if (j < limit && toks.get(j).isSymbol('(')) {
        j = matchClose(toks, j, '(', ')');
        if (j < 0 || j >= limit)
          return Optional.empty();
      }
      j++;
    }
    if (j >= limit || !toks.get(j).isIdentifier(instanceName))
      return Optional.empty();
    j++;
    while (j < limit && toks.get(j).isSymbol('[')) {
      j = matchClose(toks, j, '[', ']');
      if (j < 0 || j >= limit)
        return Optional.empty();
      j++;
    }
    if (j >= limit || !toks.get(j).isSymbol('('))
      return Optional.empty();
    int open = j;
    int close = matchClose(toks, open, '(', ')');
    if (close < 0 || close + 1 >= limit)
      return Optional.empty();
    VerilogToken after = toks.get(close + 1);
    if (!after.isSymbol(';') && !after.isSymbol(','))
      return Optional.empty();
    VerilogToken typeTok = toks.get(typeIdx);
    return Optional.of(
        new InstanceAnchor(instanceName, typeTok.getText(), typeTok.toAnchor(), toks.get(open).toAnchor(), close == open + 1));
  }

  private static NetKind classifyNet(List<VerilogToken> toks, int from, int to, String netName) {
    int i = from;
    while (i < to) {
      VerilogToken tok = toks.get(i);
      boolean isPort = tok.isIdentifier() && PORT_DIRECTIONS.contains(tok.getText());
      boolean isNet = tok.isIdentifier() && NET_TYPES.contains(tok.getText());
      if (!isPort && !isNet) {
        i++;
        continue;
      }
      int j = i + 1;
      if (isPort && j < to && toks.get(j).isIdentifier() && NET_TYPES.contains(toks.get(j).getText()))
        j++;
      while (j < to && toks.get(j).isIdentifier() && DECL_MODIFIERS.contains(toks.get(j).getText()))
        j++;
      boolean vector = false;
      while (j < to && toks.get(j).isSymbol('[')) {
        vector = true;
        j = matchClose(toks, j, '[', ']');
        if (j < 0)
          return NetKind.NOT_FOUND;
        j++;
      }
      List<String> names = new ArrayList<>();
      j = collectDeclaredNames(toks, j, to, names);
      if (names.contains(netName))
        return vector ? NetKind.VECTOR : NetKind.SCALAR;
      i = Math.max(j, i + 1);
    }
    return NetKind.NOT_FOUND;
  }

  /**
   * Collects {@code name [unpacked range] [= expr] {, name ...}} and returns the index after the list.
   * The list ends at ';', at a closing ')' or when a keyword follows a ','.
   */
  private static int collectDeclaredNames(List<VerilogToken> toks, int j, int to, List<String> names) {
    while (j < to && toks.get(j).isIdentifier() && !KEYWORDS.contains(toks.get(j).getText())) {
      names.add(toks.get(j).getText());
      j++;
      while (j < to && toks.get(j).isSymbol('[')) {
        j = matchClose(toks, j, '[', ']');
        if (j < 0)
          return to;
        j++;
      }
      if (j < to && toks.get(j).isSymbol('=')) {
        int depth = 0;
        while (j < to) {
          VerilogToken t = toks.get(j);
          if (t.isSymbol('(') || t.isSymbol('[') || t.isSymbol('{'))
            depth++;
          else if (t.isSymbol(')') || t.isSymbol(']') || t.isSymbol('}'))
            depth--;
          if (depth < 0 || (depth == 0 && (t.isSymbol(',') || t.isSymbol(';'))))
            break;
          j++;
        }
      }
      if (j < to && toks.get(j).isSymbol(','))
        j++;
      else
        break;
    }
    return j;
  }

  private static int skipLifetime(List<VerilogToken> toks, int idx) {
    if (idx < toks.size() && (toks.get(idx).isIdentifier("automatic") || toks.get(idx).isIdentifier("static")))
      return idx + 1;
    return idx;
  }

  private static int indexOf(List<VerilogToken> toks, String identifier, int from, int to) {
    for (int i = from; i < to; i++) {
      if (toks.get(i).isIdentifier(identifier))
        return i;
    }
    return -1;
  }

  /**
   * Returns the index of the bracket closing the one at {@code openIdx}, or -1 if it is never closed.
   */
  static int matchClose(List<VerilogToken> toks, int openIdx, char open, char close) {
    int depth = 0;
    for (int i = openIdx; i < toks.size(); i++) {
      VerilogToken tok = toks.get(i);
      if (tok.isSymbol(open))
        depth++;
      else if (tok.isSymbol(close) && --depth == 0)
        return i;
    }
    return -1;
  }
}
