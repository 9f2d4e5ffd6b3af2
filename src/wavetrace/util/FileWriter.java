package wavetrace.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavetrace.parser.VerilogLocator;

/*
 * Class for writing patched copies of source files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static class FileUpdateInfo {
    final Path inFile;
    final List<ToWrite> updates = new ArrayList<>();
    FileUpdateInfo(Path inFile) { this.inFile = inFile; }
  }

  /** key: output path; insertion order is the write order */
  private final LinkedHashMap<Path, FileUpdateInfo> updateFiles = new LinkedHashMap<>();

  /**
   * Registers an output file produced from a source file. The source is never modified.
   * @throws IllegalArgumentException if the output path is already registered
   */
  public void addFile(Path outFile, Path inFile) {
    if (updateFiles.containsKey(outFile))
      throw new IllegalArgumentException("Output file " + outFile + " is already generated from " + updateFiles.get(outFile).inFile);
    updateFiles.put(outFile, new FileUpdateInfo(inFile));
  }

  public boolean hasFile(Path outFile) { return updateFiles.containsKey(outFile); }

  /**
   * Adds an edit to be applied when the output file is written.
   */
  public void updateContent(Path outFile, ToWrite edit) {
    FileUpdateInfo info = updateFiles.get(outFile);
    if (info == null)
      throw new IllegalArgumentException("No source registered for output file " + outFile);
    info.updates.add(edit);
  }

  /**
   * Writes all registered files in registration order.
   * @return the written paths
   */
  public List<Path> writeFiles() throws IOException {
    List<Path> written = new ArrayList<>();
    for (Map.Entry<Path, FileUpdateInfo> entry : updateFiles.entrySet()) {
      writeFile(entry.getValue(), entry.getKey());
      written.add(entry.getKey());
    }
    return written;
  }

  private void writeFile(FileUpdateInfo updateInfo, Path outFile) throws IOException {
    logger.info("Writing {} (from {})", outFile, updateInfo.inFile);
    String source = Files.readString(updateInfo.inFile, VerilogLocator.SOURCE_CHARSET);
    String patched = patch(source, updateInfo.updates);
    Path parent = outFile.toAbsolutePath().getParent();
    if (parent != null)
      Files.createDirectories(parent);
    Files.writeString(outFile, patched, VerilogLocator.SOURCE_CHARSET);
  }

  /**
   * Applies edits to source text. Lines without edits are copied unchanged, including their terminators.
   * Edits on the same line are applied from the rightmost column to the leftmost one.
   * @throws IllegalStateException if an edit points outside the text, or two edits share a position
   */
  public static String patch(String source, List<ToWrite> updates) {
    TreeMap<Integer, List<ToWrite>> byLine = new TreeMap<>();
    for (ToWrite edit : updates)
      byLine.computeIfAbsent(edit.line, l -> new ArrayList<>()).add(edit);

    List<String> lines = splitLines(source);
    if (!byLine.isEmpty() && byLine.lastKey() >= lines.size())
      throw new IllegalStateException("Edit at line " + (byLine.lastKey() + 1) + " but the file has " + lines.size() + " lines");
    String eol = lineSeparator(source);

    StringBuilder out = new StringBuilder(source.length() + 256);
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      List<ToWrite> edits = byLine.get(i);
      if (edits == null) {
        out.append(line);
        continue;
      }
      String terminator = terminator(line);
      String content = line.substring(0, line.length() - terminator.length());
      edits.sort(Comparator.comparingInt((ToWrite edit) -> edit.column).reversed());
      for (int e = 1; e < edits.size(); e++) {
        if (edits.get(e).column == edits.get(e - 1).column)
          throw new IllegalStateException("Conflicting edits at " + edits.get(e) + " and " + edits.get(e - 1));
      }
      for (ToWrite edit : edits)
        content = edit.apply(content, eol);
      out.append(content).append(terminator);
    }
    return out.toString();
  }

  /** Splits text into lines, each keeping its terminator ("\n" or "\r\n"). */
  public static List<String> splitLines(String text) {
    List<String> lines = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        lines.add(text.substring(start, i + 1));
        start = i + 1;
      }
    }
    if (start < text.length())
      lines.add(text.substring(start));
    return lines;
  }

  /** The first line separator used in the text, "\n" if there is none. */
  public static String lineSeparator(String text) {
    int nl = text.indexOf('\n');
    return (nl > 0 && text.charAt(nl - 1) == '\r') ? "\r\n" : "\n";
  }

  private static String terminator(String line) {
    if (line.endsWith("\r\n"))
      return "\r\n";
    return line.endsWith("\n") ? "\n" : "";
  }
}
