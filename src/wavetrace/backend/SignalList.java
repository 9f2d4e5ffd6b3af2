package wavetrace.backend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import wavetrace.hierarchy.DebugInstance;
import wavetrace.hierarchy.LayoutEngine;

/**
 * Writes the legend of the debug vector: one net path per line, in canonical order starting at bit 0.
 */
public class SignalList {
  public static final String FILE_NAME = "signal_list.txt";

  public static List<String> paths(DebugInstance root) {
    return LayoutEngine.canonicalOrder(root).stream().map(net -> net.getPath()).collect(Collectors.toList());
  }

  /**
   * @return the written file
   */
  public static Path write(Path outputDir, DebugInstance root) throws IOException {
    Path file = outputDir.resolve(FILE_NAME);
    Files.createDirectories(outputDir);
    StringBuilder sb = new StringBuilder();
    for (String path : paths(root))
      sb.append(path).append('\n');
    Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
    return file;
  }
}
