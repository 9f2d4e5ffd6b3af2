package wavetrace.hierarchy;

import java.nio.file.Path;
import java.util.HashMap;

/**
 * Hands out variant ids per source file, so the Nth debug instance of a module becomes its own renamed module.
 */
public class DedupCounter {
  private final HashMap<Path, Integer> counts = new HashMap<>();

  /** Returns the next id for the file, starting at 0. */
  public int next(Path file) {
    Path key = file.toAbsolutePath().normalize();
    int id = counts.getOrDefault(key, 0);
    counts.put(key, id + 1);
    return id;
  }
}
