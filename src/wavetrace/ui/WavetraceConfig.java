package wavetrace.ui;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import wavetrace.ConfigurationException;
import wavetrace.Wavetrace;

/**
 * Data-Class to hold a debug setup as read from a YAML file.
 *
 * <pre>
 * sources: [rtl, lib/fifo.v]
 * exclude: [rtl/old]
 * top: top
 * clock: clk
 * reset: rst
 * clock_mhz: 80.0
 * nets:
 *   - core0.din_valid
 *   - base: core0
 *     nets:
 *       - "dout[7:0]"
 * </pre>
 *
 * Relative source and output paths are resolved against the directory holding the setup file.
 */
public class WavetraceConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Nets sharing a hierarchical base path; the base is empty for plain entries. */
  public static class NetGroup {
    public String base = "";
    public List<String> nets = new ArrayList<>();
  }

  public List<String> sources = new ArrayList<>();
  public List<String> exclude = new ArrayList<>();
  public String top = null;
  public String clock = null;
  public String reset = null;
  public double clock_mhz = 0.0;
  public int uart_baud = 115200;
  public int pre_trigger_depth = 64;
  public int capture_depth = 512;
  public String output = Wavetrace.DEFAULT_OUTPUT_DIR;
  public List<NetGroup> nets = new ArrayList<>();

  /**
   * Reads a setup file.
   * @throws ConfigurationException if the YAML is malformed or a setting has the wrong type
   */
  public static WavetraceConfig load(Path file) throws ConfigurationException, IOException {
    Object data;
    try (InputStream in = Files.newInputStream(file)) {
      data = new Yaml().load(in);
    } catch (YAMLException e) {
      throw new ConfigurationException("Malformed setup file '" + file + "': " + e.getMessage(), e);
    }
    if (!(data instanceof Map))
      throw new ConfigurationException("Setup file '" + file + "' must hold a mapping of settings");
    return fromMap((Map<?, ?>)data);
  }

  static WavetraceConfig fromMap(Map<?, ?> data) throws ConfigurationException {
    WavetraceConfig cfg = new WavetraceConfig();
    for (Map.Entry<?, ?> entry : data.entrySet()) {
      String setting = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      switch (setting) {
      case "sources":
        cfg.sources = stringList(setting, value);
        break;
      case "exclude":
        cfg.exclude = stringList(setting, value);
        break;
      case "top":
        cfg.top = string(setting, value);
        break;
      case "clock":
        cfg.clock = string(setting, value);
        break;
      case "reset":
        cfg.reset = string(setting, value);
        break;
      case "clock_mhz":
        cfg.clock_mhz = number(setting, value).doubleValue();
        break;
      case "uart_baud":
        cfg.uart_baud = number(setting, value).intValue();
        break;
      case "pre_trigger_depth":
        cfg.pre_trigger_depth = number(setting, value).intValue();
        break;
      case "capture_depth":
        cfg.capture_depth = number(setting, value).intValue();
        break;
      case "output":
        cfg.output = string(setting, value);
        break;
      case "nets":
        cfg.nets = netGroups(value);
        break;
      default:
        logger.warn("Ignoring unknown setting '{}'", setting);
      }
    }
    return cfg;
  }

  /**
   * Creates a configured {@link Wavetrace} object. Sources are indexed immediately.
   * @param baseDir directory relative paths are resolved against
   */
  public Wavetrace toWavetrace(Path baseDir) throws ConfigurationException, IOException {
    Wavetrace wt = new Wavetrace(clock_mhz);
    for (String src : sources)
      wt.addSources(resolve(baseDir, src));
    for (String excluded : exclude)
      wt.removeSources(resolve(baseDir, excluded));
    if (top != null)
      wt.setTop(top);
    if (clock != null)
      wt.setClock(clock);
    if (reset != null)
      wt.setReset(reset);
    for (NetGroup group : nets)
      wt.addNets(group.base, group.nets);
    wt.setUartBaud(uart_baud).setPreTrigDepth(pre_trigger_depth).setCaptDepth(capture_depth);
    wt.setOutputDir(Path.of(resolve(baseDir, output)));
    return wt;
  }

  private static String resolve(Path baseDir, String path) {
    if (baseDir == null || path.startsWith("~") || Path.of(path).isAbsolute())
      return path;
    return baseDir.resolve(path).toString();
  }

  private static List<NetGroup> netGroups(Object value) throws ConfigurationException {
    if (!(value instanceof List))
      throw new ConfigurationException("Setting 'nets' must be a list");
    List<NetGroup> groups = new ArrayList<>();
    for (Object item : (List<?>)value) {
      NetGroup group = new NetGroup();
      if (item instanceof Map) {
        Map<?, ?> map = (Map<?, ?>)item;
        if (map.containsKey("base"))
          group.base = string("base", map.get("base"));
        group.nets = stringList("nets", map.get("nets"));
      } else {
        group.nets.add(string("nets", item));
      }
      groups.add(group);
    }
    return groups;
  }

  private static String string(String setting, Object value) throws ConfigurationException {
    if (value instanceof String || value instanceof Number)
      return value.toString();
    throw new ConfigurationException("Setting '" + setting + "' must be a string, got " + value);
  }

  private static Number number(String setting, Object value) throws ConfigurationException {
    if (value instanceof Number)
      return (Number)value;
    throw new ConfigurationException("Setting '" + setting + "' must be a number, got " + value);
  }

  private static List<String> stringList(String setting, Object value) throws ConfigurationException {
    List<String> result = new ArrayList<>();
    if (value instanceof List) {
      for (Object item : (List<?>)value)
        result.add(string(setting, item));
    } else {
      result.add(string(setting, value));
    }
    return result;
  }
}
