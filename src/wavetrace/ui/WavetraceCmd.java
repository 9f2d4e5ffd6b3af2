package wavetrace.ui;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import wavetrace.GenerationResult;
import wavetrace.Wavetrace;
import wavetrace.WavetraceException;

public class WavetraceCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("wavetrace - instrument a verilog design with a wavetrace capture module", options);
  }

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("setup.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file describing sources, top module, clock, reset and debug nets")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to generate output-files; overrides the 'output' setting")
                          .build());
    options.addOption(Option.builder("t").longOpt("tree").required(false).desc("Print the debug net hierarchy").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  /**
   * Parses the command line and runs the generation.
   * @return the process exit status
   */
  public static int run(String[] args) {
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();
    CommandLine line;
    try {
      line = parser.parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return 2;
    }
    if (line.hasOption("h")) {
      printHelp(options);
      return 0;
    }
    if (!line.hasOption("c")) {
      System.err.println("Missing required option: c");
      printHelp(options);
      return 2;
    }

    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    Path configFile = Path.of(line.getOptionValue("c"));
    try {
      if (!Files.isRegularFile(configFile))
        throw new WavetraceException("Setup file '" + configFile + "' not found");
      WavetraceConfig cfg = WavetraceConfig.load(configFile);
      Path baseDir = configFile.toAbsolutePath().getParent();
      Wavetrace wt = cfg.toWavetrace(baseDir);
      if (line.hasOption("o"))
        wt.setOutputDir(Path.of(line.getOptionValue("o")));
      GenerationResult result = wt.generate();
      if (line.hasOption("t"))
        System.out.print(result.getTop().printTree());
      logger.info("Generated {} files, debug vector width {}", result.getGeneratedFiles().size(), result.getDataBits());
      return 0;
    } catch (WavetraceException e) {
      logger.fatal(e.getMessage());
      logger.debug("Generation failed", e);
      System.err.println("Error: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      logger.fatal("I/O error: " + e.getMessage());
      logger.debug("Generation failed", e);
      System.err.println("Error: I/O error: " + e.getMessage());
      return 1;
    }
  }
}
