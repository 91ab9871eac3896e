package fsmgen.ui;

import fsmgen.FsmGen;
import fsmgen.backend.EmitterKind;
import fsmgen.frontend.FsmSpecException;
import fsmgen.frontend.SpecLoader;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class FsmGenCmd {
  // logging, set up by InitLogging before the first logger is requested
  protected static Logger logger = null;

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = -1;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp(new PrintWriter(System.err, true), helper.getWidth(), "fsmgen -i <fsm.yaml> [-o <rtl.sv>] [-g <graph.dot>] [-t <tb>]",
                     "generate SystemVerilog, Graphviz and testbench sources from a state machine description", options,
                     helper.getLeftPadding(), helper.getDescPadding(), null);
  }

  static Options CreateOptions() {
    Options options = new Options();
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("fsm.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML file describing the state machine")
                          .build());
    options.addOption(
        Option.builder("o").longOpt("rtl").argName("file.sv").hasArg().required(false).desc("Write the SystemVerilog module").build());
    options.addOption(
        Option.builder("g").longOpt("graph").argName("file.dot").hasArg().required(false).desc("Write a Graphviz state diagram").build());
    options.addOption(
        Option.builder("t").longOpt("testbench").argName("file").hasArg().required(false).desc("Write a testbench, see --testbench-kind").build());
    options.addOption(Option.builder("k")
                          .longOpt("testbench-kind")
                          .argName("sv|verilator")
                          .hasArg()
                          .required(false)
                          .desc("Testbench flavour: SystemVerilog random stimulus (sv, default) or Verilator C++ harness (verilator)")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with tool options (signal names, testbench length, ...)")
                          .build());
    options.addOption(Option.builder().longOpt("no-formal").required(false).desc("Omit the `ifdef FORMAL block").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  // entrypoint
  public static void main(String[] args) {
    InitLogging();
    System.exit(run(args));
  }

  /** Console logging with the tool's message layout at level INFO. */
  static void InitLogging() {
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
    // apply logging config, replacing any running configuration, and generate logger for current class
    Configurator.reconfigure(builder.build());
    logger = LogManager.getLogger();
  }

  /** Parses the command line and runs the generation. Returns the process exit status. */
  static int run(String[] args) {
    if (logger == null)
      logger = LogManager.getLogger();
    Options options = CreateOptions();
    // -h must work without the otherwise required -i
    if (args.length == 1 && (args[0].equals("-h") || args[0].equals("--help"))) {
      printHelp(options);
      return EXIT_OK;
    }

    //////////   collect options   //////////
    CommandLine line;
    try {
      line = new DefaultParser().parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return EXIT_USAGE;
    }
    if (line.hasOption("h")) {
      printHelp(options);
      return EXIT_OK;
    }
    if (!line.hasOption("o") && !line.hasOption("g") && !line.hasOption("t")) {
      System.err.println("At least one of --rtl, --graph or --testbench is required");
      printHelp(options);
      return EXIT_USAGE;
    }
    Optional<EmitterKind> testbenchKind = EmitterKind.fromTestbenchName(line.getOptionValue("k", "sv"));
    if (testbenchKind.isEmpty()) {
      System.err.println("Unknown testbench kind '" + line.getOptionValue("k") + "', expected sv or verilator");
      printHelp(options);
      return EXIT_USAGE;
    }
    if (line.hasOption("k") && !line.hasOption("t"))
      logger.warn("--testbench-kind has no effect without --testbench");

    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    //////////   invoke generation   //////////
    try {
      FsmGenConfig cfg = line.hasOption("c") ? SpecLoader.loadConfig(Paths.get(line.getOptionValue("c"))) : new FsmGenConfig();
      if (line.hasOption("no-formal"))
        cfg.formal = false;
      FsmGen generator = new FsmGen(cfg);
      if (line.hasOption("o"))
        generator.AddOutput(EmitterKind.RTL, Paths.get(line.getOptionValue("o")));
      if (line.hasOption("g"))
        generator.AddOutput(EmitterKind.GRAPH, Paths.get(line.getOptionValue("g")));
      if (line.hasOption("t"))
        generator.AddOutput(testbenchKind.get(), Paths.get(line.getOptionValue("t")));
      Path input = Paths.get(line.getOptionValue("i"));
      generator.Generate(input);
      logger.info("Done");
      return EXIT_OK;
    } catch (FsmSpecException e) {
      System.err.println("error: " + e.getMessage());
      logger.debug("Generation failed", e);
      return EXIT_FAILURE;
    }
  }
}
