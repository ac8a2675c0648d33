package logsim.ui;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import logsim.LogSim;
import logsim.devices.Signal;
import logsim.frontend.Diagnostic;
import logsim.sim.OscillationException;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class LogSimCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("logsim - load a logic circuit definition and simulate it", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout carries the traces
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stderr")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    options.addOption(Option.builder("f")
                          .longOpt("file")
                          .argName("definition file")
                          .hasArg()
                          .required(true)
                          .desc("Circuit definition file to load")
                          .build());
    options.addOption(Option.builder("n")
                          .longOpt("cycles")
                          .argName("count")
                          .hasArg()
                          .required(false)
                          .desc("Number of ticks to run; default_cycles from the config by default")
                          .build());
    options.addOption(Option.builder("s")
                          .longOpt("switch")
                          .argName("NAME=0|1")
                          .hasArg()
                          .required(false)
                          .desc("Set a switch before running; may be repeated")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with simulator options")
                          .build());
    options.addOption(Option.builder("i").longOpt("interactive").required(false).desc("Start the command shell instead of running").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    CommandLineParser parser = new DefaultParser();
    CommandLine line = null;
    LogSimConfig cfg = new LogSimConfig();
    int cycles = 0;
    try {
      line = parser.parse(options, args);

      if (line.hasOption("h"))
        printHelpAndExit(options);

      // set verbosity of printing
      Level logLvl = Level.WARN;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.INFO;
      if (line.hasOption("vv"))
        logLvl = Level.DEBUG;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      if (line.hasOption("c"))
        cfg = LogSimConfig.load(Path.of(line.getOptionValue("c")));
      cycles = line.hasOption("n") ? Integer.parseInt(line.getOptionValue("n")) : cfg.default_cycles;
      if (cycles < 0)
        throw new ParseException("Number of cycles must not be negative");
    } catch (ParseException | NumberFormatException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    } catch (IOException | RuntimeException e) {
      System.err.println("Invalid config: " + e.getMessage());
      printHelpAndExit(options);
    }

    //////////   load the definition   //////////
    LogSim sim = new LogSim(cfg);
    try {
      List<Diagnostic> diagnostics = sim.load(Path.of(line.getOptionValue("f")));
      if (!diagnostics.isEmpty()) {
        sim.renderDiagnostics().forEach(System.err::println);
        System.err.println(diagnostics.size() + " error(s) found, nothing simulated");
        System.exit(1);
      }
    } catch (IOException e) {
      System.err.println("Cannot read definition file: " + e.getMessage());
      System.exit(1);
    }

    if (line.hasOption("s")) {
      for (String setting : line.getOptionValues("s")) {
        String[] parts = setting.split("=", 2);
        try {
          if (parts.length != 2)
            throw new IllegalArgumentException("Expected NAME=0|1, got '" + setting + "'");
          sim.setSwitch(parts[0].trim(), Signal.fromBit(Integer.parseInt(parts[1].trim())));
        } catch (IllegalArgumentException e) {
          System.err.println(e.getMessage());
          printHelpAndExit(options);
        }
      }
    }

    //////////   simulate   //////////
    if (line.hasOption("i")) {
      try {
        new UserInterface(sim, System.out).commandLoop(new InputStreamReader(System.in, StandardCharsets.UTF_8));
      } catch (IOException e) {
        logger.error("Reading commands failed", e);
        System.exit(1);
      }
      System.exit(0);
    }

    boolean success = true;
    try {
      sim.step(cycles);
    } catch (OscillationException e) {
      System.err.println(e.getMessage());
      success = false;
    }
    TraceFormatter.formatAll(sim.getMonitors()).forEach(System.out::println);
    System.exit(success ? 0 : 1);
  }
}
