package ipxgen.ui;

import ipxgen.IpxactExporter;
import ipxgen.Standard;
import ipxgen.rdl.RdlFatalException;
import ipxgen.rdl.RdlFormatException;
import ipxgen.rdl.RdlYamlReader;
import ipxgen.rdl.RootNode;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class IpxactCmd {
  // logging
  protected static Logger logger = null;

  public static final int EXIT_OK = 0;
  public static final int EXIT_EXPORT_FAILED = 1;
  public static final int EXIT_USAGE = -1;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("ipxgen - export a YAML register description as IP-XACT", options);
  };

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("model.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML file describing the register model")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file.xml")
                          .hasArg()
                          .required(false)
                          .desc("IP-XACT file to generate; defaults to <component name>.xml")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with exporter options (vendor, library, version, standard, xml_indent, xml_newline)")
                          .build());
    options.addOption(Option.builder("n")
                          .longOpt("name")
                          .argName("component")
                          .hasArg()
                          .required(false)
                          .desc("IP-XACT component name; defaults to the top-level node name")
                          .build());
    options.addOption(Option.builder("s")
                          .longOpt("standard")
                          .argName("year")
                          .hasArg()
                          .required(false)
                          .desc("IP-XACT standard: 2009 or 2014 (default); overrides the config file")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  // entrypoint
  public static void main(String[] args) {
    initLogging();
    System.exit(run(args));
  }

  static void initLogging() {
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
  }

  /**
   * Runs the command line tool.
   * @return process exit code
   */
  static int run(String[] args) {
    logger = LogManager.getLogger();
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String inputFile;
    String outputFile;
    String configFile;
    String componentName;
    String standardName;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp(options);
        return EXIT_USAGE;
      }

      inputFile = line.getOptionValue("i");
      outputFile = line.getOptionValue("o");
      configFile = line.getOptionValue("c");
      componentName = line.getOptionValue("n");
      standardName = line.getOptionValue("s");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return EXIT_USAGE;
    }

    //////////   build exporter configuration   //////////
    IpxactConfig cfg;
    try {
      cfg = (configFile != null) ? IpxactConfig.fromYaml(new File(configFile)) : new IpxactConfig();
      if (standardName != null) {
        cfg.standard = Standard.fromSerialName(standardName)
                           .orElseThrow(() -> new IllegalArgumentException("Unknown IP-XACT standard '" + standardName + "'"));
      }
    } catch (IOException e) {
      logger.error("Config file {} could not be read: {}", configFile, e.getMessage());
      return EXIT_USAGE;
    } catch (IllegalArgumentException e) {
      logger.error(e.getMessage());
      return EXIT_USAGE;
    }

    //////////   read register model   //////////
    RootNode root;
    try {
      root = new RdlYamlReader().read(new File(inputFile));
    } catch (IOException e) {
      logger.error("Register description {} could not be read: {}", inputFile, e.getMessage());
      return EXIT_USAGE;
    } catch (RdlFormatException e) {
      logger.error(e.getMessage());
      return EXIT_EXPORT_FAILED;
    }

    //////////   export   //////////
    HashMap<String, Object> exportOptions = new HashMap<>();
    if (componentName != null)
      exportOptions.put(IpxactExporter.OPT_COMPONENT_NAME, componentName);
    String outName = (outputFile != null) ? outputFile
                                          : ((componentName != null) ? componentName : root.getTop().getInstName()) + ".xml";
    try {
      new IpxactExporter(cfg).export(root, Path.of(outName), exportOptions);
    } catch (RdlFatalException e) {
      logger.fatal("Export aborted, no output written.");
      return EXIT_EXPORT_FAILED;
    } catch (IOException e) {
      logger.fatal("Error writing file " + outName + ": " + e.getMessage());
      return EXIT_EXPORT_FAILED;
    }
    return EXIT_OK;
  }
}
