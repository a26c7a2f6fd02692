package asyncdep.exec;

import asyncdep.analysis.AnalysisPass;
import asyncdep.analysis.DependencyGraphAnalysis;
import asyncdep.hir.PrintTools;
import asyncdep.hir.Program;
import asyncdep.hir.Tools;
import asyncdep.transforms.DependencyCanonicalizer;
import asyncdep.transforms.TraceDependencies;
import asyncdep.transforms.TransformPass;

import java.io.*;
import java.util.HashSet;
import java.util.Set;

/**
 * Implements the option parser and controls pass ordering. The program
 * being processed is built by the caller and handed to
 * {@link #run(String[], Program)}. Users may extend this class by overriding
 * runPasses.
 */
public class Driver
{
  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  static {
    registerOptions();
  }

  /** The program being processed. */
  protected Program program;

  public Driver()
  {
  }

  /**
   * Register default legal set of options and default values for Driver.
   * Only registered options can have values set.
   */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.UTILITY, "outdir", "asyncdep_output", "dirname",
                "Set the output directory name for graph dumps (default is asyncdep_output)");
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "version",
                "Print the version information");
    options.add(options.UTILITY, "dump-options",
                "Create file options.asyncdep with default options");
    options.add(options.UTILITY, "load-options",
                "Load options from file options.asyncdep");
    options.add(options.UTILITY, "skip-functions", "func1,func2,...",
                "Skip the given functions in every pass");
    options.add(options.ANALYSIS, "dump-graphs",
                "Write the dependency graph of every level in dot format, before and after reduction");
    options.add(options.ANALYSIS, "dump-flat-graph",
                "Write the reduced dependency graphs of all levels into a single graph.dot");
    options.add(options.TRANSFORM, "trace-deps",
                "Add the dependencies inferred from buffer accesses before canonicalization");
    options.add(options.TRANSFORM, "canonicalize", "1", "N",
                "Rewrite every dependency list to the transitive reduction of the dependency graph (0 disables)");
  }

  /**
   * Returns the value of the given key or null if the value is not set.
   * Key values are set on the command line as <b>-option_name=value</b>.
   *
   * @param key The key to search
   * @return the value of the given key or null if the
   *   value is not set.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Sets the value of the option represented by <i>key</i> to
   * <i>value</i>.
   *
   * @param key The option name.
   * @param value The option value.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  /**
   * Restores the default value of every option.
   */
  public static void resetOptions()
  {
    options.reset();
  }

  /**
   * Returns the set of function names that should be excluded from the
   * passes, given as a comma-separated list by the skip-functions option.
   */
  public static Set<String> getSkipFunctionSet()
  {
    Set<String> skip_set = new HashSet<String>();

    String s = getOptionValue("skip-functions");
    if (s != null) {
      for (String name : s.split(",")) {
        if (name.trim().length() > 0)
          skip_set.add(name.trim());
      }
    }

    return skip_set;
  }

  /**
   * Checks if the option is set to a value other than "0".
   */
  public static boolean isEnabled(String key)
  {
    String value = getOptionValue(key);
    return value != null && !value.trim().equals("0");
  }

  protected void parseOption(String opt)
  {
    opt = opt.trim();
    // empty line
    if (opt.length() < 2)
      return;
    int eq = opt.indexOf('=');

    if (eq == -1) {
      if (options.contains(opt))
        setOptionValue(opt, "1");
      else
        System.err.println("ignoring unrecognized option " + opt);
    } else {
      String option_name = opt.substring(0, eq);

      if (options.contains(option_name))
        setOptionValue(option_name, opt.substring(eq + 1));
      else
        System.err.println("ignoring unrecognized option " + option_name);
    }
  }

  /**
   * Parses command line options.
   *
   * @param args The option strings, each starting with "-".
   */
  protected void parseCommandLine(String[] args)
  {
    for (int i = 0; i < args.length; ++i) {
      String opt = args[i];
      if (opt.length() < 2 || opt.charAt(0) != '-') {
        System.err.println("ignoring argument " + opt);
        continue;
      }

      parseOption(opt.substring(1));

      if (getOptionValue("help") != null) {
        setOptionValue("help", null);
        printUsage();
        Tools.exit(0);
      }

      if (getOptionValue("version") != null) {
        setOptionValue("version", null);
        printVersion();
        Tools.exit(0);
      }

      if (getOptionValue("dump-options") != null) {
        setOptionValue("dump-options", null);
        dumpOptionsFile(new File("options.asyncdep"));
        Tools.exit(0);
      }

      // load options file and then proceed with rest
      // of command line options
      if (getOptionValue("load-options") != null) {
        setOptionValue("load-options", null);
        loadOptionsFile(new File("options.asyncdep"));
        // prevent reentering this handler
        setOptionValue("load-options", null);
      }
    }
  }

  /**
   * Prints the list of options that the driver accepts.
   */
  public void printUsage()
  {
    String usage = "\nasyncdep.exec.Driver [option]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  public void printVersion()
  {
    System.err.println("asyncdep 1.0 - dependency canonicalization for"
        + " token-synchronized async programs");
  }

  /**
   * Writes the default options to the given file unless it already exists.
   */
  public void dumpOptionsFile(File options_file)
  {
    try {
      if (options_file.createNewFile()) {
        PrintStream ps = new PrintStream(new FileOutputStream(options_file));
        ps.println(options.dumpOptions().trim());
        ps.close();
      }
    } catch (IOException e) {
      System.err.println("Error: Failed to dump " + options_file + ": " + e);
    }
  }

  /**
   * Loads option lines from the given file. Lines starting with "#" are
   * comments.
   */
  public void loadOptionsFile(File options_file)
  {
    if (!options_file.exists()) {
      System.err.println("Error: Failed to load " + options_file);
      System.err.println("Use option -dump-options to create "
          + options_file.getName() + " with default values");
      Tools.exit(1);
      return;
    }
    try {
      BufferedReader br = new BufferedReader(new FileReader(options_file));
      try {
        String line;
        while ((line = br.readLine()) != null) {
          if (line.startsWith("#"))
            continue;
          parseOption(line);
        }
      } finally {
        br.close();
      }
    } catch (IOException e) {
      System.err.println("Error while loading options file: " + e);
      Tools.exit(1);
    }
  }

  /**
   * Runs this driver on the given program with args as the command line.
   *
   * @param args The command line options.
   * @param program The program to process; it is rewritten in place.
   */
  public void run(String[] args, Program program)
  {
    parseCommandLine(args);

    this.program = program;

    runPasses();

    PrintTools.printlnStatus("Printing...", 2);
    PrintTools.printlnStatus(program.toString(), 2);
  }

  /**
   * Runs the dependency passes on the program.
   */
  public void runPasses()
  {
    if (isEnabled("trace-deps"))
      TransformPass.run(new TraceDependencies(program));

    if (isEnabled("canonicalize"))
      TransformPass.run(new DependencyCanonicalizer(program));
    else if (isEnabled("dump-graphs") || isEnabled("dump-flat-graph"))
      AnalysisPass.run(new DependencyGraphAnalysis(program));
  }
}
