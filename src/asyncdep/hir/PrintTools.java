package asyncdep.hir;

import asyncdep.exec.Driver;

/**
* <b>PrintTools</b> provides verbosity-controlled printing of status and
* debug messages. The verbosity is taken from the <b>verbosity</b> option of
* the {@link Driver}.
*/
public final class PrintTools {

    // Short names for system properties
    public static final String line_sep = System.getProperty("line.separator");
    public static final String file_sep = System.getProperty("file.separator");

    private PrintTools() {
    }

    /**
    * Returns the global verbosity level, 0 if the option is not set.
    */
    public static int getVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            System.err.println("ignoring malformed verbosity " + value);
            Driver.setOptionValue("verbosity", "0");
            return 0;
        }
    }

    /**
    * Prints a string to System.err if the
    * verbosity level is greater than min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void printlnStatus(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.err.println(message);
        }
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is greater than {@code min_verbosity}.
    * The string is composed only if the verbosity level is met.
    * @param min_verbosity the minium verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= getVerbosity()) {
            if (items.length > 0) {
                StringBuilder sb = new StringBuilder(80);
                sb.append(items[0]);
                for (int i = 1; i < items.length; i++) {
                    sb.append(" ").append(items[i]);
                }
                System.err.println(sb.toString());
            }
        }
    }

    /**
    * Prints a string to System.out if the
    * verbosity level is greater than min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void println(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.out.println(message);
        }
    }

    /**
    * Prints a warning message to System.err if the verbosity level is
    * greater than min_verbosity.
    */
    public static void printlnWarning(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.err.println("[WARNING] " + message);
        }
    }

}
