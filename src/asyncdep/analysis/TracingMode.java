package asyncdep.analysis;

/**
* Modes of the buffer access tracing. RAW looks for earlier writers of the
* traced region, WAW/WAR for any earlier access, READ for earlier readers.
*/
public enum TracingMode {

    READ('r'),
    RAW('w'),
    WAW_WAR('n');

    private final char code;

    TracingMode(char code) {
        this.code = code;
    }

    /**
    * Returns the access character compared against the classification of a
    * hierarchy argument: 'r', 'w', or 'n' for any access.
    */
    public char getCode() {
        return code;
    }

    /**
    * Parses the external mode names "RAW" and "WAW/WAR".
    *
    * @throws InternalError for any other name.
    */
    public static TracingMode fromString(String mode) {
        if ("RAW".equals(mode)) {
            return RAW;
        }
        if ("WAW/WAR".equals(mode)) {
            return WAW_WAR;
        }
        throw new InternalError("Unknown dependency type " + mode);
    }

}
