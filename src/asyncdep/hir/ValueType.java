package asyncdep.hir;

/**
* The closed set of value types carried by the program model.
*/
public enum ValueType {
    /** A single-shot completion handle. */
    ASYNC_TOKEN,
    /** A memory buffer with a rank and a memory space. */
    BUFFER,
    /** An index or other scalar integer. */
    INDEX
}
