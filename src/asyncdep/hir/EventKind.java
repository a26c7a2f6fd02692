package asyncdep.hir;

/**
* The closed set of event kinds the program model supports. Every consumer
* that dispatches on the kind of an event switches over this enumeration.
*/
public enum EventKind {
    DMA,
    CHANNEL_PUT,
    CHANNEL_GET,
    EXECUTE,
    PRIMITIVE,
    EXECUTE_TERMINATOR,
    WAIT_ALL,
    FOR_LOOP,
    PARALLEL_LOOP,
    YIELD,
    REDUCE,
    CONDITIONAL,
    HIERARCHY,
    HIERARCHY_TERMINATOR,
    SCALAR
}
