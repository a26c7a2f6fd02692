package asyncdep.analysis;

import asyncdep.hir.Event;

/**
* Types of the vertices of a {@link ScopeGraph}. Each type draws its ids from
* an id category; DMA and channel vertices share one category, and so do the
* two terminator types.
*/
public enum VertexType {

    START("start", null),
    DMA("dma", "dma"),
    CHANNEL("channel", "dma"),
    EXECUTE("execute", "execute"),
    WAIT_ALL("wait_all", "wait_all"),
    FOR_LOOP("for_loop", "for_loop"),
    PARALLEL_LOOP("parallel_loop", "parallel_loop"),
    HIERARCHY("hierarchy", "hierarchy"),
    HIERARCHY_TERMINATOR("hierarchy_terminator", "terminator"),
    TERMINATOR("terminator", "terminator");

    private final String name;

    private final String id_category;

    VertexType(String name, String id_category) {
        this.name = name;
        this.id_category = id_category;
    }

    public String getName() {
        return name;
    }

    /** Returns the name of the id counter used by this type. */
    public String getIdCategory() {
        return id_category;
    }

    /**
    * Returns the type of the vertex representing the specified event, or
    * null if the event kind is never represented. An execute event maps to
    * {@link #EXECUTE} although its vertices are those of its body.
    */
    public static VertexType forEvent(Event e) {
        switch (e.getKind()) {
        case DMA:
            return DMA;
        case CHANNEL_PUT:
        case CHANNEL_GET:
            return CHANNEL;
        case EXECUTE:
        case PRIMITIVE:
        case EXECUTE_TERMINATOR:
            return EXECUTE;
        case WAIT_ALL:
            return WAIT_ALL;
        case FOR_LOOP:
            return FOR_LOOP;
        case PARALLEL_LOOP:
            return PARALLEL_LOOP;
        case HIERARCHY:
            return HIERARCHY;
        case HIERARCHY_TERMINATOR:
            return HIERARCHY_TERMINATOR;
        case YIELD:
        case REDUCE:
            return TERMINATOR;
        default:
            return null;
        }
    }

    @Override
    public String toString() {
        return name;
    }

}
