package asyncdep.analysis;

import asyncdep.hir.Event;
import asyncdep.hir.Value;

import java.util.Collections;
import java.util.List;

/**
* Result of tracing the index operands of an event back to the loop
* induction variables, loop iteration arguments and hierarchy ids they
* derive from.
*/
public class InductionTrace {

    private final List<Value> sources;

    private final List<Event> history;

    public InductionTrace(List<Value> sources, List<Event> history) {
        this.sources = sources;
        this.history = history;
    }

    /** Returns the induction variables, iteration arguments and ids found. */
    public List<Value> getSources() {
        return Collections.unmodifiableList(sources);
    }

    /** Returns the producing events walked through, in visiting order. */
    public List<Event> getHistory() {
        return Collections.unmodifiableList(history);
    }

}
