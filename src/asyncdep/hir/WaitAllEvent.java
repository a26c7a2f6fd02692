package asyncdep.hir;

import java.util.Arrays;
import java.util.List;

/** Joins a set of tokens into a single token. */
public class WaitAllEvent extends AsyncEvent {

    public WaitAllEvent(List<Value> deps) {
        super(deps);
    }

    public EventKind getKind() {
        return EventKind.WAIT_ALL;
    }

    public String getName() {
        return "wait_all";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.<List<Value>>asList(async_deps);
    }

}
