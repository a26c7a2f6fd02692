package asyncdep.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* Ends the body of a parallel loop. The reduced tokens of all iterations are
* joined into the loop result.
*/
public class ReduceEvent extends Event {

    private final List<Value> operands;

    ReduceEvent(List<Value> operands) {
        super();
        this.operands = new ArrayList<Value>(operands);
    }

    public EventKind getKind() {
        return EventKind.REDUCE;
    }

    public String getName() {
        return "reduce";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.<List<Value>>asList(operands);
    }

    /** Returns the live list of reduced values. */
    public List<Value> getReducedValues() {
        return operands;
    }

}
