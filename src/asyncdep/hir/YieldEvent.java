package asyncdep.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* Ends the body of a for loop or a branch of a conditional event. For a loop,
* the yielded values become the next iteration arguments and finally the loop
* results; for a conditional, they become the conditional results.
*/
public class YieldEvent extends Event {

    private final List<Value> operands;

    YieldEvent(List<Value> operands) {
        super();
        this.operands = new ArrayList<Value>(operands);
    }

    public EventKind getKind() {
        return EventKind.YIELD;
    }

    public String getName() {
        return "yield";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.<List<Value>>asList(operands);
    }

    /** Returns the live list of yielded values. */
    public List<Value> getYieldedValues() {
        return operands;
    }

}
