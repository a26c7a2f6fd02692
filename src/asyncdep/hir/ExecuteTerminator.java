package asyncdep.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Ends the body of an execute event and yields its values. */
public class ExecuteTerminator extends Event {

    private final List<Value> operands;

    ExecuteTerminator(List<Value> operands) {
        super();
        this.operands = new ArrayList<Value>(operands);
    }

    public EventKind getKind() {
        return EventKind.EXECUTE_TERMINATOR;
    }

    public String getName() {
        return "execute_terminator";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.<List<Value>>asList(operands);
    }

    public List<Value> getYieldedValues() {
        return Collections.unmodifiableList(operands);
    }

}
