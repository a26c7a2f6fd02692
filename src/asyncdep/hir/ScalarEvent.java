package asyncdep.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* A synchronous scalar operation producing one index value: a constant or
* index arithmetic outside of execute events.
*/
public class ScalarEvent extends Event {

    public enum ScalarKind {
        CONSTANT, ADDI, MULI, APPLY
    }

    private final ScalarKind scalar_kind;

    private final long constant;

    private final List<Value> operands;

    private ScalarEvent(ScalarKind kind, long constant, List<Value> operands) {
        super();
        this.scalar_kind = kind;
        this.constant = constant;
        this.operands = new ArrayList<Value>(operands);
        addResult(Value.index());
    }

    public static ScalarEvent constant(long value) {
        return new ScalarEvent(ScalarKind.CONSTANT, value,
                Collections.<Value>emptyList());
    }

    public static ScalarEvent addi(Value lhs, Value rhs) {
        return new ScalarEvent(ScalarKind.ADDI, 0, Arrays.asList(lhs, rhs));
    }

    public static ScalarEvent muli(Value lhs, Value rhs) {
        return new ScalarEvent(ScalarKind.MULI, 0, Arrays.asList(lhs, rhs));
    }

    public static ScalarEvent apply(List<Value> operands) {
        return new ScalarEvent(ScalarKind.APPLY, 0, operands);
    }

    public ScalarKind getScalarKind() {
        return scalar_kind;
    }

    /** Returns the value of a constant; 0 for other scalar kinds. */
    public long getConstant() {
        return constant;
    }

    public Value getValue() {
        return getResult(0);
    }

    public EventKind getKind() {
        return EventKind.SCALAR;
    }

    public String getName() {
        return scalar_kind.name().toLowerCase();
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.<List<Value>>asList(operands);
    }

    @Override
    protected void printAttributes(PrintWriter o) {
        if (scalar_kind == ScalarKind.CONSTANT) {
            o.print(" " + constant);
        }
    }

}
