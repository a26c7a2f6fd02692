package asyncdep.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* <b>ForLoopEvent</b> is a sequential loop. Loop-carried values enter through
* the iteration operands, are visible in the body as region iteration
* arguments, are passed to the next iteration by the terminating
* {@link YieldEvent} and leave the loop as its results. A loop-carried token
* threads the iterations one after another.
*/
public class ForLoopEvent extends Event {

    private final List<Value> bounds;

    private final List<Value> iter_operands;

    private final Value induction_var;

    private final List<Value> region_iter_args;

    private final Block body;

    /**
    * Constructs a loop from <var>lb</var> to <var>ub</var> with the given
    * step, carrying the specified iteration operands.
    */
    public ForLoopEvent(Value lb, Value ub, Value step,
            List<Value> iter_operands) {
        super();
        this.bounds = new ArrayList<Value>(Arrays.asList(lb, ub, step));
        this.iter_operands = new ArrayList<Value>(iter_operands);
        body = addRegion(new Block());
        induction_var = Value.index();
        induction_var.setOwner(this, 0);
        region_iter_args = new ArrayList<Value>(iter_operands.size());
        for (Value operand : iter_operands) {
            Value arg = Value.like(operand);
            arg.setOwner(this, region_iter_args.size() + 1);
            region_iter_args.add(arg);
            addResult(Value.like(operand));
        }
    }

    public EventKind getKind() {
        return EventKind.FOR_LOOP;
    }

    public String getName() {
        return "for";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.asList(bounds, iter_operands);
    }

    public Block getBody() {
        return body;
    }

    public Value getInductionVar() {
        return induction_var;
    }

    /** Returns the live list of iteration operands. */
    public List<Value> getIterOperands() {
        return iter_operands;
    }

    public List<Value> getRegionIterArgs() {
        return Collections.unmodifiableList(region_iter_args);
    }

    /**
    * Terminates the body, yielding the values carried to the next
    * iteration.
    */
    public YieldEvent terminate(Value... values) {
        if (getYield() != null) {
            throw new IllegalStateException("loop body is terminated");
        }
        if (values.length != region_iter_args.size()) {
            throw new IllegalArgumentException("loop yields " + values.length
                    + " values but carries " + region_iter_args.size());
        }
        return body.add(new YieldEvent(Arrays.asList(values)));
    }

    /** Returns the terminator, or null if the body is not terminated. */
    public YieldEvent getYield() {
        Event last = body.getLast();
        return (last instanceof YieldEvent) ? (YieldEvent)last : null;
    }

}
