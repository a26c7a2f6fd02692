package asyncdep.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Arrays;
import java.util.List;

/**
* <b>ParallelLoopEvent</b> is a multi-dimensional loop whose iterations may
* run concurrently. The initial values are visible inside the body as they
* are; the terminating {@link ReduceEvent} joins the tokens of all iterations
* into the loop results.
*/
public class ParallelLoopEvent extends Event {

    private final List<Value> lower_bounds;

    private final List<Value> upper_bounds;

    private final List<Value> steps;

    private final List<Value> init_vals;

    private final List<Value> induction_vars;

    private final Block body;

    public ParallelLoopEvent(List<Value> lower_bounds, List<Value> upper_bounds,
            List<Value> steps, List<Value> init_vals) {
        super();
        if (lower_bounds.size() != upper_bounds.size()
                || lower_bounds.size() != steps.size()) {
            throw new IllegalArgumentException("mismatched loop bounds");
        }
        this.lower_bounds = new ArrayList<Value>(lower_bounds);
        this.upper_bounds = new ArrayList<Value>(upper_bounds);
        this.steps = new ArrayList<Value>(steps);
        this.init_vals = new ArrayList<Value>(init_vals);
        body = addRegion(new Block());
        induction_vars = new ArrayList<Value>(lower_bounds.size());
        for (int i = 0; i < lower_bounds.size(); i++) {
            Value iv = Value.index();
            iv.setOwner(this, i);
            induction_vars.add(iv);
        }
        for (Value init : init_vals) {
            addResult(Value.like(init));
        }
    }

    public EventKind getKind() {
        return EventKind.PARALLEL_LOOP;
    }

    public String getName() {
        return "parallel";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.asList(lower_bounds, upper_bounds, steps, init_vals);
    }

    public Block getBody() {
        return body;
    }

    public List<Value> getInductionVars() {
        return Collections.unmodifiableList(induction_vars);
    }

    /** Returns the live list of initial values. */
    public List<Value> getInitVals() {
        return init_vals;
    }

    /** Terminates the body, reducing the specified values. */
    public ReduceEvent terminate(Value... values) {
        if (getReduce() != null) {
            throw new IllegalStateException("loop body is terminated");
        }
        return body.add(new ReduceEvent(Arrays.asList(values)));
    }

    /** Returns the terminator, or null if the body is not terminated. */
    public ReduceEvent getReduce() {
        Event last = body.getLast();
        return (last instanceof ReduceEvent) ? (ReduceEvent)last : null;
    }

}
