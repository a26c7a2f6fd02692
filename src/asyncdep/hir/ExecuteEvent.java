package asyncdep.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* <b>ExecuteEvent</b> bundles a sequence of primitive operations into one
* asynchronous unit of compute. The body holds {@link PrimitiveEvent}s and
* ends with an {@link ExecuteTerminator}; results after the token mirror the
* values yielded by the terminator.
*/
public class ExecuteEvent extends AsyncEvent {

    private final Block body;

    public ExecuteEvent(List<Value> deps) {
        super(deps);
        body = addRegion(new Block());
    }

    public EventKind getKind() {
        return EventKind.EXECUTE;
    }

    public String getName() {
        return "execute";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.<List<Value>>asList(async_deps);
    }

    public Block getBody() {
        return body;
    }

    /**
    * Appends a primitive to the body.
    *
    * @throws IllegalStateException if the body is already terminated.
    */
    public PrimitiveEvent add(PrimitiveEvent primitive) {
        if (getTerminator() != null) {
            throw new IllegalStateException("execute body is terminated");
        }
        return body.add(primitive);
    }

    /**
    * Terminates the body, yielding the specified inner values. A result of
    * the same type is added to this event for each yielded value.
    *
    * @return the results mirroring the yielded values.
    */
    public List<Value> terminate(Value... values) {
        if (getTerminator() != null) {
            throw new IllegalStateException("execute body is terminated");
        }
        body.add(new ExecuteTerminator(Arrays.asList(values)));
        List<Value> ret = new ArrayList<Value>(values.length);
        for (Value v : values) {
            ret.add(addResult(Value.like(v)));
        }
        return ret;
    }

    /** Returns the terminator, or null if the body is not terminated. */
    public ExecuteTerminator getTerminator() {
        Event last = body.getLast();
        return (last instanceof ExecuteTerminator) ?
                (ExecuteTerminator)last : null;
    }

    /**
    * Returns the primitive operations of the body, excluding the
    * terminator.
    */
    public List<PrimitiveEvent> getPrimitives() {
        List<PrimitiveEvent> ret = new ArrayList<PrimitiveEvent>();
        for (Event e : body.getEvents()) {
            if (e instanceof PrimitiveEvent) {
                ret.add((PrimitiveEvent)e);
            }
        }
        return ret;
    }

}
