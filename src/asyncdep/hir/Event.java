package asyncdep.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* <b>Event</b> is the base class of every operation in the program model. An
* event lives in a {@link Block}, produces a list of result values and may
* hold nested blocks (regions). Operands are grouped in operand lists owned
* by the subclasses; the lists returned by {@link #getOperandLists()} are the
* live storage, so rewriting them rewrites the program.
*/
public abstract class Event implements Traversable {

    /** The block containing this event. */
    private Block parent;

    /** Nested regions, in order. */
    private final List<Block> regions;

    /** Produced values, in order. */
    private final List<Value> results;

    /** The id tag written by the dependency analysis. */
    private Integer id;

    protected Event() {
        parent = null;
        regions = new ArrayList<Block>(1);
        results = new ArrayList<Value>(1);
        id = null;
    }

    /** Returns the kind of this event. */
    public abstract EventKind getKind();

    /** Returns the operation name used when printing this event. */
    public abstract String getName();

    /**
    * Returns the live operand lists of this event. The order of the lists is
    * fixed for each event class.
    */
    public abstract List<List<Value>> getOperandLists();

    /**
    * Returns all operands of this event in a new list.
    */
    public List<Value> getOperands() {
        List<Value> ret = new ArrayList<Value>();
        for (List<Value> operands : getOperandLists()) {
            ret.addAll(operands);
        }
        return ret;
    }

    /**
    * Checks if the specified value is an operand of this event.
    */
    public boolean uses(Value v) {
        for (List<Value> operands : getOperandLists()) {
            for (Value operand : operands) {
                if (operand == v) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
    * Replaces every occurrence of <var>from</var> in the operand lists of
    * this event with <var>to</var>.
    *
    * @return the number of replaced occurrences.
    */
    public int replaceUsesOfWith(Value from, Value to) {
        int count = 0;
        for (List<Value> operands : getOperandLists()) {
            for (int i = 0; i < operands.size(); i++) {
                if (operands.get(i) == from) {
                    operands.set(i, to);
                    count++;
                }
            }
        }
        return count;
    }

    protected Value addResult(Value v) {
        v.setDefiningEvent(this, results.size());
        results.add(v);
        return v;
    }

    protected Block addRegion(Block region) {
        if (region.getParent() != null) {
            throw new IllegalArgumentException("region already has a parent");
        }
        regions.add(region);
        region.setParent(this);
        return region;
    }

    /** Returns the results of this event; the list is not modifiable. */
    public List<Value> getResults() {
        return Collections.unmodifiableList(results);
    }

    public Value getResult(int i) {
        return results.get(i);
    }

    /** Returns the regions of this event; the list is not modifiable. */
    public List<Block> getRegions() {
        return Collections.unmodifiableList(regions);
    }

    public Integer getId() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public void removeId() {
        id = null;
    }

    public boolean hasId() {
        return id != null;
    }

    /** Returns the block containing this event. */
    public Block getBlock() {
        return parent;
    }

    /**
    * Returns the event owning the block that contains this event.
    *
    * @return the parent event, or null at the function level.
    */
    public Event getParentEvent() {
        if (parent == null || !(parent.getParent() instanceof Event)) {
            return null;
        }
        return (Event)parent.getParent();
    }

    /**
    * Returns the closest enclosing event that is an instance of the specified
    * class.
    *
    * @param c the class of the enclosing event.
    * @return the enclosing event, or null if there is none.
    */
    @SuppressWarnings("unchecked")
    public <T extends Event> T getParentOfType(Class<T> c) {
        Event e = getParentEvent();
        while (e != null) {
            if (c.isInstance(e)) {
                return (T)e;
            }
            e = e.getParentEvent();
        }
        return null;
    }

    /**
    * Checks if this event is a (transitive) ancestor of the specified one.
    */
    public boolean isProperAncestor(Event other) {
        Event e = other.getParentEvent();
        while (e != null) {
            if (e == this) {
                return true;
            }
            e = e.getParentEvent();
        }
        return false;
    }

    /**
    * Checks if this event comes before the other event in the same block.
    *
    * @throws IllegalArgumentException if the events are in different blocks.
    */
    public boolean isBeforeInBlock(Event other) {
        if (parent == null || parent != other.parent) {
            throw new IllegalArgumentException(
                    "events are not in the same block");
        }
        return parent.indexOf(this) < parent.indexOf(other);
    }

    /** Returns the function enclosing this event, or null if detached. */
    public Function getFunction() {
        Traversable t = parent;
        while (t != null && !(t instanceof Function)) {
            t = t.getParent();
        }
        return (Function)t;
    }

    /**
    * Removes this event from its block. Uses of its results are not
    * rewritten.
    */
    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
        }
    }

    public List<Traversable> getChildren() {
        return Collections.<Traversable>unmodifiableList(regions);
    }

    public Traversable getParent() {
        return parent;
    }

    public void removeChild(Traversable child) {
        if (!regions.contains(child)) {
            throw new NotAChildException();
        }
        throw new UnsupportedOperationException(
                "regions of " + getName() + " cannot be removed");
    }

    public void setParent(Traversable t) {
        if (t == null) {
            parent = null;
            return;
        }
        if (!(t instanceof Block)) {
            throw new IllegalArgumentException("event parent must be a block");
        }
        if (((Block)t).indexOf(this) < 0) {
            throw new NotAChildException();
        }
        parent = (Block)t;
    }

    /**
    * Prints the attributes following the operand lists, if any.
    */
    protected void printAttributes(PrintWriter o) {
    }

    public void print(PrintWriter o) {
        if (!results.isEmpty()) {
            for (int i = 0; i < results.size(); i++) {
                if (i > 0) {
                    o.print(", ");
                }
                results.get(i).print(o);
            }
            o.print(" = ");
        }
        o.print(getName());
        for (List<Value> operands : getOperandLists()) {
            o.print(" (");
            for (int i = 0; i < operands.size(); i++) {
                if (i > 0) {
                    o.print(", ");
                }
                operands.get(i).print(o);
            }
            o.print(")");
        }
        printAttributes(o);
        if (id != null) {
            o.print(" {id = " + id + "}");
        }
        for (Block region : regions) {
            o.print(" ");
            region.print(o);
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
