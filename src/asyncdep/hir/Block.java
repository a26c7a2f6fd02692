package asyncdep.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* <b>Block</b> is an ordered sequence of events. A block is the body of a
* function or one region of a region-holding event.
*/
public class Block implements Traversable {

    private Traversable parent;

    private final List<Event> events;

    public Block() {
        parent = null;
        events = new ArrayList<Event>();
    }

    /**
    * Appends an event at the end of this block.
    *
    * @param event the event being added.
    * @return the added event.
    * @throws IllegalArgumentException if the event already has a parent.
    */
    public <T extends Event> T add(T event) {
        if (event.getParent() != null) {
            throw new IllegalArgumentException(
                    "event already has a parent: " + event.getName());
        }
        events.add(event);
        event.setParent(this);
        return event;
    }

    /**
    * Inserts an event right before the reference event.
    *
    * @throws NotAChildException if the reference is not in this block.
    */
    public <T extends Event> T addBefore(Event ref, T event) {
        int index = indexOf(ref);
        if (index < 0) {
            throw new NotAChildException();
        }
        if (event.getParent() != null) {
            throw new IllegalArgumentException(
                    "event already has a parent: " + event.getName());
        }
        events.add(index, event);
        event.setParent(this);
        return event;
    }

    /** Returns the events of this block; the list is not modifiable. */
    public List<Event> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /** Returns the last event of the block, or null if empty. */
    public Event getLast() {
        return (events.isEmpty()) ? null : events.get(events.size() - 1);
    }

    public int indexOf(Event event) {
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i) == event) {
                return i;
            }
        }
        return -1;
    }

    /**
    * Returns the event owning this block.
    *
    * @return the owning event, or null for a function body.
    */
    public Event getParentEvent() {
        return (parent instanceof Event) ? (Event)parent : null;
    }

    public List<Traversable> getChildren() {
        return Collections.<Traversable>unmodifiableList(events);
    }

    public Traversable getParent() {
        return parent;
    }

    public void removeChild(Traversable child) {
        int index = (child instanceof Event) ? indexOf((Event)child) : -1;
        if (index < 0) {
            throw new NotAChildException();
        }
        events.remove(index);
        child.setParent(null);
    }

    public void setParent(Traversable t) {
        if (t != null && t.getChildren().indexOf(this) < 0) {
            throw new NotAChildException();
        }
        parent = t;
    }

    private int getDepth() {
        int depth = 0;
        for (Traversable t = parent; t != null; t = t.getParent()) {
            if (t instanceof Block) {
                depth++;
            }
        }
        return depth;
    }

    public void print(PrintWriter o) {
        StringBuilder indent = new StringBuilder();
        for (int i = 0; i < getDepth(); i++) {
            indent.append("  ");
        }
        o.println("{");
        for (Event event : events) {
            o.print(indent);
            o.print("  ");
            event.print(o);
            o.println();
        }
        o.print(indent);
        o.print("}");
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
