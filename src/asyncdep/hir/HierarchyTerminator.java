package asyncdep.hir;

import java.util.Collections;
import java.util.List;

/** Ends the body of a hierarchy event. */
public class HierarchyTerminator extends Event {

    HierarchyTerminator() {
        super();
    }

    public EventKind getKind() {
        return EventKind.HIERARCHY_TERMINATOR;
    }

    public String getName() {
        HierarchyEvent parent = (HierarchyEvent)getParentEvent();
        if (parent == null) {
            return "hierarchy_terminator";
        }
        return parent.getLevel().getName() + "_terminator";
    }

    public List<List<Value>> getOperandLists() {
        return Collections.emptyList();
    }

}
