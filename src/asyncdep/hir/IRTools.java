package asyncdep.hir;

import java.util.ArrayList;
import java.util.List;

/**
* <b>IRTools</b> provides tools that find and rewrite uses of values in the
* program tree.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Returns the events under the specified root that use the value, in
    * depth-first order. An event using the value twice is listed once.
    *
    * @param root the subtree being searched.
    * @param v the used value.
    * @return the list of using events.
    */
    public static List<Event> getUses(Traversable root, Value v) {
        List<Event> ret = new ArrayList<Event>();
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(root);
        while (iter.hasNext()) {
            Traversable t = iter.next();
            if (t instanceof Event && ((Event)t).uses(v)) {
                ret.add((Event)t);
            }
        }
        return ret;
    }

    /**
    * Returns the uses of the value in the function enclosing its producer or
    * owner.
    */
    public static List<Event> getUses(Value v) {
        Traversable scope = getScope(v);
        if (scope == null) {
            return new ArrayList<Event>();
        }
        return getUses(scope, v);
    }

    /**
    * Checks if the value has any use in the function enclosing it.
    */
    public static boolean hasUses(Value v) {
        return !getUses(v).isEmpty();
    }

    /**
    * Returns the function in which the value is visible, or null if its
    * producer is detached.
    */
    public static Traversable getScope(Value v) {
        if (v.getDefiningEvent() != null) {
            return v.getDefiningEvent().getFunction();
        }
        Traversable owner = v.getOwner();
        if (owner instanceof Function) {
            return owner;
        }
        if (owner instanceof Event) {
            return ((Event)owner).getFunction();
        }
        return null;
    }

    /**
    * Replaces every use of <var>from</var> under the root with
    * <var>to</var>.
    *
    * @return the number of replaced occurrences.
    */
    public static int replaceAllUsesWith(Traversable root, Value from,
            Value to) {
        int count = 0;
        for (Event user : getUses(root, from)) {
            count += user.replaceUsesOfWith(from, to);
        }
        return count;
    }

    /**
    * Returns all events of the specified class under the root, in
    * depth-first order.
    */
    public static <T extends Traversable> List<T> getEvents(Traversable root,
            Class<T> c) {
        return new DepthFirstIterator<Traversable>(root).getList(c);
    }

    /**
    * Checks that every object under the root is listed as a child of its
    * parent.
    *
    * @param t the root of the checked subtree.
    * @return true if the tree is consistent.
    */
    public static boolean checkConsistency(Traversable t) {
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(t);
        iter.next();
        while (iter.hasNext()) {
            Traversable tr = iter.next();
            Traversable p = tr.getParent();
            if (p == null || Tools.identityIndexOf(p.getChildren(), tr) < 0) {
                PrintTools.printlnStatus(0, "Affected IR =", tr);
                PrintTools.printlnStatus(0, "Affected parent =", p);
                return false;
            }
        }
        return true;
    }

}
