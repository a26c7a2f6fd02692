package asyncdep.hir;

import java.util.List;

/**
* Any class implementing this interface can act as a tree node by providing
* access to its children and parent. The program tree alternates between
* blocks and events below the function level.
*/
public interface Traversable extends Printable {

    /**
    * Provides access to the children of this object as a list. The returned
    * list must not be modified by the caller; use the methods of the
    * particular class to change its children.
    *
    * @return the children as a list.
    */
    List<Traversable> getChildren();

    /**
    * Provides access to the parent of this object. Every IR object has at most
    * one parent.
    *
    * @return the parent of this object.
    */
    Traversable getParent();

    /**
    * Removes the specified child.
    *
    * @param child a reference to a child object that must match with ==.
    * @throws NotAChildException if the child does not exist.
    * @throws UnsupportedOperationException if the child exists but the
    *   parent refuses to let it go. A region-holding event never gives up
    *   its regions.
    */
    void removeChild(Traversable child);

    /**
    * Sets the parent of this object. The parent must already consider this
    * object a child.
    *
    * @throws NotAChildException if the parent does not already consider
    *   this object a child.
    */
    void setParent(Traversable t);

}
