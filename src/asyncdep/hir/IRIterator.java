package asyncdep.hir;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
* An iterator implementing this interface supports special versions of next.
*/
public abstract class IRIterator<E extends Traversable> implements Iterator<E> {

    /** The root traversable object */
    protected Traversable root;

    /** Constructs a base IRIterator */
    protected IRIterator(Traversable root) {
        this.root = root;
    }

    public abstract boolean hasNext();

    public abstract E next();

    /**
    * Returns the next element in the iteration that is an instance of a
    * certain class.
    *
    * @param c The class of which the next element must be a instance.
    * @throws NoSuchElementException if there are no elements of class c.
    * @return the next element that is of class c.
    */
    @SuppressWarnings("unchecked")
    public <T extends Traversable> T next(Class<T> c)
            throws NoSuchElementException {
        while (hasNext()) {
            Object obj = next();
            if (c.isInstance(obj)) {
                return (T)obj;
            }
        }
        throw new NoSuchElementException();
    }

    /**
    * This operation is not supported.
    */
    public void remove() {
        throw new UnsupportedOperationException();
    }

    /**
    * Moves the iterator back to the beginning of the sequence.
    */
    public abstract void reset();

}
