package asyncdep.hir;

import java.util.ArrayList;
import java.util.List;

/**
* <b>AsyncEvent</b> is an event producing a completion token as its first
* result and carrying an explicit list of dependency tokens. The dependency
* list is the declared set of predecessors of the event and is the list the
* dependency canonicalization rewrites.
*/
public abstract class AsyncEvent extends Event {

    /** The dependency token list. */
    protected final List<Value> async_deps;

    protected AsyncEvent(List<Value> deps) {
        super();
        async_deps = new ArrayList<Value>();
        addResult(Value.token());
        if (deps != null) {
            for (Value dep : deps) {
                addAsyncDependency(dep);
            }
        }
    }

    /** Returns the token produced by this event. */
    public Value getAsyncToken() {
        return getResult(0);
    }

    /**
    * Returns the live dependency token list. Callers mutating the list are
    * responsible for adding token values only.
    */
    public List<Value> getAsyncDependencies() {
        return async_deps;
    }

    /**
    * Appends a dependency token.
    *
    * @throws InternalError if the value is not a token.
    */
    public void addAsyncDependency(Value token) {
        if (token == null || !token.isToken()) {
            throw new InternalError("non-token value " + token
                    + " added to the dependency list of " + getName());
        }
        async_deps.add(token);
    }

    /**
    * Appends a dependency token unless it is already in the list.
    *
    * @return true if the token was added.
    */
    public boolean addAsyncDependencyIfNew(Value token) {
        if (async_deps.contains(token)) {
            return false;
        }
        addAsyncDependency(token);
        return true;
    }

    /** Removes the dependency at the specified index. */
    public void eraseAsyncDependency(int index) {
        async_deps.remove(index);
    }

    /**
    * Removes every occurrence of the specified token from the dependency
    * list.
    *
    * @return true if the list changed.
    */
    public boolean removeAsyncDependency(Value token) {
        boolean changed = false;
        while (async_deps.remove(token)) {
            changed = true;
        }
        return changed;
    }

    public void clearAsyncDependencies() {
        async_deps.clear();
    }

}
