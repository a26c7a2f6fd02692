package asyncdep.analysis;

import asyncdep.hir.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Describes the part of a buffer touched by an access: one index per
* dimension, where a null index leaves the dimension unconstrained.
*/
public class PartialRegion {

    private final Value buffer;

    private final List<Value> indices;

    /**
    * Constructs a region of the buffer starting at the given offsets. Empty
    * offsets describe the whole buffer.
    */
    public PartialRegion(Value buffer, List<Value> offsets) {
        if (buffer == null || !buffer.isBuffer()) {
            throw new IllegalArgumentException("not a buffer: " + buffer);
        }
        this.buffer = buffer;
        if (offsets == null || offsets.isEmpty()) {
            indices = new ArrayList<Value>(
                    Collections.<Value>nCopies(buffer.getRank(), null));
        } else {
            indices = new ArrayList<Value>(offsets);
        }
    }

    /** Returns the region covering the whole buffer. */
    public static PartialRegion whole(Value buffer) {
        return new PartialRegion(buffer, null);
    }

    public Value getBuffer() {
        return buffer;
    }

    /** Returns the number of dimensions described by this region. */
    public int getRank() {
        return indices.size();
    }

    /** Returns the per-dimension indices; null entries are unconstrained. */
    public List<Value> getIndices() {
        return Collections.unmodifiableList(indices);
    }

    /**
    * Checks if two regions may refer to the same elements: the ranks are
    * equal and every dimension pair may be equal.
    */
    public boolean mayOverlap(PartialRegion other) {
        if (getRank() != other.getRank()) {
            return false;
        }
        for (int i = 0; i < indices.size(); i++) {
            if (!mayBeEqual(indices.get(i), other.indices.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
    * Checks if two indices may be equal: either is unconstrained, they are
    * the same value, or both are constants holding the same number.
    */
    public static boolean mayBeEqual(Value a, Value b) {
        if (a == null || b == null || a == b) {
            return true;
        }
        Long ca = a.getConstantValue();
        Long cb = b.getConstantValue();
        return ca != null && cb != null && ca.longValue() == cb.longValue();
    }

    @Override
    public String toString() {
        return buffer + indices.toString();
    }

}
