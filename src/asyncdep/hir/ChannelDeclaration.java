package asyncdep.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Declares a named channel connecting put and get events. A channel with a
* broadcast shape delivers each put to several receivers.
*/
public class ChannelDeclaration {

    private final String name;

    private final List<Integer> size;

    private final List<Integer> broadcast_shape;

    public ChannelDeclaration(String name, List<Integer> size) {
        this(name, size, null);
    }

    public ChannelDeclaration(String name, List<Integer> size,
            List<Integer> broadcast_shape) {
        this.name = name;
        this.size = new ArrayList<Integer>(size);
        this.broadcast_shape = (broadcast_shape == null) ?
                null : new ArrayList<Integer>(broadcast_shape);
    }

    public String getName() {
        return name;
    }

    public List<Integer> getSize() {
        return Collections.unmodifiableList(size);
    }

    public boolean isBroadcast() {
        return broadcast_shape != null;
    }

    /** Returns the broadcast shape, or null if the channel is not broadcast. */
    public List<Integer> getBroadcastShape() {
        return (broadcast_shape == null) ?
                null : Collections.unmodifiableList(broadcast_shape);
    }

}
