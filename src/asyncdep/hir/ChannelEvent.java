package asyncdep.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* Base class of the events moving data through a named channel. A put reads
* its buffer region, a get writes it.
*/
public abstract class ChannelEvent extends AsyncEvent {

    private final String channel_name;
    private final List<Value> indices;
    private final List<Value> memref;
    private final List<Value> offsets;
    private final List<Value> sizes;
    private final List<Value> strides;

    protected ChannelEvent(List<Value> deps, String channel_name,
            List<Value> indices, Value memref, List<Value> offsets,
            List<Value> sizes, List<Value> strides) {
        super(deps);
        this.channel_name = channel_name;
        this.indices = copy(indices);
        this.memref = new ArrayList<Value>(Arrays.asList(memref));
        this.offsets = copy(offsets);
        this.sizes = copy(sizes);
        this.strides = copy(strides);
    }

    private static List<Value> copy(List<Value> list) {
        return (list == null) ?
                new ArrayList<Value>() : new ArrayList<Value>(list);
    }

    public String getChannelName() {
        return channel_name;
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.asList(async_deps, indices, memref, offsets, sizes,
                strides);
    }

    public Value getMemref() {
        return memref.get(0);
    }

    public List<Value> getIndices() {
        return Collections.unmodifiableList(indices);
    }

    public List<Value> getOffsets() {
        return Collections.unmodifiableList(offsets);
    }

    public List<Value> getSizes() {
        return Collections.unmodifiableList(sizes);
    }

    public List<Value> getStrides() {
        return Collections.unmodifiableList(strides);
    }

    @Override
    protected void printAttributes(PrintWriter o) {
        o.print(" @" + channel_name);
    }

}
