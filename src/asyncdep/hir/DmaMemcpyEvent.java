package asyncdep.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* Copies a strided region of a source buffer into a region of a destination
* buffer. Offsets, sizes and strides may be empty, in which case the whole
* buffer is transferred.
*/
public class DmaMemcpyEvent extends AsyncEvent {

    private final List<Value> dst;
    private final List<Value> dst_offsets;
    private final List<Value> dst_sizes;
    private final List<Value> dst_strides;
    private final List<Value> src;
    private final List<Value> src_offsets;
    private final List<Value> src_sizes;
    private final List<Value> src_strides;

    public DmaMemcpyEvent(List<Value> deps,
            Value dst, List<Value> dst_offsets, List<Value> dst_sizes,
            List<Value> dst_strides,
            Value src, List<Value> src_offsets, List<Value> src_sizes,
            List<Value> src_strides) {
        super(deps);
        this.dst = new ArrayList<Value>(Arrays.asList(dst));
        this.dst_offsets = copy(dst_offsets);
        this.dst_sizes = copy(dst_sizes);
        this.dst_strides = copy(dst_strides);
        this.src = new ArrayList<Value>(Arrays.asList(src));
        this.src_offsets = copy(src_offsets);
        this.src_sizes = copy(src_sizes);
        this.src_strides = copy(src_strides);
    }

    /** Transfers the whole source buffer into the whole destination buffer. */
    public DmaMemcpyEvent(List<Value> deps, Value dst, Value src) {
        this(deps, dst, null, null, null, src, null, null, null);
    }

    private static List<Value> copy(List<Value> list) {
        return (list == null) ?
                new ArrayList<Value>() : new ArrayList<Value>(list);
    }

    public EventKind getKind() {
        return EventKind.DMA;
    }

    public String getName() {
        return "dma_memcpy_nd";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.asList(async_deps, dst, dst_offsets, dst_sizes,
                dst_strides, src, src_offsets, src_sizes, src_strides);
    }

    public Value getDstMemref() {
        return dst.get(0);
    }

    public Value getSrcMemref() {
        return src.get(0);
    }

    public List<Value> getDstOffsets() {
        return Collections.unmodifiableList(dst_offsets);
    }

    public List<Value> getDstSizes() {
        return Collections.unmodifiableList(dst_sizes);
    }

    public List<Value> getDstStrides() {
        return Collections.unmodifiableList(dst_strides);
    }

    public List<Value> getSrcOffsets() {
        return Collections.unmodifiableList(src_offsets);
    }

    public List<Value> getSrcSizes() {
        return Collections.unmodifiableList(src_sizes);
    }

    public List<Value> getSrcStrides() {
        return Collections.unmodifiableList(src_strides);
    }

}
