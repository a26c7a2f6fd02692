package asyncdep.hir;

import java.util.List;

/** Sends a buffer region into a channel. */
public class ChannelPutEvent extends ChannelEvent {

    public ChannelPutEvent(List<Value> deps, String channel_name,
            List<Value> indices, Value src, List<Value> offsets,
            List<Value> sizes, List<Value> strides) {
        super(deps, channel_name, indices, src, offsets, sizes, strides);
    }

    public ChannelPutEvent(List<Value> deps, String channel_name, Value src) {
        this(deps, channel_name, null, src, null, null, null);
    }

    public EventKind getKind() {
        return EventKind.CHANNEL_PUT;
    }

    public String getName() {
        return "channel.put";
    }

}
