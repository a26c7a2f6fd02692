package asyncdep.hir;

import java.util.List;

/** Receives a buffer region from a channel. */
public class ChannelGetEvent extends ChannelEvent {

    public ChannelGetEvent(List<Value> deps, String channel_name,
            List<Value> indices, Value dst, List<Value> offsets,
            List<Value> sizes, List<Value> strides) {
        super(deps, channel_name, indices, dst, offsets, sizes, strides);
    }

    public ChannelGetEvent(List<Value> deps, String channel_name, Value dst) {
        this(deps, channel_name, null, dst, null, null, null);
    }

    public EventKind getKind() {
        return EventKind.CHANNEL_GET;
    }

    public String getName() {
        return "channel.get";
    }

}
