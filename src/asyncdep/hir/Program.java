package asyncdep.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* <b>Program</b> is the root of the program tree. It holds the functions and
* the channel declarations shared by them.
*/
public class Program implements Traversable {

    private final List<Function> functions;

    private final Map<String, ChannelDeclaration> channels;

    public Program() {
        functions = new ArrayList<Function>();
        channels = new LinkedHashMap<String, ChannelDeclaration>();
    }

    public Function addFunction(Function function) {
        functions.add(function);
        function.setParent(this);
        return function;
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    /** Returns the function with the given name, or null. */
    public Function getFunction(String name) {
        for (Function f : functions) {
            if (f.getName().equals(name)) {
                return f;
            }
        }
        return null;
    }

    public ChannelDeclaration addChannel(ChannelDeclaration channel) {
        if (channels.containsKey(channel.getName())) {
            throw new IllegalArgumentException(
                    "duplicate channel " + channel.getName());
        }
        channels.put(channel.getName(), channel);
        return channel;
    }

    /** Returns the declaration of the named channel, or null. */
    public ChannelDeclaration getChannel(String name) {
        return channels.get(name);
    }

    public List<Traversable> getChildren() {
        return Collections.<Traversable>unmodifiableList(functions);
    }

    public Traversable getParent() {
        return null;
    }

    public void removeChild(Traversable child) {
        if (!functions.remove(child)) {
            throw new NotAChildException();
        }
        child.setParent(null);
    }

    public void setParent(Traversable t) {
        throw new UnsupportedOperationException("program has no parent");
    }

    public void print(PrintWriter o) {
        for (ChannelDeclaration channel : channels.values()) {
            o.print("channel @" + channel.getName() + " " + channel.getSize());
            if (channel.isBroadcast()) {
                o.print(" {broadcast_shape = "
                        + channel.getBroadcastShape() + "}");
            }
            o.println();
        }
        for (Function f : functions) {
            f.print(o);
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
