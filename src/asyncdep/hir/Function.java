package asyncdep.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* <b>Function</b> is a named top-level body of events. Its arguments are
* typically the external buffers the function moves data between.
*/
public class Function implements Traversable {

    private final String name;

    private final List<Value> arguments;

    private final Block body;

    private Program parent;

    public Function(String name) {
        this.name = name;
        arguments = new ArrayList<Value>();
        body = new Block();
        body.setParent(this);
    }

    /**
    * Adds a new buffer argument to this function.
    *
    * @return the argument value.
    */
    public Value addBufferArgument(int rank, MemorySpace space) {
        Value arg = Value.buffer(rank, space);
        arg.setOwner(this, arguments.size());
        arguments.add(arg);
        return arg;
    }

    /** Adds a new index argument to this function. */
    public Value addIndexArgument() {
        Value arg = Value.index();
        arg.setOwner(this, arguments.size());
        arguments.add(arg);
        return arg;
    }

    public String getName() {
        return name;
    }

    public List<Value> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Block getBody() {
        return body;
    }

    public Program getProgram() {
        return parent;
    }

    public List<Traversable> getChildren() {
        return Collections.<Traversable>singletonList(body);
    }

    public Traversable getParent() {
        return parent;
    }

    public void removeChild(Traversable child) {
        if (child != body) {
            throw new NotAChildException();
        }
        throw new UnsupportedOperationException(
                "function body cannot be removed");
    }

    public void setParent(Traversable t) {
        if (t != null && !(t instanceof Program)) {
            throw new IllegalArgumentException(
                    "function parent must be a program");
        }
        if (t != null && t.getChildren().indexOf(this) < 0) {
            throw new NotAChildException();
        }
        parent = (Program)t;
    }

    public void print(PrintWriter o) {
        o.print("func " + name + "(");
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                o.print(", ");
            }
            arguments.get(i).print(o);
        }
        o.print(") ");
        body.print(o);
        o.println();
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
