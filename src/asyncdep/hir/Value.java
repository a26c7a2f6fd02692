package asyncdep.hir;

import java.io.PrintWriter;

/**
* <b>Value</b> is an SSA value of the program model. A value is either the
* result of exactly one event or an argument owned by a region-holding event
* or a function. Values are compared by identity.
*/
public class Value implements Printable {

    private static int name_counter = 0;

    private final ValueType type;

    private final int rank;

    private final MemorySpace space;

    private final String name;

    /** The event producing this value, null for arguments. */
    private Event defining_event;

    private int result_number;

    /** The event or function owning this value when it is an argument. */
    private Traversable owner;

    private int arg_number;

    private Value(ValueType type, int rank, MemorySpace space) {
        this.type = type;
        this.rank = rank;
        this.space = space;
        this.name = nextName(type);
        this.result_number = -1;
        this.arg_number = -1;
    }

    private static synchronized String nextName(ValueType type) {
        switch (type) {
        case ASYNC_TOKEN:
            return "%t" + (name_counter++);
        case BUFFER:
            return "%m" + (name_counter++);
        default:
            return "%i" + (name_counter++);
        }
    }

    /** Returns a new token value. */
    public static Value token() {
        return new Value(ValueType.ASYNC_TOKEN, 0, null);
    }

    /** Returns a new index value. */
    public static Value index() {
        return new Value(ValueType.INDEX, 0, null);
    }

    /**
    * Returns a new buffer value.
    *
    * @param rank the number of dimensions of the buffer.
    * @param space the memory space the buffer lives in.
    * @return the new value.
    */
    public static Value buffer(int rank, MemorySpace space) {
        if (rank < 0) {
            throw new IllegalArgumentException("negative rank " + rank);
        }
        return new Value(ValueType.BUFFER, rank, space);
    }

    /**
    * Returns a new value with the same type, rank and memory space as the
    * given one.
    */
    public static Value like(Value v) {
        return new Value(v.type, v.rank, v.space);
    }

    void setDefiningEvent(Event event, int result_number) {
        this.defining_event = event;
        this.result_number = result_number;
    }

    void setOwner(Traversable owner, int arg_number) {
        this.owner = owner;
        this.arg_number = arg_number;
    }

    public ValueType getType() {
        return type;
    }

    public boolean isToken() {
        return type == ValueType.ASYNC_TOKEN;
    }

    public boolean isBuffer() {
        return type == ValueType.BUFFER;
    }

    public boolean isIndex() {
        return type == ValueType.INDEX;
    }

    /** Returns the rank of a buffer, 0 for other values. */
    public int getRank() {
        return rank;
    }

    /** Returns the memory space of a buffer, null for other values. */
    public MemorySpace getMemorySpace() {
        return space;
    }

    public String getName() {
        return name;
    }

    /**
    * Returns the event producing this value.
    *
    * @return the defining event, or null if this value is an argument.
    */
    public Event getDefiningEvent() {
        return defining_event;
    }

    /**
    * Returns the position of this value in the results of its defining
    * event, -1 for arguments.
    */
    public int getResultNumber() {
        return result_number;
    }

    public boolean isArgument() {
        return owner != null;
    }

    /**
    * Returns the event or function owning this argument.
    *
    * @return the owner, or null if this value is an event result.
    */
    public Traversable getOwner() {
        return owner;
    }

    /** Returns the position of this argument within its owner, -1 for results. */
    public int getArgNumber() {
        return arg_number;
    }

    /**
    * Returns the constant this value is known to hold.
    *
    * @return the constant, or null if the value is not a constant.
    */
    public Long getConstantValue() {
        if (defining_event instanceof ScalarEvent) {
            ScalarEvent scalar = (ScalarEvent)defining_event;
            if (scalar.getScalarKind() == ScalarEvent.ScalarKind.CONSTANT) {
                return scalar.getConstant();
            }
        }
        return null;
    }

    public void print(PrintWriter o) {
        o.print(name);
    }

    @Override
    public String toString() {
        return name;
    }

}
