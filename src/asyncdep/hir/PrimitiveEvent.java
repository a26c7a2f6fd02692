package asyncdep.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* A primitive operation wrapped inside an {@link ExecuteEvent}. The operand
* list split into inputs and outputs follows the data direction of the
* primitive: a linalg operation reads its inputs and reads and writes its
* outputs (init operands), a copy reads its input and writes its output.
*/
public class PrimitiveEvent extends Event {

    public enum PrimitiveKind {
        LINALG, ALLOC, DEALLOC, COPY, AFFINE_APPLY, MULI, ADDI
    }

    private final PrimitiveKind primitive_kind;

    /** Operation name of a linalg primitive, e.g. matmul. */
    private final String op_name;

    private final List<Value> inputs;

    private final List<Value> outputs;

    private PrimitiveEvent(PrimitiveKind kind, String op_name,
            List<Value> inputs, List<Value> outputs) {
        super();
        this.primitive_kind = kind;
        this.op_name = op_name;
        this.inputs = new ArrayList<Value>(inputs);
        this.outputs = new ArrayList<Value>(outputs);
    }

    /** Creates a linalg operation named <var>name</var>. */
    public static PrimitiveEvent linalg(String name, List<Value> ins,
            List<Value> outs) {
        return new PrimitiveEvent(PrimitiveKind.LINALG, name, ins, outs);
    }

    /** Creates an allocation producing a new buffer. */
    public static PrimitiveEvent alloc(int rank, MemorySpace space) {
        PrimitiveEvent ret = new PrimitiveEvent(PrimitiveKind.ALLOC, null,
                Collections.<Value>emptyList(), Collections.<Value>emptyList());
        ret.addResult(Value.buffer(rank, space));
        return ret;
    }

    public static PrimitiveEvent dealloc(Value buffer) {
        return new PrimitiveEvent(PrimitiveKind.DEALLOC, null,
                Arrays.asList(buffer), Collections.<Value>emptyList());
    }

    public static PrimitiveEvent copy(Value src, Value dst) {
        return new PrimitiveEvent(PrimitiveKind.COPY, null,
                Arrays.asList(src), Arrays.asList(dst));
    }

    public static PrimitiveEvent affineApply(List<Value> operands) {
        PrimitiveEvent ret = new PrimitiveEvent(PrimitiveKind.AFFINE_APPLY,
                null, operands, Collections.<Value>emptyList());
        ret.addResult(Value.index());
        return ret;
    }

    public static PrimitiveEvent muli(Value lhs, Value rhs) {
        PrimitiveEvent ret = new PrimitiveEvent(PrimitiveKind.MULI, null,
                Arrays.asList(lhs, rhs), Collections.<Value>emptyList());
        ret.addResult(Value.index());
        return ret;
    }

    public static PrimitiveEvent addi(Value lhs, Value rhs) {
        PrimitiveEvent ret = new PrimitiveEvent(PrimitiveKind.ADDI, null,
                Arrays.asList(lhs, rhs), Collections.<Value>emptyList());
        ret.addResult(Value.index());
        return ret;
    }

    public PrimitiveKind getPrimitiveKind() {
        return primitive_kind;
    }

    public EventKind getKind() {
        return EventKind.PRIMITIVE;
    }

    public String getName() {
        switch (primitive_kind) {
        case LINALG:
            return "linalg." + op_name;
        case ALLOC:
            return "alloc";
        case DEALLOC:
            return "dealloc";
        case COPY:
            return "copy";
        case AFFINE_APPLY:
            return "affine.apply";
        case MULI:
            return "muli";
        default:
            return "addi";
        }
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.asList(inputs, outputs);
    }

    public List<Value> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Value> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    /** Returns the execute event wrapping this primitive, or null. */
    public ExecuteEvent getExecute() {
        Event parent = getParentEvent();
        return (parent instanceof ExecuteEvent) ? (ExecuteEvent)parent : null;
    }

}
