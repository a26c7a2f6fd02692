package asyncdep.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* <b>HierarchyEvent</b> opens a launch, partition or herd scope. The body
* sees one id argument per dimension of the iteration space and one kernel
* argument per kernel operand; values from outside the scope are only
* visible through kernel arguments.
*/
public class HierarchyEvent extends AsyncEvent {

    private final HierarchyLevel level;

    private final List<Value> sizes;

    private final List<Value> kernel_operands;

    private final List<Value> ids;

    private final List<Value> kernel_args;

    private final Block body;

    public HierarchyEvent(HierarchyLevel level, List<Value> deps,
            List<Value> sizes, List<Value> kernel_operands) {
        super(deps);
        this.level = level;
        this.sizes = new ArrayList<Value>(sizes);
        this.kernel_operands = new ArrayList<Value>(kernel_operands);
        body = addRegion(new Block());
        ids = new ArrayList<Value>(sizes.size());
        for (int i = 0; i < sizes.size(); i++) {
            Value id = Value.index();
            id.setOwner(this, i);
            ids.add(id);
        }
        kernel_args = new ArrayList<Value>(kernel_operands.size());
        for (Value operand : kernel_operands) {
            Value arg = Value.like(operand);
            kernel_args.add(arg);
        }
        renumberArguments();
    }

    private void renumberArguments() {
        for (int i = 0; i < kernel_args.size(); i++) {
            kernel_args.get(i).setOwner(this, ids.size() + i);
        }
    }

    public EventKind getKind() {
        return EventKind.HIERARCHY;
    }

    public String getName() {
        return (level == null) ? "hierarchy" : level.getName();
    }

    public HierarchyLevel getLevel() {
        return level;
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.asList(async_deps, sizes, kernel_operands);
    }

    public Block getBody() {
        return body;
    }

    public List<Value> getIds() {
        return Collections.unmodifiableList(ids);
    }

    public List<Value> getSizes() {
        return Collections.unmodifiableList(sizes);
    }

    public List<Value> getKernelOperands() {
        return Collections.unmodifiableList(kernel_operands);
    }

    public List<Value> getKernelArguments() {
        return Collections.unmodifiableList(kernel_args);
    }

    public int getNumKernelOperands() {
        return kernel_operands.size();
    }

    /**
    * Returns the kernel argument bound to the specified operand.
    *
    * @return the argument, or null if the value is not a kernel operand.
    */
    public Value getTiedKernelArgument(Value operand) {
        int index = kernel_operands.indexOf(operand);
        return (index < 0) ? null : kernel_args.get(index);
    }

    /**
    * Removes the kernel operand at the specified index together with its
    * argument. The argument must have no remaining uses.
    */
    public void eraseKernelOperand(int index) {
        kernel_operands.remove(index);
        kernel_args.remove(index);
        renumberArguments();
    }

    /** Terminates the body. */
    public HierarchyTerminator terminate() {
        if (getTerminator() != null) {
            throw new IllegalStateException(level.getName()
                    + " body is terminated");
        }
        return body.add(new HierarchyTerminator());
    }

    /** Returns the terminator, or null if the body is not terminated. */
    public HierarchyTerminator getTerminator() {
        Event last = body.getLast();
        return (last instanceof HierarchyTerminator) ?
                (HierarchyTerminator)last : null;
    }

    @Override
    protected void printAttributes(PrintWriter o) {
        o.print(" args(" + kernel_args + ")");
    }

}
