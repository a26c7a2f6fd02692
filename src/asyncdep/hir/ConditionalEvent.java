package asyncdep.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* <b>ConditionalEvent</b> selects one of two blocks. Each block ends with a
* {@link YieldEvent}; the result at position <i>i</i> is the <i>i</i>th value
* yielded by whichever branch ran. An else block may itself hold a single
* nested conditional followed by its yield, forming an else-chain.
*/
public class ConditionalEvent extends Event {

    private final List<Value> condition;

    private final Block then_block;

    private final Block else_block;

    /**
    * Constructs a conditional on the given value producing
    * <var>num_tokens</var> token results.
    */
    public ConditionalEvent(Value condition, int num_tokens) {
        super();
        this.condition = new ArrayList<Value>(Arrays.asList(condition));
        then_block = addRegion(new Block());
        else_block = addRegion(new Block());
        for (int i = 0; i < num_tokens; i++) {
            addResult(Value.token());
        }
    }

    public EventKind getKind() {
        return EventKind.CONDITIONAL;
    }

    public String getName() {
        return "if";
    }

    public List<List<Value>> getOperandLists() {
        return Arrays.<List<Value>>asList(condition);
    }

    public Value getCondition() {
        return condition.get(0);
    }

    public Block getThenBlock() {
        return then_block;
    }

    public Block getElseBlock() {
        return else_block;
    }

    public YieldEvent terminateThen(Value... values) {
        return terminate(then_block, values);
    }

    public YieldEvent terminateElse(Value... values) {
        return terminate(else_block, values);
    }

    private YieldEvent terminate(Block block, Value... values) {
        if (block.getLast() instanceof YieldEvent) {
            throw new IllegalStateException("branch is terminated");
        }
        if (values.length != getResults().size()) {
            throw new IllegalArgumentException("branch yields " + values.length
                    + " values but the conditional has "
                    + getResults().size() + " results");
        }
        return block.add(new YieldEvent(Arrays.asList(values)));
    }

    /** Returns the terminator of the then block, or null. */
    public YieldEvent getThenYield() {
        Event last = then_block.getLast();
        return (last instanceof YieldEvent) ? (YieldEvent)last : null;
    }

    /** Returns the terminator of the else block, or null. */
    public YieldEvent getElseYield() {
        Event last = else_block.getLast();
        return (last instanceof YieldEvent) ? (YieldEvent)last : null;
    }

}
