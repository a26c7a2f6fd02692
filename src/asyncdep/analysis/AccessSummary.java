package asyncdep.analysis;

import asyncdep.hir.Value;

import java.util.ArrayList;
import java.util.List;

/**
* The buffer regions read and written by an event, and the index values it
* consumes and produces.
*/
public class AccessSummary {

    private final List<PartialRegion> reads;

    private final List<PartialRegion> writes;

    private final List<Value> scalar_ins;

    private final List<Value> scalar_outs;

    public AccessSummary() {
        reads = new ArrayList<PartialRegion>();
        writes = new ArrayList<PartialRegion>();
        scalar_ins = new ArrayList<Value>();
        scalar_outs = new ArrayList<Value>();
    }

    public List<PartialRegion> getReads() {
        return reads;
    }

    public List<PartialRegion> getWrites() {
        return writes;
    }

    public List<Value> getScalarIns() {
        return scalar_ins;
    }

    public List<Value> getScalarOuts() {
        return scalar_outs;
    }

    /** Appends the contents of another summary to this one. */
    public void addAll(AccessSummary other) {
        reads.addAll(other.reads);
        writes.addAll(other.writes);
        scalar_ins.addAll(other.scalar_ins);
        scalar_outs.addAll(other.scalar_outs);
    }

    @Override
    public String toString() {
        return "reads=" + reads + " writes=" + writes + " ins=" + scalar_ins
                + " outs=" + scalar_outs;
    }

}
