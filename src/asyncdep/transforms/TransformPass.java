package asyncdep.transforms;

import asyncdep.hir.IRTools;
import asyncdep.hir.PrintTools;
import asyncdep.hir.Program;
import asyncdep.hir.Tools;

/**
* Base class of all transformation passes. For consistent compilation, the
* program tree is checked at the end of every transformation pass.
*/
public abstract class TransformPass {

    /** The associated program */
    protected Program program;

    /** Flags for skipping consistency checking */
    protected boolean disable_protection;

    /** Constructs a transform pass with the given program */
    protected TransformPass(Program program) {
        this.program = program;
        disable_protection = false;
    }

    /** Returns the name of the transform pass */
    public abstract String getPassName();

    /**
    * Invokes the specified transform pass.
    * @param pass the transform pass that is to be run.
    */
    public static void run(TransformPass pass) {
        double timer = Tools.getTime();
        PrintTools.println(pass.getPassName() + " begin", 0);
        pass.start();
        PrintTools.println(pass.getPassName() + " end in " +
                String.format("%.2f seconds", Tools.getTime(timer)), 0);
        if (!pass.disable_protection) {
            if (!IRTools.checkConsistency(pass.program)) {
                throw new InternalError("Inconsistent IR after " +
                                        pass.getPassName());
            }
        }
    }

    /** Starts a transform pass */
    public abstract void start();

}
