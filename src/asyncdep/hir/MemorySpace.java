package asyncdep.hir;

/**
* Memory hierarchy levels a buffer can be placed in. L3 is external memory
* seen by the host, L2 is shared on-chip memory and L1 is local to a herd.
*/
public enum MemorySpace {
    L1, L2, L3;
}
