package asyncdep.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* One node of the tree pairing every graph of a function with its reduced
* copy. The children follow the order of the subgraphs.
*/
public class VertexMapTree {

    private final ScopeGraph original;

    private final ScopeGraph reduced;

    private final VertexMap map;

    private final List<VertexMapTree> children;

    public VertexMapTree(ScopeGraph original, ScopeGraph reduced,
            VertexMap map) {
        this.original = original;
        this.reduced = reduced;
        this.map = map;
        children = new ArrayList<VertexMapTree>();
    }

    public ScopeGraph getOriginal() {
        return original;
    }

    public ScopeGraph getReduced() {
        return reduced;
    }

    public VertexMap getMap() {
        return map;
    }

    public List<VertexMapTree> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(VertexMapTree child) {
        children.add(child);
    }

}
