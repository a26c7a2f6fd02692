package asyncdep.hir;

/**
* The three nested levels opened by hierarchy events. A launch may hold
* partitions or herds, a partition may hold herds.
*/
public enum HierarchyLevel {
    LAUNCH("launch"),
    PARTITION("partition"),
    HERD("herd");

    private final String name;

    private HierarchyLevel(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
