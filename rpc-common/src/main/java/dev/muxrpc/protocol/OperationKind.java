package dev.muxrpc.protocol;

/**
 * Kind of an invocation. Queries and mutations answer once; subscriptions stream until stopped.
 */
public enum OperationKind {
    QUERY("query"),
    MUTATION("mutation"),
    SUBSCRIPTION("subscription");

    private final String wireName;

    OperationKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the matching kind, or {@code null} when the name is not an operation kind
     */
    public static OperationKind fromWireName(String name) {
        for (OperationKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
