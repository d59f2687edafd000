package dev.muxrpc.protocol;

public enum ResultType {
    DATA("data"),
    STARTED("started"),
    STOPPED("stopped");

    private final String wireName;

    ResultType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ResultType fromWireName(String name) {
        for (ResultType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        return null;
    }
}
