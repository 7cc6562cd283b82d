package cinder.db;

public enum DataType {
    STRING("string"),
    LIST("list"),
    HASH("hash"),
    SET("set"),
    ZSET("zset");

    private final String typeName;

    DataType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Name reported by TYPE.
     */
    public String typeName() {
        return typeName;
    }
}
