package io.macroexpand.core.syntax;

/** Kind of accessor inside an accessor block. */
public enum AccessorKind {
    GET("get"),
    SET("set"),
    INIT("init"),
    WILL_SET("willSet"),
    DID_SET("didSet");

    private final String keyword;

    AccessorKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /** Observers keep a property stored; every other accessor makes it computed. */
    public boolean isObserver() {
        return this == WILL_SET || this == DID_SET;
    }
}
