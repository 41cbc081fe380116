package io.concourse.driver.resolve;

/**
 * A logical operation; every remote variant of the family starts with {@link #prefix()}.
 */
public enum OperationFamily {
    GET("get"),
    SELECT("select"),
    AUDIT("audit"),
    ADD("add"),
    SET("set"),
    TIME("time"),
    STAGE("stage"),
    COMMIT("commit"),
    ABORT("abort"),
    SERVER_ENVIRONMENT("getServerEnvironment"),
    SERVER_VERSION("getServerVersion");

    private final String prefix;

    OperationFamily(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
