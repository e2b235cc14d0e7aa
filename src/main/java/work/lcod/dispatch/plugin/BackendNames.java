package work.lcod.dispatch.plugin;

/**
 * Reserved backend names.
 */
public final class BackendNames {
    /** Name that selects the native implementation. */
    public static final String NATIVE = "native";
    /** Reference backend: missing algorithms are hard failures under the conversion harness. */
    public static final String REFERENCE = "loopback";

    private BackendNames() {}

    public static boolean isNative(String name) {
        return name == null || NATIVE.equals(name);
    }
}
