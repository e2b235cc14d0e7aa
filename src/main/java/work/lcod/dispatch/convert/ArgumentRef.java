package work.lcod.dispatch.convert;

import java.util.Objects;

/**
 * Points at another call argument whose runtime value should be used.
 */
public record ArgumentRef(String name) {
    public ArgumentRef {
        Objects.requireNonNull(name, "name");
    }

    public static ArgumentRef arg(String name) {
        return new ArgumentRef(name);
    }
}
