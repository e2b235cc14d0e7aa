package work.lcod.dispatch.convert;

import java.util.Objects;
import java.util.Optional;
import work.lcod.dispatch.runtime.BoundArguments;

/**
 * Whether a conversion keeps every attribute: never, always, or when a boolean argument is {@code true}.
 */
public final class PreserveAttributes {
    private static final PreserveAttributes NEVER = new PreserveAttributes(false, null);
    private static final PreserveAttributes ALWAYS = new PreserveAttributes(true, null);

    private final boolean always;
    private final String argument;

    private PreserveAttributes(boolean always, String argument) {
        this.always = always;
        this.argument = argument;
    }

    public static PreserveAttributes never() {
        return NEVER;
    }

    public static PreserveAttributes always() {
        return ALWAYS;
    }

    public static PreserveAttributes of(boolean preserve) {
        return preserve ? ALWAYS : NEVER;
    }

    public static PreserveAttributes whenArgument(String argument) {
        return new PreserveAttributes(false, Objects.requireNonNull(argument, "argument"));
    }

    public Optional<String> argument() {
        return Optional.ofNullable(argument);
    }

    public boolean resolve(BoundArguments bound) {
        if (always) {
            return true;
        }
        return argument != null && Boolean.TRUE.equals(bound.get(argument));
    }

    @Override
    public String toString() {
        if (always) {
            return "always";
        }
        return argument == null ? "never" : "when " + argument;
    }
}
