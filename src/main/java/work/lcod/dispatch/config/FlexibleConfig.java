package work.lcod.dispatch.config;

import java.util.Map;

/**
 * Open-schema config: keys may be added and removed freely, unknown reads return {@code null}.
 */
public class FlexibleConfig extends AbstractConfig {
    public FlexibleConfig() {
    }

    public FlexibleConfig(Map<String, ?> initial) {
        load(initial);
    }

    @Override
    protected boolean isDeclared(String key) {
        return contains(key);
    }

    @Override
    public final boolean isStrict() {
        return false;
    }

    @Override
    public Config reconstruct(Map<String, Object> exported) {
        return new FlexibleConfig(exported);
    }
}
