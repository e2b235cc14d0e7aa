package work.lcod.dispatch.plugin;

import java.util.Objects;

/**
 * Deferred loader for a backend. Called at most once successfully per process.
 */
@FunctionalInterface
public interface BackendLoader {
    Backend load() throws Exception;

    static BackendLoader of(Backend backend) {
        Objects.requireNonNull(backend, "backend");
        return () -> backend;
    }

    /**
     * Instantiates {@code className} through its public no-arg constructor on first load.
     */
    static BackendLoader forClassName(String className) {
        Objects.requireNonNull(className, "className");
        return () -> {
            Class<?> type = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
            if (!Backend.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(className + " does not implement " + Backend.class.getName());
            }
            return (Backend) type.getDeclaredConstructor().newInstance();
        };
    }
}
