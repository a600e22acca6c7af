package co.deferworks.lode.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * The default {@link JobResolver}: a map from job kind to handler factory, filled in at
 * startup. Factories run on every resolution, so a handler that keeps per-run state should
 * be registered through {@link #registerFactory(String, Supplier)}; stateless handlers can
 * be shared with {@link #register(String, JobHandler)}.
 */
public class JobRegistry implements JobResolver {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, Supplier<? extends JobHandler>> factories = new ConcurrentHashMap<>();

    public JobRegistry register(String kind, JobHandler handler) {
        Objects.requireNonNull(handler, "handler");
        return registerFactory(kind, () -> handler);
    }

    public JobRegistry registerFactory(String kind, Supplier<? extends JobHandler> factory) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Job kind must not be blank");
        }
        Objects.requireNonNull(factory, "factory");
        if (factories.put(kind, factory) != null) {
            log.warn("Handler for job kind {} was replaced.", kind);
        }
        return this;
    }

    public Set<String> kinds() {
        return Set.copyOf(factories.keySet());
    }

    @Override
    public boolean canResolve(String kind) {
        return kind != null && factories.containsKey(kind);
    }

    @Override
    public JobHandler resolve(String kind) throws JobResolutionException {
        var factory = kind == null ? null : factories.get(kind);
        if (factory == null) {
            throw new JobResolutionException("No handler registered for job kind '" + kind + "'");
        }
        JobHandler handler;
        try {
            handler = factory.get();
        } catch (RuntimeException e) {
            throw new JobResolutionException("Failed to create handler for job kind '" + kind + "'", e);
        }
        if (handler == null) {
            throw new JobResolutionException("Factory for job kind '" + kind + "' returned no handler");
        }
        return handler;
    }
}
