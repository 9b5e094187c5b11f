package io.cronbot.core.dispatch;

import io.cronbot.core.job.JobParameters;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * A named function a collaborator exposes to scheduled jobs. The returned value is snapshotted into
 * the execution log as JSON.
 */
@FunctionalInterface
public interface Capability {

    Object invoke(JobParameters parameters) throws Exception;

    /**
     * Capability taking the whole payload bound to {@code type}.
     */
    static <T> Capability typed(Class<T> type, TypedHandler<T> handler) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        return parameters -> handler.handle(parameters.as(type));
    }

    static Capability noArgs(Callable<?> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        return parameters -> handler.call();
    }

    @FunctionalInterface
    interface TypedHandler<T> {
        Object handle(T parameters) throws Exception;
    }
}
