package cn.edu.zju.daily.metricguard.utils;

import cn.edu.zju.daily.metricguard.core.error.DataAccessException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class FutureUtils {

    /**
     * Blocks on the future and rethrows the failure that completed it. Runtime exceptions keep
     * their type; checked ones are wrapped in a {@link DataAccessException}.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataAccessException("Interrupted while waiting for the query engine", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    public static RuntimeException unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new DataAccessException(String.valueOf(cause.getMessage()), cause);
    }
}
