package com.eainde.research;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Unchecked failure raised by the research engine for stage failures that are not
 * already unchecked exceptions of the underlying capability.
 */
public class ResearchException extends RuntimeException {

    public ResearchException(String message) {
        super(message);
    }

    public ResearchException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
     * futures put around a failure, returning the first meaningful cause.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Converts any failure into something that can be thrown without a {@code throws}
     * clause: unchecked exceptions pass through unwrapped, errors are rethrown as-is,
     * checked exceptions are wrapped.
     */
    public static RuntimeException propagate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new ResearchException(String.valueOf(cause.getMessage()), cause);
    }
}
