package com.bko.healthexport.export.app;

import com.bko.healthexport.healthdata.HealthDataException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class ProviderCalls {

    private ProviderCalls() {
    }

    static <T> T await(CompletableFuture<T> future, String operation) throws HealthDataException {
        try {
            return future.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new HealthDataException("Interrupted while waiting for " + operation, ie);
        } catch (CancellationException ce) {
            throw new HealthDataException(operation + " was cancelled", ce);
        } catch (ExecutionException ee) {
            throw failure(ee.getCause(), operation);
        }
    }

    static <T> CompletableFuture<T> cancelWith(CompletableFuture<T> dependent, CompletableFuture<?> source) {
        dependent.whenComplete((value, failure) -> {
            if (failure instanceof CancellationException) {
                source.cancel(true);
            }
        });
        return dependent;
    }

    static HealthDataException failure(Throwable cause, String operation) {
        Throwable root = cause;
        while (root instanceof CompletionException && root.getCause() != null) {
            root = root.getCause();
        }
        if (root instanceof HealthDataException healthDataException) {
            return healthDataException;
        }
        return new HealthDataException(operation + " failed: " + root.getMessage(), root);
    }
}
