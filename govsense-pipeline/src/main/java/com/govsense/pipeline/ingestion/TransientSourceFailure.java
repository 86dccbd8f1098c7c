package com.govsense.pipeline.ingestion;

import com.govsense.pipeline.exception.SourceUnavailableException;

import java.util.function.Predicate;

/**
 * Retry predicate for the dataGouv retry instance: only transient source
 * failures are worth another attempt.
 */
public class TransientSourceFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof SourceUnavailableException e && e.isTransientFailure();
    }
}
