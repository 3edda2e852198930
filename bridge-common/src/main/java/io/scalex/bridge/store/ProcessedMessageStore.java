package io.scalex.bridge.store;

/**
 * Append-only set of applied message ids.
 * 
 * Callers must invoke {@link #markProcessed(String)} inside the same critical
 * section as the state change it guards, and check its return value: an id is
 * inserted at most once, ever.
 */
public interface ProcessedMessageStore {

    boolean isProcessed(String messageId);

    /**
     * Insert {@code messageId} if absent.
     *
     * @return true if the id was inserted, false if it was already present
     */
    boolean markProcessed(String messageId);

    long size();
}
