package io.scalex.bridge.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory processed message store.
 * 
 * In production this would be a table with a unique constraint on the message
 * id, written in the same transaction as the ledger mutation.
 */
public class InMemoryProcessedMessageStore implements ProcessedMessageStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProcessedMessageStore.class);

    private final Set<String> processed = Collections.newSetFromMap(new ConcurrentHashMap<>());

    @Override
    public boolean isProcessed(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return false;
        }
        return processed.contains(key(messageId));
    }

    @Override
    public boolean markProcessed(String messageId) {
        boolean inserted = processed.add(key(messageId));
        if (inserted) {
            log.debug("Marked message as processed: id={}", messageId);
        } else {
            log.warn("Message already processed: id={}", messageId);
        }
        return inserted;
    }

    @Override
    public long size() {
        return processed.size();
    }

    private static String key(String messageId) {
        return messageId.trim().toLowerCase(Locale.ROOT);
    }
}
