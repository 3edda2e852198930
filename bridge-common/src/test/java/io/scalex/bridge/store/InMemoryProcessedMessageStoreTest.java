package io.scalex.bridge.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryProcessedMessageStoreTest {
    
    private static final String ID = "0xf94a8e8ca7d9aa13229827de38e93e53a5f6c016356f94f5f6d61275678f0366";
    
    @Test
    public void testMarkOnce() {
        ProcessedMessageStore store = new InMemoryProcessedMessageStore();
        
        assertFalse(store.isProcessed(ID));
        assertTrue(store.markProcessed(ID));
        assertFalse(store.markProcessed(ID.toUpperCase().replace("0X", "0x")), "ids are case-insensitive");
        assertTrue(store.isProcessed(ID));
        assertEquals(1, store.size());
    }
    
    @Test
    public void testConcurrentMarkHasOneWinner() throws Exception {
        ProcessedMessageStore store = new InMemoryProcessedMessageStore();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                tasks.add(() -> store.markProcessed(ID));
            }
            int winners = 0;
            for (Future<Boolean> result : executor.invokeAll(tasks)) {
                if (result.get()) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            executor.shutdownNow();
        }
    }
}
