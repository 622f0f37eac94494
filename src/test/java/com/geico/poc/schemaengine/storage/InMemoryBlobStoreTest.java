package com.geico.poc.schemaengine.storage;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryBlobStoreTest {

    @Test
    public void testBasicOperations() {
        InMemoryBlobStore store = new InMemoryBlobStore();
        store.put("/snapshots/b/data.json", "b");
        store.put("snapshots/a/data.json", "a");

        assertEquals("a", store.get("/snapshots/a/data.json").orElseThrow());
        assertEquals(List.of("snapshots/a/data.json", "snapshots/b/data.json"), store.list("snapshots/"));

        assertTrue(store.delete("snapshots/a/data.json"));
        assertFalse(store.delete("snapshots/a/data.json"));

        store.deletePrefix("snapshots/");
        assertEquals(0, store.size());
    }

    @Test
    public void testNullContentRejected() {
        InMemoryBlobStore store = new InMemoryBlobStore();
        assertThrows(NullPointerException.class, () -> store.put("k", null));
    }
}
