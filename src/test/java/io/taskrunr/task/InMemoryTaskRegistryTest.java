package io.taskrunr.task;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskRegistryTest {

    private final InMemoryTaskRegistry registry = new InMemoryTaskRegistry();

    @Test
    void shouldRegisterAndLookUpTasks() {
        TaskRecord task = registry.register(new TaskRecord("t1", "Daily report"));

        assertTrue(registry.exists("t1"));
        assertSame(task, registry.get("t1"));
        assertEquals(1, registry.list().size());
    }

    @Test
    void unknownTasksShouldNotExist() {
        assertFalse(registry.exists("missing"));
        assertNull(registry.get("missing"));
        assertFalse(registry.exists(null));
        assertNull(registry.get(null));
    }

    @Test
    void removeShouldForgetTask() {
        registry.register(new TaskRecord("t1", "Daily report"));
        registry.remove("t1");
        registry.remove("t1");

        assertFalse(registry.exists("t1"));
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void registerShouldReplaceTaskWithSameId() {
        registry.register(new TaskRecord("t1", "old"));
        registry.register(new TaskRecord("t1", "new"));

        assertEquals("new", registry.get("t1").getName());
        assertEquals(1, registry.list().size());
    }
}
