package dev.fumaz.graft.bind;

import dev.fumaz.graft.provider.InstanceProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegistrationStoreTest {

    private final RegistrationStore store = new RegistrationStore();

    @Test
    void storesAndLooksUpByKey() {
        Registration<String> registration = instance(ServiceKey.of(String.class), "value");

        assertNull(store.register(registration));

        assertSame(registration, store.lookup(ServiceKey.of(String.class)));
        assertTrue(store.isRegistered(ServiceKey.of(String.class)));
        assertFalse(store.isRegistered(ServiceKey.of(String.class, "other")));
        assertNull(store.lookup(ServiceKey.of(Integer.class)));
    }

    @Test
    void replacingReturnsPreviousAndKeepsPosition() {
        Registration<String> first = instance(ServiceKey.of(String.class), "first");
        Registration<Integer> number = instance(ServiceKey.of(Integer.class), 1);
        Registration<String> replacement = instance(ServiceKey.of(String.class), "second");
        store.register(first);
        store.register(number);

        assertSame(first, store.register(replacement));

        assertEquals(List.of(replacement, number), store.all());
        assertEquals(2, store.size());
    }

    @Test
    void allForListsKeyedAndUnkeyedInInsertionOrder() {
        Registration<String> keyed = instance(ServiceKey.of(String.class, "a"), "a");
        Registration<Integer> number = instance(ServiceKey.of(Integer.class), 1);
        Registration<String> unkeyed = instance(ServiceKey.of(String.class), "default");
        store.register(keyed);
        store.register(number);
        store.register(unkeyed);

        assertEquals(List.of(keyed, unkeyed), store.allFor(String.class));
        assertTrue(store.allFor(Long.class).isEmpty());
    }

    @Test
    void clearEmptiesTheStore() {
        store.register(instance(ServiceKey.of(String.class), "value"));

        store.clear();

        assertTrue(store.isEmpty());
        assertTrue(store.all().isEmpty());
        assertTrue(store.allFor(String.class).isEmpty());
    }

    private static <T> Registration<T> instance(ServiceKey<T> key, T value) {
        return new Registration<>(key, Lifetime.SINGLETON, new InstanceProvider<>(value));
    }
}
