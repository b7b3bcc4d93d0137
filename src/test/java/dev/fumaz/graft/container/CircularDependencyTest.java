package dev.fumaz.graft.container;

import dev.fumaz.graft.bind.Lifetime;
import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.context.ResolutionContext;
import dev.fumaz.graft.exception.CircularDependencyException;
import dev.fumaz.graft.exception.NotRegisteredException;
import dev.fumaz.graft.provider.BuildStrategy;
import dev.fumaz.graft.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircularDependencyTest {

    @Test
    void reportsMutualDependencyWithFullPath() {
        Container container = Container.create();
        container.register(First.class, FirstImpl.class, Lifetime.TRANSIENT);
        container.register(Second.class, SecondImpl.class, Lifetime.TRANSIENT);

        CircularDependencyException exception = assertThrows(CircularDependencyException.class,
                () -> container.resolve(First.class));

        assertEquals(List.of(ServiceKey.of(First.class), ServiceKey.of(Second.class), ServiceKey.of(First.class)),
                exception.getPath());
        assertTrue(exception.getMessage().startsWith("Circular dependency detected"),
                "message should mention cycle detection");
        assertTrue(exception.getMessage().contains(Second.class.getName()),
                "message should mention the types participating in the cycle");
    }

    @Test
    void reportsSelfDependency() {
        Container container = Container.create();
        container.register(SelfDependent.class, Lifetime.TRANSIENT);

        CircularDependencyException exception = assertThrows(CircularDependencyException.class,
                () -> container.resolve(SelfDependent.class));

        assertEquals(List.of(ServiceKey.of(SelfDependent.class), ServiceKey.of(SelfDependent.class)),
                exception.getPath());
    }

    @Test
    void pathStartsAtTheRequestedServiceAndCycleStartsAtTheRepeatedOne() {
        Container container = Container.create();
        container.register(Entry.class, Lifetime.TRANSIENT);
        container.register(First.class, FirstImpl.class, Lifetime.TRANSIENT);
        container.register(Second.class, SecondImpl.class, Lifetime.TRANSIENT);

        CircularDependencyException exception = assertThrows(CircularDependencyException.class,
                () -> container.resolve(Entry.class));

        assertEquals(4, exception.getPath().size());
        assertEquals(ServiceKey.of(Entry.class), exception.getPath().get(0));
        assertEquals(List.of(ServiceKey.of(First.class), ServiceKey.of(Second.class), ServiceKey.of(First.class)),
                exception.getCycle());
    }

    @Test
    void detectsCyclesThroughSingletonsAndFactories() {
        Container container = Container.create();
        container.bind(First.class).asSingleton().toFactory(Second.class, FirstImpl::new);
        container.bind(Second.class).asSingleton().to(SecondImpl.class);

        CircularDependencyException exception = assertThrows(CircularDependencyException.class,
                () -> container.resolve(Second.class));

        assertEquals(List.of(ServiceKey.of(Second.class), ServiceKey.of(First.class), ServiceKey.of(Second.class)),
                exception.getPath());
    }

    @Test
    void tryResolvePropagatesCycles() {
        Container container = Container.create();
        container.register(SelfDependent.class, Lifetime.TRANSIENT);

        assertThrows(CircularDependencyException.class, () -> container.tryResolve(SelfDependent.class));
    }

    @Test
    void distinctKeysOfTheSameTypeAreNotACycle() {
        Container container = Container.create();
        container.bind(Message.class).named("outer").toFactory(
                arguments -> new Message("outer(" + ((Message) arguments[0]).text + ")"),
                ServiceKey.of(Message.class, "inner"));
        container.bind(Message.class).named("inner").toInstance(new Message("inner"));

        Message message = container.resolveKeyed(Message.class, "outer");

        assertEquals("outer(inner)", message.text);
    }

    @Test
    void stackUnwindsAfterFailedSiblingResolution() {
        Container container = Container.create();
        container.register(Broken.class, Lifetime.TRANSIENT);
        container.bind(Holder.class).toProvider(new Provider<Holder>() {
            @Override
            public @NotNull BuildStrategy getStrategy() {
                return BuildStrategy.FACTORY;
            }

            @Override
            public @NotNull List<ServiceKey<?>> getDependencies() {
                return Collections.emptyList();
            }

            @Override
            public @NotNull Holder provide(@NotNull ResolutionContext context) {
                assertThrows(NotRegisteredException.class, () -> context.resolve(Broken.class));
                assertEquals(List.of(ServiceKey.of(Holder.class)), context.getPath(),
                        "failed resolution should leave only the holder on the stack");

                NotRegisteredException again = assertThrows(NotRegisteredException.class,
                        () -> context.resolve(Broken.class));

                return new Holder(again);
            }
        });

        Holder holder = container.resolve(Holder.class);

        assertNotNull(holder.failure);
        assertEquals(ServiceKey.of(Missing.class), holder.failure.getKey());
    }

    @Test
    void containerStaysUsableAfterCycle() {
        Container container = Container.create();
        container.register(SelfDependent.class, Lifetime.TRANSIENT);
        container.register(Entry.class, Lifetime.TRANSIENT);
        container.register(First.class, FirstImpl.class, Lifetime.TRANSIENT);
        container.registerFactory(Second.class, () -> new Second() {
        }, Lifetime.TRANSIENT);

        assertThrows(CircularDependencyException.class, () -> container.resolve(SelfDependent.class));

        Entry entry = container.resolve(Entry.class);
        assertNotNull(entry.first);
    }

    interface First {
    }

    interface Second {
    }

    static class FirstImpl implements First {
        final Second second;

        FirstImpl(Second second) {
            this.second = second;
        }
    }

    static class SecondImpl implements Second {
        final First first;

        SecondImpl(First first) {
            this.first = first;
        }
    }

    static class SelfDependent {
        SelfDependent(SelfDependent self) {
        }
    }

    static class Entry {
        final First first;

        Entry(First first) {
            this.first = first;
        }
    }

    static class Message {
        final String text;

        Message(String text) {
            this.text = text;
        }
    }

    static class Missing {
    }

    static class Broken {
        Broken(Missing missing) {
        }
    }

    static class Holder {
        final NotRegisteredException failure;

        Holder(NotRegisteredException failure) {
            this.failure = failure;
        }
    }
}
