package dev.fumaz.graft.scope;

import dev.fumaz.graft.bind.Lifetime;
import dev.fumaz.graft.container.Container;
import dev.fumaz.graft.exception.NoActiveScopeException;
import dev.fumaz.graft.exception.ProvisionException;
import dev.fumaz.graft.exception.ScopeAlreadyActiveException;
import dev.fumaz.graft.exception.ScopeRequiredException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScopeLifecycleTest {

    private Container container;
    private List<String> closed;

    @BeforeEach
    void setUp() {
        container = Container.create();
        closed = new ArrayList<>();
    }

    @AfterEach
    void endLeftoverScope() {
        if (container.hasActiveScope()) {
            container.endScope();
        }
    }

    @Test
    void scopedInstanceIsSharedWithinScope() {
        container.register(Session.class, Lifetime.SCOPED);

        try (ScopeHandle ignored = container.beginScope()) {
            assertSame(container.resolve(Session.class), container.resolve(Session.class));
        }
    }

    @Test
    void newScopeBuildsNewInstance() {
        container.register(Session.class, Lifetime.SCOPED);

        container.beginScope();
        Session first = container.resolve(Session.class);
        container.endScope();

        container.beginScope();
        Session second = container.resolve(Session.class);
        container.endScope();

        assertNotSame(first, second);
    }

    @Test
    void scopedServiceRequiresActiveScope() {
        container.register(Session.class, Lifetime.SCOPED);

        ScopeRequiredException exception = assertThrows(ScopeRequiredException.class,
                () -> container.resolve(Session.class));

        assertEquals(Session.class, exception.getKey().getType());
    }

    @Test
    void scopedDependencyOfTransientRequiresActiveScope() {
        container.register(Session.class, Lifetime.SCOPED);
        container.register(Handler.class, Lifetime.TRANSIENT);

        assertThrows(ScopeRequiredException.class, () -> container.resolve(Handler.class));
    }

    @Test
    void transientsInOneScopeShareScopedDependency() {
        container.register(Session.class, Lifetime.SCOPED);
        container.register(Handler.class, Lifetime.TRANSIENT);

        try (ScopeHandle ignored = container.beginScope()) {
            Handler first = container.resolve(Handler.class);
            Handler second = container.resolve(Handler.class);

            assertNotSame(first, second);
            assertSame(first.session, second.session);
        }
    }

    @Test
    void scopesDoNotNest() {
        ScopeHandle handle = container.beginScope();

        ScopeAlreadyActiveException exception = assertThrows(ScopeAlreadyActiveException.class,
                container::beginScope);

        assertEquals(handle.getId(), exception.getActiveScope());
        assertTrue(handle.isActive());
    }

    @Test
    void endingWithoutScopeFails() {
        assertThrows(NoActiveScopeException.class, container::endScope);
    }

    @Test
    void handleReportsScopeState() {
        ScopeHandle handle = container.beginScope();

        assertTrue(container.hasActiveScope());
        assertSame(handle, container.currentScope().orElseThrow());

        handle.close();

        assertFalse(handle.isActive());
        assertFalse(container.hasActiveScope());
        assertTrue(container.currentScope().isEmpty());
    }

    @Test
    void closingHandleTwiceIsHarmless() {
        ScopeHandle handle = container.beginScope();

        handle.close();
        handle.close();

        assertFalse(container.hasActiveScope());
    }

    @Test
    void staleHandleDoesNotEndNewerScope() {
        ScopeHandle first = container.beginScope();
        container.endScope();
        ScopeHandle second = container.beginScope();

        first.close();

        assertTrue(second.isActive());
        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void closeableScopedInstancesAreClosedNewestFirst() {
        container.registerFactory(First.class, () -> new First(closed), Lifetime.SCOPED);
        container.registerFactory(Second.class, () -> new Second(closed), Lifetime.SCOPED);

        try (ScopeHandle ignored = container.beginScope()) {
            container.resolve(First.class);
            container.resolve(Second.class);
            assertTrue(closed.isEmpty());
        }

        assertEquals(List.of("second", "first"), closed);
    }

    @Test
    void prebuiltInstanceIsNotClosed() {
        First shared = new First(closed);
        container.bind(First.class).asScoped().toInstance(shared);

        try (ScopeHandle ignored = container.beginScope()) {
            assertSame(shared, container.resolve(First.class));
        }

        assertTrue(closed.isEmpty());
    }

    @Test
    void singletonsSurviveScopeEnd() {
        container.registerFactory(First.class, () -> new First(closed), Lifetime.SINGLETON);

        container.beginScope();
        First first = container.resolve(First.class);
        container.endScope();

        assertTrue(closed.isEmpty());
        assertSame(first, container.resolve(First.class));
    }

    @Test
    void closeFailureIsReportedAfterScopeEnds() {
        container.registerFactory(First.class, () -> new First(closed), Lifetime.SCOPED);
        container.register(Failing.class, Lifetime.SCOPED);
        container.beginScope();
        container.resolve(First.class);
        container.resolve(Failing.class);

        ProvisionException exception = assertThrows(ProvisionException.class, container::endScope);

        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertEquals(List.of("first"), closed, "remaining instances are still closed");
        assertFalse(container.hasActiveScope());
    }

    @Test
    void everyCloseFailureIsKept() {
        container.registerKeyed(Failing.class, "a", Failing.class, Lifetime.SCOPED);
        container.registerKeyed(Failing.class, "b", Failing.class, Lifetime.SCOPED);
        container.beginScope();
        container.resolveKeyed(Failing.class, "a");
        container.resolveKeyed(Failing.class, "b");

        ProvisionException exception = assertThrows(ProvisionException.class, container::endScope);

        assertEquals(1, exception.getSuppressed().length);
    }

    @Test
    void scopeIsInvisibleToOtherThreads() throws Exception {
        container.register(Session.class, Lifetime.SCOPED);
        container.beginScope();

        CompletableFuture<Boolean> otherThread = CompletableFuture.supplyAsync(() -> container.hasActiveScope());

        assertFalse(otherThread.get(5, TimeUnit.SECONDS));

        CompletableFuture<Session> resolved = CompletableFuture.supplyAsync(() -> container.resolve(Session.class));
        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> resolved.get(5, TimeUnit.SECONDS));

        assertInstanceOf(ScopeRequiredException.class, exception.getCause());
    }

    @Test
    void handleCannotBeClosedFromAnotherThread() throws Exception {
        ScopeHandle handle = container.beginScope();

        CompletableFuture<Void> close = CompletableFuture.runAsync(handle::close);
        ExecutionException exception = assertThrows(ExecutionException.class, () -> close.get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertTrue(handle.isActive());
    }

    static class Session {
    }

    static class Handler {
        final Session session;

        Handler(Session session) {
            this.session = session;
        }
    }

    static class First implements AutoCloseable {
        private final List<String> closed;

        First(List<String> closed) {
            this.closed = closed;
        }

        @Override
        public void close() {
            closed.add("first");
        }
    }

    static class Second implements AutoCloseable {
        private final List<String> closed;

        Second(List<String> closed) {
            this.closed = closed;
        }

        @Override
        public void close() {
            closed.add("second");
        }
    }

    static class Failing implements AutoCloseable {
        @Override
        public void close() {
            throw new IllegalStateException("cannot close");
        }
    }
}
