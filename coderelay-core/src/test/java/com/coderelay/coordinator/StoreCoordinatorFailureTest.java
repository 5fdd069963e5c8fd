package com.coderelay.coordinator;

import com.coderelay.CoordinatorException;
import com.coderelay.Reply;
import com.coderelay.RequestDroppedException;
import com.coderelay.Result;
import com.coderelay.bus.BusEvent;
import com.coderelay.bus.Signal;
import com.coderelay.bus.Subscription;
import com.coderelay.config.CoordinatorConfig;
import com.coderelay.mailbox.config.MailboxConfig;
import com.coderelay.model.AccessLevel;
import com.coderelay.model.CodeRow;
import com.coderelay.model.User;
import com.coderelay.store.StateStore;
import com.coderelay.store.StoreException;
import com.coderelay.test.AsyncAssertion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for StoreCoordinator with a mocked store covering:
 * - a store failure stops the coordinator as FAILED
 * - an Error thrown by the store fails the coordinator the same way
 * - requests queued behind Terminate are dropped, not executed
 * - an abandoned reply does not disturb later requests
 * - a full mailbox blocks callers until the coordinator catches up
 */
@ExtendWith(MockitoExtension.class)
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class StoreCoordinatorFailureTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Mock
    private StateStore store;

    @Test
    void testStoreFailureStopsCoordinator() throws Exception {
        when(store.findUser(7L)).thenThrow(new StoreException("findUser", new SQLException("disk I/O error")));
        StoreCoordinator coordinator = StoreCoordinator.start(store, config());
        CoordinatorHandle handle = coordinator.handle();
        Subscription subscription = coordinator.subscribe();

        Result<Boolean> result = handle.addUser(7L).await(TIMEOUT);

        assertTrue(result instanceof Result.Failure<Boolean> failure && failure.isDropped());
        AsyncAssertion.eventually(() -> coordinator.state() == CoordinatorState.FAILED, TIMEOUT);
        CoordinatorException error = assertThrows(CoordinatorException.class,
                () -> coordinator.awaitTermination(TIMEOUT));
        assertTrue(error.getCause() instanceof StoreException);
        assertEquals(CoordinatorState.FAILED, coordinator.state());
        verify(store).close();
        assertEquals(new Signal.Event(BusEvent.EXIT), subscription.receive(TIMEOUT).orElseThrow());
        assertEquals(Signal.CLOSED, subscription.receive(TIMEOUT).orElseThrow());

        assertEquals(Optional.empty(), handle.queryCode("ABCDE12345").toOptional());
        verify(store, never()).findCode(anyString());
    }

    @Test
    void testStoreCloseFailureIsLoggedNotThrown() throws Exception {
        doThrow(new StoreException("close", new SQLException("busy"))).when(store).close();
        StoreCoordinator coordinator = StoreCoordinator.start(store, config());

        assertTrue(coordinator.shutdown());

        assertEquals(CoordinatorState.CLOSED, coordinator.state());
    }

    @Test
    void testRequestsQueuedBehindTerminateAreDropped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(store.findCode("SLOW")).thenAnswer(invocation -> {
            entered.countDown();
            release.await();
            return Optional.of(new CodeRow("SLOW", 1, false));
        });
        StoreCoordinator coordinator = StoreCoordinator.start(store, config());
        CoordinatorHandle handle = coordinator.handle();

        var slow = handle.queryCode("SLOW");
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        var terminate = handle.terminate();
        var queued = handle.queryCode("QUEUED");
        release.countDown();

        assertEquals("SLOW", slow.get(TIMEOUT).orElseThrow().code());
        terminate.get(TIMEOUT);
        Result<Optional<CodeRow>> queuedResult = queued.await(TIMEOUT);
        assertFalse(queuedResult.isSuccess());
        assertTrue(((Result.Failure<Optional<CodeRow>>) queuedResult).error() instanceof RequestDroppedException);
        verify(store, never()).findCode("QUEUED");
        assertEquals(CoordinatorState.CLOSED, coordinator.state());
    }

    @Test
    void testErrorDuringDispatchStopsCoordinator() throws Exception {
        when(store.findUser(7L)).thenThrow(new AssertionError("native driver fault"));
        StoreCoordinator coordinator = StoreCoordinator.start(store, config());
        CoordinatorHandle handle = coordinator.handle();
        Subscription subscription = coordinator.subscribe();

        Result<Optional<User>> result = handle.queryUser(7L).await(TIMEOUT);

        assertTrue(result instanceof Result.Failure<Optional<User>> failure && failure.isDropped());
        AsyncAssertion.eventually(() -> coordinator.state() == CoordinatorState.FAILED, TIMEOUT);
        CoordinatorException error = assertThrows(CoordinatorException.class,
                () -> coordinator.awaitTermination(TIMEOUT));
        assertTrue(error.getCause() instanceof AssertionError);
        verify(store).close();
        assertEquals(new Signal.Event(BusEvent.EXIT), subscription.receive(TIMEOUT).orElseThrow());

        Result<Optional<User>> later = handle.queryUser(8L).await(TIMEOUT);
        assertTrue(later instanceof Result.Failure<Optional<User>> failure && failure.isDropped());
        verify(store, never()).findUser(8L);
    }

    @Test
    void testAbandonedReplyDoesNotDisturbLaterRequests() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(store.findCode("SLOW")).thenAnswer(invocation -> {
            entered.countDown();
            release.await();
            return Optional.empty();
        });
        when(store.findUser(1L)).thenReturn(Optional.of(new User(1L, AccessLevel.SEND)));
        when(store.findUser(2L)).thenReturn(Optional.of(new User(2L, AccessLevel.ALL)));
        StoreCoordinator coordinator = StoreCoordinator.start(store, config());
        CoordinatorHandle handle = coordinator.handle();

        handle.queryCode("SLOW");
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        Reply<Optional<User>> abandoned = handle.queryUser(1L);
        abandoned.future().cancel(true);
        release.countDown();

        assertEquals(AccessLevel.ALL, handle.queryUser(2L).get(TIMEOUT).orElseThrow().accessLevel());
        verify(store).findUser(1L);
        assertTrue(abandoned.future().isCancelled());
        assertEquals(CoordinatorState.RUNNING, coordinator.state());
        assertTrue(coordinator.shutdown());
    }

    @Test
    void testFullMailboxBlocksCallerUntilSlotFrees() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(store.findCode(anyString())).thenAnswer(invocation -> {
            entered.countDown();
            release.await();
            return Optional.empty();
        });
        CoordinatorConfig config = CoordinatorConfig.builder()
                .dbPath(Path.of("unused.db"))
                .mailboxConfig(new MailboxConfig().setCapacity(2))
                .shutdownTimeout(TIMEOUT)
                .build();
        StoreCoordinator coordinator = StoreCoordinator.start(store, config);
        CoordinatorHandle handle = coordinator.handle();

        handle.queryCode("BUSY");
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        handle.queryCode("FIRST");
        handle.queryCode("SECOND");
        assertEquals(2, coordinator.getQueuedRequests());

        AtomicReference<Reply<Optional<CodeRow>>> overflow = new AtomicReference<>();
        Thread caller = new Thread(() -> overflow.set(handle.queryCode("THIRD")), "blocked-caller");
        caller.start();

        caller.join(300);
        assertTrue(caller.isAlive());
        assertNull(overflow.get());

        release.countDown();
        caller.join(TIMEOUT.toMillis());
        assertFalse(caller.isAlive());
        assertEquals(Optional.empty(), overflow.get().get(TIMEOUT));
        verify(store).findCode("THIRD");
        assertTrue(coordinator.shutdown());
    }

    private static CoordinatorConfig config() {
        return CoordinatorConfig.builder()
                .dbPath(Path.of("unused.db"))
                .shutdownTimeout(TIMEOUT)
                .build();
    }
}
