package com.coderelay;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ReplyTest {

    @Test
    void testDroppedReplyIsAbsent() {
        Reply<String> reply = Reply.failed(new RequestDroppedException("QueryCode"));

        assertEquals(Optional.empty(), reply.toOptional());
        Result<String> result = reply.await();
        assertTrue(result instanceof Result.Failure<String> failure && failure.isDropped());
        assertThrows(RequestDroppedException.class, reply::get);
    }

    @Test
    void testOtherFailuresAreWrapped() {
        Reply<String> reply = Reply.failed(new IllegalStateException("boom"));

        ReplyException error = assertThrows(ReplyException.class, reply::get);
        assertTrue(error.getCause() instanceof IllegalStateException);
    }

    @Test
    void testMapAndPoll() {
        CompletableFuture<Integer> future = new CompletableFuture<>();
        Reply<String> reply = Reply.from(future).map(value -> "v" + value);

        assertEquals(Optional.empty(), reply.poll());
        future.complete(7);
        assertEquals("v7", reply.get());
        assertEquals(Optional.of("v7"), reply.toOptional());
    }

    @Test
    void testTimeouts() {
        Reply<String> reply = Reply.from(new CompletableFuture<>());

        assertThrows(TimeoutException.class, () -> reply.get(Duration.ofMillis(20)));
        Result<String> result = reply.await(Duration.ofMillis(20));
        assertTrue(result instanceof Result.Failure<String> failure && failure.error() instanceof TimeoutException);
    }

    @Test
    void testResultHelpers() {
        Result<Integer> success = Result.success(2);
        Result<Integer> failure = Result.failure(new RequestDroppedException("AddUser"));

        assertEquals(4, success.map(v -> v * 2).getOrThrow());
        assertEquals(-1, failure.getOrElse(-1));
        assertEquals(Optional.empty(), failure.toOptional());
        assertThrows(RequestDroppedException.class, failure::getOrThrow);
    }
}
