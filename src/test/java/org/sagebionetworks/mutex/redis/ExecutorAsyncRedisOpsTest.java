package org.sagebionetworks.mutex.redis;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.collect.ImmutableList;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class ExecutorAsyncRedisOpsTest {

    private RedisOps ops;
    private ExecutorService executor;
    private ExecutorAsyncRedisOps asyncOps;

    @BeforeMethod
    public void before() {
        ops = mock(RedisOps.class);
        executor = Executors.newSingleThreadExecutor();
        asyncOps = new ExecutorAsyncRedisOps(ops, executor);
    }

    @AfterMethod
    public void after() {
        executor.shutdownNow();
    }

    @Test
    public void testCommandsRunOnExecutor() throws Exception {
        AtomicReference<Thread> caller = new AtomicReference<>();
        when(ops.setNxPx("key", "token", 100L)).thenAnswer(invocation -> {
            caller.set(Thread.currentThread());
            return true;
        });
        assertTrue(asyncOps.setNxPx("key", "token", 100L).get(5, TimeUnit.SECONDS));
        assertTrue(caller.get() != Thread.currentThread());
    }

    @Test
    public void testDelegates() throws Exception {
        List<String> keys = ImmutableList.of("key");
        List<String> args = ImmutableList.of("token");
        when(ops.setNxPx("key", "token", 1000L)).thenReturn(true);
        when(ops.get("key")).thenReturn("token");
        when(ops.eval("script", keys, args)).thenReturn(1L);

        assertTrue(asyncOps.setNxPx("key", "token", 1000L).get(5, TimeUnit.SECONDS));
        assertEquals(asyncOps.get("key").get(5, TimeUnit.SECONDS), "token");
        assertEquals(asyncOps.eval("script", keys, args).get(5, TimeUnit.SECONDS), 1L);
        verify(ops).eval("script", keys, args);
    }

    @Test
    public void testFailureCompletesExceptionally() throws Exception {
        RedisException error = new StoreUnavailableException("down", new RuntimeException());
        when(ops.get("key")).thenThrow(error);
        CompletableFuture<String> future = asyncOps.get("key");
        try {
            future.get(5, TimeUnit.SECONDS);
            fail("ExecutionException expected.");
        } catch (ExecutionException e) {
            assertSame(e.getCause(), error);
        }
    }

    @Test
    public void testCloseLeavesCallersExecutorRunning() throws Exception {
        when(ops.get("key")).thenReturn("token");
        asyncOps.close();
        assertFalse(executor.isShutdown());
        assertEquals(asyncOps.get("key").get(5, TimeUnit.SECONDS), "token");
    }

    @Test
    public void testCloseShutsDownOwnedExecutor() throws Exception {
        ExecutorService owned = Executors.newSingleThreadExecutor();
        ExecutorAsyncRedisOps owningOps = ExecutorAsyncRedisOps.owning(ops, owned);
        when(ops.get("key")).thenReturn("token");
        CompletableFuture<String> submitted = owningOps.get("key");

        owningOps.close();

        assertTrue(owned.isShutdown());
        // already submitted work still runs
        assertEquals(submitted.get(5, TimeUnit.SECONDS), "token");
        assertTrue(owned.awaitTermination(5, TimeUnit.SECONDS));
        verify(ops, never()).close();
    }

    @Test(expectedExceptions = RejectedExecutionException.class)
    public void testCommandAfterCloseIsRejected() {
        ExecutorAsyncRedisOps owningOps = ExecutorAsyncRedisOps.owning(ops, Executors.newSingleThreadExecutor());
        owningOps.close();
        owningOps.get("key");
    }
}
