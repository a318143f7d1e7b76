package org.sagebionetworks.mutex.lock;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.time.Duration;

import com.google.common.collect.ImmutableList;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import org.sagebionetworks.mutex.redis.FakeTicker;
import org.sagebionetworks.mutex.redis.InMemoryRedisOps;
import org.sagebionetworks.mutex.redis.RedisOps;
import org.sagebionetworks.mutex.redis.StoreUnavailableException;

public class LockHandleTest {
    private static final Duration TTL = Duration.ofSeconds(10);

    private FakeTicker ticker;
    private InMemoryRedisOps store;
    private RedisLock lock;

    @BeforeMethod
    public void before() {
        ticker = new FakeTicker();
        store = spy(new InMemoryRedisOps(ticker));
        lock = new RedisLock(store);
    }

    @Test
    public void testRelease() {
        LockHandle handle = lock.acquire("key", TTL).get();
        assertTrue(handle.release());
        assertFalse(handle.isHeld());
        assertNull(handle.getToken());
        assertNull(store.get("key"));
        // free for the next caller
        assertTrue(lock.acquire("key", TTL).isPresent());
    }

    @Test
    public void testReleaseIsIdempotent() {
        LockHandle handle = lock.acquire("key", TTL).get();
        assertTrue(handle.release());
        assertFalse(handle.release());
        assertFalse(handle.release());
        verify(store, times(1)).eval(eq(CompareAndDelete.SCRIPT), anyList(), anyList());
    }

    @Test
    public void testReleaseLeavesOtherHoldersKey() {
        LockHandle handle = lock.acquire("key", TTL).get();
        store.set("key", "new-owner");

        assertFalse(handle.release());

        assertFalse(handle.isHeld());
        assertEquals(store.get("key"), "new-owner");
    }

    @Test
    public void testReleaseAfterExpiryDoesNotDeleteNewHolder() {
        LockHandle first = lock.acquire("key", TTL).get();
        ticker.advance(TTL);
        LockHandle second = lock.acquire("key", TTL).get();

        assertFalse(first.release());

        assertTrue(second.isHeld());
        assertEquals(store.get("key"), second.getToken());
        assertTrue(second.release());
    }

    @Test
    public void testReleaseAfterExpiry() {
        LockHandle handle = lock.acquire("key", TTL).get();
        ticker.advance(TTL.plusMillis(1));
        assertFalse(handle.release());
        assertFalse(handle.isHeld());
    }

    @Test
    public void testReleaseScriptFailureKeepsHandleHeld() {
        RedisOps ops = mock(RedisOps.class);
        StoreUnavailableException error = new StoreUnavailableException("down", new RuntimeException());
        when(ops.eval(eq(CompareAndDelete.SCRIPT), anyList(), anyList())).thenThrow(error).thenReturn(1L);
        LockHandle handle = new LockHandle(ops, "key", 10000L, "token");

        try {
            handle.release();
            fail("ScriptExecutionFailedException expected.");
        } catch (ScriptExecutionFailedException e) {
            assertSame(e.getCause(), error);
        }
        assertTrue(handle.isHeld());
        assertEquals(handle.getToken(), "token");

        // retried once the store is back
        assertTrue(handle.release());
        verify(ops, times(2)).eval(CompareAndDelete.SCRIPT, ImmutableList.of("key"), ImmutableList.of("token"));
    }

    @Test
    public void testCloseReleases() {
        try (LockHandle handle = lock.acquire("key", TTL).get()) {
            assertEquals(store.get("key"), handle.getToken());
        }
        assertNull(store.get("key"));
    }

    @Test
    public void testCloseAfterReleaseDoesNothing() {
        LockHandle handle = lock.acquire("key", TTL).get();
        handle.release();
        handle.close();
        verify(store, times(1)).eval(eq(CompareAndDelete.SCRIPT), anyList(), anyList());
    }

    @Test
    public void testCloseLogsFailure() {
        RedisOps ops = mock(RedisOps.class);
        when(ops.eval(eq(CompareAndDelete.SCRIPT), anyList(), anyList()))
                .thenThrow(new StoreUnavailableException("down", new RuntimeException()));
        LockHandle handle = new LockHandle(ops, "key", 10000L, "token");

        // does not throw
        handle.close();

        assertTrue(handle.isHeld());
    }

    @Test
    public void testSuppressAutoRelease() {
        LockHandle handle = lock.acquire("key", TTL).get();
        handle.suppressAutoRelease();
        assertTrue(handle.isAutoReleaseSuppressed());

        handle.close();

        assertTrue(handle.isHeld());
        assertEquals(store.get("key"), handle.getToken());
        assertEquals(store.pttl("key"), 10000L);
        verify(store, never()).eval(eq(CompareAndDelete.SCRIPT), anyList(), anyList());

        // expiry still frees it
        ticker.advance(TTL);
        assertTrue(lock.acquire("key", TTL).isPresent());
    }

    @Test
    public void testSuppressedHandleCanStillBeReleased() {
        LockHandle handle = lock.acquire("key", TTL).get();
        handle.suppressAutoRelease();
        assertTrue(handle.release());
        assertNull(store.get("key"));
    }

    @Test
    public void testToString() {
        LockHandle handle = lock.acquire("key", TTL).get();
        String string = handle.toString();
        assertTrue(string.contains("key=key"));
        assertTrue(string.contains("held=true"));
        // the token is a credential of sorts
        assertFalse(string.contains(handle.getToken()));
    }
}
