package org.sagebionetworks.mutex.lock;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import org.sagebionetworks.mutex.redis.AsyncRedisOps;
import org.sagebionetworks.mutex.redis.RedisException;
import org.sagebionetworks.mutex.redis.RedisOps;

public class CompareAndDeleteTest {
    private static final List<String> KEYS = ImmutableList.of("key");
    private static final List<String> ARGS = ImmutableList.of("token");

    @Test
    public void testDeleted() {
        RedisOps ops = mock(RedisOps.class);
        when(ops.eval(CompareAndDelete.SCRIPT, KEYS, ARGS)).thenReturn(1L);
        assertTrue(CompareAndDelete.run(ops, "key", "token"));
    }

    @Test
    public void testNotDeleted() {
        RedisOps ops = mock(RedisOps.class);
        when(ops.eval(CompareAndDelete.SCRIPT, KEYS, ARGS)).thenReturn(0L);
        assertFalse(CompareAndDelete.run(ops, "key", "token"));
    }

    @Test
    public void testUnexpectedReply() {
        RedisOps ops = mock(RedisOps.class);
        when(ops.eval(CompareAndDelete.SCRIPT, KEYS, ARGS)).thenReturn("OK");
        assertFalse(CompareAndDelete.run(ops, "key", "token"));
    }

    @Test
    public void testScriptError() {
        RedisOps ops = mock(RedisOps.class);
        RedisException error = new RedisException("NOSCRIPT");
        when(ops.eval(CompareAndDelete.SCRIPT, KEYS, ARGS)).thenThrow(error);
        try {
            CompareAndDelete.run(ops, "key", "token");
            fail("ScriptExecutionFailedException expected.");
        } catch (ScriptExecutionFailedException e) {
            assertSame(e.getCause(), error);
        }
    }

    @Test
    public void testAsyncScriptError() throws Exception {
        AsyncRedisOps ops = mock(AsyncRedisOps.class);
        RedisException error = new RedisException("NOSCRIPT");
        when(ops.eval(CompareAndDelete.SCRIPT, KEYS, ARGS))
                .thenReturn(CompletableFuture.failedFuture(error));
        try {
            CompareAndDelete.runAsync(ops, "key", "token").get();
            fail("ExecutionException expected.");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof ScriptExecutionFailedException);
            assertSame(e.getCause().getCause(), error);
        }
    }
}
