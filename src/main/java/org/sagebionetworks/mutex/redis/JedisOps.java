package org.sagebionetworks.mutex.redis;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisExhaustedPoolException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

/**
 * A thin wrapper of <code>Jedis</code>. Provides a template
 * that obtains a <code>Jedis</code> instance from a pool,
 * executes a command on the <code>Jedis</code> instance, and
 * returns the <code>Jedis</code> instance to the pool after
 * the command execution.
 * <p>
 * Jedis failures are translated: connection and pool failures become
 * {@link StoreUnavailableException}, anything else a plain {@link RedisException}.
 */
public class JedisOps implements RedisOps {

    static final String OK = "OK";

    private final JedisPool jedisPool;

    public JedisOps(JedisPool jedisPool) {
        checkNotNull(jedisPool);
        this.jedisPool = jedisPool;
    }

    @Override
    public boolean setNxPx(final String key, final String value, final long ttlMillis) {
        return new AbstractJedisTemplate<Boolean>("SET NX PX " + key) {
            @Override
            Boolean execute(Jedis jedis) {
                return OK.equals(jedis.set(key, value, SetParams.setParams().nx().px(ttlMillis)));
            }
        }.execute();
    }

    @Override
    public String get(final String key) {
        return new AbstractJedisTemplate<String>("GET " + key) {
            @Override
            String execute(Jedis jedis) {
                return jedis.get(key);
            }
        }.execute();
    }

    @Override
    public long pttl(final String key) {
        return new AbstractJedisTemplate<Long>("PTTL " + key) {
            @Override
            Long execute(Jedis jedis) {
                return jedis.pttl(key);
            }
        }.execute();
    }

    @Override
    public Object eval(final String script, final List<String> keys, final List<String> args) {
        return new AbstractJedisTemplate<Object>("EVAL " + keys) {
            @Override
            Object execute(Jedis jedis) {
                return jedis.eval(script, keys, args);
            }
        }.execute();
    }

    @Override
    public String ping() {
        return new AbstractJedisTemplate<String>("PING") {
            @Override
            String execute(Jedis jedis) {
                return jedis.ping();
            }
        }.execute();
    }

    /** Closes the pool. */
    @Override
    public void close() {
        jedisPool.close();
    }

    /** Maps a Jedis failure onto the store exception hierarchy. Shared with the cluster ops. */
    static RedisException translate(final String command, final JedisException ex) {
        if (ex instanceof JedisConnectionException || ex instanceof JedisExhaustedPoolException) {
            return new StoreUnavailableException("Redis unavailable for " + command + ": " + ex.getMessage(), ex);
        }
        return new RedisException("Redis command " + command + " failed: " + ex.getMessage(), ex);
    }

    /**
     * Responsible for providing template code such as closing resources.
     */
    private abstract class AbstractJedisTemplate<T> {
        private final String command;

        AbstractJedisTemplate(String command) {
            this.command = command;
        }

        T execute() {
            try (Jedis jedis = jedisPool.getResource()) {
                return execute(jedis);
            } catch (JedisException ex) {
                throw translate(command, ex);
            }
        }

        abstract T execute(final Jedis jedis);
    }
}
