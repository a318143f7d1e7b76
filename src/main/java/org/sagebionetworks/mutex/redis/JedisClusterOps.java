package org.sagebionetworks.mutex.redis;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.Map;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisCluster;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

/**
 * Treats a <code>JedisCluster</code> as a single logical endpoint. Every command the lock issues touches exactly one
 * key, so the cluster client routes it to the owning shard and the single-instance semantics hold per key.
 */
public class JedisClusterOps implements RedisOps {

    private final JedisCluster jedisCluster;

    public JedisClusterOps(JedisCluster jedisCluster) {
        checkNotNull(jedisCluster);
        this.jedisCluster = jedisCluster;
    }

    @Override
    public boolean setNxPx(final String key, final String value, final long ttlMillis) {
        try {
            return JedisOps.OK.equals(jedisCluster.set(key, value, SetParams.setParams().nx().px(ttlMillis)));
        } catch (JedisException ex) {
            throw JedisOps.translate("SET NX PX " + key, ex);
        }
    }

    @Override
    public String get(final String key) {
        try {
            return jedisCluster.get(key);
        } catch (JedisException ex) {
            throw JedisOps.translate("GET " + key, ex);
        }
    }

    @Override
    public long pttl(final String key) {
        try {
            return jedisCluster.pttl(key);
        } catch (JedisException ex) {
            throw JedisOps.translate("PTTL " + key, ex);
        }
    }

    @Override
    public Object eval(final String script, final List<String> keys, final List<String> args) {
        try {
            return jedisCluster.eval(script, keys, args);
        } catch (JedisException ex) {
            throw JedisOps.translate("EVAL " + keys, ex);
        }
    }

    /**
     * Pings the first reachable node. The cluster is usable as long as one node answers, because the client
     * refreshes its slot map from any of them.
     */
    @Override
    public String ping() {
        JedisException last = null;
        for (Map.Entry<String, JedisPool> node : jedisCluster.getClusterNodes().entrySet()) {
            try (Jedis jedis = node.getValue().getResource()) {
                return jedis.ping();
            } catch (JedisException ex) {
                last = ex;
            }
        }
        if (last == null) {
            last = new JedisConnectionException("No cluster nodes known.");
        }
        throw JedisOps.translate("PING", last);
    }

    /** Closes the connection pools of all cluster nodes. */
    @Override
    public void close() {
        jedisCluster.close();
    }
}
