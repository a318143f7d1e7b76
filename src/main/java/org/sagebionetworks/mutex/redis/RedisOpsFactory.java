package org.sagebionetworks.mutex.redis;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisCluster;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import org.sagebionetworks.mutex.config.Config;
import org.sagebionetworks.mutex.lock.LockSettings;

/**
 * Builds {@link RedisOps} from config. A non-empty <code>redis.cluster.nodes</code> selects cluster mode; otherwise
 * <code>redis.url</code> names the single node, e.g. <code>redis://:password@host:6379/0</code>.
 */
public final class RedisOpsFactory {
    private static final Logger LOG = LoggerFactory.getLogger(RedisOpsFactory.class);

    static final String URL_KEY = "redis.url";
    static final String CLUSTER_NODES_KEY = "redis.cluster.nodes";
    static final String TIMEOUT_KEY = "redis.timeout.millis";
    static final String CLUSTER_MAX_ATTEMPTS_KEY = "redis.cluster.max.attempts";
    static final String POOL_MAX_TOTAL_KEY = "redis.pool.max.total";
    static final String POOL_MIN_IDLE_KEY = "redis.pool.min.idle";
    static final String POOL_MAX_WAIT_KEY = "redis.pool.max.wait.millis";
    static final String PING_ON_START_KEY = "redis.ping.on.start";

    static final String PONG = "PONG";

    private RedisOpsFactory() {
    }

    /**
     * Creates the ops described by the config. With <code>redis.ping.on.start</code> the server is pinged once, so
     * a wrong address fails here rather than on the first lock.
     */
    public static RedisOps create(Config config) {
        checkNotNull(config);
        final List<String> clusterNodes = config.getList(CLUSTER_NODES_KEY);
        final RedisOps ops;
        if (clusterNodes.isEmpty()) {
            final URI uri = URI.create(config.get(URL_KEY));
            LOG.info("Connecting to Redis at " + uri.getHost() + ":" + uri.getPort());
            ops = new JedisOps(new JedisPool(poolConfig(config), uri, config.getInt(TIMEOUT_KEY)));
        } else {
            LOG.info("Connecting to Redis cluster " + clusterNodes);
            ops = new JedisClusterOps(new JedisCluster(parseNodes(clusterNodes), config.getInt(TIMEOUT_KEY),
                    config.getInt(CLUSTER_MAX_ATTEMPTS_KEY), poolConfig(config)));
        }
        if (config.getBoolean(PING_ON_START_KEY)) {
            try {
                checkAlive(ops);
            } catch (RuntimeException ex) {
                ops.close();
                throw ex;
            }
        }
        return ops;
    }

    /**
     * Wraps the ops for non-blocking use on a fixed pool of daemon threads. Size it to
     * <code>redis.pool.max.total</code> at most; more threads would only queue on the connection pool. Closing the
     * returned ops shuts the thread pool down; the wrapped ops stay open.
     */
    public static AsyncRedisOps newAsyncOps(RedisOps ops, int threads) {
        checkNotNull(ops);
        checkArgument(threads > 0, "threads must be positive: %s", threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("redis-mutex-%d").setDaemon(true).build());
        return ExecutorAsyncRedisOps.owning(ops, executor);
    }

    /** Same as {@link #newAsyncOps(RedisOps, int)}, sized by <code>lock.async.threads</code>. */
    public static AsyncRedisOps newAsyncOps(RedisOps ops, LockSettings settings) {
        checkNotNull(settings);
        return newAsyncOps(ops, settings.getAsyncThreads());
    }

    /** Pings the server and fails unless it answers PONG. */
    static void checkAlive(RedisOps ops) {
        final String reply = ops.ping();
        if (!PONG.equals(reply)) {
            throw new RedisException("Unexpected PING reply: " + reply);
        }
    }

    static JedisPoolConfig poolConfig(Config config) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(config.getInt(POOL_MAX_TOTAL_KEY));
        poolConfig.setMinIdle(config.getInt(POOL_MIN_IDLE_KEY));
        poolConfig.setMaxWaitMillis(config.getLong(POOL_MAX_WAIT_KEY));
        // validate connections before lending them
        poolConfig.setTestOnBorrow(true);
        return poolConfig;
    }

    /** Parses <code>host:port</code> entries. */
    static Set<HostAndPort> parseNodes(List<String> nodes) {
        Set<HostAndPort> parsed = new LinkedHashSet<>();
        for (String node : nodes) {
            int colon = node.lastIndexOf(':');
            checkArgument(colon > 0 && colon < node.length() - 1, "Expected host:port, got '%s'", node);
            String host = node.substring(0, colon);
            int port;
            try {
                port = Integer.parseInt(node.substring(colon + 1));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid port in '" + node + "'", ex);
            }
            parsed.add(new HostAndPort(host, port));
        }
        return parsed;
    }
}
