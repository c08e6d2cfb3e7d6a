package com.accountability.leaderboard.repository.impl;

import com.accountability.leaderboard.model.CachedLeaderboardPage;
import com.accountability.leaderboard.repository.LeaderboardCacheRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.time.Instant;
import java.util.Optional;

/**
 * Redis-backed page cache.
 *
 * <p>Keys embed an invalidation generation ({@code <prefix>:v<generation>:<page>:<size>}).
 * Invalidation bumps the generation, so readers stop seeing old pages at once; the old keys
 * are left to their TTL. Every Redis failure is logged and treated as a miss; when the
 * generation itself cannot be read no key is handed out, so a reader never falls back to a
 * generation that may already be invalidated.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.cache.enabled", havingValue = "true", matchIfMissing = true)
public class JedisLeaderboardCacheRepository implements LeaderboardCacheRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisLeaderboardCacheRepository.class);

    private static final String GENERATION_SUFFIX = ":generation";

    private final String redisHost;
    private final int redisPort;
    private final String redisPassword;
    private final boolean redisSsl;
    private final int timeout;
    private final ObjectMapper objectMapper;

    private JedisPool jedisPool;
    private volatile boolean available = false;

    @Autowired
    public JedisLeaderboardCacheRepository(
            @Value("${redis.host:localhost}") String redisHost,
            @Value("${redis.port:6379}") int redisPort,
            @Value("${redis.password:}") String redisPassword,
            @Value("${redis.ssl:false}") boolean redisSsl,
            @Value("${redis.timeout:2000}") int timeout) {
        this.redisHost = redisHost;
        this.redisPort = redisPort;
        this.redisPassword = redisPassword;
        this.redisSsl = redisSsl;
        this.timeout = timeout;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    JedisLeaderboardCacheRepository(JedisPool jedisPool) {
        this("localhost", 6379, "", false, 2000);
        this.jedisPool = jedisPool;
        this.available = true;
    }

    @PostConstruct
    public void init() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(64);
            poolConfig.setMaxIdle(16);
            poolConfig.setMinIdle(4);
            poolConfig.setTestOnBorrow(true);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);

            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }

            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.warn("Redis unavailable at {}:{}, leaderboard pages will not be cached: {}",
                redisHost, redisPort, e.getMessage());
            available = false;
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    /**
     * Pings Redis. A failed ping marks the cache unavailable until the next successful one.
     */
    @Override
    public boolean isAvailable() {
        if (jedisPool == null) {
            return false;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            if (!available) {
                logger.info("Redis connection restored at {}:{}", redisHost, redisPort);
            }
            available = true;
            return true;
        } catch (Exception e) {
            if (available) {
                logger.warn("Lost Redis connection: {}", e.getMessage());
            }
            available = false;
            return false;
        }
    }

    @Override
    public Optional<CachedLeaderboardPage> get(String key) {
        if (key == null || key.isBlank() || jedisPool == null) {
            return Optional.empty();
        }

        try (Jedis jedis = jedisPool.getResource()) {
            String payload = jedis.get(key);
            if (payload == null) {
                logger.debug("Leaderboard cache miss: {}", key);
                return Optional.empty();
            }

            CachedLeaderboardPage page = deserialize(payload);
            if (page.isExpiredAt(Instant.now())) {
                logger.debug("Leaderboard cache entry expired: {}", key);
                jedis.del(key);
                return Optional.empty();
            }

            logger.debug("Leaderboard cache hit: {}", key);
            return Optional.of(page);
        } catch (Exception e) {
            logger.warn("Failed to read leaderboard cache key {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, CachedLeaderboardPage page, int ttlSeconds) {
        if (key == null || key.isBlank() || page == null || ttlSeconds <= 0 || jedisPool == null) {
            return;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            Instant now = Instant.now();
            page.setCachedAt(now);
            page.setExpiresAt(now.plusSeconds(ttlSeconds));
            jedis.setex(key, ttlSeconds, serialize(page));
            logger.debug("Cached leaderboard page {} (ttl={}s)", key, ttlSeconds);
        } catch (Exception e) {
            logger.warn("Failed to cache leaderboard page {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void invalidateAll(String prefix) {
        if (prefix == null || prefix.isBlank() || jedisPool == null) {
            return;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            long generation = jedis.incr(prefix + GENERATION_SUFFIX);
            logger.info("Invalidated leaderboard cache, generation now {}", generation);
        } catch (Exception e) {
            logger.warn("Failed to invalidate leaderboard cache with prefix {}: {}", prefix, e.getMessage());
        }
    }

    @Override
    public Optional<String> pageKey(String prefix, int pageIndex, int pageSize) {
        return currentGeneration(prefix).map(generation -> buildPageKey(prefix, generation, pageIndex, pageSize));
    }

    private Optional<Long> currentGeneration(String prefix) {
        if (jedisPool == null) {
            return Optional.empty();
        }

        try (Jedis jedis = jedisPool.getResource()) {
            String value = jedis.get(prefix + GENERATION_SUFFIX);
            return Optional.of(value != null ? Long.parseLong(value) : 0L);
        } catch (Exception e) {
            logger.debug("Could not read cache generation for {}, bypassing cache: {}", prefix, e.getMessage());
            return Optional.empty();
        }
    }

    String serialize(CachedLeaderboardPage page) throws JsonProcessingException {
        return objectMapper.writeValueAsString(page);
    }

    CachedLeaderboardPage deserialize(String payload) throws JsonProcessingException {
        return objectMapper.readValue(payload, CachedLeaderboardPage.class);
    }

    static String buildPageKey(String prefix, long generation, int pageIndex, int pageSize) {
        return prefix + ":v" + generation + ":" + pageIndex + ":" + pageSize;
    }
}
