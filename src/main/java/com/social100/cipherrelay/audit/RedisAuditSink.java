package com.social100.cipherrelay.audit;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.StreamEntryID;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.XAddParams;

/**
 * Appends {@link AuditEvent}s to a Redis stream.
 *
 * <p>The stream is trimmed approximately to {@code maxLength} entries on every append. A failed
 * append is logged and dropped; the relay keeps routing.</p>
 */
public class RedisAuditSink implements AuditSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(RedisAuditSink.class);

  // connect=1s, read/write=3s
  private static final int CONNECT_TIMEOUT_MS = 1000;
  private static final int SO_TIMEOUT_MS = 3000;
  private static final String CLIENT_NAME = "cipher-relay-audit";

  private final JedisPool pool;
  private final String streamName;
  private final long maxLength;

  public RedisAuditSink(String host, int port, String streamName, long maxLength) {
    this(createPool(host, port), streamName, maxLength);
  }

  RedisAuditSink(JedisPool pool, String streamName, long maxLength) {
    this.pool = pool;
    this.streamName = streamName;
    this.maxLength = maxLength;
  }

  @Override
  public void record(AuditEvent event) {
    try (Jedis jedis = pool.getResource()) {
      XAddParams params = new XAddParams().approximateTrimming().maxLen(maxLength);
      StreamEntryID id = jedis.xadd(streamName, params, event.toFields());
      LOGGER.trace("Audit {} -> {} {}", event.type(), streamName, id);
    } catch (JedisException e) {
      LOGGER.warn("Audit publish of {} to '{}' failed: {}", event.type(), streamName, e.getMessage());
    }
  }

  @Override
  public void close() {
    pool.close();
  }

  private static JedisPool createPool(String host, int port) {
    JedisPoolConfig poolConfig = new JedisPoolConfig();
    poolConfig.setMaxTotal(8);
    poolConfig.setMaxIdle(8);
    poolConfig.setMinIdle(0);
    poolConfig.setTestOnBorrow(true);
    poolConfig.setTestWhileIdle(true);
    poolConfig.setTimeBetweenEvictionRuns(Duration.ofSeconds(30));
    poolConfig.setMinEvictableIdleDuration(Duration.ofSeconds(30));
    poolConfig.setMaxWait(Duration.ofSeconds(2));

    return new JedisPool(
        poolConfig, host, port,
        CONNECT_TIMEOUT_MS, SO_TIMEOUT_MS,
        null, 0, CLIENT_NAME
    );
  }
}
