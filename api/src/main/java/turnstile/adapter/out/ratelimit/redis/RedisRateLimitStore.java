package turnstile.adapter.out.ratelimit.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.UUID;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import turnstile.core.model.ratelimit.EffectiveRateLimit;
import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.core.model.ratelimit.RateLimitAlgorithmHandler;
import turnstile.core.model.ratelimit.RateLimitDecision;
import turnstile.core.model.ratelimit.RateLimitUnavailableException;
import turnstile.core.port.out.RateLimitStore;

/**
 * Redis-based rate limit store for distributed deployments.
 *
 * <p>Each algorithm runs as one Lua script so that the read, decision and write for a
 * key are atomic across every instance sharing the Redis server. The scripts make the
 * same decisions as the in-process algorithm handlers.
 *
 * <p>Every call is bounded by the backend timeout. Timeouts and Redis errors surface as
 * {@link RateLimitUnavailableException}; the caller decides whether to fall back.
 *
 * <p>Key format: {@code {prefix}{logical key}[:{window index}]}
 */
public final class RedisRateLimitStore implements RateLimitStore {

    private static final Logger LOG = Logger.getLogger(RedisRateLimitStore.class);

    static final String NAME = "redis";

    static final int SCAN_BATCH = 100;

    /**
     * Fixed window counter.
     *
     * <p>ARGV: limit, cost, window end (ms), now (ms).
     * Returns: [allowed, remaining, reset_at_ms, retry_after_s or -1]
     */
    private static final String FIXED_WINDOW_SCRIPT =
            """
            local limit = tonumber(ARGV[1])
            local cost = tonumber(ARGV[2])
            local window_end = tonumber(ARGV[3])
            local now_ms = tonumber(ARGV[4])

            local count = tonumber(redis.call('GET', KEYS[1]) or '0')

            if cost == 0 then
                return {1, limit - count, window_end, -1}
            end

            -- A rejected request is not charged
            if count + cost > limit then
                return {0, limit - count, window_end, math.ceil((window_end - now_ms) / 1000)}
            end

            count = redis.call('INCRBY', KEYS[1], cost)
            redis.call('PEXPIREAT', KEYS[1], window_end)
            return {1, limit - count, window_end, -1}
            """;

    /**
     * Sliding window over one sorted-set member per unit of cost.
     *
     * <p>ARGV: limit, cost, window (ms), now (ms), nonce.
     */
    private static final String SLIDING_WINDOW_SCRIPT =
            """
            local limit = tonumber(ARGV[1])
            local cost = tonumber(ARGV[2])
            local window_ms = tonumber(ARGV[3])
            local now_ms = tonumber(ARGV[4])
            local nonce = ARGV[5]

            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', now_ms - window_ms)
            local count = redis.call('ZCARD', KEYS[1])

            local function reset_at()
                local oldest = redis.call('ZRANGE', KEYS[1], 0, 0, 'WITHSCORES')
                if #oldest == 0 then
                    return now_ms + window_ms
                end
                return tonumber(oldest[2]) + window_ms
            end

            if cost == 0 then
                return {1, limit - count, reset_at(), -1}
            end

            if count + cost > limit then
                local retry = window_ms / 1000
                if cost <= limit then
                    local idx = count + cost - limit - 1
                    local freed = redis.call('ZRANGE', KEYS[1], idx, idx, 'WITHSCORES')
                    retry = math.ceil((tonumber(freed[2]) + window_ms - now_ms) / 1000)
                end
                return {0, limit - count, reset_at(), retry}
            end

            for i = 1, cost do
                redis.call('ZADD', KEYS[1], now_ms, nonce .. ':' .. i)
            end
            redis.call('PEXPIRE', KEYS[1], window_ms)
            return {1, limit - count - cost, reset_at(), -1}
            """;

    /**
     * Sliding log of (timestamp, cost) entries; members are {@code nonce:cost}.
     *
     * <p>ARGV: limit, cost, window (ms), now (ms), nonce.
     */
    private static final String SLIDING_LOG_SCRIPT =
            """
            local limit = tonumber(ARGV[1])
            local cost = tonumber(ARGV[2])
            local window_ms = tonumber(ARGV[3])
            local now_ms = tonumber(ARGV[4])
            local nonce = ARGV[5]

            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', now_ms - window_ms)
            local entries = redis.call('ZRANGE', KEYS[1], 0, -1, 'WITHSCORES')

            local used = 0
            for i = 1, #entries, 2 do
                used = used + tonumber(string.match(entries[i], ':(%d+)$'))
            end

            local reset_at = now_ms + window_ms
            if #entries > 0 then
                reset_at = tonumber(entries[2]) + window_ms
            end

            if cost == 0 then
                return {1, limit - used, reset_at, -1}
            end

            if used + cost > limit then
                local retry = window_ms / 1000
                if cost <= limit then
                    local must_free = used + cost - limit
                    local freed = 0
                    for i = 1, #entries, 2 do
                        freed = freed + tonumber(string.match(entries[i], ':(%d+)$'))
                        if freed >= must_free then
                            retry = math.ceil((tonumber(entries[i + 1]) + window_ms - now_ms) / 1000)
                            break
                        end
                    end
                end
                return {0, limit - used, reset_at, retry}
            end

            redis.call('ZADD', KEYS[1], now_ms, nonce .. ':' .. cost)
            redis.call('PEXPIRE', KEYS[1], window_ms)
            return {1, limit - used - cost, reset_at, -1}
            """;

    /**
     * Token bucket holding fractional tokens and the last refill time in a hash.
     *
     * <p>ARGV: capacity, cost, window (ms), now (ms).
     */
    private static final String TOKEN_BUCKET_SCRIPT =
            """
            local capacity = tonumber(ARGV[1])
            local cost = tonumber(ARGV[2])
            local window_ms = tonumber(ARGV[3])
            local now_ms = tonumber(ARGV[4])

            local data = redis.call('HMGET', KEYS[1], 'tokens', 'last_refill_ms')
            local tokens = tonumber(data[1])
            local last_refill_ms = tonumber(data[2])

            -- New buckets start full
            if tokens == nil then
                tokens = capacity
                last_refill_ms = now_ms
            end

            if capacity > 0 then
                local elapsed_ms = math.max(0, now_ms - last_refill_ms)
                tokens = math.min(capacity, tokens + elapsed_ms * capacity / window_ms)
            end
            last_refill_ms = math.max(now_ms, last_refill_ms)

            local ms_to_full = 0
            if capacity > 0 then
                ms_to_full = math.ceil((capacity - tokens) * window_ms / capacity)
            end

            if cost == 0 then
                return {1, math.floor(tokens), now_ms + ms_to_full, -1}
            end

            local allowed = 1
            local retry = -1
            if tokens < cost then
                allowed = 0
                if cost > capacity or capacity == 0 then
                    retry = window_ms / 1000
                else
                    retry = math.max(1, math.ceil((cost - tokens) * window_ms / 1000 / capacity))
                end
            else
                tokens = tokens - cost
                if capacity > 0 then
                    ms_to_full = math.ceil((capacity - tokens) * window_ms / capacity)
                end
            end

            redis.call('HSET', KEYS[1], 'tokens', tostring(tokens), 'last_refill_ms', tostring(last_refill_ms))
            redis.call('PEXPIRE', KEYS[1], ms_to_full + 1000)
            return {allowed, math.floor(tokens), now_ms + ms_to_full, retry}
            """;

    /**
     * Counter with a lifetime set when the counter is created.
     *
     * <p>ARGV: delta, ttl (ms).
     */
    private static final String INCREMENT_SCRIPT =
            """
            local value = redis.call('INCRBY', KEYS[1], ARGV[1])
            if redis.call('PTTL', KEYS[1]) < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[2])
            end
            return value
            """;

    private static final Map<RateLimitAlgorithm, String> SCRIPTS = scripts();

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final Duration timeout;
    private final Clock clock;

    public RedisRateLimitStore(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, Duration timeout, Clock clock) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<RateLimitDecision> evaluate(
            RateLimitAlgorithmHandler handler, String key, EffectiveRateLimit limit, long cost) {
        final var nowMillis = clock.millis();
        final var algorithm = handler.algorithm();
        final var redisKey = keyPrefix + handler.storageKey(key, limit, nowMillis);
        final var args = scriptArguments(algorithm, limit, cost, nowMillis);

        final var command = new ArrayList<String>(args.size() + 3);
        command.add(SCRIPTS.get(algorithm));
        command.add("1"); // numkeys
        command.add(redisKey);
        command.addAll(args);

        return guard(redisDataSource.execute("EVAL", command.toArray(new String[0])), "evaluate", key)
                .map(response -> parseDecision(parseArrayResponse(response), limit, algorithm));
    }

    @Override
    public Uni<Long> increment(String key, long delta, Duration ttl) {
        return guard(
                        redisDataSource.execute(
                                "EVAL",
                                INCREMENT_SCRIPT,
                                "1", // numkeys
                                keyPrefix + key,
                                String.valueOf(delta),
                                String.valueOf(ttl.toMillis())),
                        "increment",
                        key)
                .map(Response::toLong);
    }

    @Override
    public Uni<Long> get(String key) {
        return guard(redisDataSource.execute("GET", keyPrefix + key), "get", key)
                .map(response -> response == null ? 0L : response.toLong());
    }

    @Override
    public Uni<Boolean> expire(String key, Duration ttl) {
        return guard(keyCommands.pexpire(keyPrefix + key, ttl), "expire", key);
    }

    @Override
    public Uni<Boolean> reset(String key) {
        final var redisKey = keyPrefix + key;
        final var derivedKeys = new KeyScanArgs().match(escapeGlob(redisKey) + ":*").count(SCAN_BATCH);
        final var removal = keyCommands.scan(derivedKeys).toMulti().collect().asList().flatMap(derived -> {
            final var all = new ArrayList<String>(derived.size() + 1);
            all.add(redisKey);
            all.addAll(derived);
            return keyCommands.del(all.toArray(new String[0]));
        });
        return guard(removal, "reset", key).map(deleted -> deleted > 0);
    }

    static String escapeGlob(String key) {
        final var escaped = new StringBuilder(key.length());
        for (var i = 0; i < key.length(); i++) {
            final var c = key.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private <T> Uni<T> guard(Uni<T> operation, String operationName, String key) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new RateLimitUnavailableException(
                        "Redis " + operationName + " timed out after " + timeout.toMillis() + "ms"))
                .onFailure(error -> !(error instanceof RateLimitUnavailableException))
                .transform(error -> {
                    LOG.warnv(error, "Redis rate limit {0} failed for key {1}", operationName, key);
                    return new RateLimitUnavailableException(
                            "Redis " + operationName + " failed: " + error.getMessage(), error);
                });
    }

    private List<String> scriptArguments(
            RateLimitAlgorithm algorithm, EffectiveRateLimit limit, long cost, long nowMillis) {
        final var windowMillis = limit.windowMillis();
        return switch (algorithm) {
            case FIXED_WINDOW -> List.of(
                    String.valueOf(limit.limit()),
                    String.valueOf(cost),
                    String.valueOf((Math.floorDiv(nowMillis, windowMillis) + 1) * windowMillis),
                    String.valueOf(nowMillis));
            case SLIDING_WINDOW, SLIDING_LOG -> List.of(
                    String.valueOf(limit.limit()),
                    String.valueOf(cost),
                    String.valueOf(windowMillis),
                    String.valueOf(nowMillis),
                    UUID.randomUUID().toString());
            case TOKEN_BUCKET -> List.of(
                    String.valueOf(limit.limit()),
                    String.valueOf(cost),
                    String.valueOf(windowMillis),
                    String.valueOf(nowMillis));
        };
    }

    private List<Long> parseArrayResponse(Response response) {
        if (response == null) {
            throw new RateLimitUnavailableException("Null response from Redis");
        }

        // [allowed, remaining, reset_at_ms, retry_after_s]
        final var result = new ArrayList<Long>(4);
        for (var i = 0; i < response.size(); i++) {
            result.add(response.get(i).toLong());
        }
        return result;
    }

    private RateLimitDecision parseDecision(List<Long> result, EffectiveRateLimit limit, RateLimitAlgorithm algorithm) {
        final var allowed = result.get(0) == 1;
        final var remaining = result.get(1);
        final var resetAt = Instant.ofEpochMilli(result.get(2));
        final var retryAfter = result.get(3);

        return new RateLimitDecision(
                allowed,
                limit.limit(),
                remaining,
                resetAt,
                allowed ? OptionalLong.empty() : OptionalLong.of(Math.max(1, retryAfter)),
                limit.windowSeconds(),
                algorithm.wireName());
    }

    private static Map<RateLimitAlgorithm, String> scripts() {
        final var scripts = new EnumMap<RateLimitAlgorithm, String>(RateLimitAlgorithm.class);
        scripts.put(RateLimitAlgorithm.FIXED_WINDOW, FIXED_WINDOW_SCRIPT);
        scripts.put(RateLimitAlgorithm.SLIDING_WINDOW, SLIDING_WINDOW_SCRIPT);
        scripts.put(RateLimitAlgorithm.SLIDING_LOG, SLIDING_LOG_SCRIPT);
        scripts.put(RateLimitAlgorithm.TOKEN_BUCKET, TOKEN_BUCKET_SCRIPT);
        return scripts;
    }
}
