package com.acme.delivery.persistence.redis;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.core.PermanentException;
import com.acme.delivery.domain.FailedMessage;
import com.acme.delivery.domain.RetryPointer;
import com.acme.delivery.repository.DeadLetterStore;
import com.acme.delivery.repository.DlqKeys;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis implementation of DeadLetterStore. Every record is a JSON string bucket under the
 * {@link DlqKeys} scheme, written with a TTL so Redis handles expiry.
 */
public class RedisDeadLetterStore implements DeadLetterStore {

    private static final Logger LOG = LoggerFactory.getLogger(RedisDeadLetterStore.class);

    private final RedissonClient redisson;

    public RedisDeadLetterStore(RedissonClient redisson) {
        this.redisson = redisson;
    }

    @Override
    public void put(FailedMessage message, Duration ttl) {
        write(DlqKeys.active(message.getQueue(), message.getId()), Jsons.toJson(message), ttl, "store DLQ message");
    }

    @Override
    public Optional<FailedMessage> get(String queue, String id) {
        return read(DlqKeys.active(queue, id), "load DLQ message")
                .map(json -> Jsons.fromJson(json, FailedMessage.class));
    }

    @Override
    public boolean delete(String queue, String id) {
        return remove(DlqKeys.active(queue, id), "delete DLQ message");
    }

    @Override
    public void movePermanent(FailedMessage message, Duration ttl) {
        putPermanent(message, ttl);
        remove(DlqKeys.active(message.getQueue(), message.getId()), "delete DLQ message");
    }

    @Override
    public void putPermanent(FailedMessage message, Duration ttl) {
        write(DlqKeys.permanent(message.getQueue(), message.getId()), Jsons.toJson(message), ttl,
                "store permanent DLQ message");
    }

    @Override
    public Optional<FailedMessage> getPermanent(String queue, String id) {
        return read(DlqKeys.permanent(queue, id), "load permanent DLQ message")
                .map(json -> Jsons.fromJson(json, FailedMessage.class));
    }

    @Override
    public boolean deletePermanent(String queue, String id) {
        return remove(DlqKeys.permanent(queue, id), "delete permanent DLQ message");
    }

    @Override
    public long countPermanent(String queue) {
        return listByPrefix(DlqKeys.permanentPattern(queue)).size();
    }

    @Override
    public void putRetryPointer(RetryPointer pointer, Duration ttl) {
        write(DlqKeys.retryPointer(pointer.queue(), pointer.messageId()), Jsons.toJson(pointer), ttl,
                "store retry pointer");
    }

    @Override
    public List<RetryPointer> listRetryPointers() {
        List<RetryPointer> pointers = new ArrayList<>();
        for (String key : listByPrefix(DlqKeys.RETRY_POINTER_PATTERN)) {
            Optional<String> json = read(key, "load retry pointer");
            if (json.isEmpty()) {
                continue; // expired between scan and read
            }
            try {
                pointers.add(Jsons.fromJson(json.get(), RetryPointer.class));
            } catch (PermanentException e) {
                LOG.warn("Skipping unreadable retry pointer key={}: {}", key, e.getMessage());
            }
        }
        return pointers;
    }

    @Override
    public Optional<RetryPointer> getRetryPointer(String queue, String id) {
        return read(DlqKeys.retryPointer(queue, id), "load retry pointer")
                .map(json -> Jsons.fromJson(json, RetryPointer.class));
    }

    @Override
    public boolean deleteRetryPointer(String queue, String id) {
        return remove(DlqKeys.retryPointer(queue, id), "delete retry pointer");
    }

    @Override
    public boolean tryClaim(String queue, String id, String owner, Duration ttl) {
        String key = DlqKeys.claim(queue, id);
        try {
            boolean claimed = bucket(key).trySet(owner, ttl.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Claim key={} owner={} acquired={}", key, owner, claimed);
            return claimed;
        } catch (RedisException e) {
            throw RedisExceptionTranslator.translateException(e, "claim " + key, LOG);
        }
    }

    @Override
    public void releaseClaim(String queue, String id) {
        remove(DlqKeys.claim(queue, id), "release claim");
    }

    /** Uses KEYS-style pattern matching: cost grows with the total number of keys in Redis. */
    @Override
    public List<String> listByPrefix(String pattern) {
        try {
            List<String> keys = new ArrayList<>();
            redisson.getKeys().getKeysByPattern(pattern).forEach(keys::add);
            return keys;
        } catch (RedisException e) {
            throw RedisExceptionTranslator.translateException(e, "list keys " + pattern, LOG);
        }
    }

    private void write(String key, String json, Duration ttl, String operation) {
        try {
            bucket(key).set(json, ttl.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Wrote key={} ttl={}", key, ttl);
        } catch (RedisException e) {
            throw RedisExceptionTranslator.translateException(e, operation + " " + key, LOG);
        }
    }

    private Optional<String> read(String key, String operation) {
        try {
            return Optional.ofNullable(bucket(key).get());
        } catch (RedisException e) {
            throw RedisExceptionTranslator.translateException(e, operation + " " + key, LOG);
        }
    }

    private boolean remove(String key, String operation) {
        try {
            return bucket(key).delete();
        } catch (RedisException e) {
            throw RedisExceptionTranslator.translateException(e, operation + " " + key, LOG);
        }
    }

    private RBucket<String> bucket(String key) {
        return redisson.getBucket(key, StringCodec.INSTANCE);
    }
}
