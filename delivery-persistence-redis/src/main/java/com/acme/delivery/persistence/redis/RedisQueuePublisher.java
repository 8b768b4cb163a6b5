package com.acme.delivery.persistence.redis;

import com.acme.delivery.core.QueueNames;
import com.acme.delivery.spi.QueuePublisher;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-publishes payloads by pushing them onto the head of the Redis list named after the queue,
 * the same end the producers push to.
 */
public class RedisQueuePublisher implements QueuePublisher {

    private static final Logger LOG = LoggerFactory.getLogger(RedisQueuePublisher.class);

    private final RedissonClient redisson;

    public RedisQueuePublisher(RedissonClient redisson) {
        this.redisson = redisson;
    }

    @Override
    public void push(String queue, String payload) {
        QueueNames.requireValid(queue);
        try {
            redisson.getDeque(queue, StringCodec.INSTANCE).addFirst(payload);
            LOG.debug("Pushed payload onto queue={}", queue);
        } catch (RedisException e) {
            throw RedisExceptionTranslator.translateException(e, "push to queue " + queue, LOG);
        }
    }
}
