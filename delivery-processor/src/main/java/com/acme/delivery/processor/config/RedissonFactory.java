package com.acme.delivery.processor.config;

import com.acme.delivery.persistence.redis.RedisDeadLetterStore;
import com.acme.delivery.persistence.redis.RedisQueuePublisher;
import com.acme.delivery.repository.DeadLetterStore;
import com.acme.delivery.spi.QueuePublisher;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

/** Redis client plus the Redis backed dead letter store and queue publisher. */
@Factory
@Requires(property = "redisson.enabled", value = "true", defaultValue = "true")
public class RedissonFactory {

  @Singleton
  @Bean(preDestroy = "shutdown")
  @Requires(property = "redisson.address")
  public RedissonClient redissonClient(@Property(name = "redisson.address") String address) {
    Config config = new Config();
    config.useSingleServer().setAddress(address);
    return Redisson.create(config);
  }

  @Singleton
  @Requires(beans = RedissonClient.class)
  public DeadLetterStore deadLetterStore(RedissonClient redisson) {
    return new RedisDeadLetterStore(redisson);
  }

  @Singleton
  @Requires(beans = RedissonClient.class)
  public QueuePublisher queuePublisher(RedissonClient redisson) {
    return new RedisQueuePublisher(redisson);
  }
}
