package com.followchat.social.common.config;

import com.followchat.social.chat.ws.RedisRoomFanout;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@ConditionalOnProperty(name = "app.ws.fanout", havingValue = "redis")
public class RedisFanoutConfig {

    @Bean
    public RedisMessageListenerContainer roomFanoutListenerContainer(
            RedisConnectionFactory connectionFactory,
            RedisRoomFanout roomFanout
    ) {
        // One dispatch thread keeps envelopes in channel order. Not a bean, so Boot's task executor stays.
        var dispatcher = new ThreadPoolTaskExecutor();
        dispatcher.setCorePoolSize(1);
        dispatcher.setMaxPoolSize(1);
        dispatcher.setDaemon(true);
        dispatcher.setThreadNamePrefix("room-fanout-");
        dispatcher.initialize();

        var container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(dispatcher);
        container.addMessageListener(roomFanout, new ChannelTopic(roomFanout.channel()));
        return container;
    }
}
