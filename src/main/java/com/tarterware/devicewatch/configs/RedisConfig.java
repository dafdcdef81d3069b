package com.tarterware.devicewatch.configs;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
public class RedisConfig
{
    @Value("${com.tarterware.redis.host}")
    private String _redisHost;

    @Value("${com.tarterware.redis.port}")
    private int _redisPort;

    @Value("${com.tarterware.redis.password:}")
    private String redisPassword;

    // Upper bound on a single Redis command.
    @Value("${com.tarterware.redis.command-timeout:2s}")
    private String commandTimeoutString;

    @Bean
    LettuceConnectionFactory redisStandAloneConnectionFactory()
    {
        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(_redisHost, _redisPort);
        configuration.setPassword(redisPassword);

        Duration commandTimeout = DurationStyle.detect(commandTimeoutString).parse(commandTimeoutString);
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(commandTimeout).build();

        return new LettuceConnectionFactory(configuration, clientConfig);
    }

    @Bean
    RedisTemplate<String, Object> redisTemplateStandAlone(
            @Qualifier("redisStandAloneConnectionFactory") LettuceConnectionFactory redisConnectionFactory)
    {
        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);

        // Keys are "metric:{deviceId}:{timestamp}"; samples are stored as JSON
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new GenericJackson2JsonRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(new GenericJackson2JsonRedisSerializer());

        template.afterPropertiesSet();
        return template;
    }
}
