package com.eventbot.reminders.infrastructure.config;

import com.eventbot.reminders.domain.model.DeliveryPolicy;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({DeliveryProperties.class, TelegramProperties.class})
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DeliveryPolicy deliveryPolicy(DeliveryProperties properties) {
        return new DeliveryPolicy(properties.getMaxAttempts(), properties.getSendTimeout());
    }
}
