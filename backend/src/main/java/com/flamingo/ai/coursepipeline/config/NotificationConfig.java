package com.flamingo.ai.coursepipeline.config;

import com.flamingo.ai.coursepipeline.service.notification.LoggingNotificationSink;
import com.flamingo.ai.coursepipeline.service.notification.NotificationSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Notification delivery. A deployment registers its own {@link NotificationSink} bean. */
@Configuration
public class NotificationConfig {

  @Bean
  @ConditionalOnMissingBean(NotificationSink.class)
  public NotificationSink notificationSink() {
    return new LoggingNotificationSink();
  }
}
