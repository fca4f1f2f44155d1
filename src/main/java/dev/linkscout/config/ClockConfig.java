package dev.linkscout.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Supplies the {@link Clock} used to time crawl runs; tests replace it with a fixed clock. */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock crawlClock() {
    return Clock.systemUTC();
  }
}
