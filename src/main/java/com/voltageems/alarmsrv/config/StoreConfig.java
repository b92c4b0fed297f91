package com.voltageems.alarmsrv.config;

import com.voltageems.alarmsrv.repository.RuleStoreInitializer;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class StoreConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // Opened once for the lifetime of the process, closed with the context.
  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(StoreProperties properties) {
    return new RuleStoreInitializer().initialize(properties);
  }
}
