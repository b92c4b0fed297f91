package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.config.StoreProperties;
import com.voltageems.alarmsrv.exception.StoreInitializationException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

public class RuleStoreInitializer {

  private static final Logger log = LoggerFactory.getLogger(RuleStoreInitializer.class);

  static final String SCHEMA_SCRIPT = "db/schema.sql";
  private static final String POOL_NAME = "alarm-rule-store";
  private static final long MIN_CONNECTION_TIMEOUT_MS = 250;

  public HikariDataSource initialize(StoreProperties properties) {
    Path file = Path.of(properties.path()).toAbsolutePath().normalize();
    createParentDirectories(file);

    HikariDataSource dataSource;
    try {
      dataSource = new HikariDataSource(poolConfig(file, properties));
    } catch (RuntimeException e) {
      throw new StoreInitializationException("Cannot open rule store at " + file, e);
    }

    try {
      applySchema(dataSource);
      String journalMode = verifyWriteAheadLog(dataSource);
      log.info("Rule store ready: file={}, journalMode={}, busyTimeout={}ms, poolSize={}",
          file, journalMode, properties.busyTimeout().toMillis(), properties.maxPoolSize());
      return dataSource;
    } catch (RuntimeException e) {
      dataSource.close();
      throw e;
    }
  }

  private void createParentDirectories(Path file) {
    Path parent = file.getParent();
    if (parent == null || Files.isDirectory(parent)) {
      return;
    }
    try {
      Files.createDirectories(parent);
      log.info("Created rule store directory {}", parent);
    } catch (IOException e) {
      throw new StoreInitializationException("Cannot create rule store directory " + parent, e);
    }
  }

  private HikariConfig poolConfig(Path file, StoreProperties properties) {
    long busyTimeoutMs = properties.busyTimeout().toMillis();

    HikariConfig config = new HikariConfig();
    config.setPoolName(POOL_NAME);
    config.setDriverClassName("org.sqlite.JDBC");
    config.setJdbcUrl("jdbc:sqlite:" + file);
    config.setMaximumPoolSize(properties.maxPoolSize());
    config.setConnectionTimeout(Math.max(MIN_CONNECTION_TIMEOUT_MS, busyTimeoutMs));

    // Applied by the driver as PRAGMAs on every new connection.
    config.addDataSourceProperty("journal_mode", "WAL");
    config.addDataSourceProperty("synchronous", "NORMAL");
    config.addDataSourceProperty("foreign_keys", "true");
    config.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeoutMs));
    return config;
  }

  private void applySchema(DataSource dataSource) {
    ResourceDatabasePopulator populator =
        new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
    try {
      populator.execute(dataSource);
    } catch (DataAccessException e) {
      throw new StoreInitializationException("Cannot apply rule store schema " + SCHEMA_SCRIPT, e);
    }
  }

  private String verifyWriteAheadLog(DataSource dataSource) {
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("PRAGMA journal_mode")) {
      String mode = rs.next() ? rs.getString(1) : null;
      if (!"wal".equalsIgnoreCase(mode)) {
        throw new StoreInitializationException(
            "Rule store refused write-ahead logging, journal_mode=" + mode);
      }
      return mode;
    } catch (SQLException e) {
      throw new StoreInitializationException("Cannot read rule store journal mode", e);
    }
  }
}
