package com.rewind.core.persistence;

import com.rewind.core.config.RewindProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring {@link Configuration} that provides the {@link CheckpointStore} bean.
 * <p>
 * With {@code rewind.storage.type=jdbc} a {@link JdbcCheckpointStore} is created on a HikariCP
 * pool and its tables are ensured on startup. Otherwise checkpoints are kept on the local file
 * system under {@code rewind.storage.root}.
 */
@Configuration
public class CheckpointStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStoreConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "rewind.storage", name = "type", havingValue = "jdbc")
    public HikariDataSource rewindDataSource(RewindProperties properties) {
        var jdbc = properties.getStorage().getJdbc();
        var config = new HikariConfig();
        config.setJdbcUrl(jdbc.getUrl());
        config.setUsername(jdbc.getUsername());
        config.setPassword(jdbc.getPassword());
        config.setMaximumPoolSize(jdbc.getMaximumPoolSize());
        config.setPoolName("rewind");
        return new HikariDataSource(config);
    }

    @Bean
    @ConditionalOnProperty(prefix = "rewind.storage", name = "type", havingValue = "jdbc")
    public CheckpointStore jdbcCheckpointStore(HikariDataSource rewindDataSource) {
        log.info("Configuring JDBC checkpoint store (PostgreSQL)");
        var store = new JdbcCheckpointStore(rewindDataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    public CheckpointStore fileSystemCheckpointStore(RewindProperties properties) {
        Path root = Path.of(properties.getStorage().getRoot());
        log.info("Using file-system checkpoint store at {}", root);
        return new FileSystemCheckpointStore(root);
    }
}
