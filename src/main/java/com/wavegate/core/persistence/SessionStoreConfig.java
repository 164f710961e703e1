package com.wavegate.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wavegate.core.config.WavegateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} that selects the {@link SessionStore} implementation from
 * {@code wavegate.store.type}.
 * <p>
 * {@code file} (the default) keeps sessions as JSON files under {@code wavegate.store.path}.
 * {@code jdbc} stores them in a relational database reached through
 * {@code wavegate.store.jdbc-url}; the tables are created on startup.
 */
@Configuration
public class SessionStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "wavegate.store.type", havingValue = "file", matchIfMissing = true)
    public SessionStore fileSessionStore(WavegateProperties properties, ObjectMapper objectMapper) {
        log.info("Configuring file session store");
        return new FileSessionStore(Path.of(properties.getStore().getPath()), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "wavegate.store.type", havingValue = "jdbc")
    public DataSource wavegateDataSource(WavegateProperties properties) {
        var store = properties.getStore();
        if (store.getJdbcUrl() == null || store.getJdbcUrl().isBlank()) {
            throw new IllegalStateException("wavegate.store.jdbc-url is required when wavegate.store.type=jdbc");
        }
        return DataSourceBuilder.create()
                .url(store.getJdbcUrl())
                .username(store.getUsername())
                .password(store.getPassword())
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "wavegate.store.type", havingValue = "jdbc")
    public SessionStore jdbcSessionStore(DataSource wavegateDataSource, ObjectMapper objectMapper) {
        log.info("Configuring JDBC session store");
        var store = new JdbcSessionStore(wavegateDataSource, objectMapper);
        store.createTables();
        return store;
    }
}
