package com.keystone.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Provides the {@link PipelineStore} bean.
 * <p>
 * With a {@link DataSource} (the {@code postgres} profile) the JDBC store is used and
 * its tables are created on startup. Otherwise an in-memory store is used, which is
 * fine for development and tests but does not survive a restart.
 * <p>
 * The DataSource is looked up lazily because auto-configured beans are not yet
 * registered when user configuration conditions are evaluated.
 */
@Configuration
public class PipelineStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineStoreConfig.class);

    @Bean
    public PipelineStore pipelineStore(ObjectProvider<DataSource> dataSource, Clock clock) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC pipeline store");
            var store = new JdbcPipelineStore(ds, clock);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory pipeline store (state will not persist across restarts)");
        return new InMemoryPipelineStore(clock);
    }
}
