package com.lodestar.core.persistence;

import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Spring {@link Configuration} that provides the LangGraph4j {@link BaseCheckpointSaver}
 * every graph transition is persisted through.
 * <p>
 * When a {@link DataSource} is configured (the {@code postgres} profile) run state goes
 * to a {@link JdbcCheckpointSaver}. Otherwise an in-memory {@link MemorySaver} is used,
 * which is suitable for development and tests but does not survive a restart.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    public BaseCheckpointSaver checkpointSaver(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC checkpoint saver");
            var saver = new JdbcCheckpointSaver(ds);
            saver.createTables();
            return saver;
        }
        log.info("No DataSource available; using in-memory checkpoint saver (state will not persist across restarts)");
        return new MemorySaver();
    }
}
