package com.deferq.internal;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Retires pooled connections once they are returned, so that a long running
 * worker does not keep the same physical connections forever.
 */
@Component
public class StoreConnectionRecycler {

    private static final Logger log = LoggerFactory.getLogger(StoreConnectionRecycler.class);

    private final DataSource dataSource;

    public StoreConnectionRecycler(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void recycle() {
        HikariPoolMXBean pool = hikariPool();
        if (pool == null) {
            log.trace("No Hikari pool available, connections are not recycled");
            return;
        }
        pool.softEvictConnections();
    }

    private HikariPoolMXBean hikariPool() {
        try {
            if (!dataSource.isWrapperFor(HikariDataSource.class)) {
                return null;
            }
            return dataSource.unwrap(HikariDataSource.class).getHikariPoolMXBean();
        } catch (SQLException e) {
            log.debug("Could not unwrap the data source to recycle connections: {}", e.getMessage());
            return null;
        }
    }
}
