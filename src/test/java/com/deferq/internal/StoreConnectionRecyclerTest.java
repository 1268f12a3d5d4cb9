package com.deferq.internal;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StoreConnectionRecyclerTest {

    @Test
    void shouldSoftEvictHikariConnections() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        HikariDataSource hikari = mock(HikariDataSource.class);
        HikariPoolMXBean pool = mock(HikariPoolMXBean.class);
        when(dataSource.isWrapperFor(HikariDataSource.class)).thenReturn(true);
        when(dataSource.unwrap(HikariDataSource.class)).thenReturn(hikari);
        when(hikari.getHikariPoolMXBean()).thenReturn(pool);

        new StoreConnectionRecycler(dataSource).recycle();

        verify(pool).softEvictConnections();
    }

    @Test
    void shouldIgnoreOtherDataSources() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.isWrapperFor(HikariDataSource.class)).thenReturn(false);

        assertDoesNotThrow(() -> new StoreConnectionRecycler(dataSource).recycle());
    }

    @Test
    void shouldIgnorePoolThatIsNotStartedYet() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        HikariDataSource hikari = mock(HikariDataSource.class);
        when(dataSource.isWrapperFor(HikariDataSource.class)).thenReturn(true);
        when(dataSource.unwrap(HikariDataSource.class)).thenReturn(hikari);

        assertDoesNotThrow(() -> new StoreConnectionRecycler(dataSource).recycle());
    }
}
