package com.trafficlens.reporting.infra.persistence;

import com.trafficlens.reporting.common.config.ReportingConfig;
import com.trafficlens.reporting.config.QueryExecutorConfig;
import com.trafficlens.reporting.core.exception.BackingStoreException;
import com.trafficlens.reporting.core.model.DataSourceKind;
import com.trafficlens.reporting.core.model.SqlRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * JdbcQueryExecutor 单元测试（JDBC 对象全部 mock）
 */
class JdbcQueryExecutorTest {

    private JdbcQueryExecutor executor;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService pool;
    private DataSource ads;
    private DataSource crm;
    private Connection connection;
    private PreparedStatement statement;
    private ResultSet resultSet;

    @BeforeEach
    void setUp() throws SQLException {
        ads = mock(DataSource.class);
        crm = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        resultSet = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);

        when(ads.getConnection()).thenReturn(connection);
        when(crm.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(2);
        when(meta.getColumnLabel(1)).thenReturn("DIMENSION_VALUE");
        when(meta.getColumnLabel(2)).thenReturn("cost");
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getObject(1)).thenReturn("Google Ads", "Facebook");
        when(resultSet.getObject(2)).thenReturn(120L, 30L);

        ReportingConfig config = mock(ReportingConfig.class);
        when(config.getQueryTimeoutSeconds()).thenReturn(15L);

        pool = Executors.newSingleThreadExecutor();
        QueryExecutorConfig executorConfig = mock(QueryExecutorConfig.class);
        when(executorConfig.getQueryExecutor()).thenReturn(pool);

        meterRegistry = new SimpleMeterRegistry();
        executor = new JdbcQueryExecutor();
        executor.adsDataSource = ads;
        executor.crmDataSource = crm;
        executor.registry = meterRegistry;
        executor.executorConfig = executorConfig;
        executor.config = config;
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static SqlRequest request() {
        return new SqlRequest("SELECT m.network AS dimension_value, SUM(m.cost) AS cost FROM t WHERE m.date BETWEEN ? AND ?"
                + " GROUP BY m.network LIMIT ?",
                List.of(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 7), 1000));
    }

    @Test
    void testExecuteBindsParamsAndMapsRows() throws SQLException {
        List<Map<String, Object>> rows = executor.execute(DataSourceKind.ADS, request());

        assertEquals(2, rows.size());
        assertEquals("Google Ads", rows.get(0).get("dimension_value"));
        assertEquals(30L, rows.get(1).get("cost"));

        verify(statement).setObject(1, LocalDate.of(2026, 2, 1));
        verify(statement).setObject(2, LocalDate.of(2026, 2, 7));
        verify(statement).setObject(3, 1000);
        verify(statement).setQueryTimeout(15);
        verify(crm, never()).getConnection();
        assertEquals(1, meterRegistry.get("reporting.query").tag("datasource", "ads").timer().count());
    }

    @Test
    void testSqlExceptionIsWrapped() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("relation does not exist"));

        BackingStoreException e = assertThrows(BackingStoreException.class,
                () -> executor.execute(DataSourceKind.CRM, request()));

        assertInstanceOf(SQLException.class, e.getCause());
        assertFalse(e.isClientCorrectable());
        verify(crm).getConnection();
        assertEquals(1, meterRegistry.get("reporting.query").tag("datasource", "crm").timer().count());
    }

    @Test
    void testSubmitRunsOnPool() throws Exception {
        RunningQuery handle = executor.submit(DataSourceKind.CRM, request());

        assertEquals(DataSourceKind.CRM, handle.dataSource());
        List<Map<String, Object>> rows = handle.result().get(5, TimeUnit.SECONDS);
        assertEquals(2, rows.size());
        verify(crm).getConnection();
    }

    @Test
    void testCancelBeforeStartNeverTouchesDatabase() throws Exception {
        // 场景：线程池被占满，查询排队时被取消
        CountDownLatch release = new CountDownLatch(1);
        pool.submit(() -> {
            release.await();
            return null;
        });

        RunningQuery handle = executor.submit(DataSourceKind.ADS, request());
        handle.cancel();
        release.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertTrue(handle.isCancelled());
        assertTrue(handle.result().isCancelled());
        verify(ads, never()).getConnection();
    }

    @Test
    void testCancelWhileRunningCancelsStatement() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(statement.executeQuery()).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            throw new SQLException("canceling statement due to user request");
        });

        RunningQuery handle = executor.submit(DataSourceKind.ADS, request());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        handle.cancel();
        release.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        verify(statement).cancel();
        assertTrue(handle.result().isCancelled());
    }

    @Test
    void testRejectedSubmission() {
        pool.shutdownNow();
        assertThrows(BackingStoreException.class, () -> executor.submit(DataSourceKind.ADS, request()));
    }
}
