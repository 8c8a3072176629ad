package com.trafficlens.reporting.infra.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trafficlens.reporting.core.date.DateMode;
import com.trafficlens.reporting.core.date.DatePreset;
import com.trafficlens.reporting.core.date.SavedView;
import com.trafficlens.reporting.core.exception.BackingStoreException;
import com.trafficlens.reporting.core.model.FilterOperator;
import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.core.model.TableFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * SavedViewRepository 单元测试
 */
class SavedViewRepositoryTest {

    private SavedViewRepository repository;
    private Connection connection;
    private PreparedStatement statement;

    @BeforeEach
    void setUp() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        when(dataSource.getConnection()).thenReturn(connection);

        repository = new SavedViewRepository();
        repository.dataSource = dataSource;
        repository.objectMapper = new ObjectMapper();
    }

    @Test
    void testSaveStoresPresetNotDates() throws SQLException {
        ResultSet keys = mock(ResultSet.class);
        when(connection.prepareStatement(anyString(), eq(Statement.RETURN_GENERATED_KEYS))).thenReturn(statement);
        when(statement.getGeneratedKeys()).thenReturn(keys);
        when(keys.next()).thenReturn(true);
        when(keys.getLong(1)).thenReturn(21L);

        SavedView view = new SavedView(null, "weekly", ReportType.MARKETING, DateMode.RELATIVE,
                DatePreset.LAST_7_DAYS, null, null, List.of("network", "campaign"),
                List.of(new TableFilter("network", FilterOperator.EQUALS, "Facebook")), "cost", SortDirection.DESC,
                null, null);

        SavedView saved = repository.save(view, "u1");

        assertEquals(21L, saved.id());
        assertEquals("u1", saved.ownerId());
        assertNotNull(saved.createdAt());
        verify(statement).setString(4, "RELATIVE");
        verify(statement).setString(5, "last7days");
        verify(statement).setNull(6, Types.DATE);
        verify(statement).setString(8, "[\"network\",\"campaign\"]");
        verify(statement).setString(9, "[{\"field\":\"network\",\"operator\":\"equals\",\"value\":\"Facebook\"}]");
    }

    @Test
    void testFindByIdMapsRow() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getLong("id")).thenReturn(4L);
        when(rs.getString("name")).thenReturn("geo");
        when(rs.getString("report_type")).thenReturn("DASHBOARD");
        when(rs.getString("date_mode")).thenReturn("RELATIVE");
        when(rs.getString("date_preset")).thenReturn("lastMonth");
        when(rs.getString("dimensions")).thenReturn("[\"country\"]");
        when(rs.getString("filters")).thenReturn("[]");
        when(rs.getString("sort_direction")).thenReturn("ASC");
        when(rs.getString("owner_id")).thenReturn("u1");
        when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(Instant.parse("2026-01-05T10:00:00Z")));

        SavedView view = repository.findById(4L, "u1").orElseThrow();

        assertEquals(ReportType.DASHBOARD, view.reportType());
        assertEquals(DatePreset.LAST_MONTH, view.datePreset());
        assertEquals(List.of("country"), view.dimensions());
        assertEquals(SortDirection.ASC, view.sortDirection());
        assertNull(view.dateStart());
        verify(statement).setLong(1, 4L);
        verify(statement).setString(2, "u1");
    }

    @Test
    void testSqlFailureIsBackingStoreError() throws SQLException {
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("connection reset"));
        assertThrows(BackingStoreException.class, () -> repository.listByReport("u1", ReportType.ON_PAGE));
    }
}
