package com.trafficlens.reporting.infra.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trafficlens.reporting.core.date.DateMode;
import com.trafficlens.reporting.core.date.DatePreset;
import com.trafficlens.reporting.core.date.SavedView;
import com.trafficlens.reporting.core.exception.BackingStoreException;
import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.core.model.TableFilter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 保存视图持久化 (app_saved_views)
 * 维度与过滤条件以 JSON 存储；日期只存模式与预设/具体日期，不存解析结果
 */
@ApplicationScoped
public class SavedViewRepository {

    private static final Logger log = LoggerFactory.getLogger(SavedViewRepository.class);

    private static final String COLUMNS = "id, owner_id, name, report_type, date_mode, date_preset, date_start, "
            + "date_end, dimensions, filters, sort_by, sort_direction, created_at";

    @Inject
    @io.quarkus.agroal.DataSource("ads")
    DataSource dataSource;

    @Inject
    ObjectMapper objectMapper;

    public SavedView save(SavedView view, String ownerId) {
        String sql = "INSERT INTO app_saved_views "
                + "(owner_id, name, report_type, date_mode, date_preset, date_start, date_end, dimensions, filters, "
                + "sort_by, sort_direction, created_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), CAST(? AS jsonb), ?, ?, ?)";
        Instant createdAt = Instant.now();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setString(1, ownerId);
            stmt.setString(2, view.name());
            stmt.setString(3, view.reportType() == null ? null : view.reportType().name());
            stmt.setString(4, view.dateMode() == null ? DateMode.NONE.name() : view.dateMode().name());
            stmt.setString(5, view.datePreset() == null ? null : view.datePreset().id());
            setDate(stmt, 6, view.dateStart());
            setDate(stmt, 7, view.dateEnd());
            stmt.setString(8, toJson(view.dimensions()));
            stmt.setString(9, toJson(view.filters()));
            stmt.setString(10, view.sortBy());
            stmt.setString(11, view.sortDirection() == null ? null : view.sortDirection().name());
            stmt.setTimestamp(12, Timestamp.from(createdAt));

            stmt.executeUpdate();

            try (ResultSet rs = stmt.getGeneratedKeys()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    log.info("[SavedView] Saved: id={}, owner={}, report={}, mode={}", id, ownerId,
                            view.reportType(), view.dateMode());
                    return view.withIdentity(id, ownerId, createdAt);
                }
            }
            throw new BackingStoreException("Saved view insert returned no generated id");
        } catch (SQLException e) {
            log.error("[SavedView] Failed to save view for owner {}: {}", ownerId, e.getMessage(), e);
            throw new BackingStoreException("Failed to save view", e);
        }
    }

    public Optional<SavedView> findById(long id, String ownerId) {
        String sql = "SELECT " + COLUMNS + " FROM app_saved_views WHERE id = ? AND owner_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, id);
            stmt.setString(2, ownerId);

            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("[SavedView] Failed to load view {}: {}", id, e.getMessage(), e);
            throw new BackingStoreException("Failed to load saved view " + id, e);
        }
    }

    /**
     * 按报表列出调用方的视图，最新在前
     */
    public List<SavedView> listByReport(String ownerId, ReportType reportType) {
        String sql = "SELECT " + COLUMNS + " FROM app_saved_views WHERE owner_id = ? AND report_type = ? "
                + "ORDER BY created_at DESC, id DESC";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, ownerId);
            stmt.setString(2, reportType.name());

            List<SavedView> views = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    views.add(mapRow(rs));
                }
            }
            return views;
        } catch (SQLException e) {
            log.error("[SavedView] Failed to list views for owner {}: {}", ownerId, e.getMessage(), e);
            throw new BackingStoreException("Failed to list saved views", e);
        }
    }

    SavedView mapRow(ResultSet rs) throws SQLException {
        String preset = rs.getString("date_preset");
        String direction = rs.getString("sort_direction");
        String report = rs.getString("report_type");
        Timestamp created = rs.getTimestamp("created_at");
        return new SavedView(
                rs.getLong("id"),
                rs.getString("name"),
                report == null ? null : ReportType.valueOf(report),
                DateMode.valueOf(rs.getString("date_mode")),
                preset == null ? null : DatePreset.fromId(preset),
                toLocalDate(rs.getDate("date_start")),
                toLocalDate(rs.getDate("date_end")),
                fromJson(rs.getString("dimensions"), new TypeReference<List<String>>() {}),
                fromJson(rs.getString("filters"), new TypeReference<List<TableFilter>>() {}),
                rs.getString("sort_by"),
                direction == null ? null : SortDirection.from(direction),
                rs.getString("owner_id"),
                created == null ? null : created.toInstant()
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BackingStoreException("Failed to serialize saved view payload", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new BackingStoreException("Corrupt saved view payload", e);
        }
    }

    private static void setDate(PreparedStatement stmt, int index, LocalDate date) throws SQLException {
        if (date == null) {
            stmt.setNull(index, Types.DATE);
        } else {
            stmt.setDate(index, Date.valueOf(date));
        }
    }

    private static LocalDate toLocalDate(Date date) {
        return date == null ? null : date.toLocalDate();
    }
}
