package com.trafficlens.reporting.infra.persistence;

import com.trafficlens.reporting.common.config.ReportingConfig;
import com.trafficlens.reporting.config.QueryExecutorConfig;
import com.trafficlens.reporting.core.exception.BackingStoreException;
import com.trafficlens.reporting.core.model.DataSourceKind;
import com.trafficlens.reporting.core.model.SqlRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * 只读聚合查询执行器
 * 所有取值通过 PreparedStatement 绑定；SQLException 在这里统一包装为 BackingStoreException
 */
@ApplicationScoped
public class JdbcQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    @Inject
    @io.quarkus.agroal.DataSource("ads")
    DataSource adsDataSource;

    @Inject
    @io.quarkus.agroal.DataSource("crm")
    DataSource crmDataSource;

    @Inject
    MeterRegistry registry;

    @Inject
    QueryExecutorConfig executorConfig;

    @Inject
    ReportingConfig config;

    /**
     * 在查询线程池中异步执行，返回可取消的句柄
     */
    public RunningQuery submit(DataSourceKind kind, SqlRequest request) {
        RunningQuery handle = new RunningQuery(kind);
        try {
            handle.attach(CompletableFuture.supplyAsync(() -> run(kind, request, handle),
                    executorConfig.getQueryExecutor()));
        } catch (RejectedExecutionException e) {
            throw new BackingStoreException("Query executor rejected " + kind + " query", e);
        }
        return handle;
    }

    /**
     * 在调用线程中同步执行
     */
    public List<Map<String, Object>> execute(DataSourceKind kind, SqlRequest request) {
        return run(kind, request, null);
    }

    private List<Map<String, Object>> run(DataSourceKind kind, SqlRequest request, RunningQuery handle) {
        if (handle != null && handle.isCancelled()) {
            throw new BackingStoreException(kind + " query cancelled before start");
        }
        Timer timer = registry.timer("reporting.query", "datasource", kind.dataSourceName());
        Timer.Sample sample = Timer.start(registry);
        log.debug("[Query] {} sql length={}, params={}", kind, request.sql().length(), request.params().size());

        try (Connection conn = dataSource(kind).getConnection();
             PreparedStatement stmt = conn.prepareStatement(request.sql())) {
            if (handle != null) {
                handle.bind(stmt);
            }
            stmt.setQueryTimeout((int) config.getQueryTimeoutSeconds());
            List<Object> params = request.params();
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            log.error("[Query] {} query failed: {}\n{}", kind, e.getMessage(), request.sql());
            throw new BackingStoreException(kind + " query failed: " + e.getMessage(), e);
        } finally {
            if (handle != null) {
                handle.unbind();
            }
            sample.stop(timer);
        }
    }

    private static List<Map<String, Object>> mapRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int colCount = meta.getColumnCount();
        List<Map<String, Object>> result = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(colCount);
            for (int i = 1; i <= colCount; i++) {
                row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
            }
            result.add(row);
        }
        return result;
    }

    private DataSource dataSource(DataSourceKind kind) {
        return kind == DataSourceKind.CRM ? crmDataSource : adsDataSource;
    }
}
