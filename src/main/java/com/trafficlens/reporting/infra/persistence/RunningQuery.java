package com.trafficlens.reporting.infra.persistence;

import com.trafficlens.reporting.core.model.DataSourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 正在执行的一条查询：可等待结果，也可取消。
 * 取消会对数据库语句调用 Statement.cancel()，尚未开始的查询不会再执行。
 */
public class RunningQuery {

    private static final Logger log = LoggerFactory.getLogger(RunningQuery.class);

    private final DataSourceKind dataSource;
    private final AtomicReference<Statement> statement = new AtomicReference<>();
    private volatile boolean cancelled;
    private volatile CompletableFuture<List<Map<String, Object>>> result;

    RunningQuery(DataSourceKind dataSource) {
        this.dataSource = dataSource;
    }

    public DataSourceKind dataSource() {
        return dataSource;
    }

    public CompletableFuture<List<Map<String, Object>>> result() {
        return result;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
        Statement running = statement.get();
        if (running != null) {
            try {
                running.cancel();
            } catch (SQLException e) {
                log.warn("[Query] Cancel failed on {}: {}", dataSource, e.getMessage());
            }
        }
        if (result != null) {
            result.cancel(true);
        }
    }

    void attach(CompletableFuture<List<Map<String, Object>>> future) {
        this.result = future;
    }

    /**
     * 语句开始执行前登记；登记前已被取消的直接取消语句
     */
    void bind(Statement stmt) throws SQLException {
        statement.set(stmt);
        if (cancelled) {
            stmt.cancel();
        }
    }

    void unbind() {
        statement.set(null);
    }
}
