package com.trafficlens.reporting.config;

import com.trafficlens.reporting.common.config.ReportingConfig;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 查询执行线程池
 * 广告与 CRM 两条查询在这里并发执行，线程数即同时打开的 JDBC 语句上限
 */
@ApplicationScoped
public class QueryExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutorConfig.class);

    @Inject
    ReportingConfig config;

    private volatile ExecutorService queryExecutor;

    void onStart(@Observes StartupEvent event) {
        getQueryExecutor();
    }

    /**
     * 获取查询执行器（首次使用时创建）
     */
    public ExecutorService getQueryExecutor() {
        if (queryExecutor == null) {
            synchronized (this) {
                if (queryExecutor == null) {
                    int poolSize = config.getQueryPoolSize();
                    queryExecutor = Executors.newFixedThreadPool(poolSize, namedThreads());
                    log.info("查询执行线程池初始化完成, poolSize={}", poolSize);
                }
            }
        }
        return queryExecutor;
    }

    @PreDestroy
    void shutdown() {
        if (queryExecutor != null) {
            queryExecutor.shutdownNow();
            log.info("查询执行线程池已关闭");
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "report-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
