package com.trafficlens.reporting.common.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.ConfigProvider;

import java.time.ZoneId;

/**
 * 报表引擎配置
 */
@ApplicationScoped
public class ReportingConfig {

    /**
     * 规范时区，"今天"按该时区的零点计算
     * 默认 UTC
     */
    public ZoneId getTimezone() {
        return ZoneId.of(ConfigProvider.getConfig()
                .getOptionalValue("reporting.timezone", String.class)
                .orElse("UTC"));
    }

    /**
     * 单次报表请求的查询超时 (单位: 秒)
     * 默认 60秒
     */
    public long getQueryTimeoutSeconds() {
        return ConfigProvider.getConfig()
                .getOptionalValue("reporting.query.timeout-seconds", Long.class)
                .orElse(60L);
    }

    /**
     * 查询执行线程数
     */
    public int getQueryPoolSize() {
        return ConfigProvider.getConfig()
                .getOptionalValue("reporting.query.pool-size", Integer.class)
                .orElse(8);
    }

    /**
     * 未指定 limit 时的默认返回行数
     */
    public int getDefaultLimit() {
        return ConfigProvider.getConfig()
                .getOptionalValue("reporting.query.default-limit", Integer.class)
                .orElse(1000);
    }

    public int getMaxLimit() {
        return ConfigProvider.getConfig()
                .getOptionalValue("reporting.query.max-limit", Integer.class)
                .orElse(10000);
    }
}
