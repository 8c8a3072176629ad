package com.trafficlens.reporting.config;

import com.trafficlens.reporting.common.config.ReportingConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * "今天"的来源：规范时区的系统时钟，测试中可替换
 */
@ApplicationScoped
public class ClockProducer {

    @Inject
    ReportingConfig config;

    @Produces
    @Singleton
    Clock reportingClock() {
        return Clock.system(config.getTimezone());
    }
}
