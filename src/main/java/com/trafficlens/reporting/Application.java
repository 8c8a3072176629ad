package com.trafficlens.reporting;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 应用程序主类
 * Quarkus启动入口
 */
@QuarkusMain
public class Application {

    public static void main(String[] args) {
        Quarkus.run(App.class, args);
    }

    /**
     * 应用程序实例
     */
    public static class App implements QuarkusApplication {

        private static final Logger log = LoggerFactory.getLogger(App.class);

        @Override
        public int run(String... args) throws Exception {
            log.info("TrafficLens Reporting Runtime started: ads spend + CRM drill-down reports");
            Quarkus.waitForExit();
            return 0;
        }
    }
}
