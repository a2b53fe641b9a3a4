package com.bko.healthexport.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SettingsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SettingsConfiguration.class);

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        HealthDataSettings healthData = new HealthDataSettings(
                envConfig.get("health_data.file")
        );
        ExportSettings export = new ExportSettings(
                envConfig.get("export.workout_id"),
                envConfig.get("export.output_dir")
        );
        if (!healthData.isConfigured()) {
            logger.warn("HEALTH_DATA_FILE not set; health data queries will fail until it is configured.");
        }
        return new AppSettings(healthData, export);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
