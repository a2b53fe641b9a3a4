package com.bko.healthexport.healthdata.file;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HealthDataConfiguration {
    public static final String EXECUTOR_BEAN = "healthDataExecutor";
    private static final int QUERY_THREADS = 4;

    @Bean(name = EXECUTOR_BEAN, destroyMethod = "shutdown")
    public ExecutorService healthDataExecutor() {
        return Executors.newFixedThreadPool(QUERY_THREADS, new CustomizableThreadFactory("health-data-"));
    }
}
