package com.scidbshim.config;

import com.scidbshim.client.ScidbClient;
import com.scidbshim.client.ScidbClientLoader;
import com.scidbshim.refresh.ArrayRefresher;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ShimProperties.class)
public class ShimConfiguration {

    @Bean
    public ScidbClient scidbClient(ScidbClientLoader loader) {
        return loader.load();
    }

    /**
     * Kick off the arrays catalog load once the context is up, whenever a catalog path is set.
     */
    @Bean
    public ApplicationRunner arrayRefresherRunner(ArrayRefresher refresher) {
        return args -> refresher.startIfConfigured();
    }
}
