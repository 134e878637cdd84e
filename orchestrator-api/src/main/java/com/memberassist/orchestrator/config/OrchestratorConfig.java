package com.memberassist.orchestrator.config;

import com.memberassist.orchestrator.service.catalog.ToolCatalog;
import com.memberassist.orchestrator.service.catalog.ToolCatalogLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkflowSettings workflowSettings(OrchestratorProperties properties) {
        return properties.toWorkflowSettings();
    }

    @Bean
    public ToolCatalogLoader toolCatalogLoader(ResourceLoader resourceLoader) {
        return new ToolCatalogLoader(resourceLoader);
    }

    /**
     * A catalog that fails to load aborts startup.
     */
    @Bean
    public ToolCatalog toolCatalog(ToolCatalogLoader loader, OrchestratorProperties properties) {
        return loader.load(properties.getCatalog().getLocation());
    }
}
