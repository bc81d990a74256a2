package com.deepansh.toolplanner.config;

import com.deepansh.toolplanner.dependency.DependencyClassifier;
import com.deepansh.toolplanner.dependency.DependencyGraphBuilder;
import com.deepansh.toolplanner.dependency.ResourceExtractor;
import com.deepansh.toolplanner.dependency.ResourceExtractorRegistry;
import com.deepansh.toolplanner.dependency.ToolCategories;
import com.deepansh.toolplanner.scheduling.ParallelGrouper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the planner pipeline: categories + extractors → classifier → graph builder → grouper.
 */
@Configuration
@EnableConfigurationProperties(PlannerProperties.class)
@Slf4j
public class PlannerConfig {

    @Bean
    public ToolCategories toolCategories(PlannerProperties properties) {
        PlannerProperties.Tools tools = properties.getTools();
        ToolCategories categories = new ToolCategories(
                tools.getWrite(), tools.getRead(), tools.getState(), properties.getStateVerbs());
        log.info("Tool categories: {} write, {} read, {} state tools, state verbs {}",
                categories.getWriteTools().size(),
                categories.getReadTools().size(),
                categories.getStateTools().size(),
                categories.getStateVerbs());
        return categories;
    }

    @Bean
    public ResourceExtractorRegistry resourceExtractorRegistry(PlannerProperties properties) {
        ResourceExtractorRegistry registry = new ResourceExtractorRegistry();
        properties.getExtractors().forEach((toolName, argumentKey) -> {
            registry.register(toolName, ResourceExtractor.argument(argumentKey));
            log.info("Registered resource extractor: [{}] → argument '{}'", toolName, argumentKey);
        });
        return registry;
    }

    @Bean
    public DependencyClassifier dependencyClassifier(ResourceExtractorRegistry extractors,
                                                     ToolCategories categories,
                                                     PlannerProperties properties) {
        if (properties.isConservativeUnresolvedResources()) {
            log.info("Conservative policy enabled: writes are serialized against calls without a resource");
        }
        return DependencyClassifier.withDefaultRules(
                extractors, categories, properties.isConservativeUnresolvedResources());
    }

    @Bean
    public DependencyGraphBuilder dependencyGraphBuilder(DependencyClassifier classifier) {
        return new DependencyGraphBuilder(classifier);
    }

    @Bean
    public ParallelGrouper parallelGrouper(DependencyGraphBuilder graphBuilder) {
        return new ParallelGrouper(graphBuilder);
    }
}
