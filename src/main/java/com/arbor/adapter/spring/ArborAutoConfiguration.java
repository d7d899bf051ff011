package com.arbor.adapter.spring;

import com.arbor.catalog.DecisionTreeCatalog;
import com.arbor.config.PredicateCatalog;
import com.arbor.engine.DecisionEngine;
import com.arbor.engine.DefaultDecisionEngine;
import com.arbor.input.DefaultInputResolver;
import com.arbor.input.InputResolver;
import com.arbor.lookup.TreeLookupService;
import com.arbor.operator.DefaultOperatorRegistry;
import com.arbor.operator.OperatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Arbor.
 * Declare an {@link OperatorRegistry} bean to add operators; it is populated before any tree
 * is loaded or evaluated.
 */
@Configuration
@ConditionalOnProperty(prefix = "arbor", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ArborProperties.class)
public class ArborAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ArborAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public OperatorRegistry operatorRegistry() {
        return new DefaultOperatorRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public PredicateCatalog predicateCatalog() {
        return PredicateCatalog.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public InputResolver inputResolver(ArborProperties properties) {
        log.info("Input binding mode: {}", properties.getBindingMode());
        return new DefaultInputResolver(properties.getBindingMode());
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionEngine decisionEngine(OperatorRegistry operatorRegistry, InputResolver inputResolver) {
        return new DefaultDecisionEngine(operatorRegistry, inputResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionTreeCatalog decisionTreeCatalog(ArborProperties properties, PredicateCatalog predicates,
                                                   OperatorRegistry operatorRegistry) {
        log.info("Loading decision trees from: {}", properties.getTreeLocations());
        return DecisionTreeCatalog.load(
                properties.getTreeLocations(),
                predicates,
                properties.isValidateOnLoad() ? operatorRegistry : null);
    }

    @Bean
    @ConditionalOnMissingBean
    public TreeLookupService treeLookupService(DecisionEngine decisionEngine, DecisionTreeCatalog catalog) {
        return new TreeLookupService(decisionEngine, catalog);
    }
}
