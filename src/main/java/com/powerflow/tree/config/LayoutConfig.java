package com.powerflow.tree.config;

import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.service.graph.ConsolidationPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default layout settings and consolidation policy used when a caller passes none.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class LayoutConfig {

    @Bean
    public LayoutSettings layoutSettings(LayoutProperties properties) {
        LayoutSettings settings = properties.toSettings().validate();
        log.info("[Layout Config] Node {}x{}, gap {}, level spacing {}, depth ceiling {}",
                settings.getNodeWidth(), settings.getNodeHeight(), settings.getMinimumGap(),
                settings.getLevelSpacing(), settings.getMaxTraversalDepth());
        return settings;
    }

    @Bean
    public ConsolidationPolicy consolidationPolicy() {
        return ConsolidationPolicy.standard();
    }
}
