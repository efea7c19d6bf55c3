package com.project.image.edges.config;

import com.project.image.edges.pipeline.AnchorStrategy;
import com.project.image.edges.pipeline.FixedOffsetAnchorStrategy;
import com.project.image.edges.pipeline.ThresholdPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(EdgeDetectionProperties.class)
public class EdgeDetectionConfig {
    private static final Logger log = LoggerFactory.getLogger(EdgeDetectionConfig.class);

    @Bean
    public ThresholdPolicy thresholdPolicy(EdgeDetectionProperties props) {
        if (props.getThresholdPolicy() == EdgeDetectionProperties.Policy.RELATIVE) {
            log.info("Using relative hysteresis thresholds: high={} x max gradient, low={} x high",
                    props.getRelativeHighRatio(), props.getRelativeLowRatio());
            return ThresholdPolicy.relative(props.getRelativeHighRatio(), props.getRelativeLowRatio());
        }
        log.info("Using fixed hysteresis thresholds: low={}, high={}", props.getLowThreshold(), props.getHighThreshold());
        return ThresholdPolicy.fixed(props.getLowThreshold(), props.getHighThreshold());
    }

    @Bean
    public AnchorStrategy anchorStrategy() {
        return new FixedOffsetAnchorStrategy();
    }

    @Bean
    public ThreadPoolTaskExecutor edgeDetectionExecutor(EdgeDetectionProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getWorkerThreads());
        executor.setMaxPoolSize(props.getWorkerThreads());
        executor.setThreadNamePrefix("edge-detect-");
        return executor;
    }
}
