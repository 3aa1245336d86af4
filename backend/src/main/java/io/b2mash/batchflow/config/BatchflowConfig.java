package io.b2mash.batchflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BatchflowProperties.class)
public class BatchflowConfig {}
