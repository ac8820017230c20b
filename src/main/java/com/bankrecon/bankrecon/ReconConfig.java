package com.bankrecon.bankrecon;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of reconciliation configuration properties.
 */
@Configuration
@EnableConfigurationProperties(ReconProperties.class)
public class ReconConfig {
}
