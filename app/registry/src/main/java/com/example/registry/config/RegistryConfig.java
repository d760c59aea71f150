package com.example.registry.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  RegistryStoreProperties.class,
  RegistryExportProperties.class,
  RegistryDisplayProperties.class
})
public class RegistryConfig {}
