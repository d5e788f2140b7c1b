package com.blockmorph.config;

import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WebServerConfig {

    @Bean
    public WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> bindAddressCustomizer(AppProperties properties) {
        return factory -> {
            factory.setAddress(properties.getBindAddress());
            factory.setPort(properties.getBindPort());
        };
    }
}
