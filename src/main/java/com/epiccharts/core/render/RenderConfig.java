package com.epiccharts.core.render;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

@Configuration
public class RenderConfig {

    @Bean
    public Supplier<RenderingEngine> renderingEngineFactory(RenderProperties properties) {
        return () -> PlaywrightRenderingEngine.launch(properties);
    }
}
