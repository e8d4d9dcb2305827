package com.mindmarker.config;

import com.mindmarker.compiler.MarkerCompiler;
import com.mindmarker.markerFile.MarkerDecoder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CompilerProperties.class)
public class CompilerConfiguration {

    @Bean
    public MarkerCompiler markerCompiler(CompilerProperties properties) {
        return MarkerCompilerFactory.create(properties);
    }

    @Bean
    public MarkerDecoder markerDecoder() {
        return new MarkerDecoder();
    }
}
