package io.cryojob4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cryojob4j.JobCompiler;
import io.cryojob4j.core.JobTypeRegistry;
import io.cryojob4j.internal.DefaultJobCompiler;
import io.cryojob4j.internal.json.JsonJobParameters;
import io.cryojob4j.internal.relion.RelionBuilderFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for the job compiler.
 */
@AutoConfiguration
@ConditionalOnClass(JobCompiler.class)
@EnableConfigurationProperties(CompilerProperties.class)
@ConditionalOnProperty(prefix = "cryojob", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CompilerAutoConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobTypeRegistry jobTypeRegistry() {
        return new JobTypeRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public RelionBuilderFactory relionBuilderFactory(CompilerProperties props) {
        return new RelionBuilderFactory(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCompiler jobCompiler(JobTypeRegistry registry, RelionBuilderFactory builders, CompilerProperties props) {
        return new DefaultJobCompiler(registry, builders, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonJobParameters jsonJobParameters(ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonJobParameters(objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
