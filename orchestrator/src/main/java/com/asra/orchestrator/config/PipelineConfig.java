package com.asra.orchestrator.config;

import com.asra.orchestrator.executor.ExecutionEnvironment;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Wiring for beans built from plain configuration values.
 */
@Configuration
public class PipelineConfig {

    /**
     * How stage programs are launched. A timeout of 0 means no ceiling.
     */
    @Bean
    ExecutionEnvironment executionEnvironment(
            @Value("${asra.executor.interpreter:python3}") List<String> interpreter,
            @Value("${asra.executor.search-path-variable:PYTHONPATH}") String searchPathVariable,
            @Value("${asra.executor.search-path:}") List<String> searchPath,
            @Value("${asra.executor.timeout-sec:0}") long timeoutSec) {
        return new ExecutionEnvironment(
                interpreter,
                searchPathVariable,
                searchPath.stream().filter(s -> !s.isBlank()).map(Path::of).toList(),
                timeoutSec > 0 ? Duration.ofSeconds(timeoutSec) : null);
    }
}
