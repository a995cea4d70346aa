package com.asra.orchestrator;

import com.asra.orchestrator.workflow.ResearchWorkflowService;
import com.asra.orchestrator.workflow.WorkflowReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class AsraApplication {

    private static final Logger log = LoggerFactory.getLogger(AsraApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AsraApplication.class, args);
    }

    /**
     * Runs the research workflow once at startup, then the application keeps
     * serving the REST API.
     *
     * To run:
     *   mvn -pl orchestrator spring-boot:run -Dspring-boot.run.arguments=--asra.workflow.run-on-startup=true
     */
    @Bean
    @ConditionalOnProperty(name = "asra.workflow.run-on-startup", havingValue = "true")
    CommandLineRunner runWorkflowOnStartup(ResearchWorkflowService workflow) {
        return args -> {
            WorkflowReport report = workflow.runResearchWorkflow(null);
            if (ResearchWorkflowService.overallSuccess(report)) {
                log.info("Research workflow completed");
            } else {
                log.error("Research workflow did not complete: {}", report);
            }
        };
    }
}
