package dev.labelflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * LabelFlow: assignment distribution and review workflow for image annotation projects.
 *
 * <p>Flow:
 * <pre>
 * register images → distribute (manual | smart) → annotate → submit
 *   → review (approve | reject with flags) → redistribute / resubmit → complete
 * </pre>
 *
 * <p>Every workflow write runs in one transaction holding the project row lock;
 * project counters are recomputed from image state at the end of each write.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class LabelFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabelFlowApplication.class, args);
    }
}
