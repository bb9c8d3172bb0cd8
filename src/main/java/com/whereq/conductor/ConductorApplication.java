package com.whereq.conductor;

import com.whereq.conductor.runner.OneShotJobRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Conductor.
 * Runs background jobs for the inventory platform: scheduling, approval gating and dispatch
 * onto a Redis-backed worker pool or onto one Kubernetes job per task.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class ConductorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ConductorApplication.class, args);
        if (context.getBeanProvider(OneShotJobRunner.class).getIfAvailable() != null) {
            // One-shot mode: the job already ran, leave with its exit code
            System.exit(SpringApplication.exit(context));
        }
    }
}
