package com.devscontext.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

/**
 * Background preprocessor. Runs the source watcher on a fixed delay, or a
 * single cycle and exit when started with {@code --once}.
 */
@SpringBootApplication(scanBasePackages = "com.devscontext")
@EnableScheduling
public class DevsContextAgentApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(DevsContextAgentApplication.class, args);
        if (Arrays.asList(args).contains("--" + OnceMode.OPTION)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
