package com.fleetwarden;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class FleetwardenApplication {

    public static void main(String[] args) {
        boolean serveMode = Arrays.asList(args).contains("serve");

        ApplicationContext ctx = new SpringApplicationBuilder(FleetwardenApplication.class)
                .properties(modeProperties(serveMode))
                .run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }

    /**
     * Default properties for the selected mode. They sit below application.yml, the environment
     * and command-line arguments, so an operator can still turn the board sync off under serve.
     */
    static String[] modeProperties(boolean serveMode) {
        if (serveMode) {
            // REST API + SSE, board sync and stale sweep run until the process is stopped
            return new String[] {
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off",
                    "fleetwarden.sync.enabled=true"
            };
        }
        return new String[] {
                "spring.main.web-application-type=none",
                "spring.main.banner-mode=off",
                "fleetwarden.sync.enabled=false"
        };
    }
}
