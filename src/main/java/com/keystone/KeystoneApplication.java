package com.keystone;

import com.keystone.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class KeystoneApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeCommand(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(KeystoneApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                        "spring.main.banner-mode=off");

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            // CLI: exit once the command has run
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            System.exit(SpringApplication.exit(ctx, exitCodeGen));
        }
    }
}
