package com.rewind;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point. {@code rewind serve} runs the REST API; every other invocation is a one-shot
 * CLI command that exits with the command's status.
 */
@SpringBootApplication
public class RewindApplication {

    public static void main(String[] args) {
        boolean serve = Arrays.asList(args).contains("serve");

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(RewindApplication.class)
                .web(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .properties("spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }
}
