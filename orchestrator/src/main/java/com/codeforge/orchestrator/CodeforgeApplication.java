package com.codeforge.orchestrator;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

/**
 * Command-line entry point. Boots the context without a web server, lets the
 * picocli runner execute the command, then exits with its exit code.
 */
@SpringBootApplication
public class CodeforgeApplication {

    public static void main(String[] args) {
        ApplicationContext ctx = new SpringApplicationBuilder(CodeforgeApplication.class)
                .properties("spring.main.web-application-type=none",
                            "spring.main.banner-mode=off")
                .run(args);
        int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
        System.exit(exitCode);
    }
}
