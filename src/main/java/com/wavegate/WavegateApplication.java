package com.wavegate;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for both faces of Wavegate: {@code wavegate serve} runs the HTTP server until the
 * process is stopped, every other command runs once and exits with the command's exit code.
 */
@SpringBootApplication
public class WavegateApplication {

    static final String SERVE_ENV = "WAVEGATE_SERVE";

    public static void main(String[] args) {
        if (args.length == 0 && System.getenv(SERVE_ENV) != null) {
            args = new String[]{"serve"};
        }
        boolean serve = isServeMode(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(WavegateApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serve ? "servlet" : "none"),
                        "spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    /**
     * Serve mode is selected by the subcommand alone, so {@code wavegate help serve} stays a CLI call.
     */
    public static boolean isServeMode(String... args) {
        return args.length > 0 && "serve".equals(args[0]);
    }
}
