package com.wavegate.dispatch.cli;

import com.wavegate.WavegateApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and hands its exit code back to
 * {@link WavegateApplication}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final WavegateCommand root;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WavegateCommand root, IFactory factory) {
        this.root = root;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (WavegateApplication.isServeMode(args)) {
            // the web server keeps running after this returns
            return;
        }
        exitCode = new CommandLine(root, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
