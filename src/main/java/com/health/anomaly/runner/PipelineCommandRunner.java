package com.health.anomaly.runner;

import com.health.anomaly.service.PipelineCommands;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Runs one batch command at startup, e.g.
 * {@code --pipeline.command=train --spring.main.web-application-type=none}.
 */
@Component
@ConditionalOnProperty(name = "pipeline.command")
public class PipelineCommandRunner implements CommandLineRunner {

    private final PipelineCommands commands;
    private final String command;
    private final PrintStream out;

    @Autowired
    public PipelineCommandRunner(PipelineCommands commands, @Value("${pipeline.command}") String command) {
        this(commands, command, System.out);
    }

    PipelineCommandRunner(PipelineCommands commands, String command, PrintStream out) {
        this.commands = commands;
        this.command = command;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        switch (command.trim().toLowerCase(Locale.ROOT)) {
            case "train":
                out.println(commands.train());
                break;
            case "analyze":
                out.println(commands.analyze());
                break;
            default:
                throw new IllegalArgumentException("Unknown pipeline command: " + command + " (expected train or analyze)");
        }
    }
}
