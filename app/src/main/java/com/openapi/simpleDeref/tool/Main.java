package com.openapi.simpleDeref.tool;

import com.openapi.simpleDeref.tool.cli.DereferenceCommand;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("Starting Simple OpenAPI Dereferencer");

        CommandLine cmd = new CommandLine(new DereferenceCommand());
        int exitCode = cmd.execute(args);

        logger.info("Dereferencer completed with exit code: {}", exitCode);
        System.exit(exitCode);
    }
}
