// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.tools;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import java.io.IOException;
import java.util.logging.LogManager;
import org.hiero.merkle.common.logging.CleanColorfulFormatter;
import org.hiero.merkle.tools.commands.RootCommand;
import org.hiero.merkle.tools.commands.StreamCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Command line tool for computing Merkle roots of leaf lists
 */
@SuppressWarnings("InstantiationOfUtilityClass")
@Command(
        name = "merkle-tool",
        mixinStandardHelpOptions = true,
        version = "MerkleTool 0.1",
        description = "Computes Merkle roots in batch or incrementally",
        subcommands = {
            RootCommand.class,
            StreamCommand.class,
        })
public final class MerkleTool {
    private static final System.Logger LOGGER = System.getLogger(MerkleTool.class.getName());

    /**
     * Empty Default constructor to remove Javadoc warning
     */
    public MerkleTool() {}

    /**
     * Main entry point for the app
     * @param args command line arguments
     */
    public static void main(String... args) {
        configureLogging();
        int exitCode = new CommandLine(new MerkleTool()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Load logging.properties from the classpath unless an external logging configuration was given, then make the
     * console output colorful.
     */
    static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            LOGGER.log(DEBUG, "External logging configuration found");
            return;
        }
        try (var loggingConfigIn = MerkleTool.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (loggingConfigIn != null) {
                LogManager.getLogManager().readConfiguration(loggingConfigIn);
            } else {
                LOGGER.log(INFO, "No logging configuration found");
            }
        } catch (IOException e) {
            LOGGER.log(INFO, "Failed to load logging configuration", e);
        }
        CleanColorfulFormatter.makeLoggingColorful();
    }
}
