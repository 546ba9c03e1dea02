// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.tools;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Logger;
import org.hiero.merkle.common.logging.CleanColorfulFormatter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

/**
 * Unit tests for the {@link MerkleTool} top level command.
 */
@DisplayName("MerkleTool Tests")
class MerkleToolTest {

    @Test
    @DisplayName("Help lists both subcommands")
    void testHelp() {
        final StringWriter out = new StringWriter();
        final CommandLine cmd = new CommandLine(new MerkleTool());
        cmd.setOut(new PrintWriter(out));

        assertThat(cmd.execute("--help")).isEqualTo(0);
        assertThat(out.toString()).contains("merkle-tool", "root", "stream");
    }

    @Test
    @DisplayName("Version option prints the tool version")
    void testVersion() {
        final StringWriter out = new StringWriter();
        final CommandLine cmd = new CommandLine(new MerkleTool());
        cmd.setOut(new PrintWriter(out));

        assertThat(cmd.execute("--version")).isEqualTo(0);
        assertThat(out.toString()).contains("MerkleTool");
    }

    @Test
    @DisplayName("An unknown subcommand is a usage error")
    void testUnknownSubcommand() {
        final CommandLine cmd = new CommandLine(new MerkleTool());
        cmd.setErr(new PrintWriter(new StringWriter()));

        assertThat(cmd.execute("prove")).isEqualTo(2);
    }

    @Test
    @DisplayName("Logging setup puts the colourful formatter on the console handler")
    void testConfigureLogging() {
        MerkleTool.configureLogging();

        assertThat(Logger.getLogger("").getHandlers())
                .anySatisfy(handler -> {
                    assertThat(handler).isInstanceOf(ConsoleHandler.class);
                    assertThat(handler.getFormatter()).isInstanceOf(CleanColorfulFormatter.class);
                });
    }
}
