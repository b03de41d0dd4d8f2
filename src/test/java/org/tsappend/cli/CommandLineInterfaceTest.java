package org.tsappend.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import picocli.CommandLine;

@Tag("unit")
class CommandLineInterfaceTest {

    @Test
    void testNoSubcommandPrintsUsage() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute();

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("Usage: tsappend")
                .contains("append")
                .contains("inspect")
                .contains("TSAPPEND_OUTPUT_DIR");
    }

    @Test
    void testUnknownSubcommandFails() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setErr(new PrintWriter(new StringWriter()));

        assertThat(cmdLine.execute("compact")).isNotEqualTo(0);
    }
}
