package com.flowbridge.cli;

import com.flowbridge.FlowBridgeCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for command tests: runs the CLI in-process and captures both console streams.
 */
abstract class CommandTestBase {

    static final String BOOKING_WORKFLOW = """
        {
          "workflow": {
            "name": "Booking",
            "nodes": [
              {"id": "greet", "isStart": true, "prompt": "Greet the caller.",
               "messagePlan": {"firstMessage": "Hi, how can I help?"}},
              {"id": "book", "prompt": "Book an appointment."},
              {"id": "cancel", "prompt": "Cancel the appointment."},
              {"id": "bye", "type": "tool", "tool": {"type": "endCall"}}
            ],
            "edges": [
              {"from": "greet", "to": "book", "condition": {"type": "ai", "prompt": "wants to book"}},
              {"from": "greet", "to": "cancel", "condition": {"type": "ai", "prompt": "wants to cancel"}},
              {"from": "cancel", "to": "bye"}
            ]
          }
        }
        """;

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void captureStreams() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    int run(String... args) {
        return FlowBridgeCLI.commandLine().execute(args);
    }

    String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    Path writeWorkflow(String fileName, String json) throws IOException {
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, json);
        return file;
    }
}
