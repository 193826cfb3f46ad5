package io.chatflow.cli.commands;

import io.chatflow.cli.execution.VerboseExecutionListener;
import io.chatflow.cli.producers.ChatflowEnvironmentProducer;
import io.chatflow.cli.ui.AnsiStyles;
import io.chatflow.core.ChatflowEnvironment;
import io.chatflow.core.exception.ChatflowValidationException;
import io.chatflow.core.execution.ExecutionListener;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.execution.result.NodeTiming;
import io.chatflow.core.graph.Graph;
import io.chatflow.serialization.ChatflowSerializer;
import jakarta.inject.Inject;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Activates a chatflow and runs conversational turns against it.
///
/// With `--message` one turn runs and the exit code reports whether it succeeded.
/// Without it, messages are read from standard input line by line within one
/// session, so each turn sees the history of the previous ones. `exit` or `quit`
/// ends the conversation.
///
/// ### Usage
/// ```bash
/// chatflow run [-d <working-dir>] [-m <message>] [-s <session>] [--stub] [--json] [-v] <file>
/// ```
///
/// ### Options
/// - `-m, --message` - the user message for a single turn
/// - `-s, --session` - session id used for history, random when omitted
/// - `--stub` - answer LLM nodes with the stub client instead of a provider
/// - `--json` - print the full result as JSON
/// - `-v, --verbose` - print each node as it runs
/// - `--no-color` - disable ANSI color output
@Command(name = "run", description = "Run a chatflow")
class ChatflowRunCommand extends ChatflowCommand {

    @Parameters(index = "0", description = "Chatflow JSON file", arity = "0..1")
    String chatflowFile;

    @Option(
            names = {"-m", "--message"},
            description = "User message for a single turn; omit to read messages from stdin")
    String message;

    @Option(
            names = {"-s", "--session"},
            description = "Session id for conversation history")
    String sessionId;

    @Option(names = "--stub", description = "Use the stub inference client")
    boolean stub;

    @Option(names = "--json", description = "Print results as JSON")
    boolean json;

    @Option(
            names = {"-v", "--verbose"},
            description = "Print each node as it runs")
    boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    boolean color = true;

    @Inject ChatflowEnvironment environment;

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);

        // Read by the producer when the environment is first used
        if (stub) {
            System.setProperty(ChatflowEnvironmentProducer.STUB_ENABLED_PROPERTY, "true");
        }

        try {
            Graph graph = environment.getActivator().activate(loadDefinition(chatflowFile));
            String session = sessionId != null ? sessionId : UUID.randomUUID().toString();
            ExecutionListener listener =
                    verbose ? new VerboseExecutionListener(System.out, color) : ExecutionListener.NOOP;

            if (message != null) {
                ExecutionResult result = respond(graph, session, message, listener);
                printResult(result, styles);
                return result.success() ? 0 : 1;
            }
            return converse(graph, session, listener, styles);
        } catch (ChatflowValidationException e) {
            System.err.printf("%s %s%n", styles.crossmark(), styles.bold("Chatflow is invalid:"));
            e.getErrors().forEach(error -> System.err.println("   - " + error));
            return 1;
        } catch (Exception e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Chatflow execution failed:"), e.getMessage());
            return 1;
        }
    }

    private int converse(Graph graph, String session, ExecutionListener listener, AnsiStyles styles)
            throws IOException {
        if (!json) {
            System.out.println(
                    styles.gray("  Session " + session + ". Type a message, or 'exit' to quit."));
        }
        BufferedReader reader =
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while (true) {
            if (!json) {
                System.out.print(styles.bold("you> "));
                System.out.flush();
            }
            line = reader.readLine();
            if (line == null || line.strip().equalsIgnoreCase("exit") || line.strip().equalsIgnoreCase("quit")) {
                return 0;
            }
            if (line.isBlank()) {
                continue;
            }
            ExecutionResult result = respond(graph, session, line, listener);
            if (json) {
                System.out.println(ChatflowSerializer.toJson(result));
            } else if (result.success()) {
                System.out.println(styles.accent("bot> ") + result.outputText());
            } else {
                printFailure(result, styles);
            }
        }
    }

    private ExecutionResult respond(
            Graph graph, String session, String text, ExecutionListener listener) {
        return environment.getSession().respond(graph, session, null, text, listener);
    }

    private void printResult(ExecutionResult result, AnsiStyles styles) {
        if (json) {
            System.out.println(ChatflowSerializer.toJson(result));
            return;
        }

        if (result.success()) {
            System.out.printf("%n%s %s%n", styles.checkmark(), styles.bold("Turn completed"));
            System.out.println(result.outputText());
        } else {
            printFailure(result, styles);
        }

        System.out.printf(
                "%n  Nodes: %s%n", String.join(" " + styles.arrow() + " ", result.nodesExecuted()));
        for (NodeTiming timing : result.timings()) {
            System.out.printf(
                    "  %s %s %s%n",
                    styles.bullet(), timing.nodeId(), styles.gray(timing.durationMs() + " ms"));
        }
        System.out.printf(
                "  %s%n", styles.gray("Total: " + result.totalDuration().toMillis() + " ms"));
    }

    private void printFailure(ExecutionResult result, AnsiStyles styles) {
        result.getError()
                .ifPresent(
                        error ->
                                System.out.printf(
                                        "%n%s %s %s%n",
                                        styles.crossmark(),
                                        styles.bold("Turn " + result.status() + " [" + error.kind() + "]:"),
                                        error.detail()));
    }
}
