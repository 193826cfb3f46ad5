package io.chatflow.cli.commands;

import io.chatflow.core.ChatflowEnvironment;
import io.chatflow.core.ChatflowFactory;
import io.chatflow.core.inference.StubInferenceClient;
import io.chatflow.core.session.InMemoryHistoryStore;
import io.chatflow.serialization.JacksonJsonCodec;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/// Base class for CLI command tests with common utilities.
abstract class BaseChatflowCommandTest {

    /// Routes "help" messages to a fixed response, everything else through the LLM node.
    protected static final String SUPPORT_BOT =
            """
            {
              "id": "support-bot",
              "version": 2,
              "nodes": [
                {"id": "t1", "type": "trigger"},
                {"id": "c1", "type": "condition",
                 "data": {"config": {"operator": "contains", "value": "help"}}},
                {"id": "r_help", "type": "response",
                 "data": {"config": {"message": "Connecting you to support: {{input}}"}}},
                {"id": "l1", "type": "llm",
                 "data": {"config": {"prompt": "{{input}}", "model": "support-model"}}},
                {"id": "r_llm", "type": "response", "data": {"config": {"message": "{{l1}}"}}}
              ],
              "edges": [
                {"source": "t1", "target": "c1"},
                {"source": "c1", "target": "r_help", "condition": "true"},
                {"source": "c1", "target": "l1", "condition": "false"},
                {"source": "l1", "target": "r_llm"}
              ]
            }
            """;

    /// A trigger feeding an LLM node with no response node anywhere.
    protected static final String NO_RESPONSE =
            """
            {
              "id": "broken",
              "nodes": [
                {"id": "t1", "type": "trigger"},
                {"id": "l1", "type": "llm", "config": {"prompt": "{{input}}"}}
              ],
              "edges": [{"source": "t1", "target": "l1"}]
            }
            """;

    protected ByteArrayOutputStream outContent;
    protected ByteArrayOutputStream errContent;
    protected ChatflowEnvironment environment;
    protected final InMemoryHistoryStore historyStore = new InMemoryHistoryStore();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUpStreams() {
        originalOut = System.out;
        originalErr = System.err;
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        if (environment != null) {
            environment.close();
        }
    }

    protected String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    protected String errors() {
        return errContent.toString(StandardCharsets.UTF_8);
    }

    /// Creates an environment whose LLM nodes answer "Happy to chat!" for `support-model`.
    protected ChatflowEnvironment createEnvironment() {
        environment =
                ChatflowFactory.builder()
                        .inferenceClient(
                                new StubInferenceClient().respondTo("support-model", "Happy to chat!"))
                        .jsonCodec(new JacksonJsonCodec())
                        .historyStore(historyStore)
                        .historyRecorder(historyStore)
                        .build();
        return environment;
    }

    protected Path writeChatflow(Path dir, String fileName, String json) throws IOException {
        return Files.writeString(dir.resolve(fileName), json);
    }

    /// Injects a value into a field, searching up the class hierarchy.
    protected void injectField(Object target, String fieldName, Object value) throws Exception {
        Field field = findField(target.getClass(), fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    private Field findField(Class<?> clazz, String fieldName) throws NoSuchFieldException {
        Class<?> current = clazz;
        while (current != null) {
            try {
                return current.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                current = current.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }
}
