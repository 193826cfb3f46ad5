package io.chatflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatflow.core.session.ConversationTurn;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ChatflowRunCommand")
class ChatflowRunCommandTest extends BaseChatflowCommandTest {

    @TempDir Path tempDir;

    private ChatflowRunCommand command;
    private final InputStream originalIn = System.in;

    @BeforeEach
    void setUp() throws Exception {
        writeChatflow(tempDir, "support.json", SUPPORT_BOT);
        command = new ChatflowRunCommand();
        injectField(command, "environment", createEnvironment());
        injectField(command, "workingDirPath", tempDir);
        injectField(command, "defaultChatflowFile", Optional.empty());
        injectField(command, "chatflowFile", "support.json");
        injectField(command, "color", false);
    }

    @AfterEach
    void restoreStdin() {
        System.setIn(originalIn);
    }

    @Nested
    @DisplayName("single turn")
    class SingleTurn {

        @Test
        void shouldPrintOutputPathAndTimings() throws Exception {
            // Given
            injectField(command, "message", "I need help with billing");

            // When
            int exitCode = command.call();

            // Then
            assertThat(exitCode).isZero();
            assertThat(output())
                    .contains("Turn completed")
                    .contains("Connecting you to support: I need help with billing")
                    .contains("Nodes: t1 → c1 → r_help")
                    .contains("• r_help");
        }

        @Test
        void shouldRouteThroughLlmOnFalseBranch() throws Exception {
            // Given
            injectField(command, "message", "Good morning");

            // When
            int exitCode = command.call();

            // Then
            assertThat(exitCode).isZero();
            assertThat(output()).contains("Happy to chat!").contains("t1 → c1 → l1 → r_llm");
        }

        @Test
        void shouldPrintJsonResult() throws Exception {
            // Given
            injectField(command, "message", "help");
            injectField(command, "json", true);

            // When
            int exitCode = command.call();

            // Then
            assertThat(exitCode).isZero();
            assertThat(output().strip())
                    .startsWith("{")
                    .contains("\"status\" : \"SUCCEEDED\"")
                    .contains("\"response_node_id\" : \"r_help\"");
        }

        @Test
        void shouldPrintEachNodeWhenVerbose() throws Exception {
            // Given
            injectField(command, "message", "Good morning");
            injectField(command, "verbose", true);

            // When
            command.call();

            // Then
            assertThat(output()).contains("* l1 (llm)").contains("OK  Happy to chat!");
        }

        @Test
        void shouldRecordTurnInSession() throws Exception {
            // Given
            injectField(command, "message", "help");
            injectField(command, "sessionId", "cli-session");

            // When
            command.call();

            // Then
            List<ConversationTurn> history = historyStore.loadHistory("cli-session", 10);
            assertThat(history)
                    .extracting(ConversationTurn::role)
                    .containsExactly(ConversationTurn.Role.USER, ConversationTurn.Role.ASSISTANT);
        }

        @Test
        void shouldRejectInvalidChatflow() throws Exception {
            // Given
            writeChatflow(tempDir, "broken.json", NO_RESPONSE);
            injectField(command, "chatflowFile", "broken.json");
            injectField(command, "message", "hi");

            // When
            int exitCode = command.call();

            // Then
            assertThat(exitCode).isEqualTo(1);
            assertThat(errors()).contains("Chatflow is invalid").contains("- No response node found");
        }
    }

    @Nested
    @DisplayName("interactive mode")
    class Interactive {

        @Test
        void shouldAnswerEachLineUntilExit() throws Exception {
            // Given
            System.setIn(stdin("hello\n\nhelp me\nexit\nignored\n"));

            // When
            int exitCode = command.call();

            // Then
            assertThat(exitCode).isZero();
            assertThat(output())
                    .contains("bot> Happy to chat!")
                    .contains("bot> Connecting you to support: help me")
                    .doesNotContain("ignored");
        }

        @Test
        void shouldKeepHistoryAcrossLines() throws Exception {
            // Given
            injectField(command, "sessionId", "chat-1");
            System.setIn(stdin("hello\nhelp\n"));

            // When
            command.call();

            // Then
            assertThat(historyStore.loadHistory("chat-1", 10))
                    .extracting(ConversationTurn::content)
                    .containsExactly(
                            "hello", "Happy to chat!", "help", "Connecting you to support: help");
        }
    }

    private static InputStream stdin(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
