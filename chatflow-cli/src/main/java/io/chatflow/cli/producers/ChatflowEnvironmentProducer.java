package io.chatflow.cli.producers;

import io.chatflow.adapter.langchain4j.LangChain4jInferenceClient;
import io.chatflow.adapter.langchain4j.LangChain4jModelProvider;
import io.chatflow.core.ChatflowConfig;
import io.chatflow.core.ChatflowEnvironment;
import io.chatflow.core.ChatflowFactory;
import io.chatflow.core.execution.executor.NodeExecutor;
import io.chatflow.core.inference.InferenceClient;
import io.chatflow.core.inference.StubInferenceClient;
import io.chatflow.serialization.JacksonJsonCodec;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// CDI producer for the chatflow runtime environment.
///
/// ### Credential Discovery
/// Credentials are loaded from (later sources win):
/// 1. **Environment variables** matching `*_API_KEY`, `*_KEY`, `*_SECRET`, `*_TOKEN`
/// 2. **Application properties** under `chatflow.credentials.*`
///
/// ### Configuration Properties
/// | Property | Type | Default |
/// |----------|------|---------|
/// | `chatflow.max-iterations` | int | `50` |
/// | `chatflow.history-limit` | int | `10` |
/// | `chatflow.node-timeout-seconds` | int | `30` |
/// | `chatflow.strict-branching` | boolean | `false` |
/// | `chatflow.inference-threads` | int | `4` |
/// | `chatflow.stub.enabled` | boolean | `false` |
///
/// The stub switch is also honored as a system property, which is how `run --stub`
/// turns it on before the environment is first used.
///
/// @implNote Application-scoped singleton. The environment is created lazily on first
/// use and closed on shutdown.
@ApplicationScoped
public class ChatflowEnvironmentProducer {

    private static final Logger logger =
            Logger.getLogger(ChatflowEnvironmentProducer.class.getName());

    public static final String STUB_ENABLED_PROPERTY = "chatflow.stub.enabled";
    private static final String CREDENTIALS_PREFIX = "chatflow.credentials.";

    private ChatflowEnvironment chatflowEnvironment;

    @Inject Config config;

    @Inject Instance<NodeExecutor> customExecutors;

    @Inject
    @ConfigProperty(name = "chatflow.max-iterations", defaultValue = "50")
    int maxIterations;

    @Inject
    @ConfigProperty(name = "chatflow.history-limit", defaultValue = "10")
    int historyLimit;

    @Inject
    @ConfigProperty(name = "chatflow.node-timeout-seconds", defaultValue = "30")
    int nodeTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "chatflow.strict-branching", defaultValue = "false")
    boolean strictBranching;

    @Inject
    @ConfigProperty(name = "chatflow.inference-threads", defaultValue = "4")
    int inferenceThreads;

    @Inject
    @ConfigProperty(name = STUB_ENABLED_PROPERTY, defaultValue = "false")
    boolean stubEnabled;

    /// Produces the environment shared by every command.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public ChatflowEnvironment chatflowEnvironment() {
        Map<String, String> credentials = ChatflowFactory.loadCredentials(extractCredentialProperties());

        ChatflowFactory.Builder builder =
                ChatflowFactory.builder()
                        .config(
                                ChatflowConfig.builder()
                                        .maxIterations(maxIterations)
                                        .historyLimit(historyLimit)
                                        .defaultNodeTimeout(Duration.ofSeconds(nodeTimeoutSeconds))
                                        .strictBranching(strictBranching)
                                        .inferenceThreads(inferenceThreads)
                                        .build())
                        .credentials(credentials)
                        .inferenceClient(createInferenceClient(credentials))
                        .jsonCodec(new JacksonJsonCodec());

        for (NodeExecutor executor : customExecutors) {
            builder.executor(executor);
            logger.info("Registered custom executor for kind: " + executor.getNodeKind());
        }

        chatflowEnvironment = builder.build();
        return chatflowEnvironment;
    }

    InferenceClient createInferenceClient(Map<String, String> credentials) {
        if (isStubEnabled()) {
            logger.info("Stub inference enabled");
            return new StubInferenceClient();
        }
        return new LangChain4jInferenceClient(new LangChain4jModelProvider(credentials));
    }

    boolean isStubEnabled() {
        return stubEnabled || Boolean.getBoolean(STUB_ENABLED_PROPERTY);
    }

    /// Collects `chatflow.credentials.*` entries from the Quarkus config.
    private Properties extractCredentialProperties() {
        Properties properties = new Properties();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(CREDENTIALS_PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        return properties;
    }

    @PreDestroy
    public void cleanup() {
        if (chatflowEnvironment != null) {
            chatflowEnvironment.close();
        }
    }
}
