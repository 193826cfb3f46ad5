package io.chatflow.core;

import io.chatflow.core.activation.ActiveChatflows;
import io.chatflow.core.activation.ChatflowActivator;
import io.chatflow.core.condition.ConditionPredicate;
import io.chatflow.core.condition.DefaultConditionEvaluator;
import io.chatflow.core.credential.CredentialResolver;
import io.chatflow.core.credential.InMemoryCredentialResolver;
import io.chatflow.core.execution.ChatflowEngine;
import io.chatflow.core.execution.executor.ConditionNodeExecutor;
import io.chatflow.core.execution.executor.DefaultNodeExecutorRegistry;
import io.chatflow.core.execution.executor.HttpRequestNodeExecutor;
import io.chatflow.core.execution.executor.LlmNodeExecutor;
import io.chatflow.core.execution.executor.NodeExecutor;
import io.chatflow.core.execution.executor.NodeExecutorRegistry;
import io.chatflow.core.execution.executor.ResponseNodeExecutor;
import io.chatflow.core.execution.executor.TriggerNodeExecutor;
import io.chatflow.core.graph.GraphBuilder;
import io.chatflow.core.graph.GraphValidator;
import io.chatflow.core.http.HttpTransport;
import io.chatflow.core.http.JdkHttpTransport;
import io.chatflow.core.inference.InferenceClient;
import io.chatflow.core.inference.StubInferenceClient;
import io.chatflow.core.json.BasicJsonCodec;
import io.chatflow.core.json.JsonCodec;
import io.chatflow.core.session.ChatflowSession;
import io.chatflow.core.session.HistoryRecorder;
import io.chatflow.core.session.HistoryStore;
import io.chatflow.core.session.InMemoryHistoryStore;
import io.chatflow.core.template.SimpleTemplateResolver;
import io.chatflow.core.template.TemplateResolver;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating and wiring chatflow execution environments.
///
/// Wires the five built-in executors into an immutable registry together with
/// the collaborators they need. Every collaborator has a dependency-free default:
///
/// | Collaborator | Default |
/// |---|---|
/// | {@link InferenceClient} | {@link StubInferenceClient} |
/// | {@link CredentialResolver} | {@link InMemoryCredentialResolver} over loaded credentials |
/// | {@link HttpTransport} | {@link JdkHttpTransport} |
/// | {@link JsonCodec} | {@link BasicJsonCodec} |
/// | {@link HistoryStore} | {@link InMemoryHistoryStore} |
///
/// ### Usage
/// {@snippet :
/// try (var env = ChatflowFactory.builder()
///         .config(ChatflowConfig.builder().maxIterations(20).build())
///         .loadCredentials(properties)
///         .inferenceClient(new LangChain4jInferenceClient(credentials))
///         .jsonCodec(new JacksonJsonCodec())
///         .build()) {
///     Graph graph = env.getActivator().activate(definition);
///     ExecutionResult result = env.getEngine().execute(graph, TurnInput.of("hi"));
/// }
/// }
///
/// @see ChatflowEnvironment
/// @see ChatflowConfig
public final class ChatflowFactory {

    private static final Logger logger = Logger.getLogger(ChatflowFactory.class.getName());
    private static final String CREDENTIALS_PREFIX = "chatflow.credentials.";

    private ChatflowFactory() {}

    /// Creates an environment with default configuration and credentials
    /// discovered from environment variables.
    ///
    /// @return a fully-configured environment, never null
    public static ChatflowEnvironment createEnvironment() {
        return builder().loadCredentialsFromEnvironment().build();
    }

    /// Creates an environment with custom configuration and credentials
    /// discovered from environment variables.
    ///
    /// @param config configuration options, not null
    /// @return a fully-configured environment, never null
    public static ChatflowEnvironment createEnvironment(ChatflowConfig config) {
        return builder().config(config).loadCredentialsFromEnvironment().build();
    }

    /// Discovers credentials in environment variables.
    ///
    /// Matches names ending in `_API_KEY`, `_KEY`, `_SECRET` or `_TOKEN`.
    ///
    /// @return map of discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (value != null && !value.isEmpty() && isApiKeyPattern(key)) {
                                credentials.put(key, value);
                            }
                        });
        return credentials;
    }

    /// Loads credentials from a Properties object.
    ///
    /// - Prefixed keys (`chatflow.credentials.weather.api_key=...`) have the prefix stripped
    /// - Direct API key names (`OPENAI_API_KEY=...`) are kept as-is
    ///
    /// @param properties the properties to extract credentials from, not null
    /// @return map of credential keys to their values, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key);
            if (value == null || value.isEmpty()) {
                continue;
            }
            if (key.startsWith(CREDENTIALS_PREFIX)) {
                credentials.put(key.substring(CREDENTIALS_PREFIX.length()), value);
            } else if (isApiKeyPattern(key)) {
                credentials.put(key, value);
            }
        }
        return credentials;
    }

    /// Loads credentials from environment variables and properties.
    ///
    /// Properties take precedence over environment variables.
    ///
    /// @param properties the properties to merge, not null
    /// @return merged credentials, never null
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase();
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ChatflowEnvironment} instances.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private ChatflowConfig config = new ChatflowConfig();
        private final Map<String, String> credentials = new HashMap<>();
        private final Map<String, ConditionPredicate> predicates = new LinkedHashMap<>();
        private final List<NodeExecutor> extraExecutors = new ArrayList<>();
        private InferenceClient inferenceClient;
        private CredentialResolver credentialResolver;
        private HttpTransport httpTransport;
        private JsonCodec jsonCodec;
        private HistoryStore historyStore;
        private HistoryRecorder historyRecorder;
        private ExecutorService inferenceExecutor;

        private Builder() {}

        public Builder config(ChatflowConfig config) {
            this.config = config;
            return this;
        }

        /// Adds a single credential entry, e.g. `weather.api_key`.
        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        public Builder loadCredentialsFromEnvironment() {
            this.credentials.putAll(ChatflowFactory.loadCredentialsFromEnvironment());
            return this;
        }

        public Builder loadCredentialsFromProperties(Properties properties) {
            this.credentials.putAll(ChatflowFactory.loadCredentialsFromProperties(properties));
            return this;
        }

        public Builder loadCredentials(Properties properties) {
            this.credentials.putAll(ChatflowFactory.loadCredentials(properties));
            return this;
        }

        /// Sets the inference capability used by LLM nodes.
        ///
        /// @param inferenceClient the client, may be null for the stub client
        /// @return this builder for chaining, never null
        public Builder inferenceClient(InferenceClient inferenceClient) {
            this.inferenceClient = inferenceClient;
            return this;
        }

        /// Replaces the credential resolver built from loaded credentials.
        public Builder credentialResolver(CredentialResolver credentialResolver) {
            this.credentialResolver = credentialResolver;
            return this;
        }

        public Builder httpTransport(HttpTransport httpTransport) {
            this.httpTransport = httpTransport;
            return this;
        }

        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /// Sets the history store; without a recorder the history stays read-only.
        public Builder historyStore(HistoryStore historyStore) {
            this.historyStore = historyStore;
            return this;
        }

        public Builder historyRecorder(HistoryRecorder historyRecorder) {
            this.historyRecorder = historyRecorder;
            return this;
        }

        /// Registers a named predicate for condition nodes (`predicate: <name>`).
        public Builder conditionPredicate(String name, ConditionPredicate predicate) {
            this.predicates.put(name, predicate);
            return this;
        }

        /// Registers an additional executor, or replaces a built-in one of the same kind.
        public Builder executor(NodeExecutor executor) {
            this.extraExecutors.add(executor);
            return this;
        }

        /// Sets the pool running inference calls; it is shut down with the environment.
        public Builder inferenceExecutor(ExecutorService inferenceExecutor) {
            this.inferenceExecutor = inferenceExecutor;
            return this;
        }

        /// Builds and returns the configured {@link ChatflowEnvironment}.
        ///
        /// @apiNote **Side effects**: creates a thread pool if none was provided.
        ///
        /// @return the configured environment, never null
        public ChatflowEnvironment build() {
            TemplateResolver templateResolver = new SimpleTemplateResolver();
            JsonCodec codec = jsonCodec != null ? jsonCodec : new BasicJsonCodec();
            InferenceClient inference =
                    inferenceClient != null ? inferenceClient : new StubInferenceClient();
            if (inferenceClient == null) {
                logger.info("No inference client configured; LLM nodes use the stub client");
            }
            CredentialResolver credentialsResolver =
                    credentialResolver != null
                            ? credentialResolver
                            : InMemoryCredentialResolver.fromFlatCredentials(credentials);
            HttpTransport transport = httpTransport != null ? httpTransport : new JdkHttpTransport();
            ExecutorService pool =
                    inferenceExecutor != null
                            ? inferenceExecutor
                            : Executors.newFixedThreadPool(config.getInferenceThreads());

            DefaultNodeExecutorRegistry.Builder registryBuilder =
                    DefaultNodeExecutorRegistry.builder()
                            .register(new TriggerNodeExecutor())
                            .register(new LlmNodeExecutor(inference, templateResolver, pool))
                            .register(
                                    new HttpRequestNodeExecutor(
                                            transport, credentialsResolver, codec, templateResolver))
                            .register(
                                    new ConditionNodeExecutor(
                                            new DefaultConditionEvaluator(templateResolver, predicates)))
                            .register(new ResponseNodeExecutor(templateResolver, codec));
            extraExecutors.forEach(registryBuilder::register);
            NodeExecutorRegistry registry = registryBuilder.build();

            GraphBuilder graphBuilder =
                    new GraphBuilder(new GraphValidator(config.isStrictBranching()));
            ChatflowEngine engine = new ChatflowEngine(registry, config);
            ActiveChatflows activeChatflows = new ActiveChatflows();
            ChatflowActivator activator = new ChatflowActivator(graphBuilder, registry, activeChatflows);

            HistoryStore store = historyStore;
            HistoryRecorder recorder = historyRecorder;
            if (store == null && recorder == null) {
                InMemoryHistoryStore memory = new InMemoryHistoryStore(config.getHistoryLimit());
                store = memory;
                recorder = memory;
            } else if (store == null) {
                store = HistoryStore.EMPTY;
            }
            ChatflowSession session =
                    new ChatflowSession(
                            engine, activeChatflows, store, recorder, config.getHistoryLimit());

            return new ChatflowEnvironment(
                    engine, registry, graphBuilder, activator, activeChatflows, session, pool);
        }
    }
}
