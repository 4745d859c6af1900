package io.courier.runtime;

import io.courier.agent.EchoToolRunner;
import io.courier.agent.ScriptToolRunner;
import io.courier.agent.ThreadedPrimaryAgent;
import io.courier.agent.ToolRunner;
import io.courier.agent.ToolRunnerSubagentFactory;
import io.courier.config.CourierConfig;
import io.courier.config.CourierSettings;
import io.courier.config.SettingsLoader;
import io.courier.conversation.ConversationManager;
import io.courier.observability.AuditLogger;
import io.courier.storage.Database;
import io.courier.storage.TaskStore;
import io.courier.tools.TaskTools;
import io.courier.transport.NoticeSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;

/**
 * Wires storage, scheduling, execution, conversations and tools over one data
 * root. {@link #init()} must run before anything else is used.
 */
public final class CourierRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CourierRuntime.class);

    private final CourierConfig config;
    private final Database database;
    private final SettingsLoader settingsLoader;
    private final AuditLogger auditLogger;
    private final TaskScheduler scheduler;
    private final TaskTools tools;
    private final ConversationManager conversations;
    private final NoticeSink noticeSink;
    private ThreadedPrimaryAgent primaryAgent;
    private TaskExecutor executor;

    public CourierRuntime(CourierConfig config) {
        this(config, NoticeSink.NONE);
    }

    public CourierRuntime(CourierConfig config, NoticeSink noticeSink) {
        this.config = config;
        this.noticeSink = noticeSink == null ? NoticeSink.NONE : noticeSink;
        this.database = new Database(config);
        this.settingsLoader = new SettingsLoader(config);
        this.auditLogger = new AuditLogger(
                config.auditFile(),
                loadOrCreateAuditSigningSecret(config.securityRoot().resolve("audit-signing.key"))
        );
        this.scheduler = new TaskScheduler(new TaskStore(database), auditLogger);
        this.tools = new TaskTools(scheduler, () -> settingsLoader.current().recentEventLimit());
        this.conversations = new ConversationManager(settingsLoader::current, this.noticeSink, auditLogger);
    }

    public synchronized void init() {
        database.init();
        settingsLoader.load();
        if (executor == null) {
            CourierSettings settings = settingsLoader.current();
            ToolRunner toolRunner = toolRunner(settings);
            primaryAgent = new ThreadedPrimaryAgent(toolRunner);
            executor = new TaskExecutor(
                    "local",
                    scheduler,
                    TaskExecutor.strategies(toolRunner, new ToolRunnerSubagentFactory(toolRunner), primaryAgent, settings),
                    settingsLoader::current,
                    noticeSink
            );
            log.debug("Runtime initialized at {} with tool runner {}", config.rootDir(), toolRunner.id());
        }
    }

    private static ToolRunner toolRunner(CourierSettings settings) {
        if (settings.scriptCommand().isEmpty()) {
            return new EchoToolRunner();
        }
        return new ScriptToolRunner("script", settings.scriptCommand(), settings.scriptTimeoutMs());
    }

    public CourierConfig config() {
        return config;
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    public TaskTools tools() {
        return tools;
    }

    public ConversationManager conversations() {
        return conversations;
    }

    public synchronized TaskExecutor executor() {
        if (executor == null) {
            throw new IllegalStateException("Runtime not initialized");
        }
        return executor;
    }

    public CourierSettings settings() {
        return settingsLoader.current();
    }

    public SettingsLoader.ReloadOutcome maybeReloadSettings(long minIntervalMs) {
        return settingsLoader.maybeReload(minIntervalMs);
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    public List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public int verifyAudit() {
        return auditLogger.verify();
    }

    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.close();
        }
        if (primaryAgent != null) {
            primaryAgent.close();
        }
        conversations.close();
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }
}
