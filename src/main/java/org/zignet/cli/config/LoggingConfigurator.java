package org.zignet.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code logging} block of the HOCON configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"          # root logger level
 *   levels {
 *     "org.zignet.compiler.frontend.semantics" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * Logger names must be quoted, otherwise HOCON splits them at the dots.
 */
public final class LoggingConfigurator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    private static final String LOGGING_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    /** The logger hierarchy raised by {@code --verbose}. */
    public static final String COMPILER_LOGGER = "org.zignet";

    private static boolean configured = false;

    private LoggingConfigurator() {}

    /**
     * The levels requested by one {@code logging} block.
     *
     * @param rootLevel The root level, or {@code null} to keep the Logback default.
     * @param loggerLevels Per-logger levels in declaration order.
     */
    record LevelPlan(Level rootLevel, Map<String, Level> loggerLevels) {

        static LevelPlan from(Config logging) {
            Level root = logging.hasPath(DEFAULT_LEVEL_KEY)
                    ? Level.toLevel(logging.getString(DEFAULT_LEVEL_KEY), Level.WARN)
                    : null;
            Map<String, Level> levels = new LinkedHashMap<>();
            if (logging.hasPath(LEVELS_KEY)) {
                for (Map.Entry<String, ConfigValue> entry : logging.getConfig(LEVELS_KEY).root().entrySet()) {
                    // Level.toLevel maps unknown names to DEBUG.
                    levels.put(entry.getKey(), Level.toLevel(String.valueOf(entry.getValue().unwrapped())));
                }
            }
            return new LevelPlan(root, levels);
        }

        void applyTo(LoggerContext context) {
            if (rootLevel != null) {
                context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
            }
            loggerLevels.forEach((name, level) -> context.getLogger(name).setLevel(level));
        }
    }

    /**
     * Applies the {@code logging} block of the given configuration once per process.
     * Later calls are ignored until {@link #reset()}.
     *
     * @param config The resolved application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (configured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        configured = true;
        if (!config.hasPath(LOGGING_PATH)) {
            LOGGER.debug("No logging block found, keeping Logback defaults.");
            return;
        }

        LevelPlan plan = LevelPlan.from(config.getConfig(LOGGING_PATH));
        plan.applyTo(context());
        LOGGER.debug("Applied root level {} and {} logger levels", plan.rootLevel(), plan.loggerLevels().size());
    }

    /**
     * Sets the level of the compiler and CLI loggers, overriding the configured ones.
     * @param level The new level.
     */
    public static synchronized void setCompilerLevel(final Level level) {
        context().getLogger(COMPILER_LOGGER).setLevel(level);
        // Explicit child levels from the configuration would otherwise win.
        context().getLoggerList().stream()
                .filter(logger -> logger.getName().startsWith(COMPILER_LOGGER + "."))
                .forEach(logger -> logger.setLevel(null));
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply its settings again. Used by tests.
     */
    public static synchronized void reset() {
        configured = false;
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }
}
