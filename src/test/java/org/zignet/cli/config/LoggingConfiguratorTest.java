package org.zignet.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests applying HOCON logging settings to Logback.
 */
@Tag("unit")
public class LoggingConfiguratorTest {

    private static final String SEMANTICS_LOGGER = "org.zignet.compiler.frontend.semantics";

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(SEMANTICS_LOGGER).setLevel(null);
        context.getLogger(LoggingConfigurator.COMPILER_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void testAppliesDefaultAndSpecificLevels() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "logging { default-level = \"ERROR\", levels { \"" + SEMANTICS_LOGGER + "\" = \"DEBUG\" } }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(SEMANTICS_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void testUnknownDefaultLevelFallsBackToWarn() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"LOUD\""));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void testSecondCallIsIgnoredUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"INFO\""));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"INFO\""));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void testMissingLoggingBlockLeavesLevelsUntouched() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }

    @Test
    void testCompilerLevelOverridesConfiguredChildren() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"" + SEMANTICS_LOGGER + "\" = \"ERROR\" }"));

        LoggingConfigurator.setCompilerLevel(Level.DEBUG);

        assertThat(context.getLogger(LoggingConfigurator.COMPILER_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger(SEMANTICS_LOGGER).getLevel()).isNull();
        assertThat(context.getLogger(SEMANTICS_LOGGER).getEffectiveLevel()).isEqualTo(Level.DEBUG);
    }
}
