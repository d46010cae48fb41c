package org.clex.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.clex.scanner.Dispatcher").setLevel(null);
        LoggingConfigurator.reset();
    }

    /**
     * Verifies that the root level and the per-logger levels are applied to Logback.
     */
    @Test
    @Tag("unit")
    void appliesDefaultAndSpecificLevels() {
        Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.clex.scanner.Dispatcher" = "TRACE"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.clex.scanner.Dispatcher").getLevel()).isEqualTo(Level.TRACE);
    }

    /**
     * Verifies that logging is configured only once until {@link LoggingConfigurator#reset()} is called.
     */
    @Test
    @Tag("unit")
    void secondCallIsIgnoredUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = DEBUG"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = DEBUG"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @Tag("unit")
    void unknownLevelIsSkipped() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"org.clex.scanner.Dispatcher\" = \"LOUD\" }"));

        assertThat(context.getLogger("org.clex.scanner.Dispatcher").getLevel()).isNull();
    }

    /**
     * Verifies that a configuration without a logging section does not touch the current levels.
     */
    @Test
    @Tag("unit")
    void missingSectionLeavesLevelsAlone() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }
}
