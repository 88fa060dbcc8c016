package io.confcheck.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.confcheck.core.error.ConfigValidationException;
import io.confcheck.core.testkit.TestSchemas;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for the log entries {@link Configurations#make} emits: one INFO line per created
 * configuration, one WARN line per rejected one.
 */
@DisplayName("NormalizationLoggingTest")
class NormalizationLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger configurationsLogger;

    @BeforeEach
    void setUp() {
        configurationsLogger = (Logger) LoggerFactory.getLogger(Configurations.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        configurationsLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        configurationsLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Created configuration → INFO entry with schema and profiles")
    void createdConfigurationLogsInfo() {
        Map<String, Object> raw = Map.of("profiles", Map.of("dev", Map.of("port", 2)));

        Configurations.make(TestSchemas.DEMO, List.of("dev"), raw);

        List<ILoggingEvent> infos = logAppender.list.stream()
                .filter(e -> e.getLevel() == Level.INFO)
                .toList();
        assertThat(infos).hasSize(1);
        assertThat(infos.get(0).getFormattedMessage())
                .startsWith("Configuration created")
                .contains("schema=demo")
                .contains("profiles=[dev]")
                .contains("keys=2");
    }

    @Test
    @DisplayName("Rejected configuration → WARN entry naming the offending value")
    void rejectedConfigurationLogsWarn() {
        assertThatThrownBy(() -> Configurations.make(TestSchemas.DEMO, List.of(), Map.of("port", 70000)))
                .isInstanceOf(ConfigValidationException.class);

        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .singleElement()
                .satisfies(e -> assertThat(e.getFormattedMessage())
                        .startsWith("Configuration rejected")
                        .contains("[port]")
                        .contains("70000"));
        assertThat(logAppender.list).noneMatch(e -> e.getLevel() == Level.INFO);
    }
}
