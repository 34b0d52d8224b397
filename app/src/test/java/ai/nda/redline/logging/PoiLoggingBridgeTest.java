package ai.nda.redline.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * POI logs through the Log4j API; those events must land in the Logback configuration.
 */
class PoiLoggingBridgeTest {

    private static final String POI_LOGGER = "org.apache.poi.ooxml.POIXMLDocumentPart";

    private Logger poiLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        appender = new ListAppender<>();
        appender.setContext(context);
        appender.start();
        poiLogger = context.getLogger("org.apache.poi");
        poiLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        poiLogger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void routesPoiLog4jEventsThroughLogback() {
        LogManager.getLogger(POI_LOGGER).warn("Relationship target missing");

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLoggerName()).isEqualTo(POI_LOGGER);
            assertThat(event.getFormattedMessage()).isEqualTo("Relationship target missing");
        });
    }

    @Test
    void appliesConfiguredPoiLevel() {
        LogManager.getLogger(POI_LOGGER).info("Parsing part");

        assertThat(appender.list).isEmpty();
    }
}
