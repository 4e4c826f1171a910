package com.condortrader.unit.observability;

import static com.condortrader.support.ChainFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.domain.model.Order;
import com.condortrader.event.OrderEvent;
import com.condortrader.event.SystemEvent;
import com.condortrader.event.SystemEventType;
import com.condortrader.observability.DecisionLogger;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Unit tests for the lines DecisionLogger writes to the DECISION logger. */
class DecisionLoggerTest {

    private final DecisionLogger decisionLogger = new DecisionLogger();

    private Logger decisions;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        decisions = (Logger) LoggerFactory.getLogger("DECISION");
        appender = new ListAppender<>();
        appender.start();
        decisions.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        decisions.detachAppender(appender);
    }

    private static Order order() {
        return Order.builder()
                .id("NIFTY-240115-1-3")
                .tradingSymbol("NIFTY2411822600CE")
                .updatedAt(T0)
                .build();
    }

    // ==== Orders ====

    @Nested
    @DisplayName("Order events")
    class Orders {

        @Test
        @DisplayName("a rejection is written as a warning with its code and reason")
        void rejectionLogged() {
            Order rejected = order().toBuilder()
                    .rejectCode(RejectCode.INVALID_ORDER)
                    .rejectReason("Price outside circuit limits")
                    .build();

            decisionLogger.onOrder(new OrderEvent(this, rejected, OrderEventType.REJECTED));

            assertThat(appender.list).singleElement().satisfies(line -> {
                assertThat(line.getLevel()).isEqualTo(Level.WARN);
                assertThat(line.getFormattedMessage())
                        .contains("ORDER REJECTED id=NIFTY-240115-1-3")
                        .contains("symbol=NIFTY2411822600CE")
                        .contains("code=INVALID_ORDER")
                        .contains("reason=Price outside circuit limits");
            });
        }

        @Test
        @DisplayName("other order transitions stay out of the decision log")
        void otherTransitionsIgnored() {
            decisionLogger.onOrder(new OrderEvent(this, order(), OrderEventType.SENT));
            decisionLogger.onOrder(new OrderEvent(this, order(), OrderEventType.FILL));

            assertThat(appender.list).isEmpty();
        }
    }

    // ==== System ====

    @Nested
    @DisplayName("System events")
    class SystemEvents {

        @Test
        @DisplayName("details are appended to the message")
        void detailsAppended() {
            decisionLogger.onSystem(
                    new SystemEvent(this, SystemEventType.FATAL, "Feed unavailable", Map.of("exitCode", 2)));

            assertThat(appender.list)
                    .singleElement()
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .isEqualTo("SYSTEM FATAL Feed unavailable {exitCode=2}");
        }

        @Test
        @DisplayName("no details, no braces")
        void noDetails() {
            decisionLogger.onSystem(new SystemEvent(this, SystemEventType.SHUTTING_DOWN, "Stopping"));

            assertThat(appender.list)
                    .singleElement()
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .isEqualTo("SYSTEM SHUTTING_DOWN Stopping");
        }
    }
}
