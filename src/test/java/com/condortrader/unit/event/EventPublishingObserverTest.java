package com.condortrader.unit.event;

import static com.condortrader.support.ChainFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.condortrader.domain.enums.ExecutionEventType;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.Order;
import com.condortrader.domain.model.Position;
import com.condortrader.engine.StepSummary;
import com.condortrader.event.EventPublisherHelper;
import com.condortrader.event.EventPublishingObserver;
import com.condortrader.event.PositionEventType;
import com.condortrader.event.SystemEventType;
import com.condortrader.execution.ExecutionManager;
import com.condortrader.risk.RiskDecision;
import com.condortrader.risk.RiskReason;
import com.condortrader.strategy.StrategyDecision;
import com.condortrader.support.PositionFixtures;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for EventPublishingObserver: position transitions detected across steps,
 * order events for execution events, and risk and decision events.
 */
@ExtendWith(MockitoExtension.class)
class EventPublishingObserverTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private ExecutionManager execution;

    private EventPublishingObserver observer;

    @BeforeEach
    void setUp() {
        observer = new EventPublishingObserver(eventPublisherHelper, execution);
    }

    @Test
    @DisplayName("State change of the open position publishes one transition event")
    void publishesTransitions() {
        Position position = PositionFixtures.enteredCondor();
        observer.onPositionOpened(position, T0);

        observer.onStepCompleted(T0, new StepSummary(PositionState.ENTERED, position, "TICK"));
        position.setState(PositionState.EXITING);
        observer.onStepCompleted(T0.plusSeconds(1), new StepSummary(PositionState.EXITING, position, "TICK"));
        observer.onStepCompleted(T0.plusSeconds(2), new StepSummary(PositionState.EXITING, position, "TIMER"));

        verify(eventPublisherHelper).publishPositionEvent(observer, position, PositionEventType.OPENED, T0);
        verify(eventPublisherHelper)
                .publishPositionEvent(observer, position, PositionEventType.EXITING, T0.plusSeconds(1));
        verify(eventPublisherHelper, never())
                .publishPositionEvent(any(), any(), eq(PositionEventType.ENTERED), any());
    }

    @Test
    @DisplayName("Execution events become order events with a copy of the order")
    void orderEvents() {
        Order order = Order.builder().id("NIFTY-240115-1-1").build();
        when(execution.order("NIFTY-240115-1-1")).thenReturn(Optional.of(order));

        observer.onExecutionEvent(ExecutionEvent.builder()
                .type(ExecutionEventType.FILL)
                .orderId("NIFTY-240115-1-1")
                .eventTime(T0)
                .build());

        ArgumentCaptor<Order> published = ArgumentCaptor.forClass(Order.class);
        verify(eventPublisherHelper).publishOrderEvent(eq(observer), published.capture(), eq(OrderEventType.FILL));
        assertThat(published.getValue()).isNotSameAs(order);
        assertThat(published.getValue().getId()).isEqualTo("NIFTY-240115-1-1");
    }

    @Test
    @DisplayName("Forced exit publishes a risk event and its notes under RISK")
    void riskDecision() {
        RiskDecision risk = RiskDecision.forceExit(RiskReason.STOP_LOSS_BREACHED);
        StrategyDecision decision = StrategyDecision.builder()
                .riskDecision(risk)
                .note("Stop loss breached, closing")
                .build();

        observer.onDecision(decision, null, T0);

        verify(eventPublisherHelper).publishRiskEvent(observer, null, risk, T0);
        verify(eventPublisherHelper)
                .publishDecision(eq(observer), eq("RISK"), eq("Stop loss breached, closing"), isNull(), anyMap(), eq(T0));
    }

    @Test
    @DisplayName("An alert is published as a manual intervention system event")
    void alertNeedsOperator() {
        String alert = "Close abandoned: position=NIFTY-240115-1, leg=NIFTY24JAN22300CE, openQuantity=50";

        observer.onDecision(StrategyDecision.builder().alert(alert).build(), null, T0);

        verify(eventPublisherHelper).publishSystemEvent(observer, SystemEventType.MANUAL_INTERVENTION, alert);
        verify(eventPublisherHelper, never()).publishDecision(any(), any(), any(), any(), anyMap(), any());
    }

    @Test
    @DisplayName("Continue without notes publishes nothing")
    void quietDecision() {
        observer.onDecision(
                StrategyDecision.builder().riskDecision(RiskDecision.continueTrading()).build(), null, T0);

        verifyNoInteractions(eventPublisherHelper);
    }
}
