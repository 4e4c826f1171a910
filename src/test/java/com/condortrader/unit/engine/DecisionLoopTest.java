package com.condortrader.unit.engine;

import static com.condortrader.support.ChainFixtures.EXPIRY;
import static com.condortrader.support.ChainFixtures.T0;
import static com.condortrader.support.ChainFixtures.spotTick;
import static com.condortrader.support.ChainFixtures.tick;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.condortrader.chain.GreeksCalculator;
import com.condortrader.chain.IVCalculator;
import com.condortrader.chain.InstrumentRegistry;
import com.condortrader.chain.IvRankTracker;
import com.condortrader.chain.OptionChain;
import com.condortrader.domain.enums.ExecutionEventType;
import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.Order;
import com.condortrader.domain.model.Position;
import com.condortrader.engine.DecisionLoop;
import com.condortrader.engine.DecisionObserver;
import com.condortrader.engine.PositionBook;
import com.condortrader.execution.ExecutionManager;
import com.condortrader.feed.FeedHealth;
import com.condortrader.persistence.PositionStore;
import com.condortrader.strategy.OptionStrategy;
import com.condortrader.strategy.StrategyContext;
import com.condortrader.strategy.StrategyDecision;
import com.condortrader.support.ChainFixtures;
import com.condortrader.support.PositionFixtures;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for DecisionLoop: step ordering, the decision clock, and how strategy
 * decisions are carried out against execution, the position book and the store.
 */
@ExtendWith(MockitoExtension.class)
class DecisionLoopTest {

    @Mock
    private OptionStrategy strategy;

    @Mock
    private ExecutionManager execution;

    @Mock
    private PositionStore positionStore;

    @Mock
    private DecisionObserver observer;

    private PositionBook positionBook;
    private DecisionLoop loop;

    @BeforeEach
    void setUp() {
        OptionChain chain = new OptionChain(
                new InstrumentRegistry(IndexName.NIFTY, EXPIRY, ChainFixtures.contracts(21500, 22500)),
                new GreeksCalculator(new IVCalculator(), 0.07));
        positionBook = new PositionBook();
        loop = new DecisionLoop(
                chain,
                strategy,
                execution,
                positionBook,
                positionStore,
                new IvRankTracker(250, 1, Duration.ofMinutes(5)),
                ChainFixtures.riskLimits().build(),
                Duration.ofSeconds(5),
                observer);
    }

    private static LegAction buyLongCall(String orderId) {
        return LegAction.builder()
                .clientOrderId(orderId)
                .positionId(PositionFixtures.POSITION_ID)
                .legId(PositionFixtures.POSITION_ID + "-LONG_CALL")
                .role(LegRole.LONG_CALL)
                .contract(ChainFixtures.contract(22500, OptionType.CE))
                .side(OrderSide.BUY)
                .quantity(75)
                .orderType(OrderType.MARKET)
                .referencePrice(new BigDecimal("20"))
                .intent(OrderIntent.OPEN)
                .reason("ENTRY")
                .build();
    }

    // ========================
    // STEP ORDER AND CLOCK
    // ========================

    @Nested
    @DisplayName("Step Order and Clock")
    class StepOrder {

        @Test
        @DisplayName("Tick that leaves the chain unchanged runs no step")
        void ignoredTickRunsNoStep() {
            loop.onTick(tick(999_999, "10", T0));

            verify(execution, never()).reconcile(any());
            verify(strategy, never()).evaluate(any());
        }

        @Test
        @DisplayName("Execution events reach the strategy before it evaluates")
        void eventsBeforeEvaluation() {
            ExecutionEvent fill = ExecutionEvent.builder()
                    .type(ExecutionEventType.FILL)
                    .orderId(PositionFixtures.POSITION_ID + "-1")
                    .fillSeq(75)
                    .quantity(75)
                    .price(new BigDecimal("20"))
                    .eventTime(T0)
                    .build();
            when(execution.reconcile(T0)).thenReturn(List.of(fill));
            when(strategy.onExecutionEvent(fill, T0)).thenReturn(StrategyDecision.none());
            when(strategy.evaluate(any())).thenReturn(StrategyDecision.none());

            loop.onTick(spotTick("22000", T0));

            InOrder order = inOrder(execution, observer, strategy);
            order.verify(execution).reconcile(T0);
            order.verify(observer).onExecutionEvent(fill);
            order.verify(strategy).onExecutionEvent(fill, T0);
            order.verify(strategy).evaluate(any());
            order.verify(observer).onStepCompleted(eq(T0), any());
        }

        @Test
        @DisplayName("Context carries the tick time, and a loop without a feed sees it stale")
        void contextWithoutFeed() {
            when(strategy.evaluate(any())).thenReturn(StrategyDecision.none());

            loop.onTick(spotTick("22000", T0));

            ArgumentCaptor<StrategyContext> context = ArgumentCaptor.forClass(StrategyContext.class);
            verify(strategy).evaluate(context.capture());
            assertThat(context.getValue().getNow()).isEqualTo(T0);
            assertThat(context.getValue().getFeedStatus().isStale()).isTrue();
            assertThat(context.getValue().getFeedStatus().getState()).isEqualTo(FeedState.DISCONNECTED);
            assertThat(context.getValue().getSnapshot().getSpot()).isEqualByComparingTo("22000");
            assertThat(context.getValue().getIvRank()).isNull();
        }

        @Test
        @DisplayName("Attached feed health decides staleness")
        void attachedFeed() {
            FeedHealth health = new FeedHealth(FeedState.CONNECTED);
            health.recordMessage(T0);
            loop.attachFeed(health);
            when(strategy.evaluate(any())).thenReturn(StrategyDecision.none());

            loop.onTick(spotTick("22000", T0));

            ArgumentCaptor<StrategyContext> context = ArgumentCaptor.forClass(StrategyContext.class);
            verify(strategy).evaluate(context.capture());
            assertThat(context.getValue().getFeedStatus().isStale()).isFalse();
        }

        @Test
        @DisplayName("Timer steps never move the decision time backwards")
        void monotonicClock() {
            when(strategy.evaluate(any())).thenReturn(StrategyDecision.none());

            loop.onTimer(T0);
            loop.onTimer(T0.minusSeconds(1));

            assertThat(loop.getLastStepAt()).isEqualTo(T0);
            verify(execution, times(2)).reconcile(T0);
        }

        @Test
        @DisplayName("A failing step is counted and the next step still runs")
        void failedStepContinues() {
            when(strategy.evaluate(any()))
                    .thenThrow(new IllegalStateException("boom"))
                    .thenReturn(StrategyDecision.none());

            loop.onTimer(T0);
            loop.onTimer(T0.plusSeconds(1));

            assertThat(loop.getFailedSteps()).isEqualTo(1);
            verify(observer).onStepFailed(eq(T0), any(IllegalStateException.class));
            verify(observer).onStepCompleted(eq(T0.plusSeconds(1)), any());
        }
    }

    // ========================
    // APPLYING DECISIONS
    // ========================

    @Nested
    @DisplayName("Applying Decisions")
    class ApplyingDecisions {

        @Test
        @DisplayName("Opened position is claimed, its orders submitted and a snapshot stored")
        void openedPosition() {
            Position position = PositionFixtures.enteredCondor();
            LegAction action = buyLongCall(PositionFixtures.POSITION_ID + "-1");
            Order submitted = Order.builder().id(action.getClientOrderId()).build();
            when(strategy.evaluate(any()))
                    .thenReturn(StrategyDecision.builder()
                            .openedPosition(position)
                            .action(action)
                            .build());
            // first call builds the context, the next ones see the opened position
            when(strategy.activePosition()).thenReturn(Optional.empty(), Optional.of(position));
            when(execution.submit(action, T0)).thenReturn(submitted);

            loop.onTimer(T0);

            assertThat(positionBook.isOpen(PositionFixtures.POSITION_ID)).isTrue();
            verify(observer).onPositionOpened(position, T0);
            verify(observer).onOrderSubmitted(submitted, action, T0);
            verify(positionStore).snapshot(position, T0);
        }

        @Test
        @DisplayName("Cancels go out before new orders")
        void cancelsFirst() {
            LegAction action = buyLongCall(PositionFixtures.POSITION_ID + "-6");
            Order open = Order.builder().id(PositionFixtures.POSITION_ID + "-5").build();
            when(execution.order(open.getId())).thenReturn(Optional.of(open));
            when(execution.order(action.getClientOrderId())).thenReturn(Optional.empty());
            when(strategy.evaluate(any()))
                    .thenReturn(StrategyDecision.builder().cancel(open.getId()).action(action).build());

            loop.onTimer(T0);

            InOrder order = inOrder(execution);
            order.verify(execution).cancel(open, T0);
            order.verify(execution).submit(action, T0);
        }

        @Test
        @DisplayName("An action whose order already exists is not submitted again")
        void existingOrderSkipped() {
            LegAction action = buyLongCall(PositionFixtures.POSITION_ID + "-1");
            when(execution.order(action.getClientOrderId()))
                    .thenReturn(Optional.of(Order.builder().id(action.getClientOrderId()).build()));
            when(strategy.evaluate(any())).thenReturn(StrategyDecision.builder().action(action).build());

            loop.onTimer(T0);

            verify(execution, never()).submit(any(), any());
        }

        @Test
        @DisplayName("Closed position is released and archived")
        void closedPosition() {
            Position position = PositionFixtures.enteredCondor();
            positionBook.claim(position);
            when(strategy.evaluate(any()))
                    .thenReturn(StrategyDecision.builder().closedPosition(position).build());

            loop.onTimer(T0);

            assertThat(positionBook.openCount()).isZero();
            verify(positionStore).archive(position, T0);
            verify(observer).onPositionClosed(position, T0);
            verify(positionStore, never()).snapshot(any(), any());
        }
    }
}
