package com.mercado.fulfillmentservice.service;

import com.mercado.common.exception.ResourceNotFoundException;
import com.mercado.fulfillmentservice.event.OrderStatusChangedEvent;
import com.mercado.fulfillmentservice.event.PaymentCompensationEvent;
import com.mercado.fulfillmentservice.exception.InvalidTransitionException;
import com.mercado.fulfillmentservice.exception.ReservationCommitException;
import com.mercado.fulfillmentservice.model.Order;
import com.mercado.fulfillmentservice.model.OrderEvent;
import com.mercado.fulfillmentservice.model.OrderItem;
import com.mercado.fulfillmentservice.model.OrderStatus;
import com.mercado.fulfillmentservice.repository.OrderEventRepository;
import com.mercado.fulfillmentservice.repository.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderStateMachine Unit Tests")
class OrderStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderEventRepository orderEventRepository;
    @Mock
    private ReservationService reservationService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private OrderStateMachine stateMachine;

    private UUID orderId;
    private Order order;
    private OrderItem itemA;
    private OrderItem itemB;

    @BeforeEach
    void setUp() {
        stateMachine = new OrderStateMachine(orderRepository, orderEventRepository, reservationService,
                eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));

        orderId = UUID.randomUUID();
        order = new Order();
        order.setId(orderId);
        order.setUserId(UUID.randomUUID());
        order.setTotalPrice(new BigDecimal("30.00"));
        order.setStatus(OrderStatus.PENDING);

        // added out of lock order on purpose
        itemB = item(UUID.fromString("00000000-0000-0000-0000-00000000000b"));
        itemA = item(UUID.fromString("00000000-0000-0000-0000-00000000000a"));
        order.addItem(itemB);
        order.addItem(itemA);
    }

    private OrderItem item(UUID productId) {
        OrderItem item = new OrderItem();
        item.setProductId(productId);
        item.setProductName("Item " + productId);
        item.setQuantity(1);
        item.setPrice(new BigDecimal("15.00"));
        item.setReservationId(UUID.randomUUID());
        return item;
    }

    private void givenLockedOrder() {
        when(orderRepository.findByIdForUpdate(orderId)).thenReturn(Optional.of(order));
    }

    @Nested
    @DisplayName("transition to PAID")
    class PaidTests {

        @Test
        @DisplayName("should commit every hold in lock order and record the change")
        void shouldCommitHoldsAndAudit() {
            // Arrange
            givenLockedOrder();
            when(reservationService.commitReservation(any(), eq(orderId))).thenReturn(true);

            // Act
            Order result = stateMachine.transition(orderId, OrderStatus.PAID, "webhook:telebirr", "Paid", "pay-1");

            // Assert
            assertThat(result.getStatus()).isEqualTo(OrderStatus.PAID);
            assertThat(result.getPaymentReference()).isEqualTo("pay-1");
            assertThat(result.getPaidAt()).isEqualTo(NOW);

            InOrder inOrder = inOrder(reservationService);
            inOrder.verify(reservationService).commitReservation(itemA.getReservationId(), orderId);
            inOrder.verify(reservationService).commitReservation(itemB.getReservationId(), orderId);

            ArgumentCaptor<OrderEvent> audit = ArgumentCaptor.forClass(OrderEvent.class);
            verify(orderEventRepository).save(audit.capture());
            assertThat(audit.getValue().getPreviousStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(audit.getValue().getNewStatus()).isEqualTo(OrderStatus.PAID);
            assertThat(audit.getValue().getActor()).isEqualTo("webhook:telebirr");

            ArgumentCaptor<OrderStatusChangedEvent> event = ArgumentCaptor.forClass(OrderStatusChangedEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().getRoutingKey()).isEqualTo("order.paid");
        }

        @Test
        @DisplayName("should fail without changing status when a hold is gone")
        void shouldThrowWhenAnyHoldInactive() {
            // Arrange
            givenLockedOrder();
            when(reservationService.commitReservation(itemA.getReservationId(), orderId)).thenReturn(true);
            when(reservationService.commitReservation(itemB.getReservationId(), orderId)).thenReturn(false);

            // Act & Assert
            assertThatThrownBy(() -> stateMachine.transition(orderId, OrderStatus.PAID, "system", null, "pay-1"))
                    .isInstanceOf(ReservationCommitException.class)
                    .satisfies(e -> assertThat(((ReservationCommitException) e).getFailedReservationIds())
                            .containsExactly(itemB.getReservationId()));

            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            verifyNoInteractions(orderEventRepository, eventPublisher);
        }
    }

    @Nested
    @DisplayName("rejected and idempotent transitions")
    class GuardTests {

        @Test
        @DisplayName("should reject an edge outside the lifecycle with the legal next statuses")
        void shouldRejectIllegalEdge() {
            givenLockedOrder();

            assertThatThrownBy(() -> stateMachine.transition(orderId, OrderStatus.SHIPPED, "admin", null))
                    .isInstanceOf(InvalidTransitionException.class)
                    .satisfies(e -> assertThat(((InvalidTransitionException) e).getLegalNextStatuses())
                            .containsExactlyInAnyOrder(OrderStatus.PAID, OrderStatus.CANCELLED));

            verifyNoInteractions(reservationService, orderEventRepository, eventPublisher);
        }

        @Test
        @DisplayName("should treat the current status as a no-op")
        void shouldIgnoreSameStatus() {
            order.setStatus(OrderStatus.CONFIRMED);
            givenLockedOrder();

            Order result = stateMachine.transition(orderId, OrderStatus.CONFIRMED, "admin", null);

            assertThat(result.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            verifyNoInteractions(reservationService, orderEventRepository, eventPublisher);
        }

        @Test
        @DisplayName("should refuse to leave a terminal status")
        void shouldRejectLeavingCancelled() {
            order.setStatus(OrderStatus.CANCELLED);
            givenLockedOrder();

            assertThatThrownBy(() -> stateMachine.transition(orderId, OrderStatus.PAID, "system", null))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("should report a missing order as not found")
        void shouldThrowWhenOrderMissing() {
            when(orderRepository.findByIdForUpdate(orderId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> stateMachine.transition(orderId, OrderStatus.PAID, "system", null))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("cancellation and refund")
    class CancelTests {

        @Test
        @DisplayName("cancelling a pending order releases its holds")
        void shouldReleaseHoldsOnCancel() {
            givenLockedOrder();

            stateMachine.transition(orderId, OrderStatus.CANCELLED, "user", "changed my mind");

            verify(reservationService).releaseReservation(itemA.getReservationId());
            verify(reservationService).releaseReservation(itemB.getReservationId());
            assertThat(order.getCancelledAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("cancelling a paid order puts committed stock back once")
        void shouldRestoreCommittedStockOnCancelAfterPayment() {
            order.setStatus(OrderStatus.PAID);
            itemB.setStockRestored(true);
            givenLockedOrder();
            when(reservationService.restoreCommittedStock(itemA.getReservationId())).thenReturn(true);

            stateMachine.transition(orderId, OrderStatus.CANCELLED, "admin", null);

            assertThat(itemA.isStockRestored()).isTrue();
            verify(reservationService, never()).restoreCommittedStock(itemB.getReservationId());
        }

        @Test
        @DisplayName("cancelling a shipped order does not restock")
        void shouldNotRestockAfterShipment() {
            order.setStatus(OrderStatus.SHIPPED);
            givenLockedOrder();

            stateMachine.transition(orderId, OrderStatus.CANCELLED, "admin", "lost in transit");

            verify(reservationService, never()).restoreCommittedStock(any());
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        }

        @Test
        @DisplayName("refunding a paid order restocks, refunding a delivered one does not")
        void shouldRestockOnlyWhenRefundedBeforeShipment() {
            order.setStatus(OrderStatus.DELIVERED);
            givenLockedOrder();

            stateMachine.transition(orderId, OrderStatus.REFUNDED, "webhook:cbe", null);

            verify(reservationService, never()).restoreCommittedStock(any());
            assertThat(order.getRefundedAt()).isEqualTo(NOW);
        }
    }

    @Nested
    @DisplayName("cancelWithCompensation")
    class CompensationTests {

        @Test
        @DisplayName("a pending order is cancelled and flagged")
        void shouldCancelPendingOrder() {
            givenLockedOrder();

            Order result = stateMachine.cancelWithCompensation(orderId, "pay-9", "webhook:telebirr", "holds expired");

            assertThat(result.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(result.isCompensationRequired()).isTrue();
            assertThat(result.getPaymentReference()).isEqualTo("pay-9");
            verify(reservationService, times(2)).releaseReservation(any());
            verify(eventPublisher).publishEvent(any(PaymentCompensationEvent.class));
            verify(eventPublisher).publishEvent(any(OrderStatusChangedEvent.class));
        }

        @Test
        @DisplayName("an already cancelled order is only flagged")
        void shouldFlagCancelledOrderWithoutTransition() {
            order.setStatus(OrderStatus.CANCELLED);
            givenLockedOrder();

            Order result = stateMachine.cancelWithCompensation(orderId, "pay-9", "webhook:telebirr", "late payment");

            assertThat(result.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(result.isCompensationRequired()).isTrue();
            verifyNoInteractions(reservationService, orderEventRepository);
            verify(eventPublisher).publishEvent(any(PaymentCompensationEvent.class));
        }
    }

    static Stream<Arguments> legalEdges() {
        return Stream.of(OrderStatus.values())
                .flatMap(from -> from.allowedTransitions().stream().map(to -> Arguments.of(from, to)));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("legalEdges")
    @DisplayName("every legal edge succeeds and stamps the target timestamp")
    void shouldApplyEveryLegalEdge(OrderStatus from, OrderStatus to) {
        order.setStatus(from);
        givenLockedOrder();
        lenient().when(reservationService.commitReservation(any(), eq(orderId))).thenReturn(true);

        Order result = stateMachine.transition(orderId, to, "admin", null);

        assertThat(result.getStatus()).isEqualTo(to);
        assertThat(result.getStatusTimestamp(to)).isEqualTo(NOW);
        verify(orderEventRepository).save(any(OrderEvent.class));
    }

    @Test
    @DisplayName("recordCreated writes the creation audit row and order.created")
    void shouldRecordCreation() {
        stateMachine.recordCreated(order, order.getUserId().toString());

        ArgumentCaptor<OrderEvent> audit = ArgumentCaptor.forClass(OrderEvent.class);
        verify(orderEventRepository).save(audit.capture());
        assertThat(audit.getValue().getPreviousStatus()).isNull();
        assertThat(audit.getValue().getNewStatus()).isEqualTo(OrderStatus.PENDING);

        ArgumentCaptor<OrderStatusChangedEvent> event = ArgumentCaptor.forClass(OrderStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getRoutingKey()).isEqualTo("order.created");
    }
}
