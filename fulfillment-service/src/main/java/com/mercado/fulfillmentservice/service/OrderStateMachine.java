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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Hibernate;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Applies order status changes together with their stock side effects.
 *
 * Every public method runs in one transaction holding the order's row lock. The
 * status change, the reservation commits or releases, the audit row and the outbox
 * row commit together or not at all.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderStateMachine {

    // same order as checkout, so two transactions never lock the same stock rows crosswise
    private static final Comparator<OrderItem> STOCK_LOCK_ORDER = Comparator
            .comparing(OrderItem::getProductId)
            .thenComparing(OrderItem::getVariantId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final OrderRepository orderRepository;
    private final OrderEventRepository orderEventRepository;
    private final ReservationService reservationService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Order transition(UUID orderId, OrderStatus target, String actor, String note) {
        return transition(orderId, target, actor, note, null);
    }

    /**
     * Moves the order to {@code target}.
     *
     * Re-applying the current status is a no-op and returns the order unchanged.
     *
     * @param paymentReference stored on the order when moving to PAID, ignored otherwise
     * @throws InvalidTransitionException if {@code target} is not reachable from the current status
     * @throws ReservationCommitException if moving to PAID and a backing hold is no longer active
     */
    @Transactional
    public Order transition(UUID orderId, OrderStatus target, String actor, String note, String paymentReference) {
        Order order = lockOrder(orderId);
        OrderStatus current = order.getStatus();

        if (current == target) {
            log.debug("Order already in status: orderId={}, status={}", orderId, current);
            return order;
        }
        if (!current.canTransitionTo(target)) {
            log.warn("Rejected status transition: orderId={}, from={}, to={}, actor={}",
                    orderId, current, target, actor);
            throw new InvalidTransitionException(orderId, current, target);
        }

        switch (target) {
            case PAID -> {
                commitReservations(order);
                if (paymentReference != null) {
                    order.setPaymentReference(paymentReference);
                }
            }
            case CANCELLED -> {
                releaseReservations(order);
                if (current.isBeforeShipment()) {
                    restoreCommittedStock(order);
                }
            }
            // paid but never shipped: the goods are still in the warehouse
            case REFUNDED -> {
                if (current == OrderStatus.PAID) {
                    restoreCommittedStock(order);
                }
            }
            default -> {
                // no stock side effects
            }
        }

        apply(order, current, target, actor, note);
        return order;
    }

    /**
     * Writes the creation audit row and the order.created notification for a freshly
     * saved order. Runs in the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordCreated(Order order, String actor) {
        Instant now = clock.instant();
        orderEventRepository.save(OrderEvent.builder()
                .orderId(order.getId())
                .previousStatus(null)
                .newStatus(order.getStatus())
                .actor(actor)
                .note("Order created")
                .createdAt(now)
                .build());
        eventPublisher.publishEvent(new OrderStatusChangedEvent(this, order, null, actor, "Order created", now));
    }

    /**
     * Money was taken but the order cannot be fulfilled. Cancels the order if it is
     * still cancellable, flags it for a refund and emits the compensation notice.
     *
     * Runs in its own transaction: the PAID attempt that failed has already rolled back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Order cancelWithCompensation(UUID orderId, String paymentReference, String actor, String reason) {
        Order order = lockOrder(orderId);
        OrderStatus current = order.getStatus();

        if (current.canTransitionTo(OrderStatus.CANCELLED) && !current.isPaymentCaptured()) {
            releaseReservations(order);
            order.setCompensationRequired(true);
            apply(order, current, OrderStatus.CANCELLED, actor, reason);
        } else {
            order.setCompensationRequired(true);
        }
        if (paymentReference != null && order.getPaymentReference() == null) {
            order.setPaymentReference(paymentReference);
        }

        eventPublisher.publishEvent(new PaymentCompensationEvent(this, order, reason, clock.instant()));
        log.warn("Payment compensation required: orderId={}, status={}, paymentReference={}, reason={}",
                orderId, order.getStatus(), order.getPaymentReference(), reason);
        return order;
    }

    private void apply(Order order, OrderStatus from, OrderStatus to, String actor, String note) {
        Instant now = clock.instant();
        order.setStatus(to);
        order.stampStatusTimestamp(to, now);

        orderEventRepository.save(OrderEvent.builder()
                .orderId(order.getId())
                .previousStatus(from)
                .newStatus(to)
                .actor(actor)
                .note(note)
                .createdAt(now)
                .build());

        eventPublisher.publishEvent(new OrderStatusChangedEvent(this, order, from, actor, note, now));
        log.info("Order status updated: orderId={}, from={}, to={}, actor={}", order.getId(), from, to, actor);
    }

    private void commitReservations(Order order) {
        List<UUID> failed = new ArrayList<>();
        for (OrderItem item : itemsInLockOrder(order)) {
            if (!reservationService.commitReservation(item.getReservationId(), order.getId())) {
                failed.add(item.getReservationId());
            }
        }
        if (!failed.isEmpty()) {
            log.warn("Reservations could not be committed: orderId={}, reservationIds={}", order.getId(), failed);
            throw new ReservationCommitException(order.getId(), failed);
        }
    }

    private void releaseReservations(Order order) {
        for (OrderItem item : itemsInLockOrder(order)) {
            reservationService.releaseReservation(item.getReservationId());
        }
    }

    private void restoreCommittedStock(Order order) {
        for (OrderItem item : itemsInLockOrder(order)) {
            if (!item.isStockRestored() && reservationService.restoreCommittedStock(item.getReservationId())) {
                item.setStockRestored(true);
            }
        }
    }

    private List<OrderItem> itemsInLockOrder(Order order) {
        List<OrderItem> items = new ArrayList<>(order.getItems());
        items.sort(STOCK_LOCK_ORDER);
        return items;
    }

    private Order lockOrder(UUID orderId) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        // callers map the order after this transaction has ended
        Hibernate.initialize(order.getItems());
        return order;
    }
}
