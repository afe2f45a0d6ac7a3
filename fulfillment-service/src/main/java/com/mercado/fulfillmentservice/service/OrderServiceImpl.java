package com.mercado.fulfillmentservice.service;

import com.mercado.common.exception.AccessDeniedException;
import com.mercado.common.exception.ResourceNotFoundException;
import com.mercado.fulfillmentservice.dto.OrderEventResponse;
import com.mercado.fulfillmentservice.dto.OrderResponse;
import com.mercado.fulfillmentservice.exception.InvalidTransitionException;
import com.mercado.fulfillmentservice.exception.ReservationCommitException;
import com.mercado.fulfillmentservice.mapper.OrderMapper;
import com.mercado.fulfillmentservice.model.Order;
import com.mercado.fulfillmentservice.model.OrderStatus;
import com.mercado.fulfillmentservice.repository.OrderEventRepository;
import com.mercado.fulfillmentservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Facade over {@link OrderStateMachine}.
 *
 * The mutating methods here are deliberately not transactional: each state machine
 * call commits or rolls back on its own, so the compensation step can run after a
 * failed PAID attempt has rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private final OrderStateMachine stateMachine;
    private final OrderRepository orderRepository;
    private final OrderEventRepository orderEventRepository;
    private final OrderMapper orderMapper;

    @Override
    public OrderResponse updateStatus(UUID orderId, OrderStatus target, String actor, String note) {
        try {
            Order order = stateMachine.transition(orderId, target, actor, note);
            return orderMapper.toOrderResponse(order);
        } catch (ReservationCommitException e) {
            stateMachine.cancelWithCompensation(orderId, null, actor,
                    "Reservations no longer active at payment: " + e.getFailedReservationIds());
            throw e;
        }
    }

    @Override
    public PaymentConfirmation confirmPayment(UUID orderId, String paymentReference, String actor) {
        Order order = findOrder(orderId);
        OrderStatus current = order.getStatus();

        if (current != OrderStatus.PENDING) {
            return resolveLatePayment(orderId, current, paymentReference, actor);
        }

        try {
            stateMachine.transition(orderId, OrderStatus.PAID, actor, "Payment confirmed", paymentReference);
            return PaymentConfirmation.PAID;
        } catch (ReservationCommitException e) {
            stateMachine.cancelWithCompensation(orderId, paymentReference, actor,
                    "Reservations no longer active at payment: " + e.getFailedReservationIds());
            return PaymentConfirmation.COMPENSATION_REQUIRED;
        } catch (InvalidTransitionException e) {
            // status moved between our read and the lock
            return resolveLatePayment(orderId, e.getCurrentStatus(), paymentReference, actor);
        }
    }

    private PaymentConfirmation resolveLatePayment(UUID orderId, OrderStatus current,
                                                   String paymentReference, String actor) {
        if (current.isPaymentCaptured()) {
            log.info("Payment already applied: orderId={}, status={}", orderId, current);
            return PaymentConfirmation.ALREADY_APPLIED;
        }
        // CANCELLED before the money arrived
        stateMachine.cancelWithCompensation(orderId, paymentReference, actor,
                "Payment received for an order in status " + current);
        return PaymentConfirmation.COMPENSATION_REQUIRED;
    }

    @Override
    public OrderResponse cancelOrder(UUID orderId, UUID userId) {
        Order order = findOrder(orderId);
        checkOwnership(order, userId);

        Order cancelled = stateMachine.transition(orderId, OrderStatus.CANCELLED, userId.toString(),
                "Cancelled by customer");
        log.info("Order cancelled by customer: orderId={}, userId={}", orderId, userId);
        return orderMapper.toOrderResponse(cancelled);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrder(UUID orderId, UUID userId) {
        Order order = findOrder(orderId);
        if (userId != null) {
            checkOwnership(order, userId);
        }
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getOrdersForUser(UUID userId) {
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderEventResponse> getOrderHistory(UUID orderId, UUID userId) {
        Order order = findOrder(orderId);
        if (userId != null) {
            checkOwnership(order, userId);
        }
        return orderMapper.toOrderEventResponses(orderEventRepository.findByOrderIdOrderByCreatedAtAsc(orderId));
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
    }

    private void checkOwnership(Order order, UUID userId) {
        if (!order.getUserId().equals(userId)) {
            log.warn("Access denied: userId={} tried to access orderId={}", userId, order.getId());
            throw new AccessDeniedException("You do not have access to order " + order.getId());
        }
    }
}
