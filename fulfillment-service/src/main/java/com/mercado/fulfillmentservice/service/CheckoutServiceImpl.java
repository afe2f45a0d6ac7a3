package com.mercado.fulfillmentservice.service;

import com.mercado.common.exception.ResourceNotFoundException;
import com.mercado.fulfillmentservice.dto.CheckoutItemRequest;
import com.mercado.fulfillmentservice.dto.CheckoutRequest;
import com.mercado.fulfillmentservice.dto.OrderResponse;
import com.mercado.fulfillmentservice.dto.ReservationRequest;
import com.mercado.fulfillmentservice.dto.ReservationResponse;
import com.mercado.fulfillmentservice.mapper.OrderMapper;
import com.mercado.fulfillmentservice.mapper.ReservationMapper;
import com.mercado.fulfillmentservice.model.Order;
import com.mercado.fulfillmentservice.model.OrderItem;
import com.mercado.fulfillmentservice.model.OrderStatus;
import com.mercado.fulfillmentservice.model.Product;
import com.mercado.fulfillmentservice.model.ProductVariant;
import com.mercado.fulfillmentservice.model.Reservation;
import com.mercado.fulfillmentservice.repository.OrderRepository;
import com.mercado.fulfillmentservice.repository.ProductRepository;
import com.mercado.fulfillmentservice.repository.ProductVariantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutServiceImpl implements CheckoutService {

    // stable lock order across concurrent checkouts, see OrderStateMachine
    private static final Comparator<CheckoutItemRequest> STOCK_LOCK_ORDER = Comparator
            .comparing(CheckoutItemRequest::getProductId)
            .thenComparing(CheckoutItemRequest::getVariantId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ReservationService reservationService;
    private final OrderStateMachine stateMachine;
    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final ProductVariantRepository variantRepository;
    private final OrderMapper orderMapper;
    private final ReservationMapper reservationMapper;

    @Override
    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${fulfillment.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${fulfillment.retry.initial-delay-ms:50}",
                    multiplier = 2,
                    maxDelay = 1000,
                    random = true))
    @Transactional
    public OrderResponse checkout(CheckoutRequest request, UUID userId) {
        log.info("Checkout started: userId={}, items={}", userId, request.getItems().size());

        List<CheckoutItemRequest> items = new ArrayList<>(request.getItems());
        items.sort(STOCK_LOCK_ORDER);

        Order order = new Order();
        order.setUserId(userId);
        order.setStatus(OrderStatus.PENDING);

        List<Reservation> reservations = new ArrayList<>();
        BigDecimal totalPrice = BigDecimal.ZERO;

        for (CheckoutItemRequest item : items) {
            // InsufficientStockException propagates and rolls back the holds placed so far
            Reservation reservation = reservationService.createReservation(
                    item.getProductId(), item.getVariantId(), item.getQuantity(), userId.toString());
            reservations.add(reservation);

            OrderItem orderItem = toOrderItem(item, reservation);
            order.addItem(orderItem);
            totalPrice = totalPrice.add(orderItem.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
        }
        order.setTotalPrice(totalPrice);

        Order saved = orderRepository.save(order);

        // managed entities, flushed on commit
        reservations.forEach(reservation -> reservation.setOrderId(saved.getId()));

        stateMachine.recordCreated(saved, userId.toString());

        log.info("Checkout completed: orderId={}, userId={}, totalPrice={}", saved.getId(), userId, totalPrice);
        return orderMapper.toOrderResponse(saved);
    }

    @Override
    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${fulfillment.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${fulfillment.retry.initial-delay-ms:50}",
                    multiplier = 2,
                    maxDelay = 1000,
                    random = true))
    @Transactional
    public ReservationResponse reserve(ReservationRequest request, String requesterId) {
        Reservation reservation = reservationService.createReservation(
                request.getProductId(), request.getVariantId(), request.getQuantity(), requesterId);
        return reservationMapper.toReservationResponse(reservation);
    }

    // name and unit price snapshot taken at checkout time
    private OrderItem toOrderItem(CheckoutItemRequest item, Reservation reservation) {
        Product product = productRepository.findById(item.getProductId())
                .orElseThrow(() -> new ResourceNotFoundException("Product not found with id: " + item.getProductId()));

        String name = product.getName();
        BigDecimal price = product.getPrice();

        if (item.getVariantId() != null) {
            ProductVariant variant = variantRepository.findByIdAndProductId(item.getVariantId(), item.getProductId())
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Variant " + item.getVariantId() + " not found for product " + item.getProductId()));
            name = product.getName() + " - " + variant.getName();
            if (variant.getPrice() != null) {
                price = variant.getPrice();
            }
        }

        OrderItem orderItem = new OrderItem();
        orderItem.setProductId(item.getProductId());
        orderItem.setVariantId(item.getVariantId());
        orderItem.setProductName(name);
        orderItem.setQuantity(item.getQuantity());
        orderItem.setPrice(price);
        orderItem.setReservationId(reservation.getId());
        orderItem.setStockRestored(false);
        return orderItem;
    }
}
