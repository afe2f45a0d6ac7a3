package com.mercado.fulfillmentservice.mapper;

import com.mercado.fulfillmentservice.dto.OrderEventResponse;
import com.mercado.fulfillmentservice.dto.OrderItemResponse;
import com.mercado.fulfillmentservice.dto.OrderResponse;
import com.mercado.fulfillmentservice.model.Order;
import com.mercado.fulfillmentservice.model.OrderEvent;
import com.mercado.fulfillmentservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    // allowedTransitions comes from the status, not from a column
    @Mapping(target = "allowedTransitions", expression = "java(order.getStatus().allowedTransitions())")
    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    OrderEventResponse toOrderEventResponse(OrderEvent orderEvent);

    List<OrderEventResponse> toOrderEventResponses(List<OrderEvent> orderEvents);
}
