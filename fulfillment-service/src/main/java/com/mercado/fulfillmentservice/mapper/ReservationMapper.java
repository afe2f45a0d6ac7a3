package com.mercado.fulfillmentservice.mapper;

import com.mercado.fulfillmentservice.dto.ReservationResponse;
import com.mercado.fulfillmentservice.dto.StockResponse;
import com.mercado.fulfillmentservice.model.Reservation;
import com.mercado.fulfillmentservice.service.StockLevel;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ReservationMapper {

    ReservationResponse toReservationResponse(Reservation reservation);

    StockResponse toStockResponse(StockLevel stockLevel);
}
