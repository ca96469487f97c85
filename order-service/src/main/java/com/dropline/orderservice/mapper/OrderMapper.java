package com.dropline.orderservice.mapper;

import com.dropline.orderservice.dto.OrderItemResponse;
import com.dropline.orderservice.dto.OrderResponse;
import com.dropline.orderservice.model.Order;
import com.dropline.orderservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);
}
