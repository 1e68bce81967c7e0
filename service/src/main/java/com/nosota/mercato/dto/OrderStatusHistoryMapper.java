package com.nosota.mercato.dto;

import com.nosota.mercato.api.dto.OrderStatusHistoryDTO;
import com.nosota.mercato.model.OrderStatusHistory;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface OrderStatusHistoryMapper {

    OrderStatusHistoryMapper INSTANCE = Mappers.getMapper(OrderStatusHistoryMapper.class);

    OrderStatusHistoryDTO toDTO(OrderStatusHistory history);

    List<OrderStatusHistoryDTO> toDTOList(List<OrderStatusHistory> history);
}
