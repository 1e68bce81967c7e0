package com.nosota.mercato.dto;

import com.nosota.mercato.api.dto.RefundTransactionDTO;
import com.nosota.mercato.model.RefundTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface RefundTransactionMapper {

    RefundTransactionMapper INSTANCE = Mappers.getMapper(RefundTransactionMapper.class);

    RefundTransactionDTO toDTO(RefundTransaction refund);

    List<RefundTransactionDTO> toDTOList(List<RefundTransaction> refunds);
}
