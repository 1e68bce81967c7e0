package com.nosota.mercato.dto;

import com.nosota.mercato.api.dto.CommissionTransactionDTO;
import com.nosota.mercato.model.CommissionTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface CommissionTransactionMapper {

    CommissionTransactionMapper INSTANCE = Mappers.getMapper(CommissionTransactionMapper.class);

    CommissionTransactionDTO toDTO(CommissionTransaction transaction);

    List<CommissionTransactionDTO> toDTOList(List<CommissionTransaction> transactions);
}
