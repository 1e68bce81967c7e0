package com.nosota.mercato.dto;

import com.nosota.mercato.api.dto.CommissionInvoiceDTO;
import com.nosota.mercato.api.dto.CommissionInvoiceItemDTO;
import com.nosota.mercato.model.CommissionInvoice;
import com.nosota.mercato.model.CommissionInvoiceItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface CommissionInvoiceMapper {

    CommissionInvoiceMapper INSTANCE = Mappers.getMapper(CommissionInvoiceMapper.class);

    @Mapping(target = "items", source = "items")
    CommissionInvoiceDTO toDTO(CommissionInvoice invoice, List<CommissionInvoiceItem> items);

    CommissionInvoiceItemDTO toItemDTO(CommissionInvoiceItem item);

    List<CommissionInvoiceItemDTO> toItemDTOList(List<CommissionInvoiceItem> items);
}
