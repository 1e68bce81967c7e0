package com.nosota.mercato.dto;

import com.nosota.mercato.api.dto.SettlementAdjustmentDTO;
import com.nosota.mercato.api.dto.SettlementDTO;
import com.nosota.mercato.api.dto.SettlementItemDTO;
import com.nosota.mercato.model.Settlement;
import com.nosota.mercato.model.SettlementAdjustment;
import com.nosota.mercato.model.SettlementItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * Maps the settlement aggregate (header, items, adjustments) to its read model.
 */
@Mapper
public interface SettlementMapper {

    SettlementMapper INSTANCE = Mappers.getMapper(SettlementMapper.class);

    @Mapping(target = "items", source = "items")
    @Mapping(target = "adjustments", source = "adjustments")
    SettlementDTO toDTO(Settlement settlement, List<SettlementItem> items, List<SettlementAdjustment> adjustments);

    SettlementItemDTO toItemDTO(SettlementItem item);

    SettlementAdjustmentDTO toAdjustmentDTO(SettlementAdjustment adjustment);

    List<SettlementItemDTO> toItemDTOList(List<SettlementItem> items);

    List<SettlementAdjustmentDTO> toAdjustmentDTOList(List<SettlementAdjustment> adjustments);
}
