package com.nosota.mshop.mapper;

import com.nosota.mshop.api.dto.PurchaseDTO;
import com.nosota.mshop.model.Purchase;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface PurchaseMapper {

    PurchaseMapper INSTANCE = Mappers.getMapper(PurchaseMapper.class);

    PurchaseDTO toDTO(Purchase purchase);

    List<PurchaseDTO> toDTOList(List<Purchase> purchases);
}
