package com.nosota.mshop.mapper;

import com.nosota.mshop.api.dto.ItemDTO;
import com.nosota.mshop.api.request.ItemRequest;
import com.nosota.mshop.api.request.ItemUpdateRequest;
import com.nosota.mshop.model.Item;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface ItemMapper {

    ItemMapper INSTANCE = Mappers.getMapper(ItemMapper.class);

    ItemDTO toDTO(Item item);

    List<ItemDTO> toDTOList(List<Item> items);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdBy", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    Item toEntity(ItemRequest request);

    /**
     * Copies the non-null fields of the request onto the item.
     */
    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdBy", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    void update(ItemUpdateRequest request, @MappingTarget Item item);
}
