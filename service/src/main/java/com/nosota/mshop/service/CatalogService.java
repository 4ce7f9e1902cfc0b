package com.nosota.mshop.service;

import com.nosota.mshop.api.request.ItemRequest;
import com.nosota.mshop.api.request.ItemUpdateRequest;
import com.nosota.mshop.error.ItemNotFoundException;
import com.nosota.mshop.mapper.ItemMapper;
import com.nosota.mshop.model.Item;
import com.nosota.mshop.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Catalog maintenance. Purchases keep their own copy of name and price, so updating or
 * deleting an item never touches purchase history.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    static final String ITEM_NOT_FOUND_MESSAGE = "Item not found";

    private final ItemRepository itemRepository;

    @Transactional(readOnly = true)
    public List<Item> listItems() {
        return itemRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public Item findItem(Long itemId) throws ItemNotFoundException {
        return itemRepository.findById(itemId)
                .orElseThrow(() -> new ItemNotFoundException(ITEM_NOT_FOUND_MESSAGE));
    }

    /**
     * @param request   Validated item fields
     * @param createdBy Username of the admin adding the item
     */
    @Transactional(rollbackFor = Exception.class)
    public Item createItem(ItemRequest request, String createdBy) {
        Item item = ItemMapper.INSTANCE.toEntity(request);
        item.setCreatedBy(createdBy);
        Item savedItem = itemRepository.save(item);

        log.info("Item created: itemId={}, name={}, price={}, createdBy={}",
                savedItem.getId(), savedItem.getName(), savedItem.getPrice(), createdBy);
        return savedItem;
    }

    /**
     * Overwrites the fields present in the request; absent fields keep their value.
     */
    @Transactional(rollbackFor = Exception.class)
    public Item updateItem(Long itemId, ItemUpdateRequest request) throws ItemNotFoundException {
        Item item = findItem(itemId);
        ItemMapper.INSTANCE.update(request, item);
        Item savedItem = itemRepository.save(item);

        log.info("Item updated: itemId={}, name={}, price={}", itemId, savedItem.getName(), savedItem.getPrice());
        return savedItem;
    }

    @Transactional(rollbackFor = Exception.class)
    public void deleteItem(Long itemId) throws ItemNotFoundException {
        Item item = findItem(itemId);
        itemRepository.delete(item);

        log.info("Item deleted: itemId={}, name={}", itemId, item.getName());
    }
}
