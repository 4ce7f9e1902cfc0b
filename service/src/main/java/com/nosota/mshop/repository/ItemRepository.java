package com.nosota.mshop.repository;

import com.nosota.mshop.model.Item;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ItemRepository extends JpaRepository<Item, Long> {
    // Newest first; id breaks ties between items created within the same clock tick
    List<Item> findAllByOrderByCreatedAtDescIdDesc();
}
