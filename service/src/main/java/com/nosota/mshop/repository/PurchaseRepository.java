package com.nosota.mshop.repository;

import com.nosota.mshop.model.Purchase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PurchaseRepository extends JpaRepository<Purchase, Long> {
    List<Purchase> findAllByUserIdOrderByPurchaseDateDescIdDesc(Long userId);

    /**
     * Sum of the snapshotted prices of all purchases.
     *
     * @return Total revenue, 0 when there are no purchases.
     */
    @Query("SELECT COALESCE(SUM(p.price), 0) FROM Purchase p")
    Long getTotalRevenue();
}
