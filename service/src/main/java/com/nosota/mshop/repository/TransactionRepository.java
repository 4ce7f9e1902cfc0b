package com.nosota.mshop.repository;

import com.nosota.mshop.model.Transaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {
    /**
     * Ledger entries of a user, newest first, limited by the page size.
     *
     * @param userId   Owner of the entries.
     * @param pageable First page of the wanted size.
     * @return At most {@code pageable.getPageSize()} entries.
     */
    List<Transaction> findByUserIdOrderByCreatedAtDescIdDesc(Long userId, Pageable pageable);

    long countByUserId(Long userId);
}
