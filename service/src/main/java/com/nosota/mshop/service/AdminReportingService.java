package com.nosota.mshop.service;

import com.nosota.mshop.api.model.UserRole;
import com.nosota.mshop.api.response.StatsResponse;
import com.nosota.mshop.model.User;
import com.nosota.mshop.repository.ItemRepository;
import com.nosota.mshop.repository.PurchaseRepository;
import com.nosota.mshop.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only figures for the admin dashboard.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminReportingService {

    private final UserRepository userRepository;
    private final ItemRepository itemRepository;
    private final PurchaseRepository purchaseRepository;

    /**
     * Counts are taken on every call. Only USER accounts count as users.
     */
    @Transactional(readOnly = true)
    public StatsResponse getStats() {
        long totalUsers = userRepository.countByRole(UserRole.USER);
        long totalItems = itemRepository.count();
        long totalPurchases = purchaseRepository.count();
        Long revenue = purchaseRepository.getTotalRevenue();
        long totalRevenue = revenue != null ? revenue : 0L;

        log.debug("Stats computed: users={}, items={}, purchases={}, revenue={}",
                totalUsers, totalItems, totalPurchases, totalRevenue);

        return new StatsResponse(totalUsers, totalItems, totalPurchases, totalRevenue);
    }

    /**
     * All accounts, admin included, in creation order.
     */
    @Transactional(readOnly = true)
    public List<User> listUsers() {
        return userRepository.findAllByOrderByIdAsc();
    }
}
