package com.nosota.mshop.service;

import com.nosota.mshop.api.model.TransactionStatus;
import com.nosota.mshop.api.model.TransactionType;
import com.nosota.mshop.dto.PurchaseReceipt;
import com.nosota.mshop.error.InsufficientBalanceException;
import com.nosota.mshop.error.InvalidAmountException;
import com.nosota.mshop.error.ItemNotFoundException;
import com.nosota.mshop.error.UserNotFoundException;
import com.nosota.mshop.model.Item;
import com.nosota.mshop.model.Purchase;
import com.nosota.mshop.model.Transaction;
import com.nosota.mshop.model.User;
import com.nosota.mshop.repository.ItemRepository;
import com.nosota.mshop.repository.PurchaseRepository;
import com.nosota.mshop.repository.TransactionRepository;
import com.nosota.mshop.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Wallet balance and ledger of a user.
 *
 * <p>Every balance change goes through {@link #post}: inside one database transaction the
 * user row is locked ({@code SELECT ... FOR UPDATE}), the business check runs against the
 * locked balance, the new balance is written and the ledger entry appended. Concurrent
 * operations for the same user are therefore serialized, and the balance, the purchase
 * record and the ledger entry commit or roll back together.
 *
 * <p>Ledger amounts are stored positive; {@link TransactionType#direction()} gives the sign.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletLedgerService {

    /**
     * Maximum number of entries returned by {@link #listTransactions(Long)}.
     */
    public static final int TRANSACTION_HISTORY_LIMIT = 50;

    static final String INVALID_AMOUNT_MESSAGE = "Invalid amount";

    private final UserRepository userRepository;
    private final ItemRepository itemRepository;
    private final TransactionRepository transactionRepository;
    private final PurchaseRepository purchaseRepository;

    @Transactional(readOnly = true)
    public Long getBalance(Long userId) throws UserNotFoundException {
        return userRepository.findById(userId)
                .orElseThrow(() -> userNotFound(userId))
                .getWallet();
    }

    /**
     * Adds {@code amount} to the wallet and records a DEPOSIT entry.
     *
     * @return The new balance
     * @throws InvalidAmountException if amount is null or not positive, or the balance would overflow
     */
    @Transactional(rollbackFor = Exception.class)
    public Long deposit(Long userId, Long amount) throws InvalidAmountException, UserNotFoundException {
        requirePositive(amount);

        User user = lockWallet(userId);
        post(user, TransactionType.DEPOSIT, amount, null, "Deposited $" + amount);

        log.info("Deposit completed: userId={}, amount={}, balance={}", userId, amount, user.getWallet());
        return user.getWallet();
    }

    /**
     * Takes {@code amount} out of the wallet and records a WITHDRAW entry.
     *
     * @return The new balance
     * @throws InvalidAmountException       if amount is null or not positive
     * @throws InsufficientBalanceException if the balance is lower than amount; nothing is written
     */
    @Transactional(rollbackFor = Exception.class)
    public Long withdraw(Long userId, Long amount)
            throws InvalidAmountException, InsufficientBalanceException, UserNotFoundException {
        requirePositive(amount);

        User user = lockWallet(userId);
        if (user.getWallet() < amount) {
            log.info("Withdrawal rejected: userId={}, amount={}, balance={}", userId, amount, user.getWallet());
            throw new InsufficientBalanceException(amount, user.getWallet());
        }
        post(user, TransactionType.WITHDRAW, amount, null, "Withdrew $" + amount);

        log.info("Withdrawal completed: userId={}, amount={}, balance={}", userId, amount, user.getWallet());
        return user.getWallet();
    }

    /**
     * Buys an item: debits its current price, stores a purchase snapshotting name and price,
     * and records a PURCHASE entry referencing the item.
     *
     * @return New balance and the stored purchase
     * @throws ItemNotFoundException        if the item does not exist
     * @throws InsufficientBalanceException if the balance is lower than the price; nothing is written
     */
    @Transactional(rollbackFor = Exception.class)
    public PurchaseReceipt purchase(Long userId, Long itemId)
            throws ItemNotFoundException, InsufficientBalanceException, InvalidAmountException, UserNotFoundException {
        Item item = itemRepository.findById(itemId)
                .orElseThrow(() -> new ItemNotFoundException(CatalogService.ITEM_NOT_FOUND_MESSAGE));

        User user = lockWallet(userId);
        long price = item.getPrice();
        if (user.getWallet() < price) {
            log.info("Purchase rejected: userId={}, itemId={}, price={}, balance={}",
                    userId, itemId, price, user.getWallet());
            throw new InsufficientBalanceException(price, user.getWallet());
        }

        post(user, TransactionType.PURCHASE, price, item.getId(),
                "Purchased " + item.getName() + " for $" + price);

        Purchase purchase = new Purchase();
        purchase.setUserId(user.getId());
        purchase.setItemId(item.getId());
        purchase.setItemName(item.getName());
        purchase.setPrice(price);
        Purchase savedPurchase = purchaseRepository.save(purchase);

        log.info("Purchase completed: userId={}, itemId={}, price={}, purchaseId={}, balance={}",
                userId, itemId, price, savedPurchase.getId(), user.getWallet());

        return new PurchaseReceipt(user.getWallet(), savedPurchase);
    }

    /**
     * All purchases of the user, newest first.
     */
    @Transactional(readOnly = true)
    public List<Purchase> listPurchases(Long userId) {
        return purchaseRepository.findAllByUserIdOrderByPurchaseDateDescIdDesc(userId);
    }

    /**
     * The user's most recent ledger entries, newest first, at most {@value #TRANSACTION_HISTORY_LIMIT}.
     */
    @Transactional(readOnly = true)
    public List<Transaction> listTransactions(Long userId) {
        return transactionRepository.findByUserIdOrderByCreatedAtDescIdDesc(
                userId, PageRequest.of(0, TRANSACTION_HISTORY_LIMIT));
    }

    private User lockWallet(Long userId) throws UserNotFoundException {
        return userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> userNotFound(userId));
    }

    /**
     * Applies the wallet delta for one ledger entry and appends the entry.
     * The user must have been loaded through {@link #lockWallet(Long)} in the current transaction.
     *
     * @throws InvalidAmountException if the new balance does not fit in a long; nothing is written
     */
    private Transaction post(User user, TransactionType type, long amount, Long itemId, String description)
            throws InvalidAmountException {
        long newBalance;
        try {
            newBalance = Math.addExact(user.getWallet(), Math.multiplyExact(type.direction(), amount));
        } catch (ArithmeticException e) {
            log.warn("Balance overflow rejected: userId={}, type={}, amount={}, balance={}",
                    user.getId(), type, amount, user.getWallet());
            throw new InvalidAmountException(INVALID_AMOUNT_MESSAGE, e);
        }
        user.setWallet(newBalance);
        userRepository.save(user);

        Transaction transaction = new Transaction();
        transaction.setUserId(user.getId());
        transaction.setType(type);
        transaction.setAmount(amount);
        transaction.setItemId(itemId);
        transaction.setStatus(TransactionStatus.COMPLETED);
        transaction.setDescription(description);
        return transactionRepository.save(transaction);
    }

    private static void requirePositive(Long amount) throws InvalidAmountException {
        if (amount == null || amount <= 0) {
            throw new InvalidAmountException(INVALID_AMOUNT_MESSAGE);
        }
    }

    private static UserNotFoundException userNotFound(Long userId) {
        return new UserNotFoundException("User not found");
    }
}
