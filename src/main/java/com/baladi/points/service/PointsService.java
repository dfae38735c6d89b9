package com.baladi.points.service;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.points.entity.PointsAccount;
import com.baladi.points.entity.PointsTransaction;
import com.baladi.points.entity.PointsTransactionType;
import com.baladi.points.repository.PointsAccountRepository;
import com.baladi.points.repository.PointsTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;

/**
 * Points ledger.
 *
 * <p>Every balance change writes exactly one {@link PointsTransaction} in the same
 * transaction as the account update, so the ledger sum and the balance cannot
 * drift. Methods join the caller's transaction: redeeming points for an order
 * commits or rolls back together with the order itself.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PointsService {

    private static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int CODE_LENGTH = 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final PointsAccountRepository accountRepository;
    private final PointsTransactionRepository transactionRepository;
    private final Clock clock;

    /** Returns the customer's account, opening one with a fresh referral code if needed. */
    @Transactional
    public PointsAccount openAccount(Long customerId) {
        return accountRepository.findByCustomerId(customerId)
                .orElseGet(() -> {
                    PointsAccount account = accountRepository.save(PointsAccount.builder()
                            .customerId(customerId)
                            .balance(0)
                            .referralCode(newReferralCode())
                            .build());
                    log.info("Points account opened: customerId={}, referralCode={}",
                            customerId, account.getReferralCode());
                    return account;
                });
    }

    /** Customers without an account have a balance of zero. */
    public int getBalance(Long customerId) {
        return accountRepository.findByCustomerId(customerId)
                .map(PointsAccount::getBalance)
                .orElse(0);
    }

    public Result<PointsAccount> getAccount(Long customerId) {
        return accountRepository.findByCustomerId(customerId)
                .<Result<PointsAccount>>map(Result::success)
                .orElseGet(() -> Result.failure(Failure.notFound(ErrorCode.POINTS_ACCOUNT_NOT_FOUND)));
    }

    public List<PointsTransaction> getHistory(Long customerId) {
        return transactionRepository.findByCustomerIdOrderByCreatedAtDescIdDesc(customerId);
    }

    @Transactional
    public Result<PointsTransaction> redeemForOrder(Long customerId, Long orderId, int points) {
        return record(customerId, orderId, PointsTransactionType.REDEEMED, -points,
                "Redeemed on order " + orderId);
    }

    /** No-op (empty success) when nothing was earned or the order was already credited. */
    @Transactional
    public Result<PointsTransaction> earnForOrder(Long customerId, Long orderId, int points) {
        if (points <= 0 || transactionRepository.existsByOrderIdAndType(orderId, PointsTransactionType.EARNED)) {
            return Result.success(null);
        }
        return record(customerId, orderId, PointsTransactionType.EARNED, points,
                "Earned on order " + orderId);
    }

    /** Gives back points redeemed on an order that was cancelled. */
    @Transactional
    public Result<PointsTransaction> refundForOrder(Long customerId, Long orderId, int points) {
        if (points <= 0) {
            return Result.success(null);
        }
        return record(customerId, orderId, PointsTransactionType.ADJUSTMENT, points,
                "Refund for cancelled order " + orderId);
    }

    @Transactional
    public Result<PointsTransaction> awardReferralBonus(Long referrerId, Long orderId, int points) {
        return record(referrerId, orderId, PointsTransactionType.REFERRAL_BONUS, points,
                "Referral bonus for order " + orderId);
    }

    /** Manual correction by an admin. A zero delta is rejected. */
    @Transactional
    public Result<PointsTransaction> adjustPoints(Long customerId, int delta, String reason) {
        if (delta == 0) {
            return Result.failure(Failure.validation("Adjustment must not be zero"));
        }
        if (reason == null || reason.isBlank()) {
            return Result.failure(Failure.validation("Adjustment reason is required"));
        }
        return record(customerId, null, PointsTransactionType.ADJUSTMENT, delta, reason);
    }

    private Result<PointsTransaction> record(Long customerId, Long orderId, PointsTransactionType type,
                                             int delta, String description) {
        PointsAccount account = accountRepository.findForUpdateByCustomerId(customerId)
                .orElseGet(() -> delta >= 0 ? openAccount(customerId) : null);
        if (account == null) {
            return Result.failure(Failure.notFound(ErrorCode.POINTS_ACCOUNT_NOT_FOUND));
        }
        if (!account.canApply(delta)) {
            log.warn("Insufficient points: customerId={}, balance={}, delta={}",
                    customerId, account.getBalance(), delta);
            return Result.failure(Failure.businessRule(ErrorCode.INSUFFICIENT_POINTS,
                    "Balance " + account.getBalance() + " cannot cover " + (-delta) + " points"));
        }

        int balanceAfter = account.apply(delta);
        PointsTransaction transaction = transactionRepository.save(PointsTransaction.builder()
                .customerId(customerId)
                .orderId(orderId)
                .type(type)
                .points(delta)
                .balanceAfter(balanceAfter)
                .description(description)
                .createdAt(clock.instant())
                .build());

        log.info("Points recorded: customerId={}, type={}, points={}, balance={}",
                customerId, type, delta, balanceAfter);
        return Result.success(transaction);
    }

    private String newReferralCode() {
        String code;
        do {
            StringBuilder sb = new StringBuilder(CODE_LENGTH);
            for (int i = 0; i < CODE_LENGTH; i++) {
                sb.append(CODE_ALPHABET.charAt(RANDOM.nextInt(CODE_ALPHABET.length())));
            }
            code = sb.toString();
        } while (accountRepository.existsByReferralCode(code));
        return code;
    }
}
