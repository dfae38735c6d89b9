package com.baladi.points.service;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Result;
import com.baladi.points.entity.PointsAccount;
import com.baladi.points.entity.PointsTransaction;
import com.baladi.points.entity.PointsTransactionType;
import com.baladi.points.repository.PointsAccountRepository;
import com.baladi.points.repository.PointsTransactionRepository;
import com.baladi.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PointsServiceTest {

    @Mock
    private PointsAccountRepository accountRepository;
    @Mock
    private PointsTransactionRepository transactionRepository;

    private PointsService pointsService;

    @BeforeEach
    void setUp() {
        pointsService = new PointsService(accountRepository, transactionRepository, Fixtures.fixedClock());
    }

    private PointsAccount account(int balance) {
        return PointsAccount.builder().customerId(100L).balance(balance).referralCode("ABCD2345").build();
    }

    @Test
    @DisplayName("redeeming writes a negative ledger line and lowers the balance")
    void redeem() {
        PointsAccount account = account(12);
        given(accountRepository.findForUpdateByCustomerId(100L)).willReturn(Optional.of(account));
        given(transactionRepository.save(any(PointsTransaction.class))).willAnswer(invocation -> invocation.getArgument(0));

        PointsTransaction tx = pointsService.redeemForOrder(100L, 1L, 5).getOrThrow();

        assertThat(tx.getType()).isEqualTo(PointsTransactionType.REDEEMED);
        assertThat(tx.getPoints()).isEqualTo(-5);
        assertThat(tx.getBalanceAfter()).isEqualTo(7);
        assertThat(account.getBalance()).isEqualTo(7);
    }

    @Test
    @DisplayName("the balance can never go negative")
    void neverNegative() {
        PointsAccount account = account(3);
        given(accountRepository.findForUpdateByCustomerId(100L)).willReturn(Optional.of(account));

        Result<PointsTransaction> result = pointsService.redeemForOrder(100L, 1L, 5);

        assertThat(result.failure().errorCode()).isEqualTo(ErrorCode.INSUFFICIENT_POINTS);
        assertThat(account.getBalance()).isEqualTo(3);
        verify(transactionRepository, never()).save(any());
    }

    @Test
    @DisplayName("points for an order are earned only once")
    void earnOnce() {
        given(transactionRepository.existsByOrderIdAndType(1L, PointsTransactionType.EARNED)).willReturn(true);

        Result<PointsTransaction> result = pointsService.earnForOrder(100L, 1L, 2);

        assertThat(result.isSuccess()).isTrue();
        verify(accountRepository, never()).findForUpdateByCustomerId(any());
    }

    @Test
    @DisplayName("a first credit opens the account")
    void creditOpensAccount() {
        given(accountRepository.findForUpdateByCustomerId(100L)).willReturn(Optional.empty());
        given(accountRepository.findByCustomerId(100L)).willReturn(Optional.empty());
        given(accountRepository.save(any(PointsAccount.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(transactionRepository.save(any(PointsTransaction.class))).willAnswer(invocation -> invocation.getArgument(0));

        PointsTransaction tx = pointsService.awardReferralBonus(100L, 1L, 2).getOrThrow();

        assertThat(tx.getType()).isEqualTo(PointsTransactionType.REFERRAL_BONUS);
        assertThat(tx.getBalanceAfter()).isEqualTo(2);
    }

    @Test
    @DisplayName("debiting a customer without an account is not found")
    void debitWithoutAccount() {
        given(accountRepository.findForUpdateByCustomerId(100L)).willReturn(Optional.empty());

        Result<PointsTransaction> result = pointsService.adjustPoints(100L, -1, "correction");

        assertThat(result.failure().errorCode()).isEqualTo(ErrorCode.POINTS_ACCOUNT_NOT_FOUND);
    }

    @Test
    @DisplayName("a zero adjustment is rejected")
    void zeroAdjustment() {
        assertThat(pointsService.adjustPoints(100L, 0, "noop").isFailure()).isTrue();
    }

    @Test
    @DisplayName("customers without an account have a zero balance")
    void balanceWithoutAccount() {
        given(accountRepository.findByCustomerId(100L)).willReturn(Optional.empty());

        assertThat(pointsService.getBalance(100L)).isZero();
    }
}
