package com.flagship.shipping_workflow.account;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;

/**
 * Prepaid user balances.
 *
 * Uses JdbcTemplate for precise control over the SQL: every change is a single
 * conditional statement, so concurrent credits and debits never lose updates
 * and a balance can never go negative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceService {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Adds {@code amount} to the user's balance, opening the account if needed.
     *
     * @return the balance after the credit
     */
    @Transactional
    public BigDecimal credit(String userKey, BigDecimal amount) {
        requirePositive(amount);

        String sql = """
            INSERT INTO user_balances (user_key, balance, updated_at)
            VALUES (?, ?, ?)
            ON CONFLICT (user_key) DO UPDATE
                SET balance = user_balances.balance + EXCLUDED.balance,
                    updated_at = EXCLUDED.updated_at
            RETURNING balance
            """;

        BigDecimal balance = jdbcTemplate.queryForObject(sql, BigDecimal.class,
                userKey, amount, Timestamp.from(clock.instant()));

        log.info("Balance credited: userKey={}, amount={}, balance={}", userKey, amount, balance);
        return balance;
    }

    /**
     * Deducts {@code amount} if the balance covers it.
     *
     * @return true if the debit happened, false if funds were insufficient
     */
    @Transactional
    public boolean tryDebit(String userKey, BigDecimal amount) {
        requirePositive(amount);

        int updated = jdbcTemplate.update("""
            UPDATE user_balances
            SET balance = balance - ?, updated_at = ?
            WHERE user_key = ? AND balance >= ?
            """,
            amount, Timestamp.from(clock.instant()), userKey, amount);

        if (updated == 1) {
            log.info("Balance debited: userKey={}, amount={}", userKey, amount);
            return true;
        }
        log.info("Balance debit refused, insufficient funds: userKey={}, amount={}", userKey, amount);
        return false;
    }

    @Transactional(readOnly = true)
    public BigDecimal getBalance(String userKey) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
                "SELECT balance FROM user_balances WHERE user_key = ?", BigDecimal.class, userKey);
        return rows.isEmpty() ? BigDecimal.ZERO : rows.get(0);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }
}
