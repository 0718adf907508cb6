package io.ledger.core.state;

import io.ledger.core.protocol.ApplyResult;
import io.ledger.core.protocol.Rejections;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory implementation of Ledger.
 * Tracks accounts and deposit history using simple maps.
 * Not persistent; state lasts for one process run.
 */
public final class InMemoryLedger implements Ledger {

    private final Map<Integer, Account> accounts = new TreeMap<>();
    private final Map<Long, StoredDeposit> deposits = new HashMap<>();
    // withdrawal ids are not kept as history, only as taken
    private final Set<Long> withdrawalIds = new HashSet<>();

    @Override
    public synchronized Optional<AccountSnapshot> findAccount(int clientId) {
        Account account = accounts.get(clientId);
        return account == null ? Optional.empty() : Optional.of(account.snapshot());
    }

    @Override
    public synchronized boolean isLocked(int clientId) {
        Account account = accounts.get(clientId);
        return account != null && account.locked();
    }

    @Override
    public synchronized Optional<StoredDeposit> findDeposit(long txId) {
        return Optional.ofNullable(deposits.get(txId));
    }

    @Override
    public synchronized boolean isTxIdUsed(long txId) {
        return deposits.containsKey(txId) || withdrawalIds.contains(txId);
    }

    @Override
    public synchronized ApplyResult deposit(int clientId, long txId, BigDecimal amount) {
        ApplyResult check = checkNewMovement(clientId, txId, amount);
        if (check.isRejected()) {
            return check;
        }
        accounts.computeIfAbsent(clientId, Account::new).credit(amount);
        deposits.put(txId, new StoredDeposit(txId, clientId, amount, DisputeState.CLEAN));
        return ApplyResult.ok();
    }

    @Override
    public synchronized ApplyResult withdraw(int clientId, long txId, BigDecimal amount) {
        ApplyResult check = checkNewMovement(clientId, txId, amount);
        if (check.isRejected()) {
            return check;
        }
        Account account = accounts.get(clientId);
        BigDecimal available = account == null ? BigDecimal.ZERO : account.available();
        if (available.compareTo(amount) < 0) {
            return Rejections.insufficientFunds(clientId, txId, available, amount);
        }
        if (account == null) {
            // zero-amount withdrawal from an unseen client
            account = new Account(clientId);
            accounts.put(clientId, account);
        }
        account.debit(amount);
        withdrawalIds.add(txId);
        return ApplyResult.ok();
    }

    @Override
    public synchronized ApplyResult dispute(int clientId, long txId) {
        ApplyResult check = checkReference(clientId, txId, DisputeState.CLEAN);
        if (check.isRejected()) {
            return check;
        }
        StoredDeposit stored = deposits.get(txId);
        accounts.get(clientId).hold(stored.amount());
        deposits.put(txId, stored.withState(DisputeState.DISPUTED));
        return ApplyResult.ok();
    }

    @Override
    public synchronized ApplyResult resolve(int clientId, long txId) {
        ApplyResult check = checkReference(clientId, txId, DisputeState.DISPUTED);
        if (check.isRejected()) {
            return check;
        }
        StoredDeposit stored = deposits.get(txId);
        accounts.get(clientId).release(stored.amount());
        deposits.put(txId, stored.withState(DisputeState.CLEAN));
        return ApplyResult.ok();
    }

    @Override
    public synchronized ApplyResult chargeback(int clientId, long txId) {
        ApplyResult check = checkReference(clientId, txId, DisputeState.DISPUTED);
        if (check.isRejected()) {
            return check;
        }
        StoredDeposit stored = deposits.get(txId);
        accounts.get(clientId).chargeBack(stored.amount());
        deposits.put(txId, stored.withState(DisputeState.CLEAN));
        return ApplyResult.ok();
    }

    @Override
    public synchronized List<AccountSnapshot> snapshot() {
        List<AccountSnapshot> out = new ArrayList<>(accounts.size());
        for (Account account : accounts.values()) {
            out.add(account.snapshot());
        }
        return out;
    }

    @Override
    public synchronized int accountCount() {
        return accounts.size();
    }

    private ApplyResult checkNewMovement(int clientId, long txId, BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            return Rejections.negativeAmount(txId, amount);
        }
        if (isLocked(clientId)) {
            return Rejections.accountLocked(clientId, txId);
        }
        if (isTxIdUsed(txId)) {
            return Rejections.duplicateTxId(txId);
        }
        return ApplyResult.ok();
    }

    private ApplyResult checkReference(int clientId, long txId, DisputeState required) {
        if (isLocked(clientId)) {
            return Rejections.accountLocked(clientId, txId);
        }
        StoredDeposit stored = deposits.get(txId);
        if (stored == null) {
            return Rejections.unknownReference(txId);
        }
        if (stored.clientId() != clientId) {
            return Rejections.ownerMismatch(clientId, txId, stored.clientId());
        }
        if (stored.disputeState() != required) {
            return required == DisputeState.CLEAN ? Rejections.alreadyDisputed(txId) : Rejections.notDisputed(txId);
        }
        return ApplyResult.ok();
    }
}
