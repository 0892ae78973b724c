package com.autopilot.core.engine;

import com.autopilot.config.AccountSettings;
import com.autopilot.domain.model.Account;
import com.autopilot.exception.ResourceNotFoundException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of accounts under management, in configuration order. Created once at startup and never
 * changed afterwards; the accounts themselves are mutated only on the scheduling loop.
 */
public class AccountRegistry {

    private final Map<String, Account> accounts;

    public AccountRegistry(List<AccountSettings> accountSettings) {
        Map<String, Account> byId = new LinkedHashMap<>();
        for (AccountSettings settings : accountSettings) {
            byId.put(settings.getAccountId(), new Account(settings));
        }
        this.accounts = Collections.unmodifiableMap(byId);
    }

    public Collection<Account> all() {
        return accounts.values();
    }

    public Optional<Account> find(String accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    public Account get(String accountId) {
        Account account = accounts.get(accountId);
        if (account == null) {
            throw new ResourceNotFoundException("Account", accountId);
        }
        return account;
    }

    public boolean contains(String accountId) {
        return accounts.containsKey(accountId);
    }

    public int size() {
        return accounts.size();
    }
}
