package io.github.goodees.cqrs.bank;

/*-
 * #%L
 * cqrs-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.cqrs.domain.AggregateRoot;
import io.github.goodees.cqrs.domain.DomainEvent;
import io.github.goodees.cqrs.domain.EventRouter;

public class BankAccount extends AggregateRoot {
    private String owner;
    private long balance;

    private final EventRouter router = EventRouter.builder()
            .on(AccountCreated.class, e -> owner = e.getOwner())
            .on(Deposited.class, e -> balance += e.getAmount())
            .on(Withdrawn.class, e -> balance -= e.getAmount())
            .build();

    BankAccount(String id) {
        super(id);
    }

    public BankAccount(String id, String owner) {
        this(id);
        applyEvent(new AccountCreated(owner));
    }

    public void deposit(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Deposit must be positive");
        }
        applyEvent(new Deposited(amount));
    }

    public void withdraw(long amount) {
        if (amount > balance) {
            throw new InsufficientFundsException(getId(), balance, amount);
        }
        applyEvent(new Withdrawn(amount));
    }

    @Override
    protected void handleEvent(DomainEvent event) {
        router.route(event);
    }

    public String getOwner() {
        return owner;
    }

    public long getBalance() {
        return balance;
    }
}
