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

import io.github.goodees.cqrs.infrastructure.PublishableException;

import java.util.Map;
import java.util.UUID;

public class InsufficientFundsException extends RuntimeException implements PublishableException {
    private final String id = UUID.randomUUID().toString();
    private final String accountId;
    private final long balance;
    private final long requested;

    public InsufficientFundsException(String accountId, long balance, long requested) {
        super("Account " + accountId + " has " + balance + ", cannot withdraw " + requested);
        this.accountId = accountId;
        this.balance = balance;
        this.requested = requested;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void serializeTo(Map<String, String> serializableInfo) {
        serializableInfo.put("accountId", accountId);
        serializableInfo.put("balance", String.valueOf(balance));
        serializableInfo.put("requested", String.valueOf(requested));
    }

    public String getAccountId() {
        return accountId;
    }
}
