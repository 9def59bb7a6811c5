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

import io.github.goodees.cqrs.commanding.Command;

public class Deposit extends Command {
    private final long amount;

    public Deposit(String accountId, long amount) {
        super(accountId);
        this.amount = amount;
    }

    public Deposit(String commandId, String accountId, long amount) {
        super(commandId, accountId);
        this.amount = amount;
    }

    public long getAmount() {
        return amount;
    }
}
