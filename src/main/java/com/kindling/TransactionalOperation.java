/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.kindling;

import org.jspecify.annotations.NonNull;

import java.util.concurrent.CompletableFuture;

/**
 * Represents work performed inside a transaction managed by
 * {@link Attachment#executeTransaction(TransactionOptions, TransactionalOperation)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransactionalOperation<T> {
	/**
	 * Performs the work.
	 * <p>
	 * The transaction is committed when the returned future completes normally and rolled back when it completes
	 * exceptionally (or when this method throws).
	 *
	 * @param transaction the transaction to perform the work in
	 * @return a future for the result of the work
	 * @throws Exception if an error occurs while starting the work
	 */
	@NonNull
	CompletableFuture<T> perform(@NonNull Transaction transaction) throws Exception;
}
