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

/**
 * Kindling is an asynchronous client for relational databases which speak a native attach/transaction/statement
 * protocol.
 * <p>
 * Every operation returns a {@link java.util.concurrent.CompletableFuture}. Engine work runs on the client's executor;
 * the client, its attachments and their resources enforce one in-flight operation per transaction and per statement.
 *
 * <pre>
 * Client client = Client.withEngine(engine).build();
 * Attachment attachment = client.connect("employees.fdb").join();
 *
 * // Queries
 * List&lt;Map&lt;String, Object&gt;&gt; rows = attachment.executeTransaction(transaction -&gt;
 *   attachment.executeQuery(transaction, "SELECT id, name FROM employee WHERE dept = ?", List.of(42))
 *     .thenCompose(resultSet -&gt; resultSet.fetchAsObject().thenCompose(result -&gt;
 *       resultSet.close().thenApply(ignored -&gt; result)))).join();
 *
 * // Statements
 * attachment.executeTransaction(transaction -&gt;
 *   attachment.execute(transaction, "UPDATE employee SET salary = salary * 1.1 WHERE dept = ?", List.of(42))).join();
 *
 * // Events
 * EventSubscription subscription = attachment.queueEvents(Set.of("salary_changed"), counts -&gt;
 *   System.out.println("Salary changes: " + counts)).join();
 *
 * subscription.cancel().join();
 * attachment.disconnect().join();
 * client.dispose().join();</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
package com.kindling;
