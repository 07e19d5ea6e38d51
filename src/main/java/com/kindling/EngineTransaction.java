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

/**
 * Engine-side handle for one transaction.
 * <p>
 * After {@link #commit()} or {@link #rollback()} succeeds the handle is no longer usable. The retaining variants keep
 * the handle (and the statements and cursors associated with it) usable.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface EngineTransaction {
	void commit() throws EngineException;

	void commitRetaining() throws EngineException;

	void rollback() throws EngineException;

	void rollbackRetaining() throws EngineException;
}
