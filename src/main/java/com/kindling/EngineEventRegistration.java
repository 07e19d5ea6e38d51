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
 * A pending engine event registration, see {@link EngineAttachment#queueEvents(java.util.Map, EngineEventListener)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface EngineEventRegistration {
	/**
	 * Cancels the registration if it has not fired yet. Cancelling an already-fired registration is a no-op.
	 *
	 * @throws EngineException if the engine failed to cancel the registration
	 */
	void cancel() throws EngineException;
}
