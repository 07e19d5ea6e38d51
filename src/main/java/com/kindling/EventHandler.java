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

import java.util.Map;

/**
 * Receives notifications for an {@link EventSubscription}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler {
	/**
	 * Called, one batch at a time, when subscribed events have been posted.
	 * <p>
	 * It is safe to call {@link EventSubscription#cancel()} from here. An exception thrown from here is logged and
	 * does not end the subscription.
	 *
	 * @param counts event names mapped to how many times each was posted since the previous batch; only events whose
	 *               count changed are present
	 */
	void handle(@NonNull Map<@NonNull String, @NonNull Long> counts);
}
