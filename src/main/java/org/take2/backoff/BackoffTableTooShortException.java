/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.take2.backoff;

import org.take2.RetryConfigurationException;

/**
 * Thrown when a backoff strategy cannot produce as many intervals as retries were
 * requested, because the next interval would no longer fit in a {@code long}.
 */
@SuppressWarnings("serial")
public class BackoffTableTooShortException extends RetryConfigurationException {

	public BackoffTableTooShortException(BackoffStrategyKind kind, int requested, int available) {
		super("A " + kind.getName() + " backoff table holds at most " + available + " intervals, " + requested
				+ " were requested");
	}

	public BackoffTableTooShortException(BackoffStrategyKind kind, int requested, int available, Throwable cause) {
		super("A " + kind.getName() + " backoff table holds at most " + available + " intervals, " + requested
				+ " were requested", cause);
	}

}
