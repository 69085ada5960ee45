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
 * Thrown when a backoff strategy name is not one of the supported
 * {@link BackoffStrategyKind kinds}.
 */
@SuppressWarnings("serial")
public class InvalidStrategyKindException extends RetryConfigurationException {

	private final String kind;

	public InvalidStrategyKindException(String kind) {
		super("Incorrect backoff type: " + kind);
		this.kind = kind;
	}

	public String getKind() {
		return this.kind;
	}

}
