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

import java.util.Locale;

import org.springframework.util.StringUtils;

/**
 * The supported shapes of a backoff table.
 *
 * 回退类型
 */
public enum BackoffStrategyKind {

	/**
	 * Every interval equals the start value.
	 */
	CONSTANT,

	/**
	 * Intervals grow by the factor: {@code (start + i) * factor}.
	 */
	LINEAR,

	/**
	 * Fibonacci numbers at or above the start value.
	 */
	FIBONACCI,

	/**
	 * Start value first, then jittered powers of two.
	 */
	EXPONENTIAL;

	/**
	 * @return the lower case name used in declarations, e.g. {@code "exponential"}
	 */
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Resolve a kind from its declared name, ignoring case and surrounding whitespace.
	 * @param name the declared name
	 * @return the matching kind
	 * @throws InvalidStrategyKindException if the name does not denote a kind
	 */
	public static BackoffStrategyKind fromName(String name) {
		if (!StringUtils.hasText(name)) {
			throw new InvalidStrategyKindException(name);
		}
		String normalized = name.trim().toUpperCase(Locale.ROOT);
		for (BackoffStrategyKind kind : values()) {
			if (kind.name().equals(normalized)) {
				return kind;
			}
		}
		throw new InvalidStrategyKindException(name);
	}

}
