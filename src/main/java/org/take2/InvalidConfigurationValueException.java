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

package org.take2;

/**
 * Thrown when a configuration field fails its type or range check.
 */
@SuppressWarnings("serial")
public class InvalidConfigurationValueException extends RetryConfigurationException {

	private final String field;

	public InvalidConfigurationValueException(String field, String msg) {
		super(field + " " + msg);
		this.field = field;
	}

	/**
	 * @return the name of the offending configuration field
	 */
	public String getField() {
		return this.field;
	}

}
