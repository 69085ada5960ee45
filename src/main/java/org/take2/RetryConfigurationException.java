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

import org.springframework.core.NestedRuntimeException;

/**
 * Root of the exceptions raised when a retry configuration is declared or merged with
 * invalid content. Never raised while a retry run is executing.
 *
 * 重试配置异常
 */
@SuppressWarnings("serial")
public class RetryConfigurationException extends NestedRuntimeException {

	/**
	 * Constructs a new instance with a message.
	 * @param msg the message
	 */
	public RetryConfigurationException(String msg) {
		super(msg);
	}

	/**
	 * Constructs a new instance with a message and nested exception.
	 * @param msg the message
	 * @param cause the cause
	 */
	public RetryConfigurationException(String msg, Throwable cause) {
		super(msg, cause);
	}

}
