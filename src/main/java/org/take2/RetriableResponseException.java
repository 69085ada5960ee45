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
 * Failure kind for a server response that is worth retrying, e.g. a 5xx or 429 status.
 * Transport integrations throw it so that the default configuration classifies the
 * response as retriable and suppression conditions can inspect {@link #getStatus()}.
 *
 * 可重试的服务端响应异常
 */
@SuppressWarnings("serial")
public class RetriableResponseException extends RuntimeException {

	private final int status;

	public RetriableResponseException(int status, String message) {
		super(message);
		this.status = status;
	}

	public RetriableResponseException(int status, String message, Throwable cause) {
		super(message, cause);
		this.status = status;
	}

	/**
	 * @return the status code of the response
	 */
	public int getStatus() {
		return this.status;
	}

}
