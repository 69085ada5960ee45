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
 * Low-level access to the state of a single retry run. Lives only for the duration of
 * one {@link RetryOperations#execute(RetryCallback)} call and is handed to the
 * callback on every attempt.
 *
 * 重试上下文
 */
public interface RetryContext {

	/**
	 * @return the retry budget this run started with (not counting the first attempt)
	 */
	int getRetries();

	/**
	 * @return the number of retries still available
	 */
	int getAttemptsRemaining();

	/**
	 * Counts the attempts made so far, including the one in progress. The first attempt
	 * is attempt 1.
	 * @return the number of attempts made
	 */
	int getAttemptCount();

	/**
	 * Accessor for the exception object that caused the current retry.
	 * @return the last exception that caused a retry, or possibly null. It will be null
	 * if this is the first attempt.
	 */
	Throwable getLastThrowable();

}
