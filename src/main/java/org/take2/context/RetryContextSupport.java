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

package org.take2.context;

import org.take2.RetryContext;

/**
 * Mutable {@link RetryContext} for one retry run. Only the thread executing the run
 * modifies it.
 *
 * 重试上下文实现
 */
public class RetryContextSupport implements RetryContext {

	/**
	 * 重试预算
	 */
	private final int retries;

	/**
	 * 剩余重试次数
	 */
	private int attemptsRemaining;

	/**
	 * 已尝试次数
	 */
	private int attemptCount = 1;

	private Throwable lastException;

	public RetryContextSupport(int retries) {
		this.retries = retries;
		this.attemptsRemaining = retries;
	}

	@Override
	public int getRetries() {
		return this.retries;
	}

	@Override
	public int getAttemptsRemaining() {
		return this.attemptsRemaining;
	}

	@Override
	public int getAttemptCount() {
		return this.attemptCount;
	}

	@Override
	public Throwable getLastThrowable() {
		return this.lastException;
	}

	/**
	 * @return the number of retries consumed so far, i.e. the index into the backoff
	 * table for the next wait
	 */
	public int getRetriesConsumed() {
		return this.retries - this.attemptsRemaining;
	}

	/**
	 * Record the failure of the current attempt.
	 * @param throwable the exception that caused the attempt to fail
	 */
	public void registerThrowable(Throwable throwable) {
		this.lastException = throwable;
	}

	/**
	 * Use up one retry and start the next attempt.
	 */
	public void consumeRetry() {
		if (this.attemptsRemaining <= 0) {
			throw new IllegalStateException("No retries left to consume in " + this);
		}
		this.attemptsRemaining--;
		this.attemptCount++;
	}

	@Override
	public String toString() {
		return String.format("[RetryContext: attemptCount=%d, attemptsRemaining=%d, lastException=%s]",
				this.attemptCount, this.attemptsRemaining, this.lastException);
	}

}
