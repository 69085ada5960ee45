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
 * Callback invoked immediately before the back off that precedes each retry. Typical
 * use is logging. Exceptions thrown from the hook abort the retry run.
 *
 * 重试前回调
 */
@FunctionalInterface
public interface RetryHook {

	/**
	 * Hook that does nothing.
	 */
	RetryHook NO_OP = new RetryHook() {
		@Override
		public void onRetry(Throwable throwable, int attemptsRemaining) {
		}

		@Override
		public String toString() {
			return "RetryHook.NO_OP";
		}
	};

	/**
	 * @param throwable the failure that is about to be retried
	 * @param attemptsRemaining retries left, including the one about to happen
	 */
	void onRetry(Throwable throwable, int attemptsRemaining);

}
