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
 * Suppression predicate consulted for a retriable failure while retries remain. When it
 * returns {@code true} the failure is rethrown immediately instead of being retried.
 *
 * 重试抑制条件
 */
@FunctionalInterface
public interface RetryCondition {

	/**
	 * Condition that never prevents a retry.
	 */
	RetryCondition NEVER = new RetryCondition() {
		@Override
		public boolean preventsRetry(Throwable throwable) {
			return false;
		}

		@Override
		public String toString() {
			return "RetryCondition.NEVER";
		}
	};

	/**
	 * @param throwable the failure raised by the last attempt
	 * @return true to give up and rethrow the failure
	 */
	boolean preventsRetry(Throwable throwable);

}
