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

package org.take2.support;

import java.io.IOException;

import org.junit.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.take2.RetriableResponseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class ExpressionRetryConditionTests {

	@Test
	public void evaluatesAgainstTheFailure() {
		ExpressionRetryCondition condition = new ExpressionRetryCondition("status < 500");
		assertThat(condition.preventsRetry(new RetriableResponseException(404, "not found"))).isTrue();
		assertThat(condition.preventsRetry(new RetriableResponseException(503, "unavailable"))).isFalse();
	}

	@Test
	public void templateExpression() {
		ExpressionRetryCondition condition = new ExpressionRetryCondition("#{message.contains('permanent')}");
		assertThat(condition.preventsRetry(new IOException("permanent failure"))).isTrue();
		assertThat(condition.preventsRetry(new IOException("timeout"))).isFalse();
	}

	@Test
	public void referencesBeans() {
		DefaultListableBeanFactory beanFactory = new DefaultListableBeanFactory();
		beanFactory.registerSingleton("statusPolicy", new StatusPolicy(429));
		ExpressionRetryCondition condition = new ExpressionRetryCondition("@statusPolicy.isFinal(status)")
			.withBeanFactory(beanFactory);
		assertThat(condition.preventsRetry(new RetriableResponseException(400, "bad request"))).isTrue();
		assertThat(condition.preventsRetry(new RetriableResponseException(429, "slow down"))).isFalse();
	}

	@Test
	public void nullResultDoesNotPreventRetry() {
		ExpressionRetryCondition condition = new ExpressionRetryCondition("null");
		assertThat(condition.preventsRetry(new IOException())).isFalse();
	}

	@Test
	public void blankExpressionIsRejected() {
		assertThatIllegalArgumentException().isThrownBy(() -> new ExpressionRetryCondition(" "));
	}

	public static class StatusPolicy {

		private final int retriableClientStatus;

		public StatusPolicy(int retriableClientStatus) {
			this.retriableClientStatus = retriableClientStatus;
		}

		public boolean isFinal(int status) {
			return status < 500 && status != this.retriableClientStatus;
		}

	}

}
