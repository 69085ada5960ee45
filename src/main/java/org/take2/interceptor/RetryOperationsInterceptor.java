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

package org.take2.interceptor;

import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.springframework.aop.ProxyMethodInvocation;
import org.springframework.util.Assert;
import org.take2.RetryCallback;
import org.take2.RetryContext;
import org.take2.RetryOperations;

/**
 * A {@link MethodInterceptor} that can be used to automatically retry calls to a method
 * on a service if it fails. The injected {@link RetryOperations} is used to control the
 * number of retries. Each attempt proceeds with a fresh copy of the method invocation.
 *
 * 重试方法拦截器
 */
public class RetryOperationsInterceptor implements MethodInterceptor {

	private static final Log logger = LogFactory.getLog(RetryOperationsInterceptor.class);

	private final RetryOperations retryOperations;

	private final String label;

	public RetryOperationsInterceptor(RetryOperations retryOperations, String label) {
		Assert.notNull(retryOperations, "'retryOperations' cannot be null.");
		this.retryOperations = retryOperations;
		this.label = label;
	}

	public RetryOperations getRetryOperations() {
		return this.retryOperations;
	}

	public String getLabel() {
		return this.label;
	}

	@Override
	public Object invoke(final MethodInvocation invocation) throws Throwable {
		if (!(invocation instanceof ProxyMethodInvocation)) {
			throw new IllegalStateException(
					"MethodInvocation of the wrong type detected - this should not happen with Spring AOP, "
							+ "so please raise an issue if you see this exception");
		}
		final ProxyMethodInvocation proxyInvocation = (ProxyMethodInvocation) invocation;
		return this.retryOperations.execute(new RetryCallback<Object, Throwable>() {

			@Override
			public Object doWithRetry(RetryContext context) throws Throwable {
				if (logger.isTraceEnabled()) {
					logger.trace("Invoking " + RetryOperationsInterceptor.this.label + ": attempt="
							+ context.getAttemptCount());
				}
				// 每次尝试都克隆调用对象，保证拦截器链从头执行
				return proxyInvocation.invocableClone().proceed();
			}

		});
	}

}
