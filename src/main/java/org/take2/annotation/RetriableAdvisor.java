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

package org.take2.annotation;

import org.aopalliance.aop.Advice;

import org.springframework.aop.Pointcut;
import org.springframework.aop.support.AbstractPointcutAdvisor;
import org.springframework.aop.support.ComposablePointcut;
import org.springframework.aop.support.annotation.AnnotationMatchingPointcut;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.BeanFactoryAware;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.util.Assert;

/**
 * Advisor applying {@link RetriableOperationsInterceptor} to beans that carry
 * <code>@Retriable</code>, either on the type (every method is advised) or on individual
 * methods, including methods declared by interfaces and superclasses. If there is a
 * unique bean elsewhere in the context of type {@link Sleeper} it will be used by the
 * retry interceptor instead of blocking the calling thread with
 * {@link Thread#sleep(long)}.
 *
 * 重试顾问
 */
@SuppressWarnings("serial")
public class RetriableAdvisor extends AbstractPointcutAdvisor implements BeanFactoryAware, InitializingBean {

	/**
	 * 通知
	 */
	private Advice advice;

	/**
	 * 切点
	 */
	private Pointcut pointcut;

	/**
	 * bean工厂
	 */
	private BeanFactory beanFactory;

	@Override
	public void setBeanFactory(BeanFactory beanFactory) {
		this.beanFactory = beanFactory;
	}

	@Override
	public void afterPropertiesSet() {
		Assert.state(this.beanFactory != null, "A BeanFactory is required to resolve @Retriable declarations");
		this.pointcut = buildPointcut();
		this.advice = buildAdvice();
	}

	@Override
	public Advice getAdvice() {
		return this.advice;
	}

	@Override
	public Pointcut getPointcut() {
		return this.pointcut;
	}

	protected Advice buildAdvice() {
		RetriableOperationsInterceptor interceptor = new RetriableOperationsInterceptor();
		// 上下文中唯一的Sleeper bean替代线程休眠
		Sleeper sleeper = this.beanFactory.getBeanProvider(Sleeper.class).getIfUnique();
		if (sleeper != null) {
			interceptor.setSleeper(sleeper);
		}
		interceptor.setBeanFactory(this.beanFactory);
		return interceptor;
	}

	/**
	 * Types annotated with {@link Retriable} match on every method; other types match on
	 * the methods that are annotated themselves.
	 * @return the pointcut for <code>@Retriable</code> declarations
	 */
	protected Pointcut buildPointcut() {
		Pointcut typeLevel = new AnnotationMatchingPointcut(Retriable.class, true);
		Pointcut methodLevel = new AnnotationMatchingPointcut(null, Retriable.class, true);
		return new ComposablePointcut(typeLevel).union(methodLevel);
	}

}
