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

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.BeanFactoryAware;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.expression.BeanFactoryResolver;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.expression.common.TemplateParserContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.util.Assert;
import org.springframework.util.ConcurrentReferenceHashMap;
import org.springframework.util.StringUtils;
import org.take2.RetryHook;
import org.take2.backoff.BackoffStrategy;
import org.take2.interceptor.RetryOperationsInterceptor;
import org.take2.support.ExpressionRetryCondition;
import org.take2.support.RetryTemplate;
import org.take2.support.RetryTemplateBuilder;

/**
 * Interceptor that parses the retry metadata on the method it is invoking and delegates
 * to an appropriate {@link RetryOperationsInterceptor}. The metadata is read once per
 * target and method; the resulting {@link RetryTemplate} holds the type-level
 * configuration for that method from then on.
 *
 * 注解感知的重试拦截器
 */
public class RetriableOperationsInterceptor implements MethodInterceptor, BeanFactoryAware {

	private static final Log logger = LogFactory.getLog(RetriableOperationsInterceptor.class);

	/**
	 * 模板解析上下文
	 */
	private static final TemplateParserContext PARSER_CONTEXT = new TemplateParserContext();

	/**
	 * Spring EL表达式解析器
	 */
	private static final SpelExpressionParser PARSER = new SpelExpressionParser();

	/**
	 * 无重试注解时的占位拦截器
	 */
	private static final MethodInterceptor NULL_INTERCEPTOR = new MethodInterceptor() {
		@Override
		public Object invoke(MethodInvocation methodInvocation) throws Throwable {
			throw new UnsupportedOperationException("Not supported");
		}
	};

	/**
	 * 评估上下文
	 */
	private final StandardEvaluationContext evaluationContext = new StandardEvaluationContext();

	/**
	 * 对象-> 方法和方法拦截器的映射
	 */
	private final ConcurrentReferenceHashMap<Object, ConcurrentMap<Method, MethodInterceptor>> delegates = new ConcurrentReferenceHashMap<Object, ConcurrentMap<Method, MethodInterceptor>>();

	/**
	 * 暂停接口
	 */
	private Sleeper sleeper;

	/**
	 * bean工厂
	 */
	private BeanFactory beanFactory;

	/**
	 * @param sleeper the sleeper to set
	 */
	public void setSleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
	}

	@Override
	public void setBeanFactory(BeanFactory beanFactory) throws BeansException {
		this.beanFactory = beanFactory;
		this.evaluationContext.setBeanResolver(new BeanFactoryResolver(beanFactory));
	}

	@Override
	public Object invoke(MethodInvocation invocation) throws Throwable {
		MethodInterceptor delegate = getDelegate(invocation.getThis(), invocation.getMethod());
		if (delegate != null) {
			return delegate.invoke(invocation);
		}
		else {
			return invocation.proceed();
		}
	}

	private MethodInterceptor getDelegate(Object target, Method method) {
		ConcurrentMap<Method, MethodInterceptor> cachedMethods = this.delegates.get(target);
		if (cachedMethods == null) {
			cachedMethods = new ConcurrentHashMap<Method, MethodInterceptor>();
		}
		MethodInterceptor delegate = cachedMethods.get(method);
		if (delegate == null) {
			MethodInterceptor interceptor = NULL_INTERCEPTOR;
			// 方法上的注解优先于类上的注解
			Retriable retriable = AnnotatedElementUtils.findMergedAnnotation(method, Retriable.class);
			if (retriable == null) {
				retriable = AnnotatedElementUtils.findMergedAnnotation(method.getDeclaringClass(), Retriable.class);
			}
			if (retriable == null) {
				retriable = findAnnotationOnTarget(target, method, Retriable.class);
			}
			if (retriable != null) {
				interceptor = new RetryOperationsInterceptor(createTemplate(retriable), method.toGenericString());
				if (logger.isTraceEnabled()) {
					logger.trace("Retry declaration resolved for " + method.toGenericString() + ": "
							+ ((RetryOperationsInterceptor) interceptor).getRetryOperations());
				}
			}
			cachedMethods.putIfAbsent(method, interceptor);
			delegate = cachedMethods.get(method);
		}
		this.delegates.putIfAbsent(target, cachedMethods);
		return delegate == NULL_INTERCEPTOR ? null : delegate;
	}

	private <A extends Annotation> A findAnnotationOnTarget(Object target, Method method, Class<A> annotation) {
		if (target == null) {
			return null;
		}
		try {
			Method targetMethod = target.getClass().getMethod(method.getName(), method.getParameterTypes());
			A retriable = AnnotatedElementUtils.findMergedAnnotation(targetMethod, annotation);
			if (retriable == null) {
				retriable = AnnotatedElementUtils.findMergedAnnotation(targetMethod.getDeclaringClass(), annotation);
			}
			return retriable;
		}
		catch (NoSuchMethodException ex) {
			return null;
		}
	}

	private RetryTemplate createTemplate(Retriable retriable) {
		RetryTemplateBuilder builder = RetryTemplate.builder();
		Integer retries = getRetries(retriable);
		if (retries != null) {
			builder.retries(retries);
		}
		if (retriable.value().length > 0) {
			builder.retryOn(retriable.value());
		}
		if (StringUtils.hasText(retriable.condition())) {
			builder.retryCondition(
					new ExpressionRetryCondition(resolve(retriable.condition())).withBeanFactory(this.beanFactory));
		}
		if (StringUtils.hasText(retriable.onRetry())) {
			Assert.state(this.beanFactory != null, "A BeanFactory is required to look up the onRetry hook");
			builder.onRetry(this.beanFactory.getBean(resolve(retriable.onRetry()), RetryHook.class));
		}
		Backoff backoff = retriable.backoff();
		if (StringUtils.hasText(backoff.kind())) {
			builder.backoff(BackoffStrategy.of(resolve(backoff.kind()), backoff.start(), backoff.factor())
				.withUnit(backoff.unit()));
		}
		if (this.sleeper != null) {
			builder.sleeper(this.sleeper);
		}
		return builder.build();
	}

	/**
	 * @return the declared retry budget, or null when the declaration keeps the default.
	 * Any other value, from the expression or the attribute, is validated by the builder.
	 */
	private Integer getRetries(Retriable retriable) {
		if (StringUtils.hasText(retriable.retriesExpression())) {
			Integer value = PARSER.parseExpression(resolve(retriable.retriesExpression()), PARSER_CONTEXT)
				.getValue(this.evaluationContext, Integer.class);
			if (value != null) {
				return value;
			}
		}
		// 0 为注解默认值，表示沿用默认重试次数
		return (retriable.retries() != 0) ? Integer.valueOf(retriable.retries()) : null;
	}

	/**
	 * Resolve the specified value if possible.
	 *
	 * @see ConfigurableBeanFactory#resolveEmbeddedValue
	 */
	private String resolve(String value) {
		if (this.beanFactory != null && this.beanFactory instanceof ConfigurableBeanFactory) {
			return ((ConfigurableBeanFactory) this.beanFactory).resolveEmbeddedValue(value);
		}
		return value;
	}

}
