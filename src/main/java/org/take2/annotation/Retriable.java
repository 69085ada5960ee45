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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for a method invocation that is retriable. On a type it applies to every
 * public method of the type; a method level declaration wins over the type level one.
 * <p>
 * Attributes that are left unset keep the values of the process-wide default
 * configuration ({@link org.take2.config.RetryDefaults}) at the time the method is
 * first invoked.
 *
 * 可重试注解
 */
@Target({ ElementType.METHOD, ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
public @interface Retriable {

	/**
	 * Exception types that are retriable, subclasses included. Defaults to empty, which
	 * keeps the default retriable kinds.
	 * @return exception types to retry
	 */
	Class<? extends Throwable>[] value() default {};

	/**
	 * @return the maximum number of retries, not counting the first attempt. 0 keeps
	 * the default (3), negative values are rejected when the declaration is resolved
	 */
	int retries() default 0;

	/**
	 * @return an expression evaluated to the maximum number of retries, e.g.
	 * {@code "${remote.retries:3}"}. Overrides {@link #retries()}. The result must be
	 * positive.
	 */
	String retriesExpression() default "";

	/**
	 * Specify an expression to be evaluated against the thrown exception, e.g.
	 * {@code "status < 500"}. When it evaluates to true the exception is rethrown without
	 * retrying.
	 * @return the suppression expression
	 */
	String condition() default "";

	/**
	 * @return the bean name of a {@link org.take2.RetryHook} called before each retry
	 */
	String onRetry() default "";

	/**
	 * Specify the backoff table for retrying this operation. The default keeps the
	 * default table.
	 * @return a backoff declaration
	 */
	Backoff backoff() default @Backoff();

}
