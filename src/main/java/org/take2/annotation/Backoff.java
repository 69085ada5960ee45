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
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Collects metadata for a {@link org.take2.backoff.BackoffStrategy}.
 *
 * 回退注解
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Backoff {

	/**
	 * One of constant, linear, fibonacci, exponential. Placeholders are resolved. Empty
	 * keeps the default table.
	 * @return the strategy kind
	 */
	String kind() default "";

	/**
	 * @return the start value, in {@link #unit()}
	 */
	long start() default 1;

	/**
	 * @return the growth factor of linear tables
	 */
	long factor() default 1;

	/**
	 * @return the unit of the start value, milliseconds or coarser
	 */
	TimeUnit unit() default TimeUnit.SECONDS;

}
