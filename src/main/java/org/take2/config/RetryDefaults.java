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

package org.take2.config;

import java.util.Map;
import java.util.function.Consumer;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.springframework.util.Assert;

/**
 * Holder of the process-wide default {@link RetryConfiguration}. The default is created
 * lazily on first access and is copied into every type-level configuration at the
 * moment that type declares its retry behaviour. Changing or resetting the default
 * afterwards does not affect types that are already configured.
 *
 * 全局默认配置
 */
public final class RetryDefaults {

	private static final Log logger = LogFactory.getLog(RetryDefaults.class);

	private static volatile RetryConfiguration configuration;

	private RetryDefaults() {
	}

	/**
	 * Mutable handle to the process-wide default configuration, created on first use.
	 * @return the default configuration
	 */
	public static RetryConfiguration config() {
		RetryConfiguration current = configuration;
		if (current == null) {
			synchronized (RetryDefaults.class) {
				current = configuration;
				if (current == null) {
					current = RetryConfiguration.createDefault();
					configuration = current;
					if (logger.isDebugEnabled()) {
						logger.debug("Created default retry configuration: " + current);
					}
				}
			}
		}
		return current;
	}

	/**
	 * Replace the default configuration with the built-in defaults.
	 * @return the new default configuration
	 */
	public static RetryConfiguration reset() {
		return replace(RetryConfiguration.createDefault());
	}

	/**
	 * Replace the default configuration with the built-in defaults overlaid with the
	 * options.
	 * @param options configuration keys and values
	 * @return the new default configuration
	 * @throws org.take2.RetryConfigurationException if the options are not valid, in
	 * which case the current default is kept
	 */
	public static RetryConfiguration reset(Map<String, ?> options) {
		return replace(new RetryConfiguration(options));
	}

	/**
	 * Adjust the default configuration in place, then check its invariants.
	 * @param configurer callback receiving the default configuration
	 * @return the default configuration
	 */
	public static RetryConfiguration configure(Consumer<RetryConfiguration> configurer) {
		Assert.notNull(configurer, "Configurer must not be null");
		RetryConfiguration current = config();
		configurer.accept(current);
		current.validate();
		return current;
	}

	private static RetryConfiguration replace(RetryConfiguration replacement) {
		synchronized (RetryDefaults.class) {
			configuration = replacement;
		}
		if (logger.isDebugEnabled()) {
			logger.debug("Reset default retry configuration: " + replacement);
		}
		return replacement;
	}

}
