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

import java.util.Map;

import org.springframework.aop.config.AopConfigUtils;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.beans.factory.support.RootBeanDefinition;
import org.springframework.context.annotation.ImportBeanDefinitionRegistrar;
import org.springframework.core.type.AnnotationMetadata;

/**
 * Registers the {@link RetriableAdvisor} as an infrastructure bean together with an
 * auto proxy creator that applies it, as requested by {@link EnableRetry}.
 */
public class RetryAutoProxyRegistrar implements ImportBeanDefinitionRegistrar {

	public static final String ADVISOR_BEAN_NAME = "org.take2.annotation.internalRetriableAdvisor";

	@Override
	public void registerBeanDefinitions(AnnotationMetadata importingClassMetadata, BeanDefinitionRegistry registry) {
		// 注册自动代理创建器
		AopConfigUtils.registerAutoProxyCreatorIfNecessary(registry);
		Map<String, Object> attributes = importingClassMetadata.getAnnotationAttributes(EnableRetry.class.getName());
		if (attributes != null && Boolean.TRUE.equals(attributes.get("proxyTargetClass"))) {
			AopConfigUtils.forceAutoProxyCreatorToUseClassProxying(registry);
		}
		if (!registry.containsBeanDefinition(ADVISOR_BEAN_NAME)) {
			RootBeanDefinition advisor = new RootBeanDefinition(RetriableAdvisor.class);
			advisor.setRole(BeanDefinition.ROLE_INFRASTRUCTURE);
			registry.registerBeanDefinition(ADVISOR_BEAN_NAME, advisor);
		}
	}

}
