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

import java.io.IOException;

import org.junit.Before;
import org.junit.Test;

import org.springframework.aop.Pointcut;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import static org.assertj.core.api.Assertions.assertThat;

public class RetriableAdvisorTests {

	private RetriableAdvisor advisor;

	@Before
	public void setUp() {
		this.advisor = new RetriableAdvisor();
		this.advisor.setBeanFactory(new DefaultListableBeanFactory());
		this.advisor.afterPropertiesSet();
	}

	@Test
	public void adviceIsTheDeclarationAwareInterceptor() {
		assertThat(this.advisor.getAdvice()).isInstanceOf(RetriableOperationsInterceptor.class);
	}

	@Test
	public void typeLevelDeclarationMatchesEveryMethod() throws Exception {
		Pointcut pointcut = this.advisor.getPointcut();
		assertThat(AopUtils.canApply(pointcut, TypeLevel.class)).isTrue();
		assertThat(pointcut.getMethodMatcher().matches(TypeLevel.class.getMethod("fetch"), TypeLevel.class)).isTrue();
	}

	@Test
	public void methodLevelDeclarationMatchesOnlyThatMethod() throws Exception {
		Pointcut pointcut = this.advisor.getPointcut();
		assertThat(AopUtils.canApply(pointcut, MethodLevel.class)).isTrue();
		assertThat(pointcut.getMethodMatcher().matches(MethodLevel.class.getMethod("fetch"), MethodLevel.class))
			.isTrue();
		assertThat(pointcut.getMethodMatcher().matches(MethodLevel.class.getMethod("local"), MethodLevel.class))
			.isFalse();
	}

	@Test
	public void declarationOnInterfaceMethodMatchesImplementation() throws Exception {
		Pointcut pointcut = this.advisor.getPointcut();
		assertThat(AopUtils.canApply(pointcut, RemoteClient.class)).isTrue();
		assertThat(pointcut.getMethodMatcher().matches(RemoteClient.class.getMethod("fetch"), RemoteClient.class))
			.isTrue();
	}

	@Test
	public void undeclaredTypeIsNotMatched() {
		assertThat(AopUtils.canApply(this.advisor.getPointcut(), Plain.class)).isFalse();
	}

	@Retriable
	public static class TypeLevel {

		public void fetch() {
		}

	}

	public static class MethodLevel {

		@Retriable(IOException.class)
		public void fetch() throws IOException {
		}

		public void local() {
		}

	}

	public interface Remote {

		@Retriable
		void fetch() throws IOException;

	}

	public static class RemoteClient implements Remote {

		@Override
		public void fetch() throws IOException {
		}

	}

	public static class Plain {

		public void fetch() {
		}

	}

}
