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

import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.BeanFactoryAware;
import org.springframework.context.expression.BeanFactoryResolver;
import org.springframework.expression.Expression;
import org.springframework.expression.common.TemplateParserContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.util.Assert;
import org.take2.RetryCondition;

/**
 * A {@link RetryCondition} backed by a SpEL expression evaluated with the failure as
 * root object, e.g. {@code "status < 500"} for a
 * {@link org.take2.RetriableResponseException}. The retry is prevented when the
 * expression yields {@code true}. Template expressions ({@code #{...}}) are supported,
 * and with a bean factory the expression can reference beans ({@code @bean}).
 *
 * 基于表达式的重试抑制条件
 */
public class ExpressionRetryCondition implements RetryCondition, BeanFactoryAware {

	private static final TemplateParserContext PARSER_CONTEXT = new TemplateParserContext();

	private static final SpelExpressionParser PARSER = new SpelExpressionParser();

	private final Expression expression;

	private final StandardEvaluationContext evaluationContext = new StandardEvaluationContext();

	/**
	 * @param expressionString the expression, evaluated against the failure
	 */
	public ExpressionRetryCondition(String expressionString) {
		Assert.hasText(expressionString, "'expressionString' cannot be null or empty");
		this.expression = getExpression(expressionString);
	}

	@Override
	public void setBeanFactory(BeanFactory beanFactory) throws BeansException {
		this.evaluationContext.setBeanResolver(new BeanFactoryResolver(beanFactory));
	}

	public ExpressionRetryCondition withBeanFactory(BeanFactory beanFactory) {
		setBeanFactory(beanFactory);
		return this;
	}

	@Override
	public boolean preventsRetry(Throwable throwable) {
		Boolean result = this.expression.getValue(this.evaluationContext, throwable, Boolean.class);
		return Boolean.TRUE.equals(result);
	}

	/**
	 * Get expression based on the expression string. At the moment supports both literal
	 * and template expressions.
	 * @param expression the expression string
	 * @return literal expression or template expression
	 */
	private static Expression getExpression(String expression) {
		if (isTemplate(expression)) {
			return PARSER.parseExpression(expression, PARSER_CONTEXT);
		}
		return PARSER.parseExpression(expression);
	}

	private static boolean isTemplate(String expression) {
		return expression.contains(PARSER_CONTEXT.getExpressionPrefix())
				&& expression.contains(PARSER_CONTEXT.getExpressionSuffix());
	}

	@Override
	public String toString() {
		return "ExpressionRetryCondition[" + this.expression.getExpressionString() + "]";
	}

}
