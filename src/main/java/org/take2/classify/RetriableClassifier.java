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

package org.take2.classify;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.springframework.classify.SubclassClassifier;

/**
 * Decides whether a failure is retriable: its class must equal, or descend from, one of
 * the configured failure kinds. Anything else, {@code null} included, classifies as
 * not retriable, so an empty kind set retries nothing.
 * <p>
 * Lookups for a failure class are cached by the underlying {@link SubclassClassifier},
 * which is safe for concurrent use.
 *
 * 子类分类器
 */
@SuppressWarnings("serial")
public class RetriableClassifier extends SubclassClassifier<Throwable, Boolean> {

	private final Set<Class<? extends Throwable>> kinds;

	public RetriableClassifier(Collection<Class<? extends Throwable>> kinds) {
		super(toTypeMap(kinds), Boolean.FALSE);
		this.kinds = Collections.unmodifiableSet(new LinkedHashSet<Class<? extends Throwable>>(kinds));
	}

	/**
	 * @return the configured failure kinds, in declaration order
	 */
	public Set<Class<? extends Throwable>> getKinds() {
		return this.kinds;
	}

	@Override
	public String toString() {
		return "RetriableClassifier" + this.kinds;
	}

	private static Map<Class<? extends Throwable>, Boolean> toTypeMap(Collection<Class<? extends Throwable>> kinds) {
		Map<Class<? extends Throwable>, Boolean> typeMap = new LinkedHashMap<Class<? extends Throwable>, Boolean>();
		for (Class<? extends Throwable> kind : kinds) {
			typeMap.put(kind, Boolean.TRUE);
		}
		return typeMap;
	}

}
