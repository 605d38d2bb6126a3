package io.abcsmc.model.scalar;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the serialization type name for a {@link ScalarModel} implementation.
 *
 * <p>The annotated name is written as the {@code "type"} field of the JSON
 * form and is used to select the concrete class when reading:
 *
 * <pre>{@code
 * {
 *   "type": "normal",
 *   "mean": 0.0,
 *   "std_dev": 1.0
 * }
 * }</pre>
 *
 * @see ScalarModelTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ModelType {
    /**
     * @return the type discriminator string, lowercase
     */
    String value();
}
