/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
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
package co.tracecore.configuration.validation;

import org.stagemonitor.configuration.ConfigurationOption;

import javax.annotation.Nullable;

/**
 * Rejects option values below a lower bound or, if there is one, above an upper bound. Both bounds are inclusive.
 */
public class RangeValidator<T extends Comparable<T>> implements ConfigurationOption.Validator<T> {

    private final T min;
    @Nullable
    private final T max;

    private RangeValidator(T min, @Nullable T max) {
        this.min = min;
        this.max = max;
    }

    public static <T extends Comparable<T>> RangeValidator<T> isInRange(T min, T max) {
        return new RangeValidator<>(min, max);
    }

    public static <T extends Comparable<T>> RangeValidator<T> min(T min) {
        return new RangeValidator<>(min, null);
    }

    @Override
    public void assertValid(@Nullable T value) {
        if (value == null) {
            return;
        }
        if (max == null) {
            if (value.compareTo(min) < 0) {
                throw new IllegalArgumentException(value + " must be at least " + min);
            }
        } else if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new IllegalArgumentException(value + " must be within [" + min + ", " + max + "]");
        }
    }
}
