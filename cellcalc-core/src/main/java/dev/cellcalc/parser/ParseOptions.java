/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.cellcalc.parser;

import org.immutables.value.Value;

/**
 * Options for turning formula text into an expression tree.
 */
@Value.Immutable
public interface ParseOptions {
    /**
     * Operator precedence and associativity used to build binary expressions.
     */
    @Value.Default
    default PrecedenceTable precedence() {
        return PrecedenceTable.standard();
    }

    static ParseOptions of() {
        return ImmutableParseOptions.builder().build();
    }

    static ImmutableParseOptions.Builder builder() {
        return ImmutableParseOptions.builder();
    }
}
