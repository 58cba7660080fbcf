/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.imgconv.scale;

/**
 * One contribution of a source sample to a destination sample.
 *
 * @param sourceIndex index of the contributing source sample
 * @param destIndex index of the receiving destination sample
 * @param weight contribution weight; weights sharing a {@code destIndex} sum to 1.0
 */
public record ScaleCoefficient(int sourceIndex, int destIndex, float weight) {}
