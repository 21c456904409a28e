/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.cubejs.client;

import io.airlift.units.Duration;

import java.util.Optional;

/**
 * Computes how long to wait before the next poll.
 */
public interface WaitStrategy
{
    /**
     * @param attempt number of requests answered so far, at least 1
     * @param serverHint wait suggested by the last response, if any
     */
    Duration computeWait(int attempt, Optional<Duration> serverHint);
}
