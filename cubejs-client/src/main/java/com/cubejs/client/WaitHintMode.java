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

/**
 * Source of the wait before the next poll when the server suggests one.
 */
public enum WaitHintMode
{
    /**
     * Use the server's hint, clamped to the backoff cap, instead of the computed backoff.
     */
    PREFER_SERVER_HINT,
    /**
     * Always use the computed backoff.
     */
    IGNORE_SERVER_HINT,
}
