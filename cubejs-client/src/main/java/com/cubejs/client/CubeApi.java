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

import static com.google.common.base.MoreObjects.firstNonNull;

/**
 * Constants of the Cube REST API load endpoint.
 */
public final class CubeApi
{
    public static final String LOAD_PATH = "/cubejs-api/v1/load";
    public static final String CONTINUE_WAIT = "Continue wait";
    public static final String JSON_MEDIA_TYPE = "application/json";
    public static final String USER_AGENT_VALUE = "cubejs-client/" +
            firstNonNull(CubeApi.class.getPackage().getImplementationVersion(), "unknown");

    private CubeApi() {}
}
