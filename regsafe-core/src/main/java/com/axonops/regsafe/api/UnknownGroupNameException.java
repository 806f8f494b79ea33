/*
 * Copyright 2025 AxonOps
 *
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

package com.axonops.regsafe.api;

/**
 * Thrown when a group is looked up by a name that neither the pattern nor the caller declared.
 *
 * @since 1.0.0
 */
public final class UnknownGroupNameException extends RegsafeException {

    private final String groupName;

    public UnknownGroupNameException(String groupName) {
        super("Regsafe: No group with name <" + groupName + ">");
        this.groupName = groupName;
    }

    public String getGroupName() {
        return groupName;
    }
}
