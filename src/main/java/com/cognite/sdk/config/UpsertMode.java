/*
 * Copyright (c) 2020 Cognite AS
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cognite.sdk.config;

/**
 * How an existing object is modified when it is written again.
 *
 * {@code UPDATE} sets the provided fields and leaves all other fields unchanged.
 * {@code REPLACE} sets the provided fields and nulls the fields that are not provided.
 */
public enum UpsertMode {
    UPDATE,
    REPLACE
}
