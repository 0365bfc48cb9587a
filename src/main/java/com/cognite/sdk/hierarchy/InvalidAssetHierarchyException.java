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

package com.cognite.sdk.hierarchy;

/**
 * Thrown when an asset hierarchy fails validation. Nothing has been written to CDF, so the write can be
 * retried once the input has been fixed.
 */
public class InvalidAssetHierarchyException extends AssetHierarchyException {
    private final ValidationReport report;

    public InvalidAssetHierarchyException(ValidationReport report) {
        super("Invalid asset hierarchy: " + report.summary());
        this.report = report;
    }

    public ValidationReport getReport() {
        return report;
    }
}
