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

import com.cognite.sdk.dto.Asset;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;

/**
 * The structural problems found in a collection of assets.
 *
 * - {@code invalid}: assets missing {@code externalId} or {@code name}.
 * - {@code orphans}: assets referencing a {@code parentExternalId} that is neither in the input nor confirmed to
 *   exist in CDF.
 * - {@code unsureParents}: assets whose parent cannot be resolved unambiguously because the parent's
 *   {@code externalId} is duplicated with conflicting parent references.
 * - {@code duplicates}: {@code externalId}s that occur more than once in the input.
 * - {@code cycles}: {@code externalId}s that are part of a parent-reference cycle.
 *
 * An asset can be listed in several categories, except that cycle membership suppresses the orphan and
 * unsure-parent checks for that asset.
 */
@AutoValue
public abstract class ValidationReport {
    private static final int MAX_DISPLAYED_ITEMS = 10;

    static Builder builder() {
        return new AutoValue_ValidationReport.Builder();
    }

    public abstract ImmutableList<Asset> getInvalid();
    public abstract ImmutableList<Asset> getOrphans();
    public abstract ImmutableList<Asset> getUnsureParents();
    public abstract ImmutableSet<String> getDuplicates();
    public abstract ImmutableSet<String> getCycles();

    /**
     * Returns {@code true} if no structural problems were found.
     */
    public boolean isValid() {
        return getInvalid().isEmpty()
                && getOrphans().isEmpty()
                && getUnsureParents().isEmpty()
                && getDuplicates().isEmpty()
                && getCycles().isEmpty();
    }

    /**
     * Returns {@code true} if the report has problems other than orphans. Orphans may be resolved by
     * confirming that their parents exist in CDF; the other categories can only be fixed in the input.
     */
    public boolean hasStructuralErrors() {
        return !getInvalid().isEmpty()
                || !getUnsureParents().isEmpty()
                || !getDuplicates().isEmpty()
                || !getCycles().isEmpty();
    }

    /**
     * Returns a short, one-line summary with the number of problems per category.
     */
    public String summary() {
        return String.format("%d invalid, %d orphans, %d unsure parents, %d duplicates, %d in cycles",
                getInvalid().size(),
                getOrphans().size(),
                getUnsureParents().size(),
                getDuplicates().size(),
                getCycles().size());
    }

    /**
     * Returns a human readable report listing the problems per category (max 10 displayed per category).
     */
    public String describe() {
        StringBuilder message = new StringBuilder();
        if (isValid()) {
            return message.append("The asset hierarchy is valid.").toString();
        }
        message.append("The asset hierarchy is invalid: ").append(summary()).append(System.lineSeparator());
        appendAssets(message, "Assets missing externalId or name", getInvalid());
        appendAssets(message, "Assets with unknown parentExternalId", getOrphans());
        appendAssets(message, "Assets with ambiguous parent", getUnsureParents());
        appendExternalIds(message, "Duplicate externalIds", getDuplicates());
        appendExternalIds(message, "ExternalIds in cycles", getCycles());
        return message.toString();
    }

    private static void appendAssets(StringBuilder message, String header, ImmutableList<Asset> assets) {
        if (assets.isEmpty()) {
            return;
        }
        message.append(header).append(" (max ").append(MAX_DISPLAYED_ITEMS).append(" displayed): ")
                .append(System.lineSeparator());
        for (Asset item : assets.subList(0, Math.min(assets.size(), MAX_DISPLAYED_ITEMS))) {
            message.append("---------------------------").append(System.lineSeparator())
                    .append("externalId: [").append(item.getExternalId()).append("]").append(System.lineSeparator())
                    .append("name: [").append(item.getName()).append("]").append(System.lineSeparator())
                    .append("parentExternalId: [").append(item.getParentExternalId()).append("]")
                    .append(System.lineSeparator());
        }
        message.append("---------------------------").append(System.lineSeparator());
    }

    private static void appendExternalIds(StringBuilder message, String header, Collection<String> externalIds) {
        if (externalIds.isEmpty()) {
            return;
        }
        message.append(header).append(" (max ").append(MAX_DISPLAYED_ITEMS).append(" displayed): ");
        externalIds.stream()
                .limit(MAX_DISPLAYED_ITEMS)
                .forEach(item -> message.append("[").append(item).append("], "));
        message.append(System.lineSeparator());
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setInvalid(Collection<Asset> value);
        abstract Builder setOrphans(Collection<Asset> value);
        abstract Builder setUnsureParents(Collection<Asset> value);
        abstract Builder setDuplicates(Collection<String> value);
        abstract Builder setCycles(Collection<String> value);

        abstract ValidationReport build();
    }
}
