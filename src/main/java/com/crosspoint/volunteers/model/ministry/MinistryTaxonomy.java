/*
 * Copyright 2022-2025 Revetware LLC.
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

package com.crosspoint.volunteers.model.ministry;

import com.crosspoint.volunteers.model.db.CustomMinistryArea;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Immutable, ordered snapshot of the ministry categories volunteers may sign up for and the areas within each.
 * <p>
 * The built-in categories are fixed. Custom areas may be appended to built-in categories, but new categories
 * cannot be introduced.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MinistryTaxonomy {
	@NonNull
	private static final Logger LOGGER;
	@NonNull
	private static final MinistryTaxonomy BUILT_IN;

	static {
		LOGGER = LoggerFactory.getLogger(MinistryTaxonomy.class);

		Map<String, List<String>> areasByCategory = new LinkedHashMap<>();
		areasByCategory.put("Children's Ministry", List.of("Childcare and/or Teaching", "VBS"));
		areasByCategory.put("Hospitality", List.of("Greeters", "Make Contact with Visitors", "Kitchen Cleanup"));
		areasByCategory.put("Media", List.of("Sound, etc.", "Social Media"));
		areasByCategory.put("Mission Trips", List.of("BBQ Fundraisers"));
		areasByCategory.put("Member Care", List.of("Meal Trains for members in need", "Help for Elderly/Widows"));
		areasByCategory.put("Community Outreach", List.of("Trunk or Treat", "Easter Event", "New Outreach Programs"));
		areasByCategory.put("Building/Grounds", List.of("Maintenance", "Security"));
		areasByCategory.put("Recurring Service Events", List.of("318 Church (Third Saturday)", "5 Loaves 2 Fish (Thursday before 1st Saturday)"));

		BUILT_IN = new MinistryTaxonomy(areasByCategory);
	}

	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull String>> areasByCategory;

	@NonNull
	public static MinistryTaxonomy builtIn() {
		return BUILT_IN;
	}

	private MinistryTaxonomy(@NonNull Map<@NonNull String, @NonNull List<@NonNull String>> areasByCategory) {
		requireNonNull(areasByCategory);

		Map<String, List<String>> copy = new LinkedHashMap<>();

		for (Map.Entry<String, List<String>> entry : areasByCategory.entrySet())
			copy.put(entry.getKey(), List.copyOf(entry.getValue()));

		this.areasByCategory = Collections.unmodifiableMap(copy);
	}

	/**
	 * Returns a new taxonomy with the given custom areas appended after the existing areas of their category.
	 * <p>
	 * Areas already present are skipped. Custom areas naming an unknown category are skipped with a warning.
	 */
	@NonNull
	public MinistryTaxonomy withCustomMinistryAreas(@NonNull Collection<@NonNull CustomMinistryArea> customMinistryAreas) {
		requireNonNull(customMinistryAreas);

		Map<String, List<String>> areasByCategory = new LinkedHashMap<>();

		for (Map.Entry<String, List<String>> entry : getAreasByCategory().entrySet())
			areasByCategory.put(entry.getKey(), new ArrayList<>(entry.getValue()));

		for (CustomMinistryArea customMinistryArea : customMinistryAreas) {
			List<String> areas = areasByCategory.get(customMinistryArea.ministryCategory());

			if (areas == null) {
				LOGGER.warn("Ignoring custom ministry area '{}' because category '{}' does not exist",
						customMinistryArea.ministryArea(), customMinistryArea.ministryCategory());
				continue;
			}

			if (!areas.contains(customMinistryArea.ministryArea()))
				areas.add(customMinistryArea.ministryArea());
		}

		return new MinistryTaxonomy(areasByCategory);
	}

	@NonNull
	public Boolean containsCategory(@Nullable String category) {
		return category != null && getAreasByCategory().containsKey(category);
	}

	@NonNull
	public Boolean containsArea(@Nullable String category,
															@Nullable String area) {
		if (category == null || area == null)
			return false;

		List<String> areas = getAreasByCategory().get(category);
		return areas != null && areas.contains(area);
	}

	@NonNull
	public Set<@NonNull String> getCategories() {
		return getAreasByCategory().keySet();
	}

	@NonNull
	public List<@NonNull String> getAreas(@NonNull String category) {
		requireNonNull(category);
		return getAreasByCategory().getOrDefault(category, List.of());
	}

	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getAreasByCategory() {
		return this.areasByCategory;
	}
}
