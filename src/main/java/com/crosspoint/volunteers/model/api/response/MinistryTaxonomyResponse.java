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

package com.crosspoint.volunteers.model.api.response;

import com.crosspoint.volunteers.model.ministry.MinistryTaxonomy;
import org.jspecify.annotations.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of the {@link MinistryTaxonomy}, in display order.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record MinistryTaxonomyResponse(
		@NonNull List<@NonNull MinistryCategoryResponse> categories
) {
	public MinistryTaxonomyResponse {
		requireNonNull(categories);
		categories = List.copyOf(categories);
	}

	@NonNull
	public static MinistryTaxonomyResponse fromMinistryTaxonomy(@NonNull MinistryTaxonomy ministryTaxonomy) {
		requireNonNull(ministryTaxonomy);

		List<MinistryCategoryResponse> categories = new ArrayList<>();

		for (Map.Entry<String, List<String>> entry : ministryTaxonomy.getAreasByCategory().entrySet())
			categories.add(new MinistryCategoryResponse(entry.getKey(), entry.getValue()));

		return new MinistryTaxonomyResponse(categories);
	}

	public record MinistryCategoryResponse(
			@NonNull String category,
			@NonNull List<@NonNull String> areas
	) {
		public MinistryCategoryResponse {
			requireNonNull(category);
			requireNonNull(areas);
			areas = List.copyOf(areas);
		}
	}
}
