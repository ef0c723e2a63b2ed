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

package com.crosspoint.volunteers.service;

import com.crosspoint.volunteers.model.api.request.MinistrySelectionRequest;
import com.crosspoint.volunteers.model.ministry.MinistrySelection;
import com.crosspoint.volunteers.model.ministry.MinistryTaxonomy;
import com.google.inject.Inject;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;

import static com.crosspoint.volunteers.util.Normalizer.trimAggressivelyToNull;
import static java.util.Objects.requireNonNull;

/**
 * Checks (category, area) selections against the {@link MinistryTaxonomy}.
 * <p>
 * Selections are examined in input order and the first failure is reported. An empty list is valid.
 * A selection missing its category or area is reported as unknown with an empty name.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MinistryTaxonomyValidator {
	@NonNull
	private final MinistryTaxonomy ministryTaxonomy;

	@Inject
	public MinistryTaxonomyValidator(@NonNull MinistryTaxonomy ministryTaxonomy) {
		requireNonNull(ministryTaxonomy);
		this.ministryTaxonomy = ministryTaxonomy;
	}

	@NonNull
	public SelectionValidationResult validate(@Nullable List<@Nullable MinistrySelectionRequest> selections) {
		if (selections == null || selections.size() == 0)
			return new SelectionValidationResult.Valid(List.of());

		List<MinistrySelection> ministrySelections = new ArrayList<>(selections.size());

		for (int i = 0; i < selections.size(); ++i) {
			MinistrySelectionRequest selection = selections.get(i);
			String category = selection == null ? null : trimAggressivelyToNull(selection.category());
			String area = selection == null ? null : trimAggressivelyToNull(selection.area());

			if (!getMinistryTaxonomy().containsCategory(category))
				return new SelectionValidationResult.UnknownCategory(i, category == null ? "" : category);

			if (!getMinistryTaxonomy().containsArea(category, area))
				return new SelectionValidationResult.UnknownArea(i, category, area == null ? "" : area);

			ministrySelections.add(new MinistrySelection(category, area));
		}

		return new SelectionValidationResult.Valid(ministrySelections);
	}

	public sealed interface SelectionValidationResult {
		record Valid(@NonNull List<@NonNull MinistrySelection> ministrySelections) implements SelectionValidationResult {
			public Valid {
				requireNonNull(ministrySelections);
				ministrySelections = List.copyOf(ministrySelections);
			}
		}

		record UnknownCategory(@NonNull Integer index,
													 @NonNull String category) implements SelectionValidationResult {
			public UnknownCategory {
				requireNonNull(index);
				requireNonNull(category);
			}
		}

		record UnknownArea(@NonNull Integer index,
											 @NonNull String category,
											 @NonNull String area) implements SelectionValidationResult {
			public UnknownArea {
				requireNonNull(index);
				requireNonNull(category);
				requireNonNull(area);
			}
		}
	}

	@NonNull
	public MinistryTaxonomy getMinistryTaxonomy() {
		return this.ministryTaxonomy;
	}
}
