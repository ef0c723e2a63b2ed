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
import com.crosspoint.volunteers.model.db.CustomMinistryArea;
import com.crosspoint.volunteers.model.ministry.MinistrySelection;
import com.crosspoint.volunteers.model.ministry.MinistryTaxonomy;
import com.crosspoint.volunteers.service.MinistryTaxonomyValidator.SelectionValidationResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MinistryTaxonomyValidatorTests {
	private final MinistryTaxonomyValidator ministryTaxonomyValidator = new MinistryTaxonomyValidator(MinistryTaxonomy.builtIn()
			.withCustomMinistryAreas(List.of(
					new CustomMinistryArea(1L, "Media", "Livestream"),
					new CustomMinistryArea(2L, "Worship", "Choir"))));

	@Test
	public void testValidSelections() {
		SelectionValidationResult result = ministryTaxonomyValidator.validate(List.of(
				new MinistrySelectionRequest(" Media ", "Livestream"),
				new MinistrySelectionRequest("Hospitality", "Greeters")));

		Assertions.assertTrue(result instanceof SelectionValidationResult.Valid, "Selections should be valid");
		Assertions.assertEquals(List.of(new MinistrySelection("Media", "Livestream"), new MinistrySelection("Hospitality", "Greeters")),
				((SelectionValidationResult.Valid) result).ministrySelections(), "Selections should be trimmed and kept in order");
	}

	@Test
	public void testEmptySelectionsAreValid() {
		Assertions.assertEquals(new SelectionValidationResult.Valid(List.of()), ministryTaxonomyValidator.validate(List.of()));
		Assertions.assertEquals(new SelectionValidationResult.Valid(List.of()), ministryTaxonomyValidator.validate(null));
	}

	@Test
	public void testUnknownCategory() {
		SelectionValidationResult result = ministryTaxonomyValidator.validate(List.of(
				new MinistrySelectionRequest("Media", "Social Media"),
				new MinistrySelectionRequest("Worship", "Choir")));

		// A custom area naming an unknown category never creates that category
		Assertions.assertEquals(new SelectionValidationResult.UnknownCategory(1, "Worship"), result);
	}

	@Test
	public void testUnknownArea() {
		SelectionValidationResult result = ministryTaxonomyValidator.validate(List.of(
				new MinistrySelectionRequest("Hospitality", "Social Media")));

		Assertions.assertEquals(new SelectionValidationResult.UnknownArea(0, "Hospitality", "Social Media"), result);
	}

	@Test
	public void testFirstFailureIsReported() {
		SelectionValidationResult result = ministryTaxonomyValidator.validate(List.of(
				new MinistrySelectionRequest("Media", "Juggling"),
				new MinistrySelectionRequest("Bogus", "Area")));

		Assertions.assertEquals(new SelectionValidationResult.UnknownArea(0, "Media", "Juggling"), result);
	}

	@Test
	public void testMissingValues() {
		Assertions.assertEquals(new SelectionValidationResult.UnknownCategory(0, ""),
				ministryTaxonomyValidator.validate(Arrays.asList((MinistrySelectionRequest) null)));
		Assertions.assertEquals(new SelectionValidationResult.UnknownCategory(0, ""),
				ministryTaxonomyValidator.validate(List.of(new MinistrySelectionRequest("  ", "Greeters"))));
		Assertions.assertEquals(new SelectionValidationResult.UnknownArea(0, "Hospitality", ""),
				ministryTaxonomyValidator.validate(List.of(new MinistrySelectionRequest("Hospitality", null))));
	}

	@Test
	public void testMatchingIsCaseSensitive() {
		Assertions.assertEquals(new SelectionValidationResult.UnknownCategory(0, "media"),
				ministryTaxonomyValidator.validate(List.of(new MinistrySelectionRequest("media", "Livestream"))));
	}
}
