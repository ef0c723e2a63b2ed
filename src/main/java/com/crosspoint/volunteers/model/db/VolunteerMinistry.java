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

package com.crosspoint.volunteers.model.db;

import com.crosspoint.volunteers.model.ministry.MinistrySelection;
import org.jspecify.annotations.NonNull;

import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code volunteer_ministry} table in the database.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record VolunteerMinistry(
		@NonNull Long volunteerMinistryId,
		@NonNull Long volunteerId,
		@NonNull String ministryCategory,
		@NonNull String ministryArea
) {
	public VolunteerMinistry {
		requireNonNull(volunteerMinistryId);
		requireNonNull(volunteerId);
		requireNonNull(ministryCategory);
		requireNonNull(ministryArea);
	}

	@NonNull
	public MinistrySelection toMinistrySelection() {
		return new MinistrySelection(ministryCategory(), ministryArea());
	}
}
