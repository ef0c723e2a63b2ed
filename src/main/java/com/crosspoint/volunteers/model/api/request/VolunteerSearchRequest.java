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

package com.crosspoint.volunteers.model.api.request;

import org.jspecify.annotations.Nullable;

/**
 * Filters and ordering for the volunteer listing.
 * <p>
 * When both {@code ministryArea} and {@code ministryCategory} are given, the area wins.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record VolunteerSearchRequest(
		@Nullable String ministryCategory,
		@Nullable String ministryArea,
		@Nullable SortOrder sortOrder
) {
	public enum SortOrder {
		// Alphabetical by name
		NAME,
		// Newest signup first
		DATE,
		// Most ministry selections first
		MINISTRY
	}
}
