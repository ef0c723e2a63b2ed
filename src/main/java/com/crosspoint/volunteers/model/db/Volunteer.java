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

import org.jspecify.annotations.NonNull;

import java.time.Instant;
import java.time.LocalDate;

import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code volunteer} table in the database.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Volunteer(
		@NonNull Long volunteerId,
		@NonNull String name,
		@NonNull String phoneNumber,
		@NonNull String emailAddress,
		@NonNull LocalDate signupDate,
		@NonNull Instant createdAt,
		@NonNull Instant updatedAt
) {
	public Volunteer {
		requireNonNull(volunteerId);
		requireNonNull(name);
		requireNonNull(phoneNumber);
		requireNonNull(emailAddress);
		requireNonNull(signupDate);
		requireNonNull(createdAt);
		requireNonNull(updatedAt);
	}
}
