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

package com.crosspoint.volunteers.util;

import com.crosspoint.volunteers.model.ministry.MinistrySelection;
import org.jspecify.annotations.NonNull;

import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Contract for outbound email.
 * <p>
 * Implementations report delivery failure by returning {@code false} and must never throw;
 * callers dispatch after their transaction commits and do not roll anything back on failure.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface EmailDispatcher {
	@NonNull
	Boolean sendPasswordReset(@NonNull String emailAddress,
														@NonNull String passwordResetToken);

	@NonNull
	Boolean sendNewVolunteerNotification(@NonNull Set<@NonNull String> recipientEmailAddresses,
																			 @NonNull VolunteerSignupSummary volunteerSignupSummary);

	record VolunteerSignupSummary(
			@NonNull Long volunteerId,
			@NonNull String name,
			@NonNull String phoneNumber,
			@NonNull String emailAddress,
			@NonNull List<@NonNull MinistrySelection> ministrySelections
	) {
		public VolunteerSignupSummary {
			requireNonNull(volunteerId);
			requireNonNull(name);
			requireNonNull(phoneNumber);
			requireNonNull(emailAddress);
			requireNonNull(ministrySelections);

			ministrySelections = List.copyOf(ministrySelections);
		}
	}

	enum Type {
		MOCK,
		SMTP
	}
}
