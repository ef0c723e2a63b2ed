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

import com.crosspoint.volunteers.CurrentContext;
import com.crosspoint.volunteers.model.db.Volunteer;
import com.crosspoint.volunteers.model.db.VolunteerMinistry;
import com.crosspoint.volunteers.model.db.VolunteerNote;
import com.crosspoint.volunteers.model.ministry.MinistrySelection;
import com.crosspoint.volunteers.service.VolunteerService;
import com.google.inject.Provider;
import com.google.inject.assistedinject.Assisted;
import com.google.inject.assistedinject.AssistedInject;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of a {@link Volunteer}, including ministry selections and admin notes.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class VolunteerResponse {
	@NonNull
	private final Long volunteerId;
	@NonNull
	private final String name;
	@NonNull
	private final String phoneNumber;
	@NonNull
	private final String emailAddress;
	@NonNull
	private final LocalDate signupDate;
	@NonNull
	private final String signupDateDescription;
	@NonNull
	private final List<@NonNull MinistrySelection> ministrySelections;
	@NonNull
	private final List<@NonNull VolunteerNoteResponse> notes;

	@ThreadSafe
	public interface VolunteerResponseFactory {
		@NonNull
		VolunteerResponse create(@NonNull Volunteer volunteer);
	}

	@AssistedInject
	public VolunteerResponse(@NonNull Provider<CurrentContext> currentContextProvider,
													 @NonNull VolunteerService volunteerService,
													 @Assisted @NonNull Volunteer volunteer) {
		requireNonNull(currentContextProvider);
		requireNonNull(volunteerService);
		requireNonNull(volunteer);

		CurrentContext currentContext = currentContextProvider.get();
		DateTimeFormatter noteDateTimeFormatter = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM, FormatStyle.SHORT)
				.withLocale(currentContext.getLocale())
				.withZone(currentContext.getTimeZone());

		this.volunteerId = volunteer.volunteerId();
		this.name = volunteer.name();
		this.phoneNumber = volunteer.phoneNumber();
		this.emailAddress = volunteer.emailAddress();
		this.signupDate = volunteer.signupDate();
		this.signupDateDescription = DateTimeFormatter.ofLocalizedDate(FormatStyle.MEDIUM)
				.withLocale(currentContext.getLocale())
				.format(volunteer.signupDate());
		this.ministrySelections = volunteerService.findVolunteerMinistriesByVolunteerId(volunteer.volunteerId()).stream()
				.map(VolunteerMinistry::toMinistrySelection)
				.collect(Collectors.toUnmodifiableList());
		this.notes = volunteerService.findVolunteerNotesByVolunteerId(volunteer.volunteerId()).stream()
				.map(volunteerNote -> new VolunteerNoteResponse(volunteerNote, noteDateTimeFormatter.format(volunteerNote.createdAt())))
				.collect(Collectors.toUnmodifiableList());
	}

	public record VolunteerNoteResponse(
			@NonNull Long volunteerNoteId,
			@Nullable Long adminAccountId,
			@NonNull String noteText,
			@NonNull Instant createdAt,
			@NonNull String createdAtDescription
	) {
		public VolunteerNoteResponse {
			requireNonNull(volunteerNoteId);
			requireNonNull(noteText);
			requireNonNull(createdAt);
			requireNonNull(createdAtDescription);
		}

		private VolunteerNoteResponse(@NonNull VolunteerNote volunteerNote,
																	@NonNull String createdAtDescription) {
			this(volunteerNote.volunteerNoteId(), volunteerNote.adminAccountId(), volunteerNote.noteText(),
					volunteerNote.createdAt(), createdAtDescription);
		}
	}

	@NonNull
	public Long getVolunteerId() {
		return this.volunteerId;
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public String getPhoneNumber() {
		return this.phoneNumber;
	}

	@NonNull
	public String getEmailAddress() {
		return this.emailAddress;
	}

	@NonNull
	public LocalDate getSignupDate() {
		return this.signupDate;
	}

	@NonNull
	public String getSignupDateDescription() {
		return this.signupDateDescription;
	}

	@NonNull
	public List<@NonNull MinistrySelection> getMinistrySelections() {
		return this.ministrySelections;
	}

	@NonNull
	public List<@NonNull VolunteerNoteResponse> getNotes() {
		return this.notes;
	}
}
