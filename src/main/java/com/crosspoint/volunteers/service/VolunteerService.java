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

import com.crosspoint.volunteers.Configuration;
import com.crosspoint.volunteers.exception.ApplicationException.ErrorCollector;
import com.crosspoint.volunteers.model.api.request.MinistrySelectionRequest;
import com.crosspoint.volunteers.model.api.request.VolunteerNoteCreateRequest;
import com.crosspoint.volunteers.model.api.request.VolunteerSearchRequest;
import com.crosspoint.volunteers.model.api.request.VolunteerSearchRequest.SortOrder;
import com.crosspoint.volunteers.model.api.request.VolunteerSignupRequest;
import com.crosspoint.volunteers.model.api.request.VolunteerUpdateRequest;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.crosspoint.volunteers.model.db.Volunteer;
import com.crosspoint.volunteers.model.db.VolunteerMinistry;
import com.crosspoint.volunteers.model.db.VolunteerNote;
import com.crosspoint.volunteers.model.ministry.MinistrySelection;
import com.crosspoint.volunteers.service.MinistryTaxonomyValidator.SelectionValidationResult;
import com.crosspoint.volunteers.util.EmailDispatcher;
import com.crosspoint.volunteers.util.EmailDispatcher.VolunteerSignupSummary;
import com.google.inject.Inject;
import com.lokalized.Strings;
import com.pyranid.Database;
import com.pyranid.TransactionResult;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.crosspoint.volunteers.util.Normalizer.normalizeEmailAddress;
import static com.crosspoint.volunteers.util.Normalizer.normalizeName;
import static com.crosspoint.volunteers.util.Normalizer.trimAggressivelyToNull;
import static com.crosspoint.volunteers.util.Validator.isValidEmailAddress;
import static com.crosspoint.volunteers.util.Validator.isValidPhoneNumber;
import static java.util.Objects.requireNonNull;

/**
 * Business logic for volunteers: public signup plus the admin-side listing, editing and notes.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class VolunteerService {
	public static final int MAXIMUM_NOTE_LENGTH = 2000;

	@NonNull
	private final Configuration configuration;
	@NonNull
	private final MinistryTaxonomyValidator ministryTaxonomyValidator;
	@NonNull
	private final EmailDispatcher emailDispatcher;
	@NonNull
	private final Database database;
	@NonNull
	private final Strings strings;
	@NonNull
	private final Clock clock;
	@NonNull
	private final Logger logger;

	@Inject
	public VolunteerService(@NonNull Configuration configuration,
													@NonNull MinistryTaxonomyValidator ministryTaxonomyValidator,
													@NonNull EmailDispatcher emailDispatcher,
													@NonNull Database database,
													@NonNull Strings strings,
													@NonNull Clock clock) {
		requireNonNull(configuration);
		requireNonNull(ministryTaxonomyValidator);
		requireNonNull(emailDispatcher);
		requireNonNull(database);
		requireNonNull(strings);
		requireNonNull(clock);

		this.configuration = configuration;
		this.ministryTaxonomyValidator = ministryTaxonomyValidator;
		this.emailDispatcher = emailDispatcher;
		this.database = database;
		this.strings = strings;
		this.clock = clock;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	public Optional<Volunteer> findVolunteerById(@Nullable Long volunteerId) {
		if (volunteerId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM volunteer
				WHERE volunteer_id=?
				""", Volunteer.class, volunteerId);
	}

	/**
	 * Lists volunteers, optionally narrowed to those who selected an area (or, failing that, a category).
	 */
	@NonNull
	public List<@NonNull Volunteer> findVolunteers(@NonNull VolunteerSearchRequest request) {
		requireNonNull(request);

		String ministryArea = trimAggressivelyToNull(request.ministryArea());
		String ministryCategory = trimAggressivelyToNull(request.ministryCategory());
		SortOrder sortOrder = request.sortOrder() == null ? SortOrder.DATE : request.sortOrder();

		List<Object> parameters = new ArrayList<>(1);
		StringBuilder sql = new StringBuilder("SELECT v.* FROM volunteer v");

		if (ministryArea != null) {
			sql.append(" WHERE EXISTS (SELECT 1 FROM volunteer_ministry vm WHERE vm.volunteer_id=v.volunteer_id AND vm.ministry_area=?)");
			parameters.add(ministryArea);
		} else if (ministryCategory != null) {
			sql.append(" WHERE EXISTS (SELECT 1 FROM volunteer_ministry vm WHERE vm.volunteer_id=v.volunteer_id AND vm.ministry_category=?)");
			parameters.add(ministryCategory);
		}

		switch (sortOrder) {
			case NAME -> sql.append(" ORDER BY v.name, v.volunteer_id");
			case DATE, MINISTRY -> sql.append(" ORDER BY v.signup_date DESC, v.created_at DESC, v.volunteer_id DESC");
		}

		List<Volunteer> volunteers = getDatabase().queryForList(sql.toString(), Volunteer.class, parameters.toArray());

		if (sortOrder != SortOrder.MINISTRY)
			return volunteers;

		Map<Long, Long> ministryCountsByVolunteerId = new HashMap<>();

		for (VolunteerMinistryCount volunteerMinistryCount : getDatabase().queryForList("""
				SELECT volunteer_id, COUNT(*) AS ministry_count
				FROM volunteer_ministry
				GROUP BY volunteer_id
				""", VolunteerMinistryCount.class))
			ministryCountsByVolunteerId.put(volunteerMinistryCount.volunteerId(), volunteerMinistryCount.ministryCount());

		// Stable sort, so equal counts keep newest-first order
		List<Volunteer> sortedVolunteers = new ArrayList<>(volunteers);
		sortedVolunteers.sort(Comparator.comparing((Volunteer volunteer) ->
				ministryCountsByVolunteerId.getOrDefault(volunteer.volunteerId(), 0L)).reversed());

		return sortedVolunteers;
	}

	@NonNull
	public List<@NonNull VolunteerMinistry> findVolunteerMinistriesByVolunteerId(@Nullable Long volunteerId) {
		if (volunteerId == null)
			return List.of();

		return getDatabase().queryForList("""
				SELECT *
				FROM volunteer_ministry
				WHERE volunteer_id=?
				ORDER BY volunteer_ministry_id
				""", VolunteerMinistry.class, volunteerId);
	}

	@NonNull
	public List<@NonNull VolunteerNote> findVolunteerNotesByVolunteerId(@Nullable Long volunteerId) {
		if (volunteerId == null)
			return List.of();

		return getDatabase().queryForList("""
				SELECT *
				FROM volunteer_note
				WHERE volunteer_id=?
				ORDER BY created_at DESC, volunteer_note_id DESC
				""", VolunteerNote.class, volunteerId);
	}

	/**
	 * Records a public signup. Admins on the notification list are emailed once the transaction commits.
	 */
	@NonNull
	public Long createVolunteer(@NonNull VolunteerSignupRequest request) {
		requireNonNull(request);

		String name = normalizeName(request.name()).orElse(null);
		String phoneNumber = trimAggressivelyToNull(request.phoneNumber());
		String emailAddress = normalizeEmailAddress(request.emailAddress()).orElse(null);
		ErrorCollector errorCollector = new ErrorCollector();

		if (name == null)
			errorCollector.addFieldError("name", getStrings().get("Name is required."));

		if (phoneNumber == null)
			errorCollector.addFieldError("phoneNumber", getStrings().get("Phone number is required."));
		else if (!isValidPhoneNumber(phoneNumber))
			errorCollector.addFieldError("phoneNumber", getStrings().get("Phone number is invalid."));

		if (emailAddress == null)
			errorCollector.addFieldError("emailAddress", getStrings().get("Email address is required."));
		else if (!isValidEmailAddress(emailAddress))
			errorCollector.addFieldError("emailAddress", getStrings().get("Email address is invalid."));

		List<MinistrySelection> ministrySelections = validateMinistrySelections(request.ministrySelections(), errorCollector);

		errorCollector.throwIfErrors();

		Instant now = Instant.now(getClock());
		LocalDate signupDate = LocalDate.ofInstant(now, Configuration.getDefaultTimeZone());
		Long volunteerId = getDatabase().queryForObject("CALL NEXT VALUE FOR volunteer_seq", Long.class).get();

		getDatabase().execute("""
				INSERT INTO volunteer (
					volunteer_id,
					name,
					phone_number,
					email_address,
					signup_date,
					created_at,
					updated_at
				) VALUES (?,?,?,?,?,?,?)
				""", volunteerId, name, phoneNumber, emailAddress, signupDate, now, now);

		insertVolunteerMinistries(volunteerId, ministrySelections);

		getLogger().info("Created volunteer {} with {} ministry selection[s]", volunteerId, ministrySelections.size());

		Set<String> recipientEmailAddresses = getConfiguration().getNotificationEmailAddresses();

		if (recipientEmailAddresses.size() == 0) {
			getLogger().warn("No notification email addresses are configured; skipping new volunteer notification");
		} else {
			VolunteerSignupSummary volunteerSignupSummary = new VolunteerSignupSummary(volunteerId, name, phoneNumber,
					emailAddress, ministrySelections);

			getDatabase().currentTransaction().get().addPostTransactionOperation((TransactionResult transactionResult) -> {
				if (transactionResult == TransactionResult.COMMITTED)
					dispatchNewVolunteerNotification(recipientEmailAddresses, volunteerSignupSummary);
			});
		}

		return volunteerId;
	}

	/**
	 * Applies whichever fields of the request are present. A present selection list replaces the old one wholesale.
	 */
	@NonNull
	public Boolean updateVolunteer(@NonNull VolunteerUpdateRequest request) {
		requireNonNull(request);

		Long volunteerId = requireNonNull(request.volunteerId());
		Volunteer volunteer = findVolunteerById(volunteerId).orElse(null);

		if (volunteer == null)
			return false;

		String name = volunteer.name();
		String phoneNumber = volunteer.phoneNumber();
		String emailAddress = volunteer.emailAddress();
		ErrorCollector errorCollector = new ErrorCollector();

		if (request.name() != null) {
			name = normalizeName(request.name()).orElse(null);

			if (name == null)
				errorCollector.addFieldError("name", getStrings().get("Name is required."));
		}

		if (request.phoneNumber() != null) {
			phoneNumber = trimAggressivelyToNull(request.phoneNumber());

			if (phoneNumber == null)
				errorCollector.addFieldError("phoneNumber", getStrings().get("Phone number is required."));
			else if (!isValidPhoneNumber(phoneNumber))
				errorCollector.addFieldError("phoneNumber", getStrings().get("Phone number is invalid."));
		}

		if (request.emailAddress() != null) {
			emailAddress = normalizeEmailAddress(request.emailAddress()).orElse(null);

			if (emailAddress == null)
				errorCollector.addFieldError("emailAddress", getStrings().get("Email address is required."));
			else if (!isValidEmailAddress(emailAddress))
				errorCollector.addFieldError("emailAddress", getStrings().get("Email address is invalid."));
		}

		List<MinistrySelection> ministrySelections = request.ministrySelections() == null
				? null : validateMinistrySelections(request.ministrySelections(), errorCollector);

		errorCollector.throwIfErrors();

		getDatabase().execute("""
				UPDATE volunteer
				SET name=?, phone_number=?, email_address=?, updated_at=?
				WHERE volunteer_id=?
				""", name, phoneNumber, emailAddress, Instant.now(getClock()), volunteerId);

		if (ministrySelections != null) {
			getDatabase().execute("DELETE FROM volunteer_ministry WHERE volunteer_id=?", volunteerId);
			insertVolunteerMinistries(volunteerId, ministrySelections);
		}

		getLogger().info("Updated volunteer {}", volunteerId);
		return true;
	}

	/**
	 * Deletes a volunteer along with its selections and notes.
	 */
	@NonNull
	public Boolean deleteVolunteer(@Nullable Long volunteerId) {
		if (volunteerId == null)
			return false;

		boolean deleted = getDatabase().execute("DELETE FROM volunteer WHERE volunteer_id=?", volunteerId) > 0;

		if (deleted)
			getLogger().info("Deleted volunteer {}", volunteerId);

		return deleted;
	}

	@NonNull
	public Long addVolunteerNote(@NonNull AdminAccount author,
															 @NonNull VolunteerNoteCreateRequest request) {
		requireNonNull(author);
		requireNonNull(request);

		Long volunteerId = requireNonNull(request.volunteerId());
		String noteText = trimAggressivelyToNull(request.noteText());
		ErrorCollector errorCollector = new ErrorCollector();

		if (noteText == null)
			errorCollector.addFieldError("noteText", getStrings().get("Note text is required."));
		else if (noteText.length() > MAXIMUM_NOTE_LENGTH)
			errorCollector.addFieldError("noteText", getStrings().get("Notes cannot be longer than {{maximumLength}} characters.",
					Map.of("maximumLength", MAXIMUM_NOTE_LENGTH)));

		errorCollector.throwIfErrors();

		Long volunteerNoteId = getDatabase().queryForObject("CALL NEXT VALUE FOR volunteer_note_seq", Long.class).get();

		getDatabase().execute("""
				INSERT INTO volunteer_note (
					volunteer_note_id,
					volunteer_id,
					admin_account_id,
					note_text,
					created_at
				) VALUES (?,?,?,?,?)
				""", volunteerNoteId, volunteerId, author.adminAccountId(), noteText, Instant.now(getClock()));

		getLogger().info("Admin account {} added note {} to volunteer {}", author.adminAccountId(), volunteerNoteId, volunteerId);
		return volunteerNoteId;
	}

	@NonNull
	private List<@NonNull MinistrySelection> validateMinistrySelections(@Nullable List<@Nullable MinistrySelectionRequest> selections,
																																			@NonNull ErrorCollector errorCollector) {
		requireNonNull(errorCollector);

		SelectionValidationResult result = getMinistryTaxonomyValidator().validate(selections);

		if (result instanceof SelectionValidationResult.Valid valid)
			return valid.ministrySelections();

		if (result instanceof SelectionValidationResult.UnknownCategory unknownCategory)
			errorCollector.addFieldError("ministrySelections", getStrings().get("Unknown ministry category '{{category}}'.",
					Map.of("category", unknownCategory.category())));
		else if (result instanceof SelectionValidationResult.UnknownArea unknownArea)
			errorCollector.addFieldError("ministrySelections", getStrings().get("Unknown ministry area '{{area}}' for category '{{category}}'.",
					Map.of("area", unknownArea.area(), "category", unknownArea.category())));

		return List.of();
	}

	private void insertVolunteerMinistries(@NonNull Long volunteerId,
																				 @NonNull List<@NonNull MinistrySelection> ministrySelections) {
		requireNonNull(volunteerId);
		requireNonNull(ministrySelections);

		if (ministrySelections.size() == 0)
			return;

		List<List<Object>> parameterGroups = new ArrayList<>(ministrySelections.size());

		for (MinistrySelection ministrySelection : ministrySelections) {
			Long volunteerMinistryId = getDatabase().queryForObject("CALL NEXT VALUE FOR volunteer_ministry_seq", Long.class).get();
			parameterGroups.add(List.of(volunteerMinistryId, volunteerId, ministrySelection.category(), ministrySelection.area()));
		}

		getDatabase().executeBatch("""
				INSERT INTO volunteer_ministry (
					volunteer_ministry_id,
					volunteer_id,
					ministry_category,
					ministry_area
				) VALUES (?,?,?,?)
				""", parameterGroups);
	}

	private void dispatchNewVolunteerNotification(@NonNull Set<@NonNull String> recipientEmailAddresses,
																								@NonNull VolunteerSignupSummary volunteerSignupSummary) {
		try {
			if (!getEmailDispatcher().sendNewVolunteerNotification(recipientEmailAddresses, volunteerSignupSummary))
				getLogger().warn("New volunteer notification for volunteer {} was not delivered", volunteerSignupSummary.volunteerId());
		} catch (RuntimeException e) {
			getLogger().error("New volunteer notification for volunteer " + volunteerSignupSummary.volunteerId() + " failed", e);
		}
	}

	public record VolunteerMinistryCount(
			@NonNull Long volunteerId,
			@NonNull Long ministryCount
	) {
		public VolunteerMinistryCount {
			requireNonNull(volunteerId);
			requireNonNull(ministryCount);
		}
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private MinistryTaxonomyValidator getMinistryTaxonomyValidator() {
		return this.ministryTaxonomyValidator;
	}

	@NonNull
	private EmailDispatcher getEmailDispatcher() {
		return this.emailDispatcher;
	}

	@NonNull
	private Database getDatabase() {
		return this.database;
	}

	@NonNull
	private Strings getStrings() {
		return this.strings;
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
