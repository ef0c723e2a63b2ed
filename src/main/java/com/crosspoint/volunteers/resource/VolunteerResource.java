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

package com.crosspoint.volunteers.resource;

import com.crosspoint.volunteers.CurrentContext;
import com.crosspoint.volunteers.RequestHandler;
import com.crosspoint.volunteers.exception.NotFoundException;
import com.crosspoint.volunteers.model.api.request.VolunteerNoteCreateRequest;
import com.crosspoint.volunteers.model.api.request.VolunteerSearchRequest;
import com.crosspoint.volunteers.model.api.request.VolunteerSearchRequest.SortOrder;
import com.crosspoint.volunteers.model.api.request.VolunteerSignupRequest;
import com.crosspoint.volunteers.model.api.request.VolunteerUpdateRequest;
import com.crosspoint.volunteers.model.api.response.MessageResponse;
import com.crosspoint.volunteers.model.api.response.MinistryTaxonomyResponse;
import com.crosspoint.volunteers.model.api.response.VolunteerResponse;
import com.crosspoint.volunteers.model.api.response.VolunteerResponse.VolunteerResponseFactory;
import com.crosspoint.volunteers.model.auth.AccessLevel;
import com.crosspoint.volunteers.model.db.Volunteer;
import com.crosspoint.volunteers.model.ministry.MinistryTaxonomy;
import com.crosspoint.volunteers.service.VolunteerService;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.lokalized.Strings;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Contains volunteer operations: the public signup form plus the admin-side roster.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class VolunteerResource {
	@NonNull
	private final RequestHandler requestHandler;
	@NonNull
	private final VolunteerService volunteerService;
	@NonNull
	private final VolunteerResponseFactory volunteerResponseFactory;
	@NonNull
	private final MinistryTaxonomy ministryTaxonomy;
	@NonNull
	private final Provider<CurrentContext> currentContextProvider;
	@NonNull
	private final Strings strings;

	@Inject
	public VolunteerResource(@NonNull RequestHandler requestHandler,
													 @NonNull VolunteerService volunteerService,
													 @NonNull VolunteerResponseFactory volunteerResponseFactory,
													 @NonNull MinistryTaxonomy ministryTaxonomy,
													 @NonNull Provider<CurrentContext> currentContextProvider,
													 @NonNull Strings strings) {
		requireNonNull(requestHandler);
		requireNonNull(volunteerService);
		requireNonNull(volunteerResponseFactory);
		requireNonNull(ministryTaxonomy);
		requireNonNull(currentContextProvider);
		requireNonNull(strings);

		this.requestHandler = requestHandler;
		this.volunteerService = volunteerService;
		this.volunteerResponseFactory = volunteerResponseFactory;
		this.ministryTaxonomy = ministryTaxonomy;
		this.currentContextProvider = currentContextProvider;
		this.strings = strings;
	}

	@NonNull
	public VolunteerResponse submitSignup(@NonNull VolunteerSignupRequest request) {
		requireNonNull(request);

		return getRequestHandler().handlePublic(() -> {
			Long volunteerId = getVolunteerService().createVolunteer(request);
			return getVolunteerResponseFactory().create(getVolunteerService().findVolunteerById(volunteerId).get());
		});
	}

	@NonNull
	public MinistryTaxonomyResponse findMinistryTaxonomy() {
		return getRequestHandler().handlePublic(() -> MinistryTaxonomyResponse.fromMinistryTaxonomy(getMinistryTaxonomy()));
	}

	@NonNull
	public List<@NonNull VolunteerResponse> findVolunteers(@Nullable String accessToken,
																												 @Nullable String ministryCategory,
																												 @Nullable String ministryArea,
																												 @Nullable SortOrder sortOrder) {
		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () ->
				getVolunteerService().findVolunteers(new VolunteerSearchRequest(ministryCategory, ministryArea, sortOrder)).stream()
						.map(volunteer -> getVolunteerResponseFactory().create(volunteer))
						.collect(Collectors.toList()));
	}

	@NonNull
	public VolunteerResponse findVolunteer(@Nullable String accessToken,
																				 @NonNull Long volunteerId) {
		requireNonNull(volunteerId);

		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () ->
				getVolunteerResponseFactory().create(findRequiredVolunteer(volunteerId)));
	}

	@NonNull
	public VolunteerResponse updateVolunteer(@Nullable String accessToken,
																					 @NonNull Long volunteerId,
																					 @NonNull VolunteerUpdateRequest request) {
		requireNonNull(volunteerId);
		requireNonNull(request);

		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () -> {
			if (!getVolunteerService().updateVolunteer(request.withVolunteerId(volunteerId)))
				throw volunteerNotFoundException(volunteerId);

			return getVolunteerResponseFactory().create(findRequiredVolunteer(volunteerId));
		});
	}

	@NonNull
	public MessageResponse deleteVolunteer(@Nullable String accessToken,
																				 @NonNull Long volunteerId) {
		requireNonNull(volunteerId);

		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () -> {
			if (!getVolunteerService().deleteVolunteer(volunteerId))
				throw volunteerNotFoundException(volunteerId);

			return new MessageResponse(getStrings().get("The volunteer was deleted."));
		});
	}

	/**
	 * Attaches a note authored by the calling admin.
	 *
	 * @return the volunteer, including the new note
	 */
	@NonNull
	public VolunteerResponse addVolunteerNote(@Nullable String accessToken,
																						@NonNull Long volunteerId,
																						@NonNull VolunteerNoteCreateRequest request) {
		requireNonNull(volunteerId);
		requireNonNull(request);

		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () -> {
			Volunteer volunteer = findRequiredVolunteer(volunteerId);
			getVolunteerService().addVolunteerNote(getCurrentContext().getAdminAccount().get(), request.withVolunteerId(volunteerId));
			return getVolunteerResponseFactory().create(volunteer);
		});
	}

	@NonNull
	private Volunteer findRequiredVolunteer(@NonNull Long volunteerId) {
		requireNonNull(volunteerId);
		return getVolunteerService().findVolunteerById(volunteerId).orElseThrow(() -> volunteerNotFoundException(volunteerId));
	}

	@NonNull
	private NotFoundException volunteerNotFoundException(@NonNull Long volunteerId) {
		requireNonNull(volunteerId);
		return new NotFoundException(format("No volunteer with ID %s", volunteerId));
	}

	@NonNull
	private RequestHandler getRequestHandler() {
		return this.requestHandler;
	}

	@NonNull
	private VolunteerService getVolunteerService() {
		return this.volunteerService;
	}

	@NonNull
	private VolunteerResponseFactory getVolunteerResponseFactory() {
		return this.volunteerResponseFactory;
	}

	@NonNull
	private MinistryTaxonomy getMinistryTaxonomy() {
		return this.ministryTaxonomy;
	}

	@NonNull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
	}

	@NonNull
	private Strings getStrings() {
		return this.strings;
	}
}
