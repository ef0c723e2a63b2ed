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

import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record VolunteerSignupRequest(
		@Nullable String name,
		@Nullable String phoneNumber,
		@Nullable String emailAddress,
		@Nullable List<@Nullable MinistrySelectionRequest> ministrySelections
) {}
