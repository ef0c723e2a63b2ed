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
import com.crosspoint.volunteers.model.auth.AdminRole;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.google.inject.Provider;
import com.google.inject.assistedinject.Assisted;
import com.google.inject.assistedinject.AssistedInject;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of an {@link AdminAccount}.
 * <p>
 * Never exposes the password hash or any password reset state.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AdminAccountResponse {
	@NonNull
	private final Long adminAccountId;
	@NonNull
	private final String emailAddress;
	@Nullable
	private final String name;
	@NonNull
	private final AdminRole role;
	@NonNull
	private final Boolean active;
	@NonNull
	private final Instant createdAt;
	@NonNull
	private final String createdAtDescription;

	@ThreadSafe
	public interface AdminAccountResponseFactory {
		@NonNull
		AdminAccountResponse create(@NonNull AdminAccount adminAccount);
	}

	@AssistedInject
	public AdminAccountResponse(@NonNull Provider<CurrentContext> currentContextProvider,
															@Assisted @NonNull AdminAccount adminAccount) {
		requireNonNull(currentContextProvider);
		requireNonNull(adminAccount);

		// Tailor our response based on current context
		CurrentContext currentContext = currentContextProvider.get();

		this.adminAccountId = adminAccount.adminAccountId();
		this.emailAddress = adminAccount.emailAddress();
		this.name = adminAccount.name();
		this.role = adminAccount.role();
		this.active = adminAccount.active();
		this.createdAt = adminAccount.createdAt();
		this.createdAtDescription = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM, FormatStyle.SHORT)
				.withLocale(currentContext.getLocale())
				.withZone(currentContext.getTimeZone())
				.format(adminAccount.createdAt());
	}

	@NonNull
	public Long getAdminAccountId() {
		return this.adminAccountId;
	}

	@NonNull
	public String getEmailAddress() {
		return this.emailAddress;
	}

	@NonNull
	public Optional<String> getName() {
		return Optional.ofNullable(this.name);
	}

	@NonNull
	public AdminRole getRole() {
		return this.role;
	}

	@NonNull
	public Boolean getActive() {
		return this.active;
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}

	@NonNull
	public String getCreatedAtDescription() {
		return this.createdAtDescription;
	}
}
