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
import com.crosspoint.volunteers.exception.ApplicationException;
import com.crosspoint.volunteers.exception.AuthenticationException;
import com.crosspoint.volunteers.exception.AuthorizationException;
import com.crosspoint.volunteers.model.api.request.AdminAccountUpdateRequest;
import com.crosspoint.volunteers.model.auth.AccessLevel;
import com.crosspoint.volunteers.model.auth.AccessToken;
import com.crosspoint.volunteers.model.auth.AccessToken.AccessTokenResult;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.google.inject.Inject;
import com.lokalized.Strings;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether a caller may perform an operation.
 * <p>
 * Every non-public operation re-resolves the token's admin against the directory, so deactivating an
 * account takes effect immediately even though previously-issued tokens remain cryptographically valid.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AuthorizationPolicy {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final AdminAccountService adminAccountService;
	@NonNull
	private final Strings strings;
	@NonNull
	private final Clock clock;
	@NonNull
	private final Logger logger;

	@Inject
	public AuthorizationPolicy(@NonNull Configuration configuration,
														 @NonNull AdminAccountService adminAccountService,
														 @NonNull Strings strings,
														 @NonNull Clock clock) {
		requireNonNull(configuration);
		requireNonNull(adminAccountService);
		requireNonNull(strings);
		requireNonNull(clock);

		this.configuration = configuration;
		this.adminAccountService = adminAccountService;
		this.strings = strings;
		this.clock = clock;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Applies the generic gate for an access level.
	 *
	 * @return the resolved caller, or empty for {@link AccessLevel#PUBLIC} operations
	 * @throws AuthenticationException if the token is unusable or names an unknown/inactive admin
	 * @throws AuthorizationException  if the level is {@link AccessLevel#SUPER_ADMIN} and the caller is not
	 */
	@NonNull
	public Optional<AdminAccount> authorize(@Nullable String accessToken,
																					@NonNull AccessLevel accessLevel) {
		requireNonNull(accessLevel);

		if (accessLevel == AccessLevel.PUBLIC)
			return Optional.empty();

		AdminAccount adminAccount = authenticate(accessToken);

		if (accessLevel == AccessLevel.SUPER_ADMIN && !adminAccount.superAdmin())
			throw new AuthorizationException("Super admin role required");

		return Optional.of(adminAccount);
	}

	@NonNull
	public AdminAccount authenticate(@Nullable String accessToken) {
		if (accessToken == null)
			throw new AuthenticationException("No access token provided");

		AccessTokenResult accessTokenResult = AccessToken.fromStringRepresentation(accessToken,
				getConfiguration().getAccessTokenSecretKey(), Instant.now(getClock()));

		if (!(accessTokenResult instanceof AccessTokenResult.Succeeded succeeded)) {
			getLogger().debug("Rejected access token: {}", accessTokenResult);
			throw new AuthenticationException("Access token is not valid");
		}

		// Inactive accounts get exactly the same treatment as unknown ones
		return getAdminAccountService().findActiveAdminAccountByEmailAddress(succeeded.accessToken().emailAddress())
				.orElseThrow(() -> new AuthenticationException("Access token does not resolve to an active admin account"));
	}

	/**
	 * Rules layered on top of the generic gate for admin account updates.
	 * <p>
	 * The super admin check looks at the target's flag rather than comparing identities, so it holds even if
	 * more than one account somehow ends up flagged.
	 */
	public void ensureUpdatePermitted(@NonNull AdminAccount caller,
																		@NonNull AdminAccount target,
																		@NonNull AdminAccountUpdateRequest request) {
		requireNonNull(caller);
		requireNonNull(target);
		requireNonNull(request);

		if (!Boolean.FALSE.equals(request.active()))
			return;

		if (caller.adminAccountId().equals(target.adminAccountId()))
			throw ApplicationException.withStatusCodeAndGeneralError(ApplicationException.STATUS_CODE_FORBIDDEN,
					getStrings().get("You cannot deactivate your own account.")).build();

		if (target.superAdmin())
			throw ApplicationException.withStatusCodeAndGeneralError(ApplicationException.STATUS_CODE_FORBIDDEN,
					getStrings().get("The super admin account cannot be deactivated.")).build();
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private AdminAccountService getAdminAccountService() {
		return this.adminAccountService;
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
