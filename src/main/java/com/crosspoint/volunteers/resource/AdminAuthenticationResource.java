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

import com.crosspoint.volunteers.Configuration;
import com.crosspoint.volunteers.RequestHandler;
import com.crosspoint.volunteers.model.api.request.AdminLoginRequest;
import com.crosspoint.volunteers.model.api.request.PasswordResetCompleteRequest;
import com.crosspoint.volunteers.model.api.request.PasswordResetRequest;
import com.crosspoint.volunteers.model.api.response.AdminAccountResponse;
import com.crosspoint.volunteers.model.api.response.AdminAccountResponse.AdminAccountResponseFactory;
import com.crosspoint.volunteers.model.api.response.MessageResponse;
import com.crosspoint.volunteers.model.auth.AccessToken;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.crosspoint.volunteers.service.AdminAccountService;
import com.crosspoint.volunteers.service.PasswordResetService;
import com.crosspoint.volunteers.service.PasswordResetService.PasswordResetResult;
import com.google.inject.Inject;
import com.lokalized.Strings;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * Contains login and password-recovery operations. All of them are public.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AdminAuthenticationResource {
	@NonNull
	private final RequestHandler requestHandler;
	@NonNull
	private final AdminAccountService adminAccountService;
	@NonNull
	private final PasswordResetService passwordResetService;
	@NonNull
	private final AdminAccountResponseFactory adminAccountResponseFactory;
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final Strings strings;

	@Inject
	public AdminAuthenticationResource(@NonNull RequestHandler requestHandler,
																		 @NonNull AdminAccountService adminAccountService,
																		 @NonNull PasswordResetService passwordResetService,
																		 @NonNull AdminAccountResponseFactory adminAccountResponseFactory,
																		 @NonNull Configuration configuration,
																		 @NonNull Strings strings) {
		requireNonNull(requestHandler);
		requireNonNull(adminAccountService);
		requireNonNull(passwordResetService);
		requireNonNull(adminAccountResponseFactory);
		requireNonNull(configuration);
		requireNonNull(strings);

		this.requestHandler = requestHandler;
		this.adminAccountService = adminAccountService;
		this.passwordResetService = passwordResetService;
		this.adminAccountResponseFactory = adminAccountResponseFactory;
		this.configuration = configuration;
		this.strings = strings;
	}

	@NonNull
	public AdminLoginResponse login(@NonNull AdminLoginRequest request) {
		requireNonNull(request);

		return getRequestHandler().handlePublic(() -> {
			AccessToken accessToken = getAdminAccountService().authenticate(request);
			AdminAccount adminAccount = getAdminAccountService().findAdminAccountByEmailAddress(accessToken.emailAddress()).get();

			// Hand back both the signed token and the account it authenticates
			return new AdminLoginResponse(accessToken.toStringRepresentation(getConfiguration().getAccessTokenSecretKey()),
					accessToken.expiresAt(), getAdminAccountResponseFactory().create(adminAccount));
		});
	}

	public record AdminLoginResponse(
			@NonNull String accessToken,
			@NonNull Instant expiresAt,
			@NonNull AdminAccountResponse adminAccount
	) {
		public AdminLoginResponse {
			requireNonNull(accessToken);
			requireNonNull(expiresAt);
			requireNonNull(adminAccount);
		}
	}

	@NonNull
	public MessageResponse requestPasswordReset(@NonNull PasswordResetRequest request) {
		requireNonNull(request);
		return getRequestHandler().handlePublic(() -> getPasswordResetService().requestPasswordReset(request));
	}

	@NonNull
	public MessageResponse completePasswordReset(@NonNull PasswordResetCompleteRequest request) {
		requireNonNull(request);

		PasswordResetResult passwordResetResult = getRequestHandler().handlePublic(() ->
				getPasswordResetService().completePasswordReset(request));

		// The expired token has been cleared and committed by now; only then is the failure reported
		if (passwordResetResult instanceof PasswordResetResult.Expired)
			throw getPasswordResetService().expiredPasswordResetTokenException();

		return new MessageResponse(getStrings().get("Your password has been reset. You can now log in."));
	}

	@NonNull
	private RequestHandler getRequestHandler() {
		return this.requestHandler;
	}

	@NonNull
	private AdminAccountService getAdminAccountService() {
		return this.adminAccountService;
	}

	@NonNull
	private PasswordResetService getPasswordResetService() {
		return this.passwordResetService;
	}

	@NonNull
	private AdminAccountResponseFactory getAdminAccountResponseFactory() {
		return this.adminAccountResponseFactory;
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private Strings getStrings() {
		return this.strings;
	}
}
