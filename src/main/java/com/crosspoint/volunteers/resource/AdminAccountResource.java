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
import com.crosspoint.volunteers.model.api.request.AdminAccountCreateRequest;
import com.crosspoint.volunteers.model.api.request.AdminAccountUpdateRequest;
import com.crosspoint.volunteers.model.api.response.AdminAccountResponse;
import com.crosspoint.volunteers.model.api.response.AdminAccountResponse.AdminAccountResponseFactory;
import com.crosspoint.volunteers.model.auth.AccessLevel;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.crosspoint.volunteers.service.AdminAccountService;
import com.crosspoint.volunteers.service.AuthorizationPolicy;
import com.crosspoint.volunteers.service.SuperAdminTransferService;
import com.google.inject.Inject;
import com.google.inject.Provider;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Contains admin directory operations.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AdminAccountResource {
	@NonNull
	private final RequestHandler requestHandler;
	@NonNull
	private final AdminAccountService adminAccountService;
	@NonNull
	private final AuthorizationPolicy authorizationPolicy;
	@NonNull
	private final SuperAdminTransferService superAdminTransferService;
	@NonNull
	private final AdminAccountResponseFactory adminAccountResponseFactory;
	@NonNull
	private final Provider<CurrentContext> currentContextProvider;

	@Inject
	public AdminAccountResource(@NonNull RequestHandler requestHandler,
															@NonNull AdminAccountService adminAccountService,
															@NonNull AuthorizationPolicy authorizationPolicy,
															@NonNull SuperAdminTransferService superAdminTransferService,
															@NonNull AdminAccountResponseFactory adminAccountResponseFactory,
															@NonNull Provider<CurrentContext> currentContextProvider) {
		requireNonNull(requestHandler);
		requireNonNull(adminAccountService);
		requireNonNull(authorizationPolicy);
		requireNonNull(superAdminTransferService);
		requireNonNull(adminAccountResponseFactory);
		requireNonNull(currentContextProvider);

		this.requestHandler = requestHandler;
		this.adminAccountService = adminAccountService;
		this.authorizationPolicy = authorizationPolicy;
		this.superAdminTransferService = superAdminTransferService;
		this.adminAccountResponseFactory = adminAccountResponseFactory;
		this.currentContextProvider = currentContextProvider;
	}

	@NonNull
	public AdminAccountResponse currentAdminAccount(@Nullable String accessToken) {
		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () ->
				getAdminAccountResponseFactory().create(getCurrentAdminAccount()));
	}

	@NonNull
	public List<@NonNull AdminAccountResponse> findAdminAccounts(@Nullable String accessToken) {
		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () ->
				getAdminAccountService().findAdminAccounts().stream()
						.map(adminAccount -> getAdminAccountResponseFactory().create(adminAccount))
						.collect(Collectors.toList()));
	}

	@NonNull
	public AdminAccountResponse createAdminAccount(@Nullable String accessToken,
																								 @NonNull AdminAccountCreateRequest request) {
		requireNonNull(request);

		return getRequestHandler().handle(accessToken, AccessLevel.SUPER_ADMIN, () -> {
			Long adminAccountId = getAdminAccountService().createAdminAccount(request);
			return getAdminAccountResponseFactory().create(getAdminAccountService().findAdminAccountById(adminAccountId).get());
		});
	}

	@NonNull
	public AdminAccountResponse updateAdminAccount(@Nullable String accessToken,
																								 @NonNull Long adminAccountId,
																								 @NonNull AdminAccountUpdateRequest request) {
		requireNonNull(adminAccountId);
		requireNonNull(request);

		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () -> {
			AdminAccount target = getAdminAccountService().findAdminAccountById(adminAccountId).orElse(null);

			if (target == null)
				throw new NotFoundException(format("No admin account with ID %s", adminAccountId));

			AdminAccountUpdateRequest pinnedRequest = request.withAdminAccountId(adminAccountId);

			getAuthorizationPolicy().ensureUpdatePermitted(getCurrentAdminAccount(), target, pinnedRequest);
			getAdminAccountService().updateAdminAccount(pinnedRequest);

			return getAdminAccountResponseFactory().create(getAdminAccountService().findAdminAccountById(adminAccountId).get());
		});
	}

	/**
	 * Hands the super admin role from the caller to another active account.
	 * <p>
	 * Open to any admin so that a transfer to oneself is rejected as invalid regardless of role;
	 * the super admin requirement is enforced by {@link SuperAdminTransferService}.
	 *
	 * @return the new super admin
	 */
	@NonNull
	public AdminAccountResponse transferSuperAdmin(@Nullable String accessToken,
																								 @Nullable Long targetAdminAccountId) {
		return getRequestHandler().handle(accessToken, AccessLevel.ADMIN, () ->
				getAdminAccountResponseFactory().create(
						getSuperAdminTransferService().transferSuperAdmin(getCurrentAdminAccount(), targetAdminAccountId)));
	}

	@NonNull
	private AdminAccount getCurrentAdminAccount() {
		return getCurrentContext().getAdminAccount().get();
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
	private AuthorizationPolicy getAuthorizationPolicy() {
		return this.authorizationPolicy;
	}

	@NonNull
	private SuperAdminTransferService getSuperAdminTransferService() {
		return this.superAdminTransferService;
	}

	@NonNull
	private AdminAccountResponseFactory getAdminAccountResponseFactory() {
		return this.adminAccountResponseFactory;
	}

	@NonNull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
	}
}
