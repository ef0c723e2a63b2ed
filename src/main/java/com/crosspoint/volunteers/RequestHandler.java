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

package com.crosspoint.volunteers;

import com.crosspoint.volunteers.model.auth.AccessLevel;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.crosspoint.volunteers.service.AuthorizationPolicy;
import com.google.inject.Inject;
import com.pyranid.Database;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.function.Supplier;

import static com.crosspoint.volunteers.util.Normalizer.normalizeAccessToken;
import static java.util.Objects.requireNonNull;

/**
 * Single entry point for every operation: authorizes the caller, binds a {@link CurrentContext} and runs the work
 * inside one database transaction.
 * <p>
 * If the work throws, the transaction rolls back and the exception propagates to the caller unchanged, ready to be
 * turned into an {@link com.crosspoint.volunteers.model.api.response.ErrorResponse}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestHandler {
	@NonNull
	private final AuthorizationPolicy authorizationPolicy;
	@NonNull
	private final Database database;
	@NonNull
	private final Logger logger;

	@Inject
	public RequestHandler(@NonNull AuthorizationPolicy authorizationPolicy,
												@NonNull Database database) {
		requireNonNull(authorizationPolicy);
		requireNonNull(database);

		this.authorizationPolicy = authorizationPolicy;
		this.database = database;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Nullable
	public <T> T handle(@Nullable String accessToken,
											@NonNull AccessLevel accessLevel,
											@NonNull Supplier<T> operation) {
		requireNonNull(accessLevel);
		requireNonNull(operation);

		// Locale and time zone are not yet known, so authorization runs under defaults
		AdminAccount adminAccount = CurrentContext.with(null, null).build().run(() ->
				getAuthorizationPolicy().authorize(normalizeAccessToken(accessToken).orElse(null), accessLevel)).orElse(null);

		return CurrentContext.withAdminAccount(adminAccount).build().run(() -> {
			getLogger().trace("Starting {} operation", accessLevel.name());

			// Any exception here rolls back the transaction
			return getDatabase().transaction(() -> Optional.ofNullable(operation.get())).orElse(null);
		});
	}

	@Nullable
	public <T> T handlePublic(@NonNull Supplier<T> operation) {
		requireNonNull(operation);
		return handle(null, AccessLevel.PUBLIC, operation);
	}

	@NonNull
	private AuthorizationPolicy getAuthorizationPolicy() {
		return this.authorizationPolicy;
	}

	@NonNull
	private Database getDatabase() {
		return this.database;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
