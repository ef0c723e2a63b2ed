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

package com.crosspoint.volunteers.model.db;

import com.crosspoint.volunteers.model.auth.AdminRole;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code admin_account} table in the database.
 * <p>
 * {@code passwordResetToken} and {@code passwordResetExpiresAt} are either both present or both absent.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record AdminAccount(
		@NonNull Long adminAccountId,
		@NonNull String emailAddress,
		@NonNull String passwordHash,
		@Nullable String name,
		@NonNull Boolean active,
		@NonNull Boolean superAdmin,
		@Nullable String passwordResetToken,
		@Nullable Instant passwordResetExpiresAt,
		@NonNull Instant createdAt
) {
	public AdminAccount {
		requireNonNull(adminAccountId);
		requireNonNull(emailAddress);
		requireNonNull(passwordHash);
		requireNonNull(active);
		requireNonNull(superAdmin);
		requireNonNull(createdAt);
	}

	@NonNull
	public AdminRole role() {
		return AdminRole.fromSuperAdminFlag(superAdmin());
	}

	// Keep credentials out of logs
	@Override
	public String toString() {
		return format("%s{adminAccountId=%s, emailAddress=%s, active=%s, superAdmin=%s}",
				getClass().getSimpleName(), adminAccountId(), emailAddress(), active(), superAdmin());
	}
}
