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

import com.crosspoint.volunteers.exception.ApplicationException;
import com.crosspoint.volunteers.exception.AuthorizationException;
import com.crosspoint.volunteers.exception.NotFoundException;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.google.inject.Inject;
import com.lokalized.Strings;
import com.pyranid.Database;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Hands the super admin role from its current holder to another active admin.
 * <p>
 * Must run inside a transaction: the role is cleared from the caller and set on the target by two conditional
 * updates, and the transaction is abandoned unless exactly one active super admin remains afterwards.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SuperAdminTransferService {
	@NonNull
	private final AdminAccountService adminAccountService;
	@NonNull
	private final Database database;
	@NonNull
	private final Strings strings;
	@NonNull
	private final Logger logger;

	@Inject
	public SuperAdminTransferService(@NonNull AdminAccountService adminAccountService,
																	 @NonNull Database database,
																	 @NonNull Strings strings) {
		requireNonNull(adminAccountService);
		requireNonNull(database);
		requireNonNull(strings);

		this.adminAccountService = adminAccountService;
		this.database = database;
		this.strings = strings;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * @return the target account as it stands after the transfer
	 */
	@NonNull
	public AdminAccount transferSuperAdmin(@NonNull AdminAccount caller,
																				 @Nullable Long targetAdminAccountId) {
		requireNonNull(caller);

		// Transferring to oneself is invalid whatever role the caller holds
		if (caller.adminAccountId().equals(targetAdminAccountId))
			throw ApplicationException.withStatusCodeAndGeneralError(ApplicationException.STATUS_CODE_UNPROCESSABLE_CONTENT,
					getStrings().get("You cannot transfer the super admin role to yourself.")).build();

		if (!caller.superAdmin())
			throw new AuthorizationException("Only the super admin can transfer the super admin role");

		AdminAccount target = getAdminAccountService().findAdminAccountById(targetAdminAccountId).orElse(null);

		if (target == null)
			throw new NotFoundException(format("No admin account with ID %s", targetAdminAccountId));

		if (!target.active())
			throw inactiveTargetException();

		long clearedRowCount = getDatabase().execute("""
				UPDATE admin_account
				SET super_admin=FALSE
				WHERE admin_account_id=?
				AND super_admin=TRUE
				AND active=TRUE
				""", caller.adminAccountId());

		// Someone else moved the role (or deactivated us) between authorization and now
		if (clearedRowCount == 0)
			throw new AuthorizationException("Caller no longer holds the super admin role");

		long setRowCount = getDatabase().execute("""
				UPDATE admin_account
				SET super_admin=TRUE
				WHERE admin_account_id=?
				AND active=TRUE
				""", target.adminAccountId());

		if (setRowCount == 0)
			throw inactiveTargetException();

		Long activeSuperAdminCount = getAdminAccountService().countActiveSuperAdmins();

		if (activeSuperAdminCount != 1L)
			throw new IllegalStateException(format("Super admin transfer would leave %d active super admins", activeSuperAdminCount));

		getLogger().info("Transferred super admin role from admin account {} to admin account {}",
				caller.adminAccountId(), target.adminAccountId());

		return getAdminAccountService().findAdminAccountById(target.adminAccountId()).get();
	}

	@NonNull
	private ApplicationException inactiveTargetException() {
		return ApplicationException.withStatusCodeAndGeneralError(ApplicationException.STATUS_CODE_UNPROCESSABLE_CONTENT,
				getStrings().get("The super admin role can only be transferred to an active account.")).build();
	}

	@NonNull
	private AdminAccountService getAdminAccountService() {
		return this.adminAccountService;
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
	private Logger getLogger() {
		return this.logger;
	}
}
