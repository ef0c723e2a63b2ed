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
import com.crosspoint.volunteers.Configuration.BootstrapAdmin;
import com.crosspoint.volunteers.exception.ApplicationException;
import com.crosspoint.volunteers.exception.ApplicationException.ErrorCollector;
import com.crosspoint.volunteers.model.api.request.AdminAccountCreateRequest;
import com.crosspoint.volunteers.model.api.request.AdminAccountUpdateRequest;
import com.crosspoint.volunteers.model.api.request.AdminLoginRequest;
import com.crosspoint.volunteers.model.auth.AccessToken;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.crosspoint.volunteers.util.PasswordManager;
import com.google.inject.Inject;
import com.lokalized.Strings;
import com.pyranid.Database;
import com.pyranid.DatabaseException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.crosspoint.volunteers.util.Normalizer.normalizeEmailAddress;
import static com.crosspoint.volunteers.util.Normalizer.normalizeName;
import static com.crosspoint.volunteers.util.Validator.isValidEmailAddress;
import static java.util.Objects.requireNonNull;

/**
 * Business logic for the admin directory: lookups, account creation and updates, and login.
 * <p>
 * Email addresses are stored lower-cased, so every lookup normalizes its input first.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AdminAccountService {
	public static final int MINIMUM_PASSWORD_LENGTH = 6;

	@NonNull
	private final Configuration configuration;
	@NonNull
	private final PasswordManager passwordManager;
	@NonNull
	private final Database database;
	@NonNull
	private final Strings strings;
	@NonNull
	private final Clock clock;
	@NonNull
	private final Logger logger;

	@Inject
	public AdminAccountService(@NonNull Configuration configuration,
														 @NonNull PasswordManager passwordManager,
														 @NonNull Database database,
														 @NonNull Strings strings,
														 @NonNull Clock clock) {
		requireNonNull(configuration);
		requireNonNull(passwordManager);
		requireNonNull(database);
		requireNonNull(strings);
		requireNonNull(clock);

		this.configuration = configuration;
		this.passwordManager = passwordManager;
		this.database = database;
		this.strings = strings;
		this.clock = clock;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	public Optional<AdminAccount> findAdminAccountById(@Nullable Long adminAccountId) {
		if (adminAccountId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM admin_account
				WHERE admin_account_id=?
				""", AdminAccount.class, adminAccountId);
	}

	@NonNull
	public Optional<AdminAccount> findAdminAccountByEmailAddress(@Nullable String emailAddress) {
		String normalizedEmailAddress = normalizeEmailAddress(emailAddress).orElse(null);

		if (normalizedEmailAddress == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM admin_account
				WHERE email_address=?
				""", AdminAccount.class, normalizedEmailAddress);
	}

	/**
	 * Like {@link #findAdminAccountByEmailAddress(String)}, but deactivated accounts are treated as nonexistent.
	 */
	@NonNull
	public Optional<AdminAccount> findActiveAdminAccountByEmailAddress(@Nullable String emailAddress) {
		return findAdminAccountByEmailAddress(emailAddress).filter(AdminAccount::active);
	}

	@NonNull
	public List<@NonNull AdminAccount> findAdminAccounts() {
		return getDatabase().queryForList("""
				SELECT *
				FROM admin_account
				ORDER BY created_at DESC, admin_account_id DESC
				""", AdminAccount.class);
	}

	@NonNull
	public Long countActiveSuperAdmins() {
		return getDatabase().queryForObject("""
				SELECT COUNT(*)
				FROM admin_account
				WHERE super_admin=TRUE
				AND active=TRUE
				""", Long.class).get();
	}

	@NonNull
	public Long countAdminAccounts() {
		return getDatabase().queryForObject("SELECT COUNT(*) FROM admin_account", Long.class).get();
	}

	@NonNull
	public Long createAdminAccount(@NonNull AdminAccountCreateRequest request) {
		requireNonNull(request);

		String emailAddress = normalizeEmailAddress(request.emailAddress()).orElse(null);
		String password = request.password();
		String name = normalizeName(request.name()).orElse(null);
		ErrorCollector errorCollector = new ErrorCollector();

		if (emailAddress == null)
			errorCollector.addFieldError("emailAddress", getStrings().get("Email address is required."));
		else if (!isValidEmailAddress(emailAddress))
			errorCollector.addFieldError("emailAddress", getStrings().get("Email address is invalid."));

		if (password == null || password.length() == 0)
			errorCollector.addFieldError("password", getStrings().get("Password is required."));
		else if (password.length() < MINIMUM_PASSWORD_LENGTH)
			errorCollector.addFieldError("password", getStrings().get("Password must be at least {{minimumLength}} characters.",
					Map.of("minimumLength", MINIMUM_PASSWORD_LENGTH)));

		errorCollector.throwIfErrors();

		if (findAdminAccountByEmailAddress(emailAddress).isPresent())
			throw duplicateEmailAddressException();

		getLogger().info("Creating admin account for {}", emailAddress);

		return insertAdminAccount(emailAddress, getPasswordManager().hashPassword(password), name, false);
	}

	/**
	 * Creates the configured bootstrap admin as super admin. Only meaningful when the directory is empty.
	 */
	@NonNull
	public Long createBootstrapSuperAdmin(@NonNull String password) {
		requireNonNull(password);

		BootstrapAdmin bootstrapAdmin = getConfiguration().getBootstrapAdmin();

		if (countAdminAccounts() > 0)
			throw new IllegalStateException("Refusing to bootstrap a super admin into a non-empty admin directory");

		getLogger().info("Admin directory is empty; creating bootstrap super admin {}", bootstrapAdmin.emailAddress());

		return insertAdminAccount(bootstrapAdmin.emailAddress(), getPasswordManager().hashPassword(password),
				normalizeName(bootstrapAdmin.name()).orElse(null), true);
	}

	@NonNull
	private Long insertAdminAccount(@NonNull String emailAddress,
																	@NonNull String passwordHash,
																	@Nullable String name,
																	@NonNull Boolean superAdmin) {
		requireNonNull(emailAddress);
		requireNonNull(passwordHash);
		requireNonNull(superAdmin);

		Long adminAccountId = getDatabase().queryForObject("CALL NEXT VALUE FOR admin_account_seq", Long.class).get();

		try {
			getDatabase().execute("""
					INSERT INTO admin_account (
						admin_account_id,
						email_address,
						password_hash,
						name,
						active,
						super_admin,
						created_at
					) VALUES (?,?,?,?,TRUE,?,?)
					""", adminAccountId, emailAddress, passwordHash, name, superAdmin, Instant.now(getClock()));
		} catch (DatabaseException e) {
			// Lost a race with a concurrent create for the same address
			if (e.getMessage() != null && e.getMessage().contains("ADMIN_ACCOUNT_EMAIL_ADDRESS_UNIQUE_IDX"))
				throw duplicateEmailAddressException();

			throw e;
		}

		return adminAccountId;
	}

	@NonNull
	private ApplicationException duplicateEmailAddressException() {
		return ApplicationException.withStatusCodeAndFieldError(ApplicationException.STATUS_CODE_CONFLICT,
				"emailAddress", getStrings().get("An admin with this email address already exists.")).build();
	}

	/**
	 * Applies the {@code active} and {@code name} fields of the request, whichever are present.
	 * <p>
	 * Callers are expected to have run {@link AuthorizationPolicy#ensureUpdatePermitted(AdminAccount, AdminAccount, AdminAccountUpdateRequest)}
	 * first. The role-related preconditions are re-checked here against the row being written.
	 */
	@NonNull
	public Boolean updateAdminAccount(@NonNull AdminAccountUpdateRequest request) {
		requireNonNull(request);

		Long adminAccountId = requireNonNull(request.adminAccountId());
		boolean updated = false;

		if (request.name() != null) {
			String name = normalizeName(request.name()).orElse(null);
			updated = getDatabase().execute("UPDATE admin_account SET name=? WHERE admin_account_id=?", name, adminAccountId) > 0;
		}

		if (Boolean.FALSE.equals(request.active())) {
			long rowCount = getDatabase().execute("""
					UPDATE admin_account
					SET active=FALSE
					WHERE admin_account_id=?
					AND super_admin=FALSE
					""", adminAccountId);

			// The account picked up the role after our caller last looked at it
			if (rowCount == 0)
				throw ApplicationException.withStatusCodeAndGeneralError(ApplicationException.STATUS_CODE_FORBIDDEN,
						getStrings().get("The super admin account cannot be deactivated.")).build();

			getLogger().info("Deactivated admin account {}", adminAccountId);
			updated = true;
		} else if (Boolean.TRUE.equals(request.active())) {
			long rowCount = getDatabase().execute("""
					UPDATE admin_account
					SET active=TRUE
					WHERE admin_account_id=?
					AND (
						super_admin=FALSE
						OR NOT EXISTS (
							SELECT 1
							FROM admin_account other
							WHERE other.super_admin=TRUE
							AND other.active=TRUE
							AND other.admin_account_id <> ?
						)
					)
					""", adminAccountId, adminAccountId);

			if (rowCount == 0)
				throw ApplicationException.withStatusCodeAndGeneralError(ApplicationException.STATUS_CODE_UNPROCESSABLE_CONTENT,
						getStrings().get("This account cannot be reactivated while another account holds the super admin role.")).build();

			getLogger().info("Activated admin account {}", adminAccountId);
			updated = true;
		}

		return updated;
	}

	/**
	 * Verifies login credentials and issues an access token.
	 * <p>
	 * Unknown addresses, deactivated accounts and wrong passwords all fail identically.
	 */
	@NonNull
	public AccessToken authenticate(@NonNull AdminLoginRequest request) {
		requireNonNull(request);

		String emailAddress = normalizeEmailAddress(request.emailAddress()).orElse(null);
		String password = request.password();
		ErrorCollector errorCollector = new ErrorCollector();

		if (emailAddress == null)
			errorCollector.addFieldError("emailAddress", getStrings().get("Email address is required."));

		if (password == null || password.length() == 0)
			errorCollector.addFieldError("password", getStrings().get("Password is required."));

		errorCollector.throwIfErrors();

		AdminAccount adminAccount = findActiveAdminAccountByEmailAddress(emailAddress).orElse(null);

		if (adminAccount == null || !getPasswordManager().verifyPassword(password, adminAccount.passwordHash())) {
			getLogger().debug("Rejected login attempt for {}", emailAddress);
			throw ApplicationException.withStatusCode(ApplicationException.STATUS_CODE_UNAUTHORIZED)
					.generalError(getStrings().get("Incorrect email address or password."))
					.build();
		}

		return issueAccessToken(adminAccount);
	}

	@NonNull
	public AccessToken issueAccessToken(@NonNull AdminAccount adminAccount) {
		requireNonNull(adminAccount);

		Instant issuedAt = Instant.now(getClock());
		Instant expiresAt = issuedAt.plus(getConfiguration().getAccessTokenExpiration());

		return new AccessToken(adminAccount.emailAddress(), issuedAt, expiresAt);
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private PasswordManager getPasswordManager() {
		return this.passwordManager;
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
