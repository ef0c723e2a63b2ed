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
import com.crosspoint.volunteers.exception.ApplicationException.ErrorCollector;
import com.crosspoint.volunteers.model.api.request.PasswordResetCompleteRequest;
import com.crosspoint.volunteers.model.api.request.PasswordResetRequest;
import com.crosspoint.volunteers.model.api.response.MessageResponse;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.crosspoint.volunteers.util.EmailDispatcher;
import com.crosspoint.volunteers.util.PasswordManager;
import com.google.inject.Inject;
import com.lokalized.Strings;
import com.pyranid.Database;
import com.pyranid.TransactionResult;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

import static com.crosspoint.volunteers.util.Normalizer.normalizeEmailAddress;
import static com.crosspoint.volunteers.util.Normalizer.trimAggressivelyToNull;
import static java.util.Objects.requireNonNull;

/**
 * Forgot-password flow for admins.
 * <p>
 * A request stores a fresh single-use token and expiry on the account (replacing any earlier one) and emails
 * the token after commit. Completing the reset consumes the token. Expiry is only noticed when someone tries
 * to use a token; nothing sweeps stale tokens.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class PasswordResetService {
	private static final int PASSWORD_RESET_TOKEN_BYTE_LENGTH = 32;

	@NonNull
	private final Configuration configuration;
	@NonNull
	private final PasswordManager passwordManager;
	@NonNull
	private final EmailDispatcher emailDispatcher;
	@NonNull
	private final Database database;
	@NonNull
	private final Strings strings;
	@NonNull
	private final Clock clock;
	@NonNull
	private final SecureRandom secureRandom;
	@NonNull
	private final Logger logger;

	@Inject
	public PasswordResetService(@NonNull Configuration configuration,
															@NonNull PasswordManager passwordManager,
															@NonNull EmailDispatcher emailDispatcher,
															@NonNull Database database,
															@NonNull Strings strings,
															@NonNull Clock clock) {
		requireNonNull(configuration);
		requireNonNull(passwordManager);
		requireNonNull(emailDispatcher);
		requireNonNull(database);
		requireNonNull(strings);
		requireNonNull(clock);

		this.configuration = configuration;
		this.passwordManager = passwordManager;
		this.emailDispatcher = emailDispatcher;
		this.database = database;
		this.strings = strings;
		this.clock = clock;
		this.secureRandom = new SecureRandom();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Starts a reset for the given address.
	 * <p>
	 * The response is identical whether or not an active account exists for the address, so it cannot be used
	 * to discover which addresses are registered.
	 */
	@NonNull
	public MessageResponse requestPasswordReset(@NonNull PasswordResetRequest request) {
		requireNonNull(request);

		String emailAddress = normalizeEmailAddress(request.emailAddress()).orElse(null);

		// No format check here: any stored address, including a configured bootstrap address, can be reset
		if (emailAddress != null) {
			String passwordResetToken = generatePasswordResetToken();
			Instant expiresAt = Instant.now(getClock()).plus(getConfiguration().getPasswordResetExpiration());

			// Token and expiry always move together
			long rowCount = getDatabase().execute("""
					UPDATE admin_account
					SET password_reset_token=?, password_reset_expires_at=?
					WHERE email_address=?
					AND active=TRUE
					""", passwordResetToken, expiresAt, emailAddress);

			if (rowCount > 0) {
				getLogger().info("Issued password reset token for {}", emailAddress);

				getDatabase().currentTransaction().get().addPostTransactionOperation((TransactionResult transactionResult) -> {
					if (transactionResult == TransactionResult.COMMITTED)
						dispatchPasswordResetEmail(emailAddress, passwordResetToken);
				});
			} else {
				getLogger().debug("Ignoring password reset request for unknown or inactive address {}", emailAddress);
			}
		} else {
			getLogger().debug("Ignoring password reset request with a missing email address");
		}

		return new MessageResponse(getStrings().get("If an account exists for that email address, a password reset link has been sent."));
	}

	/**
	 * Sets a new password using a reset token.
	 * <p>
	 * Malformed input and unknown tokens are rejected with an exception and change nothing. An expired token is
	 * different: its fields are cleared, and that clearing must be committed, so it is reported through the
	 * {@link PasswordResetResult.Expired} return value rather than an exception that would roll it back.
	 */
	@NonNull
	public PasswordResetResult completePasswordReset(@NonNull PasswordResetCompleteRequest request) {
		requireNonNull(request);

		String passwordResetToken = trimAggressivelyToNull(request.passwordResetToken());
		String password = request.password() == null ? "" : request.password();
		String passwordConfirmation = request.passwordConfirmation() == null ? "" : request.passwordConfirmation();
		ErrorCollector errorCollector = new ErrorCollector();

		if (!password.equals(passwordConfirmation))
			errorCollector.addFieldError("passwordConfirmation", getStrings().get("Passwords do not match."));
		else if (password.length() < AdminAccountService.MINIMUM_PASSWORD_LENGTH)
			errorCollector.addFieldError("password", getStrings().get("Password must be at least {{minimumLength}} characters.",
					Map.of("minimumLength", AdminAccountService.MINIMUM_PASSWORD_LENGTH)));

		errorCollector.throwIfErrors();

		if (passwordResetToken == null)
			throw invalidPasswordResetTokenException();

		AdminAccount adminAccount = getDatabase().queryForObject("""
				SELECT *
				FROM admin_account
				WHERE password_reset_token=?
				AND active=TRUE
				""", AdminAccount.class, passwordResetToken).orElse(null);

		if (adminAccount == null)
			throw invalidPasswordResetTokenException();

		Instant now = Instant.now(getClock());
		Instant expiresAt = adminAccount.passwordResetExpiresAt();

		if (expiresAt == null || !now.isBefore(expiresAt)) {
			getDatabase().execute("""
					UPDATE admin_account
					SET password_reset_token=NULL, password_reset_expires_at=NULL
					WHERE admin_account_id=?
					AND password_reset_token=?
					""", adminAccount.adminAccountId(), passwordResetToken);

			getLogger().info("Cleared expired password reset token for admin account {}", adminAccount.adminAccountId());
			return new PasswordResetResult.Expired(adminAccount.adminAccountId());
		}

		// Matching on the token makes this single-use even if two completions race
		long rowCount = getDatabase().execute("""
				UPDATE admin_account
				SET password_hash=?, password_reset_token=NULL, password_reset_expires_at=NULL
				WHERE password_reset_token=?
				AND password_reset_expires_at > ?
				AND active=TRUE
				""", getPasswordManager().hashPassword(password), passwordResetToken, now);

		if (rowCount == 0)
			throw invalidPasswordResetTokenException();

		getLogger().info("Completed password reset for admin account {}", adminAccount.adminAccountId());
		return new PasswordResetResult.Completed(adminAccount.adminAccountId());
	}

	@NonNull
	public ApplicationException expiredPasswordResetTokenException() {
		return ApplicationException.withStatusCodeAndGeneralError(ApplicationException.STATUS_CODE_UNPROCESSABLE_CONTENT,
				getStrings().get("This password reset link has expired. Please request a new one.")).build();
	}

	@NonNull
	private ApplicationException invalidPasswordResetTokenException() {
		return ApplicationException.withStatusCodeAndGeneralError(ApplicationException.STATUS_CODE_UNPROCESSABLE_CONTENT,
				getStrings().get("This password reset link is invalid or has expired.")).build();
	}

	private void dispatchPasswordResetEmail(@NonNull String emailAddress,
																					@NonNull String passwordResetToken) {
		try {
			if (!getEmailDispatcher().sendPasswordReset(emailAddress, passwordResetToken))
				getLogger().warn("Password reset email to {} was not delivered", emailAddress);
		} catch (RuntimeException e) {
			getLogger().error("Password reset email to " + emailAddress + " failed", e);
		}
	}

	@NonNull
	private String generatePasswordResetToken() {
		byte[] bytes = new byte[PASSWORD_RESET_TOKEN_BYTE_LENGTH];
		getSecureRandom().nextBytes(bytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
	}

	/**
	 * Outcome of a reset attempt that got as far as finding the token's account.
	 */
	public sealed interface PasswordResetResult {
		record Completed(@NonNull Long adminAccountId) implements PasswordResetResult {}

		record Expired(@NonNull Long adminAccountId) implements PasswordResetResult {}
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
	private EmailDispatcher getEmailDispatcher() {
		return this.emailDispatcher;
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
	private SecureRandom getSecureRandom() {
		return this.secureRandom;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
