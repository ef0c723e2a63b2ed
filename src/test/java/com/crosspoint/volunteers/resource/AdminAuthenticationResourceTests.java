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

import com.crosspoint.volunteers.App;
import com.crosspoint.volunteers.MutableClock;
import com.crosspoint.volunteers.TestingModule;
import com.crosspoint.volunteers.exception.ApplicationException;
import com.crosspoint.volunteers.exception.AuthenticationException;
import com.crosspoint.volunteers.mock.MockEmailDispatcher;
import com.crosspoint.volunteers.mock.MockEmailDispatcher.SentPasswordReset;
import com.crosspoint.volunteers.model.api.request.AdminAccountCreateRequest;
import com.crosspoint.volunteers.model.api.request.AdminAccountUpdateRequest;
import com.crosspoint.volunteers.model.api.request.AdminLoginRequest;
import com.crosspoint.volunteers.model.api.request.PasswordResetCompleteRequest;
import com.crosspoint.volunteers.model.api.request.PasswordResetRequest;
import com.crosspoint.volunteers.model.api.response.AdminAccountResponse;
import com.crosspoint.volunteers.model.api.response.MessageResponse;
import com.crosspoint.volunteers.model.auth.AdminRole;
import com.crosspoint.volunteers.model.db.AdminAccount;
import com.crosspoint.volunteers.resource.AdminAuthenticationResource.AdminLoginResponse;
import com.crosspoint.volunteers.service.AdminAccountService;
import com.crosspoint.volunteers.util.EmailDispatcher;
import com.pyranid.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AdminAuthenticationResourceTests {
	private static final String SUPER_ADMIN_EMAIL_ADDRESS = "admin@crosspointbc.org";
	private static final String SUPER_ADMIN_PASSWORD = "bootstrap-password";

	@Test
	public void testLoginIssuesUsableToken() {
		App app = TestingModule.createApp();
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);

		// Email matching is case-insensitive
		AdminLoginResponse loginResponse = authenticationResource.login(new AdminLoginRequest("  Admin@CrosspointBC.org ", SUPER_ADMIN_PASSWORD));

		Assertions.assertEquals(SUPER_ADMIN_EMAIL_ADDRESS, loginResponse.adminAccount().getEmailAddress(), "Email doesn't match");
		Assertions.assertEquals(AdminRole.SUPER_ADMIN, loginResponse.adminAccount().getRole(), "Bootstrap admin should be super admin");

		AdminAccountResponse currentAdminAccount = adminAccountResource.currentAdminAccount(loginResponse.accessToken());
		Assertions.assertEquals(loginResponse.adminAccount().getAdminAccountId(), currentAdminAccount.getAdminAccountId());

		// Transports commonly hand over the raw Authorization header
		currentAdminAccount = adminAccountResource.currentAdminAccount("Bearer " + loginResponse.accessToken());
		Assertions.assertEquals(SUPER_ADMIN_EMAIL_ADDRESS, currentAdminAccount.getEmailAddress());
	}

	@Test
	public void testLoginFailuresAreIndistinguishable() {
		App app = TestingModule.createApp();
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);

		ApplicationException wrongPassword = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.login(new AdminLoginRequest(SUPER_ADMIN_EMAIL_ADDRESS, "not-the-password")));
		ApplicationException unknownEmailAddress = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.login(new AdminLoginRequest("nobody@crosspointbc.org", SUPER_ADMIN_PASSWORD)));

		Assertions.assertEquals(401, wrongPassword.getStatusCode().intValue(), "Bad status code");
		Assertions.assertEquals(401, unknownEmailAddress.getStatusCode().intValue(), "Bad status code");
		Assertions.assertEquals(wrongPassword.getGeneralErrors(), unknownEmailAddress.getGeneralErrors(), "Failure reasons should not leak");
	}

	@Test
	public void testAccessTokenExpires() {
		App app = TestingModule.createApp();
		MutableClock clock = app.getInjector().getInstance(MutableClock.class);
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);

		String accessToken = authenticationResource.login(new AdminLoginRequest(SUPER_ADMIN_EMAIL_ADDRESS, SUPER_ADMIN_PASSWORD)).accessToken();

		clock.advance(Duration.ofHours(7));
		Assertions.assertNotNull(adminAccountResource.currentAdminAccount(accessToken), "Token should still be valid");

		clock.advance(Duration.ofHours(1));
		Assertions.assertThrows(AuthenticationException.class, () -> adminAccountResource.currentAdminAccount(accessToken));
	}

	@Test
	public void testGarbageAndMissingTokensAreRejected() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);

		Assertions.assertThrows(AuthenticationException.class, () -> adminAccountResource.currentAdminAccount(null));
		Assertions.assertThrows(AuthenticationException.class, () -> adminAccountResource.currentAdminAccount("not-a-token"));
		Assertions.assertThrows(AuthenticationException.class, () -> adminAccountResource.findAdminAccounts("a.b.c"));
	}

	@Test
	public void testDeactivatedAdminIsLockedOut() {
		App app = TestingModule.createApp();
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);

		String superAdminAccessToken = authenticationResource.login(new AdminLoginRequest(SUPER_ADMIN_EMAIL_ADDRESS, SUPER_ADMIN_PASSWORD)).accessToken();
		AdminAccountResponse helper = adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("helper@crosspointbc.org", "helper-password", "Helper"));
		String helperAccessToken = authenticationResource.login(new AdminLoginRequest("helper@crosspointbc.org", "helper-password")).accessToken();

		adminAccountResource.updateAdminAccount(superAdminAccessToken, helper.getAdminAccountId(),
				new AdminAccountUpdateRequest(null, false, null));

		// An outstanding token stops working immediately...
		Assertions.assertThrows(AuthenticationException.class, () -> adminAccountResource.currentAdminAccount(helperAccessToken));

		// ...and a fresh login fails the same way a wrong password does
		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.login(new AdminLoginRequest("helper@crosspointbc.org", "helper-password")));
		Assertions.assertEquals(401, e.getStatusCode().intValue(), "Bad status code");
	}

	@Test
	public void testPasswordResetRequestDoesNotRevealAccounts() {
		App app = TestingModule.createApp();
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		MockEmailDispatcher emailDispatcher = (MockEmailDispatcher) app.getInjector().getInstance(EmailDispatcher.class);

		MessageResponse knownResponse = authenticationResource.requestPasswordReset(new PasswordResetRequest(SUPER_ADMIN_EMAIL_ADDRESS));
		MessageResponse unknownResponse = authenticationResource.requestPasswordReset(new PasswordResetRequest("nobody@crosspointbc.org"));
		MessageResponse malformedResponse = authenticationResource.requestPasswordReset(new PasswordResetRequest("not an email"));

		Assertions.assertEquals(knownResponse, unknownResponse, "Responses should be identical");
		Assertions.assertEquals(knownResponse, malformedResponse, "Responses should be identical");

		List<SentPasswordReset> sentPasswordResets = emailDispatcher.getSentPasswordResets();
		Assertions.assertEquals(1, sentPasswordResets.size(), "Only the real account should get an email");
		Assertions.assertEquals(SUPER_ADMIN_EMAIL_ADDRESS, sentPasswordResets.get(0).emailAddress());
	}

	@Test
	public void testPasswordResetForStoredAddressOutsideValidatorRules() {
		App app = TestingModule.createApp();
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		MockEmailDispatcher emailDispatcher = (MockEmailDispatcher) app.getInjector().getInstance(EmailDispatcher.class);
		Database database = app.getInjector().getInstance(Database.class);

		// Bootstrap addresses come from configuration and never pass through the email validator
		database.execute("UPDATE admin_account SET email_address=? WHERE email_address=?", "admin@localhost", SUPER_ADMIN_EMAIL_ADDRESS);

		authenticationResource.requestPasswordReset(new PasswordResetRequest("Admin@Localhost"));

		List<SentPasswordReset> sentPasswordResets = emailDispatcher.getSentPasswordResets();
		Assertions.assertEquals(1, sentPasswordResets.size(), "Stored address should get a reset email");
		Assertions.assertEquals("admin@localhost", sentPasswordResets.get(0).emailAddress());

		authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(sentPasswordResets.get(0).passwordResetToken(),
				"new-password", "new-password"));
		Assertions.assertNotNull(authenticationResource.login(new AdminLoginRequest("admin@localhost", "new-password")));
	}

	@Test
	public void testPasswordResetIsSingleUse() {
		App app = TestingModule.createApp();
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		MockEmailDispatcher emailDispatcher = (MockEmailDispatcher) app.getInjector().getInstance(EmailDispatcher.class);

		authenticationResource.requestPasswordReset(new PasswordResetRequest(SUPER_ADMIN_EMAIL_ADDRESS));
		String passwordResetToken = emailDispatcher.getSentPasswordResets().get(0).passwordResetToken();

		authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(passwordResetToken, "new-password", "new-password"));

		// Old password is gone, new one works
		Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.login(new AdminLoginRequest(SUPER_ADMIN_EMAIL_ADDRESS, SUPER_ADMIN_PASSWORD)));
		Assertions.assertNotNull(authenticationResource.login(new AdminLoginRequest(SUPER_ADMIN_EMAIL_ADDRESS, "new-password")));

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(passwordResetToken, "another-password", "another-password")));
		Assertions.assertEquals(422, e.getStatusCode().intValue(), "Bad status code");

		AdminAccount adminAccount = app.getInjector().getInstance(AdminAccountService.class).findAdminAccountByEmailAddress(SUPER_ADMIN_EMAIL_ADDRESS).get();
		Assertions.assertNull(adminAccount.passwordResetToken(), "Token should be cleared");
		Assertions.assertNull(adminAccount.passwordResetExpiresAt(), "Expiry should be cleared");
	}

	@Test
	public void testNewPasswordResetRequestReplacesOldToken() {
		App app = TestingModule.createApp();
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		MockEmailDispatcher emailDispatcher = (MockEmailDispatcher) app.getInjector().getInstance(EmailDispatcher.class);

		authenticationResource.requestPasswordReset(new PasswordResetRequest(SUPER_ADMIN_EMAIL_ADDRESS));
		authenticationResource.requestPasswordReset(new PasswordResetRequest(SUPER_ADMIN_EMAIL_ADDRESS));

		String firstPasswordResetToken = emailDispatcher.getSentPasswordResets().get(0).passwordResetToken();
		String secondPasswordResetToken = emailDispatcher.getSentPasswordResets().get(1).passwordResetToken();

		Assertions.assertNotEquals(firstPasswordResetToken, secondPasswordResetToken, "Tokens should differ");
		Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(firstPasswordResetToken, "new-password", "new-password")));

		authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(secondPasswordResetToken, "new-password", "new-password"));
	}

	@Test
	public void testExpiredPasswordResetTokenIsClearedAndCanBeReissued() {
		App app = TestingModule.createApp();
		MutableClock clock = app.getInjector().getInstance(MutableClock.class);
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		AdminAccountService adminAccountService = app.getInjector().getInstance(AdminAccountService.class);
		MockEmailDispatcher emailDispatcher = (MockEmailDispatcher) app.getInjector().getInstance(EmailDispatcher.class);

		authenticationResource.requestPasswordReset(new PasswordResetRequest(SUPER_ADMIN_EMAIL_ADDRESS));
		String expiredPasswordResetToken = emailDispatcher.getSentPasswordResets().get(0).passwordResetToken();

		clock.advance(Duration.ofHours(1));

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(expiredPasswordResetToken, "new-password", "new-password")));
		Assertions.assertEquals(422, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertTrue(e.getGeneralErrors().get(0).contains("expired"), "Should explain that the link expired");

		// The clearing survives even though an error was reported
		AdminAccount adminAccount = adminAccountService.findAdminAccountByEmailAddress(SUPER_ADMIN_EMAIL_ADDRESS).get();
		Assertions.assertNull(adminAccount.passwordResetToken(), "Expired token should be cleared");
		Assertions.assertNull(adminAccount.passwordResetExpiresAt(), "Expired token expiry should be cleared");

		// A second attempt no longer finds the token at all
		e = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(expiredPasswordResetToken, "new-password", "new-password")));
		Assertions.assertEquals(422, e.getStatusCode().intValue(), "Bad status code");

		authenticationResource.requestPasswordReset(new PasswordResetRequest(SUPER_ADMIN_EMAIL_ADDRESS));
		String freshPasswordResetToken = emailDispatcher.getSentPasswordResets().get(1).passwordResetToken();

		authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(freshPasswordResetToken, "new-password", "new-password"));
		Assertions.assertNotNull(authenticationResource.login(new AdminLoginRequest(SUPER_ADMIN_EMAIL_ADDRESS, "new-password")));
	}

	@Test
	public void testPasswordResetValidation() {
		App app = TestingModule.createApp();
		AdminAuthenticationResource authenticationResource = app.getInjector().getInstance(AdminAuthenticationResource.class);
		MockEmailDispatcher emailDispatcher = (MockEmailDispatcher) app.getInjector().getInstance(EmailDispatcher.class);

		authenticationResource.requestPasswordReset(new PasswordResetRequest(SUPER_ADMIN_EMAIL_ADDRESS));
		String passwordResetToken = emailDispatcher.getSentPasswordResets().get(0).passwordResetToken();

		ApplicationException mismatch = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(passwordResetToken, "new-password", "other-password")));
		Assertions.assertTrue(mismatch.getFieldErrors().containsKey("passwordConfirmation"), "Mismatch should be reported");

		ApplicationException tooShort = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(passwordResetToken, "abc", "abc")));
		Assertions.assertTrue(tooShort.getFieldErrors().containsKey("password"), "Short password should be reported");

		// A blank password is either a mismatch or too short, nothing else
		ApplicationException blankMismatch = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(passwordResetToken, "", "abc")));
		Assertions.assertEquals(Set.of("passwordConfirmation"), blankMismatch.getFieldErrors().keySet(), "Blank password should be a mismatch");

		ApplicationException blankTooShort = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(passwordResetToken, "", "")));
		Assertions.assertEquals(Set.of("password"), blankTooShort.getFieldErrors().keySet(), "Blank password should be too short");
		Assertions.assertTrue(blankTooShort.getFieldErrors().get("password").get(0).contains("6"), "Minimum length should be reported");

		ApplicationException unknownToken = Assertions.assertThrows(ApplicationException.class, () ->
				authenticationResource.completePasswordReset(new PasswordResetCompleteRequest("no-such-token", "new-password", "new-password")));
		Assertions.assertEquals(422, unknownToken.getStatusCode().intValue(), "Bad status code");

		// Validation failures do not consume the token
		authenticationResource.completePasswordReset(new PasswordResetCompleteRequest(passwordResetToken, "new-password", "new-password"));
	}
}
