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
import com.crosspoint.volunteers.TestingModule;
import com.crosspoint.volunteers.exception.ApplicationException;
import com.crosspoint.volunteers.exception.AuthorizationException;
import com.crosspoint.volunteers.exception.NotFoundException;
import com.crosspoint.volunteers.model.api.request.AdminAccountCreateRequest;
import com.crosspoint.volunteers.model.api.request.AdminAccountUpdateRequest;
import com.crosspoint.volunteers.model.api.request.AdminLoginRequest;
import com.crosspoint.volunteers.model.api.response.AdminAccountResponse;
import com.crosspoint.volunteers.model.auth.AdminRole;
import com.crosspoint.volunteers.service.AdminAccountService;
import com.pyranid.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AdminAccountResourceTests {
	@Test
	public void testOnlySuperAdminCanCreateAdmins() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");

		AdminAccountResponse helper = adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("Helper@CrosspointBC.org", "helper-password", " Helper   Person "));

		Assertions.assertEquals("helper@crosspointbc.org", helper.getEmailAddress(), "Email should be lower-cased");
		Assertions.assertEquals("Helper Person", helper.getName().get(), "Name should be normalized");
		Assertions.assertEquals(AdminRole.ADMIN, helper.getRole(), "New admins are never super admin");
		Assertions.assertTrue(helper.getActive(), "New admins are active");

		String helperAccessToken = login(app, "helper@crosspointbc.org", "helper-password");

		Assertions.assertThrows(AuthorizationException.class, () -> adminAccountResource.createAdminAccount(helperAccessToken,
				new AdminAccountCreateRequest("another@crosspointbc.org", "another-password", null)));

		// Plain admins can still read the directory
		Assertions.assertEquals(2, adminAccountResource.findAdminAccounts(helperAccessToken).size(), "Wrong number of admins");
	}

	@Test
	public void testCreateAdminValidation() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () -> adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("not-an-email", "short", null)));

		Assertions.assertEquals(422, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertTrue(e.getFieldErrors().containsKey("emailAddress"), "Email should be rejected");
		Assertions.assertTrue(e.getFieldErrors().containsKey("password"), "Password should be rejected");
	}

	@Test
	public void testDuplicateEmailAddressIsCaseInsensitive() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");

		adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("helper@crosspointbc.org", "helper-password", null));

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () -> adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("HELPER@crosspointbc.org", "helper-password", null)));

		Assertions.assertEquals(409, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertTrue(e.getFieldErrors().containsKey("emailAddress"), "Email should be flagged");
	}

	@Test
	public void testAdminCannotDeactivateSelf() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");

		AdminAccountResponse helper = adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("helper@crosspointbc.org", "helper-password", null));
		String helperAccessToken = login(app, "helper@crosspointbc.org", "helper-password");

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () -> adminAccountResource.updateAdminAccount(helperAccessToken,
				helper.getAdminAccountId(), new AdminAccountUpdateRequest(null, false, null)));

		Assertions.assertEquals(403, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertTrue(adminAccountResource.currentAdminAccount(helperAccessToken).getActive(), "Helper should still be active");

		// Renaming yourself is fine
		AdminAccountResponse renamed = adminAccountResource.updateAdminAccount(helperAccessToken,
				helper.getAdminAccountId(), new AdminAccountUpdateRequest(null, null, "New Name"));
		Assertions.assertEquals("New Name", renamed.getName().get());
	}

	@Test
	public void testSuperAdminCannotDeactivateSelf() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");
		Long superAdminAccountId = adminAccountResource.currentAdminAccount(superAdminAccessToken).getAdminAccountId();

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () -> adminAccountResource.updateAdminAccount(superAdminAccessToken,
				superAdminAccountId, new AdminAccountUpdateRequest(null, false, null)));

		Assertions.assertEquals(403, e.getStatusCode().intValue(), "Bad status code");

		AdminAccountResponse superAdmin = adminAccountResource.currentAdminAccount(superAdminAccessToken);
		Assertions.assertTrue(superAdmin.getActive(), "Super admin should still be active");
		Assertions.assertEquals(AdminRole.SUPER_ADMIN, superAdmin.getRole(), "Super admin should keep the role");
	}

	@Test
	public void testSuperAdminCannotBeDeactivated() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");
		Long superAdminAccountId = adminAccountResource.currentAdminAccount(superAdminAccessToken).getAdminAccountId();

		adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("helper@crosspointbc.org", "helper-password", null));
		String helperAccessToken = login(app, "helper@crosspointbc.org", "helper-password");

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () -> adminAccountResource.updateAdminAccount(helperAccessToken,
				superAdminAccountId, new AdminAccountUpdateRequest(null, false, null)));

		Assertions.assertEquals(403, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertThrows(NotFoundException.class, () -> adminAccountResource.updateAdminAccount(helperAccessToken,
				999_999L, new AdminAccountUpdateRequest(null, false, null)));
	}

	@Test
	public void testReactivationCannotCreateSecondSuperAdmin() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		Database database = app.getInjector().getInstance(Database.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");

		AdminAccountResponse helper = adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("helper@crosspointbc.org", "helper-password", null));

		adminAccountResource.updateAdminAccount(superAdminAccessToken, helper.getAdminAccountId(), new AdminAccountUpdateRequest(null, false, null));

		// Simulate legacy data: an inactive account still carrying the flag
		database.execute("UPDATE admin_account SET super_admin=TRUE WHERE admin_account_id=?", helper.getAdminAccountId());

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () -> adminAccountResource.updateAdminAccount(superAdminAccessToken,
				helper.getAdminAccountId(), new AdminAccountUpdateRequest(null, true, null)));

		Assertions.assertEquals(422, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertEquals(1L, app.getInjector().getInstance(AdminAccountService.class).countActiveSuperAdmins().longValue());
	}

	@Test
	public void testTransferSuperAdmin() {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");
		Long superAdminAccountId = adminAccountResource.currentAdminAccount(superAdminAccessToken).getAdminAccountId();

		AdminAccountResponse helper = adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("helper@crosspointbc.org", "helper-password", null));
		AdminAccountResponse inactive = adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("inactive@crosspointbc.org", "inactive-password", null));
		adminAccountResource.updateAdminAccount(superAdminAccessToken, inactive.getAdminAccountId(), new AdminAccountUpdateRequest(null, false, null));

		ApplicationException selfTransfer = Assertions.assertThrows(ApplicationException.class, () ->
				adminAccountResource.transferSuperAdmin(superAdminAccessToken, superAdminAccountId));
		Assertions.assertEquals(422, selfTransfer.getStatusCode().intValue(), "Bad status code");

		Assertions.assertThrows(NotFoundException.class, () -> adminAccountResource.transferSuperAdmin(superAdminAccessToken, 999_999L));

		ApplicationException inactiveTarget = Assertions.assertThrows(ApplicationException.class, () ->
				adminAccountResource.transferSuperAdmin(superAdminAccessToken, inactive.getAdminAccountId()));
		Assertions.assertEquals(422, inactiveTarget.getStatusCode().intValue(), "Bad status code");

		String helperAccessToken = login(app, "helper@crosspointbc.org", "helper-password");
		Assertions.assertThrows(AuthorizationException.class, () -> adminAccountResource.transferSuperAdmin(helperAccessToken, superAdminAccountId));

		// Transferring to yourself is invalid no matter which role you hold
		ApplicationException helperSelfTransfer = Assertions.assertThrows(ApplicationException.class, () ->
				adminAccountResource.transferSuperAdmin(helperAccessToken, helper.getAdminAccountId()));
		Assertions.assertEquals(422, helperSelfTransfer.getStatusCode().intValue(), "Bad status code");
		Assertions.assertEquals(AdminRole.ADMIN, adminAccountResource.currentAdminAccount(helperAccessToken).getRole(), "Helper should still be a plain admin");

		AdminAccountResponse newSuperAdmin = adminAccountResource.transferSuperAdmin(superAdminAccessToken, helper.getAdminAccountId());
		Assertions.assertEquals(AdminRole.SUPER_ADMIN, newSuperAdmin.getRole(), "Helper should now be super admin");
		Assertions.assertEquals(AdminRole.ADMIN, adminAccountResource.currentAdminAccount(superAdminAccessToken).getRole(), "Old super admin should be demoted");

		// The old super admin's token still authenticates, but no longer carries the role
		Assertions.assertThrows(AuthorizationException.class, () -> adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("another@crosspointbc.org", "another-password", null)));

		// The old super admin can now be deactivated by the new one
		adminAccountResource.updateAdminAccount(helperAccessToken, superAdminAccountId, new AdminAccountUpdateRequest(null, false, null));
		Assertions.assertEquals(1L, app.getInjector().getInstance(AdminAccountService.class).countActiveSuperAdmins().longValue());
	}

	@Test
	public void testConcurrentTransfersLeaveExactlyOneSuperAdmin() throws Exception {
		App app = TestingModule.createApp();
		AdminAccountResource adminAccountResource = app.getInjector().getInstance(AdminAccountResource.class);
		String superAdminAccessToken = login(app, "admin@crosspointbc.org", "bootstrap-password");

		Long firstTargetId = adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("first@crosspointbc.org", "first-password", null)).getAdminAccountId();
		Long secondTargetId = adminAccountResource.createAdminAccount(superAdminAccessToken,
				new AdminAccountCreateRequest("second@crosspointbc.org", "second-password", null)).getAdminAccountId();

		ExecutorService executorService = Executors.newFixedThreadPool(2);
		CountDownLatch startLatch = new CountDownLatch(1);
		List<Future<AdminAccountResponse>> futures = new ArrayList<>();

		try {
			for (Long targetId : List.of(firstTargetId, secondTargetId)) {
				futures.add(executorService.submit(() -> {
					startLatch.await();
					return adminAccountResource.transferSuperAdmin(superAdminAccessToken, targetId);
				}));
			}

			startLatch.countDown();

			int successes = 0;

			for (Future<AdminAccountResponse> future : futures) {
				try {
					future.get(30, TimeUnit.SECONDS);
					++successes;
				} catch (ExecutionException e) {
					Throwable cause = e.getCause();
					Assertions.assertTrue(cause instanceof AuthorizationException || cause instanceof ApplicationException,
							"Losing transfer failed in an unexpected way: " + cause);
				}
			}

			Assertions.assertEquals(1, successes, "Exactly one transfer should win");
		} finally {
			executorService.shutdownNow();
		}

		Assertions.assertEquals(1L, app.getInjector().getInstance(AdminAccountService.class).countActiveSuperAdmins().longValue(),
				"There must be exactly one active super admin");
	}

	private String login(App app, String emailAddress, String password) {
		return app.getInjector().getInstance(AdminAuthenticationResource.class)
				.login(new AdminLoginRequest(emailAddress, password))
				.accessToken();
	}
}
