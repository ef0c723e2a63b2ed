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

package com.crosspoint.volunteers.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class PasswordManagerTests {
	@Test
	public void testHashAndVerify() {
		PasswordManager passwordManager = PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512")
				.iterations(1_000)
				.build();

		String firstHash = passwordManager.hashPassword("correct horse");
		String secondHash = passwordManager.hashPassword("correct horse");

		Assertions.assertNotEquals(firstHash, secondHash, "Salting should make every hash unique");
		Assertions.assertTrue(firstHash.startsWith("PBKDF2WithHmacSHA512:1000:"), "Parameters should be encoded in the hash");

		Assertions.assertTrue(passwordManager.verifyPassword("correct horse", firstHash));
		Assertions.assertTrue(passwordManager.verifyPassword("correct horse", secondHash));
		Assertions.assertFalse(passwordManager.verifyPassword("battery staple", firstHash));
	}

	@Test
	public void testHashesRemainVerifiableAfterWorkFactorChange() {
		String hash = PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512").iterations(1_000).build().hashPassword("secret");
		PasswordManager strongerPasswordManager = PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512").iterations(2_000).build();

		Assertions.assertTrue(strongerPasswordManager.verifyPassword("secret", hash), "Stored parameters should drive verification");
	}

	@Test
	public void testMalformedHashNeverVerifies() {
		PasswordManager passwordManager = PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512").iterations(1_000).build();

		Assertions.assertFalse(passwordManager.verifyPassword("secret", ""));
		Assertions.assertFalse(passwordManager.verifyPassword("secret", "not-a-hash"));
		Assertions.assertFalse(passwordManager.verifyPassword("secret", "PBKDF2WithHmacSHA512:abc:512:salt:hash"));
		Assertions.assertFalse(passwordManager.verifyPassword("secret", "NoSuchAlgorithm:1000:512:c2FsdA==:aGFzaA=="));
	}
}
