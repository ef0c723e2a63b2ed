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

package com.crosspoint.volunteers.model.auth;

import com.crosspoint.volunteers.model.auth.AccessToken.AccessTokenResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AccessTokenTests {
	private static final SecretKey SECRET_KEY = new SecretKeySpec(
			"test-secret-test-secret-test-secret!".getBytes(StandardCharsets.UTF_8), "HmacSHA256");
	private static final Instant ISSUED_AT = Instant.parse("2025-03-01T15:00:00Z");

	@Test
	public void testRoundTripWithinExpiry() {
		AccessToken accessToken = new AccessToken("admin@crosspointbc.org", ISSUED_AT, ISSUED_AT.plus(Duration.ofHours(8)));
		String string = accessToken.toStringRepresentation(SECRET_KEY);

		AccessTokenResult result = AccessToken.fromStringRepresentation(string, SECRET_KEY, ISSUED_AT.plus(Duration.ofHours(1)));

		Assertions.assertTrue(result instanceof AccessTokenResult.Succeeded, "Token should verify");
		Assertions.assertEquals(accessToken, ((AccessTokenResult.Succeeded) result).accessToken());
	}

	@Test
	public void testExpiry() {
		AccessToken accessToken = new AccessToken("admin@crosspointbc.org", ISSUED_AT, ISSUED_AT.plus(Duration.ofHours(8)));
		String string = accessToken.toStringRepresentation(SECRET_KEY);

		Assertions.assertTrue(AccessToken.fromStringRepresentation(string, SECRET_KEY, ISSUED_AT.plus(Duration.ofHours(8)))
				instanceof AccessTokenResult.Expired, "Token should expire exactly at its expiry instant");
	}

	@Test
	public void testTamperingIsDetected() {
		String string = new AccessToken("admin@crosspointbc.org", ISSUED_AT, ISSUED_AT.plus(Duration.ofHours(8)))
				.toStringRepresentation(SECRET_KEY);
		String[] components = string.split("\\.");

		// Swap in a payload naming someone else
		String forgedPayload = Base64.getUrlEncoder().withoutPadding().encodeToString(
				"{\"sub\":\"intruder@example.com\",\"iat\":1740841200,\"exp\":4102444800}".getBytes(StandardCharsets.UTF_8));
		String forged = components[0] + "." + forgedPayload + "." + components[2];

		Assertions.assertTrue(AccessToken.fromStringRepresentation(forged, SECRET_KEY, ISSUED_AT) instanceof AccessTokenResult.SignatureMismatch);

		SecretKey otherSecretKey = new SecretKeySpec("another-secret-another-secret-12345".getBytes(StandardCharsets.UTF_8), "HmacSHA256");
		Assertions.assertTrue(AccessToken.fromStringRepresentation(string, otherSecretKey, ISSUED_AT) instanceof AccessTokenResult.SignatureMismatch);
	}

	@Test
	public void testUnsignedAlgorithmIsRejected() {
		String header = Base64.getUrlEncoder().withoutPadding().encodeToString("{\"alg\":\"none\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
		String payload = Base64.getUrlEncoder().withoutPadding().encodeToString(
				"{\"sub\":\"admin@crosspointbc.org\",\"iat\":1740841200,\"exp\":4102444800}".getBytes(StandardCharsets.UTF_8));

		Assertions.assertTrue(AccessToken.fromStringRepresentation(header + "." + payload + ".", SECRET_KEY, ISSUED_AT)
				instanceof AccessTokenResult.InvalidHeaders);
	}

	@Test
	public void testMalformedInput() {
		Assertions.assertTrue(AccessToken.fromStringRepresentation("", SECRET_KEY, ISSUED_AT) instanceof AccessTokenResult.InvalidStructure);
		Assertions.assertTrue(AccessToken.fromStringRepresentation("abc", SECRET_KEY, ISSUED_AT) instanceof AccessTokenResult.InvalidStructure);
		Assertions.assertTrue(AccessToken.fromStringRepresentation("!!.??.**", SECRET_KEY, ISSUED_AT) instanceof AccessTokenResult.InvalidStructure);
	}
}
