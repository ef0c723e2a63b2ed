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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jspecify.annotations.NonNull;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static com.crosspoint.volunteers.util.Normalizer.normalizeAccessToken;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates a JWT which securely carries the identity of an authenticated admin.
 * <p>
 * The token names the admin by email address only. Whether that admin is still active, and which role
 * it holds, is re-resolved against the admin directory on every request.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record AccessToken(
		@NonNull String emailAddress,
		@NonNull Instant issuedAt,
		@NonNull Instant expiresAt
) {
	// Manage our own internal GSON instance because our needs are simple - no need to inject one
	@NonNull
	private static final Gson GSON;
	@NonNull
	private static final String SIGNING_ALGORITHM;
	@NonNull
	private static final String JWT_ALGORITHM;

	static {
		GSON = new GsonBuilder().disableHtmlEscaping().create();
		SIGNING_ALGORITHM = "HmacSHA256";
		JWT_ALGORITHM = "HS256";
	}

	public AccessToken {
		requireNonNull(emailAddress);
		requireNonNull(issuedAt);
		requireNonNull(expiresAt);
	}

	// Parsing an AccessToken can have many outcomes.
	public sealed interface AccessTokenResult {
		record Succeeded(@NonNull AccessToken accessToken) implements AccessTokenResult {}

		record InvalidStructure() implements AccessTokenResult {}

		record SignatureMismatch() implements AccessTokenResult {}

		record Expired(@NonNull AccessToken accessToken, @NonNull Instant expiredAt) implements AccessTokenResult {}

		record MissingHeaders(@NonNull Set<@NonNull String> headers) implements AccessTokenResult {}

		record InvalidHeaders(@NonNull Set<@NonNull String> headers) implements AccessTokenResult {}

		record MissingClaims(@NonNull Set<@NonNull String> claims) implements AccessTokenResult {}
	}

	@NonNull
	public Boolean isExpiredAt(@NonNull Instant instant) {
		requireNonNull(instant);
		return !instant.isBefore(expiresAt());
	}

	/**
	 * Encodes this JWT to a string representation and signs it with HMAC-SHA256.
	 */
	@NonNull
	public String toStringRepresentation(@NonNull SecretKey secretKey) {
		requireNonNull(secretKey);

		Map<String, Object> header = new LinkedHashMap<>();
		header.put("alg", JWT_ALGORITHM);
		header.put("typ", "JWT");

		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("sub", emailAddress());
		payload.put("iat", issuedAt().getEpochSecond());
		payload.put("exp", expiresAt().getEpochSecond());

		String encodedHeader = base64UrlEncode(GSON.toJson(header).getBytes(StandardCharsets.UTF_8));
		String encodedPayload = base64UrlEncode(GSON.toJson(payload).getBytes(StandardCharsets.UTF_8));
		String signingInput = format("%s.%s", encodedHeader, encodedPayload);

		try {
			return format("%s.%s", signingInput, base64UrlEncode(sign(signingInput, secretKey)));
		} catch (GeneralSecurityException e) {
			throw new IllegalArgumentException("Unable to compute HMAC signature", e);
		}
	}

	/**
	 * Parses and verifies an AccessToken from its string representation.
	 * <p>
	 * Only a {@link AccessTokenResult.Succeeded} result should be trusted; every other outcome means the caller is unauthenticated.
	 *
	 * @param string    the compact JWT, optionally prefixed with {@code Bearer }
	 * @param secretKey the shared HMAC key
	 * @param now       the instant to test expiry against
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public static AccessTokenResult fromStringRepresentation(@NonNull String string,
																													 @NonNull SecretKey secretKey,
																													 @NonNull Instant now) {
		requireNonNull(string);
		requireNonNull(secretKey);
		requireNonNull(now);

		String token = normalizeAccessToken(string).orElse(null);

		if (token == null)
			return new AccessTokenResult.InvalidStructure();

		String[] components = token.split("\\.", -1);

		if (components.length != 3)
			return new AccessTokenResult.InvalidStructure();

		String encodedHeader = components[0];
		String encodedPayload = components[1];

		Map<String, Object> header;
		Map<String, Object> payload;
		byte[] signatureBytes;

		try {
			header = GSON.fromJson(new String(base64UrlDecode(encodedHeader), StandardCharsets.UTF_8), Map.class);
			payload = GSON.fromJson(new String(base64UrlDecode(encodedPayload), StandardCharsets.UTF_8), Map.class);
			signatureBytes = base64UrlDecode(components[2]);
		} catch (RuntimeException e) {
			// Bad base64, bad JSON, etc.
			return new AccessTokenResult.InvalidStructure();
		}

		if (header == null || payload == null)
			return new AccessTokenResult.InvalidStructure();

		Object algAsObject = header.get("alg");

		if (algAsObject == null)
			return new AccessTokenResult.MissingHeaders(Set.of("alg"));

		// Reject "none" and anything else we did not issue
		if (!JWT_ALGORITHM.equals(algAsObject))
			return new AccessTokenResult.InvalidHeaders(Set.of("alg"));

		try {
			byte[] expectedSignatureBytes = sign(format("%s.%s", encodedHeader, encodedPayload), secretKey);

			if (!MessageDigest.isEqual(expectedSignatureBytes, signatureBytes))
				return new AccessTokenResult.SignatureMismatch();
		} catch (GeneralSecurityException e) {
			return new AccessTokenResult.InvalidStructure();
		}

		Object subAsObject = payload.get("sub");
		Object iatAsObject = payload.get("iat");
		Object expAsObject = payload.get("exp");

		Set<String> missingClaims = new LinkedHashSet<>();

		if (!(subAsObject instanceof String))
			missingClaims.add("sub");
		if (!(iatAsObject instanceof Number))
			missingClaims.add("iat");
		if (!(expAsObject instanceof Number))
			missingClaims.add("exp");

		if (!missingClaims.isEmpty())
			return new AccessTokenResult.MissingClaims(missingClaims);

		AccessToken accessToken = new AccessToken((String) subAsObject,
				Instant.ofEpochSecond(((Number) iatAsObject).longValue()),
				Instant.ofEpochSecond(((Number) expAsObject).longValue()));

		if (accessToken.isExpiredAt(now))
			return new AccessTokenResult.Expired(accessToken, accessToken.expiresAt());

		return new AccessTokenResult.Succeeded(accessToken);
	}

	@NonNull
	private static byte[] sign(@NonNull String signingInput,
														 @NonNull SecretKey secretKey) throws GeneralSecurityException {
		requireNonNull(signingInput);
		requireNonNull(secretKey);

		Mac mac = Mac.getInstance(SIGNING_ALGORITHM);
		mac.init(secretKey);

		return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
	}

	@NonNull
	private static String base64UrlEncode(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
	}

	@NonNull
	private static byte[] base64UrlDecode(@NonNull String string) {
		requireNonNull(string);
		return Base64.getUrlDecoder().decode(string);
	}
}
