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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Hashes administrator passwords with PBKDF2 and verifies plaintext against stored hashes.
 * <p>
 * Hashes are self-describing strings of the form {@code <algorithm>:<iterations>:<key length>:<salt>:<hash>},
 * so the work factor can be raised later without invalidating existing hashes.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class PasswordManager {
	@NonNull
	private static final Integer DEFAULT_ITERATIONS;
	@NonNull
	private static final Integer DEFAULT_SALT_LENGTH;
	@NonNull
	private static final Integer DEFAULT_KEY_LENGTH;
	@NonNull
	private static final Integer HASH_COMPONENT_COUNT;

	static {
		DEFAULT_ITERATIONS = 210_000; // OWASP 2023 recommendation for PBKDF2-HMAC-SHA512
		DEFAULT_SALT_LENGTH = 64;
		DEFAULT_KEY_LENGTH = 512;
		HASH_COMPONENT_COUNT = 5;
	}

	@NonNull
	private final String hashAlgorithm;
	@NonNull
	private final Integer iterations;
	@NonNull
	private final Integer saltLength;
	@NonNull
	private final Integer keyLength;
	@NonNull
	private final SecureRandom secureRandom;
	@NonNull
	private final Logger logger;

	@NonNull
	public static Builder withHashAlgorithm(@NonNull String hashAlgorithm) {
		requireNonNull(hashAlgorithm);
		return new Builder(hashAlgorithm);
	}

	private PasswordManager(@NonNull Builder builder) {
		requireNonNull(builder);

		this.hashAlgorithm = requireNonNull(builder.hashAlgorithm);
		this.iterations = builder.iterations == null ? DEFAULT_ITERATIONS : builder.iterations;
		this.saltLength = builder.saltLength == null ? DEFAULT_SALT_LENGTH : builder.saltLength;
		this.keyLength = builder.keyLength == null ? DEFAULT_KEY_LENGTH : builder.keyLength;
		this.secureRandom = new SecureRandom();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Produces a salted hash of the given password. Two calls with the same input never return the same value.
	 */
	@NonNull
	public String hashPassword(@NonNull String plaintextPassword) {
		requireNonNull(plaintextPassword);

		byte[] salt = new byte[getSaltLength()];
		getSecureRandom().nextBytes(salt);

		try {
			byte[] hash = deriveKey(getHashAlgorithm(), plaintextPassword, salt, getIterations(), getKeyLength());
			return format("%s:%d:%d:%s:%s", getHashAlgorithm(), getIterations(), getKeyLength(), base64Encode(salt), base64Encode(hash));
		} catch (GeneralSecurityException e) {
			throw new IllegalStateException(format("Unable to hash password using %s", getHashAlgorithm()), e);
		}
	}

	/**
	 * Checks a plaintext password against a stored hash in constant time.
	 * <p>
	 * A stored hash that cannot be parsed is treated as a mismatch rather than an error.
	 */
	@NonNull
	public Boolean verifyPassword(@NonNull String plaintextPassword,
																@NonNull String storedHash) {
		requireNonNull(plaintextPassword);
		requireNonNull(storedHash);

		String[] components = storedHash.split(":");

		if (components.length != HASH_COMPONENT_COUNT) {
			getLogger().warn("Encountered a malformed password hash ({} components), treating as a mismatch", components.length);
			return false;
		}

		try {
			String hashAlgorithm = components[0];
			int iterations = Integer.parseInt(components[1]);
			int keyLength = Integer.parseInt(components[2]);
			byte[] salt = base64Decode(components[3]);
			byte[] expectedHash = base64Decode(components[4]);

			byte[] actualHash = deriveKey(hashAlgorithm, plaintextPassword, salt, iterations, keyLength);
			return MessageDigest.isEqual(expectedHash, actualHash);
		} catch (IllegalArgumentException | GeneralSecurityException e) {
			// NumberFormatException and bad Base64 both surface as IllegalArgumentException
			getLogger().warn("Unable to verify against a malformed password hash, treating as a mismatch", e);
			return false;
		}
	}

	@NonNull
	private static byte[] deriveKey(@NonNull String hashAlgorithm,
																	@NonNull String plaintextPassword,
																	@NonNull byte[] salt,
																	int iterations,
																	int keyLength) throws GeneralSecurityException {
		PBEKeySpec keySpec = new PBEKeySpec(plaintextPassword.toCharArray(), salt, iterations, keyLength);

		try {
			return SecretKeyFactory.getInstance(hashAlgorithm).generateSecret(keySpec).getEncoded();
		} finally {
			keySpec.clearPassword();
		}
	}

	@NonNull
	private static String base64Encode(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return Base64.getEncoder().withoutPadding().encodeToString(bytes);
	}

	@NonNull
	private static byte[] base64Decode(@NonNull String string) {
		requireNonNull(string);
		return Base64.getDecoder().decode(string);
	}

	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String hashAlgorithm;
		@Nullable
		private Integer iterations;
		@Nullable
		private Integer saltLength;
		@Nullable
		private Integer keyLength;

		private Builder(@NonNull String hashAlgorithm) {
			requireNonNull(hashAlgorithm);
			this.hashAlgorithm = hashAlgorithm;
		}

		@NonNull
		public Builder iterations(@Nullable Integer iterations) {
			this.iterations = iterations;
			return this;
		}

		@NonNull
		public Builder saltLength(@Nullable Integer saltLength) {
			this.saltLength = saltLength;
			return this;
		}

		@NonNull
		public Builder keyLength(@Nullable Integer keyLength) {
			this.keyLength = keyLength;
			return this;
		}

		@NonNull
		public PasswordManager build() {
			return new PasswordManager(this);
		}
	}

	@NonNull
	public String getHashAlgorithm() {
		return this.hashAlgorithm;
	}

	@NonNull
	public Integer getIterations() {
		return this.iterations;
	}

	@NonNull
	public Integer getSaltLength() {
		return this.saltLength;
	}

	@NonNull
	public Integer getKeyLength() {
		return this.keyLength;
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
