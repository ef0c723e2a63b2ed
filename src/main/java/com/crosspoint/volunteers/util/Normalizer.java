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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Utilities for normalizing user-supplied input.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Normalizer {
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern INTERIOR_WHITESPACE_PATTERN;
	@NonNull
	private static final String BEARER_PREFIX;

	static {
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
		INTERIOR_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+");
		BEARER_PREFIX = "bearer ";
	}

	/**
	 * Trims and lower-cases an email address.
	 * <p>
	 * Email addresses are stored and compared lower-cased, so every lookup path must go through here.
	 */
	@NonNull
	public static Optional<String> normalizeEmailAddress(@Nullable String emailAddress) {
		emailAddress = trimAggressivelyToNull(emailAddress);

		if (emailAddress == null)
			return Optional.empty();

		return Optional.of(emailAddress.toLowerCase(Locale.ROOT));
	}

	/**
	 * Collapses runs of interior whitespace in a display name, e.g. {@code "  Jane   Doe "} becomes {@code "Jane Doe"}.
	 */
	@NonNull
	public static Optional<String> normalizeName(@Nullable String name) {
		name = trimAggressivelyToNull(name);

		if (name == null)
			return Optional.empty();

		return Optional.of(INTERIOR_WHITESPACE_PATTERN.matcher(name).replaceAll(" "));
	}

	/**
	 * Accepts either a raw access token or an {@code Authorization} header value of the form {@code Bearer <token>}.
	 */
	@NonNull
	public static Optional<String> normalizeAccessToken(@Nullable String accessToken) {
		accessToken = trimAggressivelyToNull(accessToken);

		if (accessToken == null)
			return Optional.empty();

		if (accessToken.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX))
			accessToken = trimAggressivelyToNull(accessToken.substring(BEARER_PREFIX.length()));

		return Optional.ofNullable(accessToken);
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 */
	@NonNull
	public static Optional<String> trimAggressively(@Nullable String string) {
		if (string == null)
			return Optional.empty();

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return Optional.of(string);

		string = TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		return Optional.of(string);
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		String trimmed = trimAggressively(string).orElse(null);
		return trimmed == null || trimmed.length() == 0 ? null : trimmed;
	}

	private Normalizer() {
		// Non-instantiable
	}
}
