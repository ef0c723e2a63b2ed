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
import java.util.regex.Pattern;

/**
 * Utilities for validating user-supplied input.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Validator {
	private static final int EMAIL_ADDRESS_MAX_LENGTH;
	private static final int EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH;
	private static final int EMAIL_ADDRESS_MAX_DOMAIN_LENGTH;
	private static final int PHONE_NUMBER_MIN_DIGITS;
	private static final int PHONE_NUMBER_MAX_DIGITS;
	@NonNull
	private static final Pattern EMAIL_ADDRESS_LOCAL_PART_PATTERN;
	@NonNull
	private static final Pattern EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN;
	@NonNull
	private static final Pattern PHONE_NUMBER_PATTERN;

	static {
		EMAIL_ADDRESS_MAX_LENGTH = 320;
		EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH = 64;
		EMAIL_ADDRESS_MAX_DOMAIN_LENGTH = 255;
		PHONE_NUMBER_MIN_DIGITS = 7;
		PHONE_NUMBER_MAX_DIGITS = 15;
		EMAIL_ADDRESS_LOCAL_PART_PATTERN = Pattern.compile("^[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*$");
		EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?$");
		PHONE_NUMBER_PATTERN = Pattern.compile("^\\+?[0-9 ().-]+$");
	}

	@NonNull
	public static Boolean isValidEmailAddress(@Nullable String emailAddress) {
		String trimmed = Normalizer.trimAggressivelyToNull(emailAddress);

		if (trimmed == null || trimmed.length() > EMAIL_ADDRESS_MAX_LENGTH)
			return false;

		if (trimmed.chars().anyMatch(Character::isWhitespace))
			return false;

		int atIndex = trimmed.indexOf('@');

		if (atIndex <= 0 || atIndex != trimmed.lastIndexOf('@') || atIndex == trimmed.length() - 1)
			return false;

		return isValidLocalPart(trimmed.substring(0, atIndex)) && isValidDomain(trimmed.substring(atIndex + 1));
	}

	/**
	 * Loose check for something dialable: digits plus common punctuation, 7-15 digits in total.
	 */
	@NonNull
	public static Boolean isValidPhoneNumber(@Nullable String phoneNumber) {
		String trimmed = Normalizer.trimAggressivelyToNull(phoneNumber);

		if (trimmed == null || !PHONE_NUMBER_PATTERN.matcher(trimmed).matches())
			return false;

		long digitCount = trimmed.chars().filter(Character::isDigit).count();
		return digitCount >= PHONE_NUMBER_MIN_DIGITS && digitCount <= PHONE_NUMBER_MAX_DIGITS;
	}

	private static boolean isValidLocalPart(@NonNull String localPart) {
		return localPart.length() <= EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH
				&& EMAIL_ADDRESS_LOCAL_PART_PATTERN.matcher(localPart).matches();
	}

	private static boolean isValidDomain(@NonNull String domain) {
		if (domain.length() > EMAIL_ADDRESS_MAX_DOMAIN_LENGTH || domain.startsWith(".") || domain.endsWith("."))
			return false;

		String[] labels = domain.split("\\.");

		if (labels.length < 2)
			return false;

		for (String label : labels)
			if (!EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN.matcher(label).matches())
				return false;

		// TLDs are at least two characters
		return labels[labels.length - 1].length() >= 2;
	}

	private Validator() {
		// Non-instantiable
	}
}
