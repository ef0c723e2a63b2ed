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
public class ValidatorTests {
	@Test
	public void testEmailAddresses() {
		Assertions.assertTrue(Validator.isValidEmailAddress("admin@crosspointbc.org"));
		Assertions.assertTrue(Validator.isValidEmailAddress("first.last+volunteers@mail.example.com"));

		Assertions.assertFalse(Validator.isValidEmailAddress(null));
		Assertions.assertFalse(Validator.isValidEmailAddress("not-an-email"));
		Assertions.assertFalse(Validator.isValidEmailAddress("admin@localhost"));
		Assertions.assertFalse(Validator.isValidEmailAddress("admin@@crosspointbc.org"));
		Assertions.assertFalse(Validator.isValidEmailAddress("ad min@crosspointbc.org"));
		Assertions.assertFalse(Validator.isValidEmailAddress(".admin@crosspointbc.org"));
	}

	@Test
	public void testPhoneNumbers() {
		Assertions.assertTrue(Validator.isValidPhoneNumber("(555) 123-4567"));
		Assertions.assertTrue(Validator.isValidPhoneNumber("+1 555.123.4567"));

		Assertions.assertFalse(Validator.isValidPhoneNumber("123"));
		Assertions.assertFalse(Validator.isValidPhoneNumber("call me maybe"));
		Assertions.assertFalse(Validator.isValidPhoneNumber(null));
	}
}
