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

package com.crosspoint.volunteers;

import com.crosspoint.volunteers.util.PasswordManager;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * Overrides for tests: a controllable clock and a password hasher cheap enough to call many times per test.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TestingModule extends AbstractModule {
	@NonNull
	private final MutableClock clock;

	public TestingModule() {
		this(new MutableClock(Instant.parse("2025-03-01T15:00:00Z")));
	}

	public TestingModule(@NonNull MutableClock clock) {
		requireNonNull(clock);
		this.clock = clock;
	}

	@NonNull
	public static App createApp() {
		return new App(new Configuration("local"), new TestingModule());
	}

	@NonNull
	@Provides
	@Singleton
	public Clock provideClock() {
		return this.clock;
	}

	@NonNull
	@Provides
	@Singleton
	public MutableClock provideMutableClock() {
		return this.clock;
	}

	@NonNull
	@Provides
	@Singleton
	public PasswordManager providePasswordManager() {
		return PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512")
				.iterations(1_000)
				.saltLength(16)
				.keyLength(256)
				.build();
	}
}
