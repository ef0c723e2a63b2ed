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

package com.crosspoint.volunteers.mock;

import com.crosspoint.volunteers.util.SecretsManager;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.crosspoint.volunteers.util.Normalizer.trimAggressivelyToNull;
import static java.lang.String.format;

/**
 * Mock implementation of {@link SecretsManager} which pulls secrets from files under {@code secrets/}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockSecretsManager implements SecretsManager {
	@NonNull
	private final String accessTokenSecret;
	@NonNull
	private final String bootstrapAdminPassword;
	@Nullable
	private final String smtpPassword;

	public MockSecretsManager() {
		// Hardcode paths; this is a mock implementation
		this.accessTokenSecret = loadRequiredSecret(Path.of("secrets/access-token-secret"));
		this.bootstrapAdminPassword = loadRequiredSecret(Path.of("secrets/bootstrap-admin-password"));
		this.smtpPassword = loadOptionalSecret(Path.of("secrets/smtp-password")).orElse(null);
	}

	@NonNull
	@Override
	public String getAccessTokenSecret() {
		return this.accessTokenSecret;
	}

	@NonNull
	@Override
	public String getBootstrapAdminPassword() {
		return this.bootstrapAdminPassword;
	}

	@NonNull
	@Override
	public Optional<String> getSmtpPassword() {
		return Optional.ofNullable(this.smtpPassword);
	}

	@NonNull
	private String loadRequiredSecret(@NonNull Path path) {
		if (!Files.isRegularFile(path))
			throw new IllegalStateException(format("Secret file not found at %s", path.toAbsolutePath()));

		return loadOptionalSecret(path).orElseThrow(() ->
				new IllegalStateException(format("Secret file at %s is empty", path.toAbsolutePath())));
	}

	@NonNull
	private Optional<String> loadOptionalSecret(@NonNull Path path) {
		if (!Files.isRegularFile(path))
			return Optional.empty();

		try {
			return Optional.ofNullable(trimAggressivelyToNull(Files.readString(path, StandardCharsets.UTF_8)));
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading secret from %s", path.toAbsolutePath()), e);
		}
	}
}
