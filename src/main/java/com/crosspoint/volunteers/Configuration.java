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

import com.crosspoint.volunteers.mock.MockSecretsManager;
import com.crosspoint.volunteers.util.EmailDispatcher;
import com.crosspoint.volunteers.util.SecretsManager;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.crosspoint.volunteers.util.Normalizer.normalizeEmailAddress;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toUnmodifiableSet;

/**
 * Encapsulates system-wide configuration.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class Configuration {
	@NonNull
	private static final Locale DEFAULT_LOCALE;
	@NonNull
	private static final ZoneId DEFAULT_TIME_ZONE;
	@NonNull
	private static final Gson GSON;
	// Access tokens are signed with HMAC-SHA256, so the secret must be at least as long as the hash output
	private static final int MINIMUM_ACCESS_TOKEN_SECRET_LENGTH;

	static {
		DEFAULT_LOCALE = Locale.US;
		DEFAULT_TIME_ZONE = ZoneId.of("America/Chicago");
		GSON = new GsonBuilder().disableHtmlEscaping().create();
		MINIMUM_ACCESS_TOKEN_SECRET_LENGTH = 32;
	}

	@NonNull
	private final String environment;
	@NonNull
	private final Duration accessTokenExpiration;
	@NonNull
	private final Duration passwordResetExpiration;
	@NonNull
	private final String passwordResetLinkTemplate;
	@NonNull
	private final SecretKey accessTokenSecretKey;
	@NonNull
	private final BootstrapAdmin bootstrapAdmin;
	@NonNull
	private final Set<@NonNull String> notificationEmailAddresses;
	@NonNull
	private final List<@NonNull CustomMinistryAreaSeed> customMinistryAreaSeeds;
	private final SecretsManager.@NonNull Type secretsManagerType;
	private final EmailDispatcher.@NonNull Type emailDispatcherType;
	@Nullable
	private final SmtpSettings smtpSettings;

	public Configuration(@NonNull String environment) {
		requireNonNull(environment);

		ConfigFile configFile = loadConfigFileForEnvironment(environment);

		this.environment = environment;
		this.accessTokenExpiration = Duration.ofSeconds(configFile.accessTokenExpirationInSeconds());
		this.passwordResetExpiration = Duration.ofSeconds(configFile.passwordResetExpirationInSeconds());
		this.passwordResetLinkTemplate = configFile.passwordResetLinkTemplate();
		this.secretsManagerType = configFile.secretsManager().type();
		this.emailDispatcherType = configFile.emailDispatcher().type();
		this.smtpSettings = configFile.emailDispatcher().smtp();
		this.bootstrapAdmin = new BootstrapAdmin(
				normalizeEmailAddress(configFile.bootstrapAdmin().emailAddress()).orElseThrow(),
				configFile.bootstrapAdmin().name());
		this.notificationEmailAddresses = configFile.notificationEmailAddresses() == null ? Set.of()
				: configFile.notificationEmailAddresses().stream()
				.map(emailAddress -> normalizeEmailAddress(emailAddress).orElse(null))
				.filter(emailAddress -> emailAddress != null)
				.collect(toUnmodifiableSet());
		this.customMinistryAreaSeeds = configFile.customMinistryAreas() == null ? List.of() : List.copyOf(configFile.customMinistryAreas());
		this.accessTokenSecretKey = loadAccessTokenSecretKey(this.secretsManagerType);

		// Initialize Logback if not done already
		if (System.getProperty("logback.configurationFile") == null)
			System.setProperty("logback.configurationFile", format("config/%s/logback.xml", environment));
	}

	@NonNull
	private SecretKey loadAccessTokenSecretKey(SecretsManager.@NonNull Type secretsManagerType) {
		requireNonNull(secretsManagerType);

		String accessTokenSecret = null;

		// Use the appropriate SecretsManager to pull data
		switch (secretsManagerType) {
			case MOCK -> accessTokenSecret = new MockSecretsManager().getAccessTokenSecret();
			case REAL ->
					throw new UnsupportedOperationException(format("No real %s implementation is available yet", SecretsManager.class.getSimpleName()));
		}

		byte[] accessTokenSecretBytes = accessTokenSecret.getBytes(StandardCharsets.UTF_8);

		if (accessTokenSecretBytes.length < MINIMUM_ACCESS_TOKEN_SECRET_LENGTH)
			throw new IllegalStateException(format("Access token secret must be at least %d bytes", MINIMUM_ACCESS_TOKEN_SECRET_LENGTH));

		return new SecretKeySpec(accessTokenSecretBytes, "HmacSHA256");
	}

	@NonNull
	private ConfigFile loadConfigFileForEnvironment(@NonNull String environment) {
		Path configFile = Path.of(format("config/%s/settings.json", environment));

		if (!Files.isRegularFile(configFile))
			throw new IllegalArgumentException(format("Config file not found at %s", configFile.toAbsolutePath()));

		try {
			return GSON.fromJson(Files.readString(configFile, StandardCharsets.UTF_8), ConfigFile.class);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading from %s", configFile.toAbsolutePath()), e);
		}
	}

	// Record that maps to the config/{environment}/settings.json file format
	private record ConfigFile(
			@NonNull Integer accessTokenExpirationInSeconds,
			@NonNull Integer passwordResetExpirationInSeconds,
			@NonNull String passwordResetLinkTemplate,
			@NonNull ConfigBootstrapAdmin bootstrapAdmin,
			@Nullable Set<String> notificationEmailAddresses,
			@Nullable List<CustomMinistryAreaSeed> customMinistryAreas,
			@NonNull ConfigSecretsManager secretsManager,
			@NonNull ConfigEmailDispatcher emailDispatcher
	) {
		public ConfigFile {
			requireNonNull(accessTokenExpirationInSeconds);
			requireNonNull(passwordResetExpirationInSeconds);
			requireNonNull(passwordResetLinkTemplate);
			requireNonNull(bootstrapAdmin);
			requireNonNull(secretsManager);
			requireNonNull(emailDispatcher);
		}

		private record ConfigBootstrapAdmin(
				@NonNull String emailAddress,
				@Nullable String name
		) {
			public ConfigBootstrapAdmin {
				requireNonNull(emailAddress);
			}
		}

		private record ConfigSecretsManager(
				SecretsManager.@NonNull Type type
		) {
			public ConfigSecretsManager {
				requireNonNull(type);
			}
		}

		private record ConfigEmailDispatcher(
				EmailDispatcher.@NonNull Type type,
				@Nullable SmtpSettings smtp
		) {
			public ConfigEmailDispatcher {
				requireNonNull(type);
			}
		}
	}

	/**
	 * The account created as super admin when the admin directory is empty at startup.
	 * Its password comes from {@link SecretsManager#getBootstrapAdminPassword()}.
	 */
	public record BootstrapAdmin(
			@NonNull String emailAddress,
			@Nullable String name
	) {
		public BootstrapAdmin {
			requireNonNull(emailAddress);
		}
	}

	public record CustomMinistryAreaSeed(
			@NonNull String category,
			@NonNull String area
	) {
		public CustomMinistryAreaSeed {
			requireNonNull(category);
			requireNonNull(area);
		}
	}

	public record SmtpSettings(
			@NonNull String host,
			@NonNull Integer port,
			@Nullable String username,
			@NonNull String fromEmailAddress,
			@NonNull Boolean startTls
	) {
		public SmtpSettings {
			requireNonNull(host);
			requireNonNull(port);
			requireNonNull(fromEmailAddress);
			requireNonNull(startTls);
		}
	}

	@NonNull
	public static Locale getDefaultLocale() {
		return DEFAULT_LOCALE;
	}

	@NonNull
	public static ZoneId getDefaultTimeZone() {
		return DEFAULT_TIME_ZONE;
	}

	@NonNull
	public String getEnvironment() {
		return this.environment;
	}

	@NonNull
	public Duration getAccessTokenExpiration() {
		return this.accessTokenExpiration;
	}

	@NonNull
	public Duration getPasswordResetExpiration() {
		return this.passwordResetExpiration;
	}

	/**
	 * A {@link String#format(String, Object...)} template with a single {@code %s} for the reset token.
	 */
	@NonNull
	public String getPasswordResetLinkTemplate() {
		return this.passwordResetLinkTemplate;
	}

	@NonNull
	public SecretKey getAccessTokenSecretKey() {
		return this.accessTokenSecretKey;
	}

	@NonNull
	public BootstrapAdmin getBootstrapAdmin() {
		return this.bootstrapAdmin;
	}

	@NonNull
	public Set<@NonNull String> getNotificationEmailAddresses() {
		return this.notificationEmailAddresses;
	}

	@NonNull
	public List<@NonNull CustomMinistryAreaSeed> getCustomMinistryAreaSeeds() {
		return this.customMinistryAreaSeeds;
	}

	public SecretsManager.@NonNull Type getSecretsManagerType() {
		return this.secretsManagerType;
	}

	public EmailDispatcher.@NonNull Type getEmailDispatcherType() {
		return this.emailDispatcherType;
	}

	@NonNull
	public Optional<SmtpSettings> getSmtpSettings() {
		return Optional.ofNullable(this.smtpSettings);
	}
}
